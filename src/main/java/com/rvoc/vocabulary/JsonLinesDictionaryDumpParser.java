package com.rvoc.vocabulary;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Parses JSON Lines dumps as published by kaikki.org: one JSON object per line with at least the
 * fields {@code word}, {@code pos} and {@code lang}. Blank lines are skipped.
 */
@Component
public class JsonLinesDictionaryDumpParser implements DictionaryDumpParser {

    private final ObjectReader reader;

    public JsonLinesDictionaryDumpParser(@Qualifier("dictionaryObjectMapper") ObjectMapper objectMapper) {
        this.reader = objectMapper.reader();
    }

    @Override
    public Stream<DictionaryEntry> parse(InputStream input) {
        BufferedReader lines = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        AtomicLong lineNumber = new AtomicLong();
        return lines.lines()
                .map(line -> new NumberedLine(lineNumber.incrementAndGet(), line))
                .filter(line -> !line.text().isBlank())
                .map(this::parseLine)
                .onClose(() -> {
                    try {
                        lines.close();
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                });
    }

    private DictionaryEntry parseLine(NumberedLine line) {
        JsonNode node;
        try {
            node = reader.readTree(line.text());
        } catch (JsonProcessingException e) {
            throw new DictionaryDumpParseException("Malformed JSON on line " + line.number(), e);
        }
        if (node == null || !node.isObject()) {
            throw new DictionaryDumpParseException("Line " + line.number() + " is not a JSON object");
        }
        return new DictionaryEntry(
                requiredText(node, "word", line.number()),
                requiredText(node, "pos", line.number()),
                requiredText(node, "lang", line.number()));
    }

    private static String requiredText(JsonNode node, String field, long lineNumber) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new DictionaryDumpParseException("Line " + lineNumber + " has no '" + field + "'");
        }
        return value.asText();
    }

    private record NumberedLine(long number, String text) {
    }
}
