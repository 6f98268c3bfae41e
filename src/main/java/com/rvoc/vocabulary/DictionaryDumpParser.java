package com.rvoc.vocabulary;

import java.io.InputStream;
import java.util.stream.Stream;

/**
 * Reads the entries of a dictionary dump. The returned stream is lazy and owns {@code input}:
 * closing the stream closes the input.
 */
public interface DictionaryDumpParser {

    Stream<DictionaryEntry> parse(InputStream input);
}
