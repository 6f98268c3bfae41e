package com.rvoc.vocabulary;

import com.rvoc.config.RVocProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Upserts dictionary entries into the vocabulary tables in batches, each in its own transaction.
 * Entries that already exist are left alone, so importing the same dump twice is harmless.
 */
@Component
public class DictionaryImporter {

    private static final Logger log = LoggerFactory.getLogger(DictionaryImporter.class);

    private static final String INSERT_LANGUAGE =
            "INSERT INTO languages (english_name) VALUES (?) ON CONFLICT (english_name) DO NOTHING";
    private static final String INSERT_WORD_TYPE =
            "INSERT INTO word_types (english_name) VALUES (?) ON CONFLICT (english_name) DO NOTHING";
    private static final String INSERT_WORD = """
            INSERT INTO words (word, word_type, language)
            SELECT ?, t.id, l.id FROM word_types t, languages l
            WHERE t.english_name = ? AND l.english_name = ?
            ON CONFLICT DO NOTHING
            """;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final int batchSize;

    public DictionaryImporter(
            JdbcTemplate jdbcTemplate,
            TransactionTemplate transactionTemplate,
            RVocProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.batchSize = Math.max(1, properties.getDictionary().getBatchSize());
    }

    /**
     * Imports all entries. Batches committed before a failure stay committed.
     */
    public ImportSummary importEntries(Stream<DictionaryEntry> entries) {
        long entryCount = 0;
        long insertedWords = 0;
        Iterator<DictionaryEntry> iterator = entries.iterator();
        List<DictionaryEntry> batch = new ArrayList<>(batchSize);
        while (iterator.hasNext()) {
            batch.add(iterator.next());
            if (batch.size() == batchSize) {
                insertedWords += importBatch(batch);
                entryCount += batch.size();
                batch.clear();
                log.debug("Imported {} dictionary entries so far", entryCount);
            }
        }
        if (!batch.isEmpty()) {
            insertedWords += importBatch(batch);
            entryCount += batch.size();
        }
        return new ImportSummary(entryCount, insertedWords);
    }

    private long importBatch(List<DictionaryEntry> batch) {
        Set<String> languages = new TreeSet<>();
        Set<String> wordTypes = new TreeSet<>();
        List<Object[]> words = new ArrayList<>(batch.size());
        for (DictionaryEntry entry : batch) {
            languages.add(entry.language());
            wordTypes.add(entry.wordType());
            words.add(new Object[] { entry.word(), entry.wordType(), entry.language() });
        }

        Long inserted = transactionTemplate.execute(status -> {
            jdbcTemplate.batchUpdate(INSERT_LANGUAGE, languages.stream().map(name -> new Object[] { name }).toList());
            jdbcTemplate.batchUpdate(INSERT_WORD_TYPE, wordTypes.stream().map(name -> new Object[] { name }).toList());
            long count = 0;
            for (int updated : jdbcTemplate.batchUpdate(INSERT_WORD, words)) {
                if (updated > 0) {
                    count += updated;
                }
            }
            return count;
        });
        return inserted == null ? 0 : inserted;
    }

    public record ImportSummary(long entries, long insertedWords) {
    }
}
