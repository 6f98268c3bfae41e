package com.rvoc.vocabulary;

import com.rvoc.jobqueue.JobContext;
import com.rvoc.jobqueue.JobName;
import com.rvoc.jobqueue.ScheduledJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.stream.Stream;

/**
 * Downloads the configured dictionary dump and merges its words into the vocabulary tables.
 */
@Component
public class ImportDictionaryDumpJob implements ScheduledJob {

    private static final Logger log = LoggerFactory.getLogger(ImportDictionaryDumpJob.class);

    private final DictionaryDumpSource dumpSource;
    private final DictionaryDumpParser parser;
    private final DictionaryImporter importer;
    private final WordRepository wordRepository;

    public ImportDictionaryDumpJob(
            DictionaryDumpSource dumpSource,
            DictionaryDumpParser parser,
            DictionaryImporter importer,
            WordRepository wordRepository) {
        this.dumpSource = dumpSource;
        this.parser = parser;
        this.importer = importer;
        this.wordRepository = wordRepository;
    }

    @Override
    public JobName getName() {
        return JobName.IMPORT_DICTIONARY_DUMP;
    }

    @Override
    public void execute(JobContext context) throws IOException {
        log.info("Importing dictionary dump from {}", dumpSource.getLocation());
        DictionaryImporter.ImportSummary summary;
        try (InputStream input = dumpSource.open();
                Stream<DictionaryEntry> entries = parser.parse(input)) {
            summary = importer.importEntries(entries);
        }
        log.info("Imported {} dictionary entries, {} new words, {} words in total", summary.entries(),
                summary.insertedWords(), wordRepository.count());
    }
}
