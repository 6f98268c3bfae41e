package com.rvoc.vocabulary;

import com.rvoc.jobqueue.JobContext;
import com.rvoc.jobqueue.JobName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.util.UUID;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ImportDictionaryDumpJobTest {

    private DictionaryDumpSource dumpSource;
    private DictionaryDumpParser parser;
    private DictionaryImporter importer;
    private WordRepository wordRepository;
    private TrackingInputStream input;

    @BeforeEach
    void setUp() throws IOException {
        dumpSource = mock(DictionaryDumpSource.class);
        parser = mock(DictionaryDumpParser.class);
        importer = mock(DictionaryImporter.class);
        wordRepository = mock(WordRepository.class);
        input = new TrackingInputStream();
        when(dumpSource.open()).thenReturn(input);
    }

    @Test
    void shouldCloseDumpWhenParserFailsBeforeReturningEntries() {
        when(parser.parse(input)).thenThrow(new DictionaryDumpParseException("Unsupported dump encoding"));

        assertThatThrownBy(() -> job().execute(context()))
                .isInstanceOf(DictionaryDumpParseException.class);

        assertThat(input.closed).isTrue();
        verifyNoInteractions(importer);
    }

    @Test
    void shouldImportParsedEntriesAndCloseDump() throws IOException {
        DictionaryEntry entry = new DictionaryEntry("house", "noun", "English");
        when(parser.parse(input)).thenReturn(Stream.of(entry));
        when(importer.importEntries(any())).thenReturn(new DictionaryImporter.ImportSummary(1, 1));

        job().execute(context());

        verify(importer).importEntries(any());
        verify(wordRepository).count();
        assertThat(input.closed).isTrue();
    }

    private static JobContext context() {
        OffsetDateTime now = OffsetDateTime.parse("2024-03-01T12:00:00Z");
        return new JobContext(JobName.IMPORT_DICTIONARY_DUMP, now, now, UUID.randomUUID());
    }

    private ImportDictionaryDumpJob job() {
        return new ImportDictionaryDumpJob(dumpSource, parser, importer, wordRepository);
    }

    private static final class TrackingInputStream extends ByteArrayInputStream {

        private boolean closed;

        TrackingInputStream() {
            super("{}".getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public void close() throws IOException {
            closed = true;
            super.close();
        }
    }
}
