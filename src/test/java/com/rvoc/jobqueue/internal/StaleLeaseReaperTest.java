package com.rvoc.jobqueue.internal;

import com.rvoc.config.RVocProperties;
import com.rvoc.jobqueue.JobQueueAccessException;
import com.rvoc.jobqueue.JobQueueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StaleLeaseReaperTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private JobQueueStore jobQueueStore;
    private JobSchedulerMetrics metrics;
    private StaleLeaseReaper reaper;

    @BeforeEach
    void setUp() {
        jobQueueStore = mock(JobQueueStore.class);
        metrics = mock(JobSchedulerMetrics.class);
        RVocProperties properties = new RVocProperties();
        properties.getScheduler().setMaxLeaseDuration(Duration.ofMinutes(20));
        reaper = new StaleLeaseReaper(jobQueueStore, metrics, Clock.fixed(NOW, ZoneOffset.UTC), properties);
    }

    @Test
    void shouldReclaimLeasesOlderThanMaxLeaseDuration() {
        OffsetDateTime now = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC);
        when(jobQueueStore.reclaimStale(now.minusMinutes(20), now)).thenReturn(List.of("import-dictionary-dump"));

        assertThat(reaper.reclaimStaleLeases()).containsExactly("import-dictionary-dump");
        verify(metrics).recordReclaimedLeases(1);
    }

    @Test
    void shouldSurviveUnavailableStore() {
        when(jobQueueStore.reclaimStale(any(), any()))
                .thenThrow(new JobQueueAccessException("Job queue stale lease sweep failed", new RuntimeException()));

        assertThatCode(reaper::sweep).doesNotThrowAnyException();
    }
}
