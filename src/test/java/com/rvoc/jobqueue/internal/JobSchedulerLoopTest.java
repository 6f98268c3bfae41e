package com.rvoc.jobqueue.internal;

import com.rvoc.config.RVocProperties;
import com.rvoc.jobqueue.ClaimResult;
import com.rvoc.jobqueue.JobName;
import com.rvoc.jobqueue.JobQueueAccessException;
import com.rvoc.jobqueue.JobQueueStore;
import com.rvoc.jobqueue.Lease;
import com.rvoc.jobqueue.LeaseManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobSchedulerLoopTest {

    private JobQueueStore jobQueueStore;
    private LeaseManager leaseManager;
    private JobRunner jobRunner;
    private RVocProperties properties;
    private JobSchedulerLoop loop;

    @BeforeEach
    void setUp() {
        jobQueueStore = mock(JobQueueStore.class);
        leaseManager = mock(LeaseManager.class);
        jobRunner = mock(JobRunner.class);
        properties = new RVocProperties();
        properties.getJobs().getImportDictionaryDump().setConcurrent(true);
        JobRegistry registry = new JobRegistry(RecordingJob.forAllNames(), properties);
        registry.init();
        loop = new JobSchedulerLoop(jobQueueStore, leaseManager, jobRunner, registry, Clock.systemUTC(),
                properties);
    }

    @AfterEach
    void tearDown() {
        loop.shutdown();
    }

    @Test
    void shouldRunClaimedJobsInline() {
        Lease lease = lease(JobName.RESET_LOGIN_COUNTERS);
        when(jobQueueStore.findDue(any())).thenReturn(List.of("reset-login-counters"));
        when(leaseManager.claim("reset-login-counters")).thenReturn(ClaimResult.claimed(lease));

        loop.poll();

        verify(jobRunner).run(lease);
        assertThat(loop.getState()).isEqualTo(JobSchedulerLoop.State.IDLE);
    }

    @Test
    void shouldDispatchConcurrentJobsToWorkers() {
        Lease lease = lease(JobName.IMPORT_DICTIONARY_DUMP);
        when(jobQueueStore.findDue(any())).thenReturn(List.of("import-dictionary-dump"));
        when(leaseManager.claim("import-dictionary-dump")).thenReturn(ClaimResult.claimed(lease));

        loop.poll();

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> verify(jobRunner).run(lease));
    }

    @Test
    void shouldSkipJobsClaimedElsewhere() {
        when(jobQueueStore.findDue(any())).thenReturn(List.of("reset-login-counters", "delete-expired-sessions"));
        when(leaseManager.claim("reset-login-counters"))
                .thenReturn(ClaimResult.failed(ClaimResult.FailureReason.HELD_ELSEWHERE_OR_NOT_DUE));
        when(leaseManager.claim("delete-expired-sessions"))
                .thenReturn(ClaimResult.failed(ClaimResult.FailureReason.UNKNOWN_JOB));

        loop.poll();

        verify(jobRunner, never()).run(any());
    }

    @Test
    void shouldEndCycleWhenStoreIsUnavailable() {
        when(jobQueueStore.findDue(any()))
                .thenThrow(new JobQueueAccessException("Job queue poll failed", new RuntimeException("down")));

        assertThatCode(loop::poll).doesNotThrowAnyException();

        assertThat(loop.getState()).isEqualTo(JobSchedulerLoop.State.IDLE);
        verify(leaseManager, never()).claim(any(String.class));
    }

    private static Lease lease(JobName name) {
        OffsetDateTime now = OffsetDateTime.now();
        return new Lease(UUID.randomUUID(), name, now.minusSeconds(1), now, "node-test", 0);
    }
}
