package com.rvoc.jobqueue.internal;

import com.rvoc.jobqueue.JobContext;
import com.rvoc.jobqueue.JobQueueAccessException;
import com.rvoc.jobqueue.JobQueueStore;
import com.rvoc.jobqueue.JobSettings;
import com.rvoc.jobqueue.Lease;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Executes one claimed job and gives its lease back: on success the job is rescheduled one interval
 * later, on failure after the backoff delay. The lease is always returned unless the store itself is
 * unreachable, in which case the stale lease sweep recovers it.
 */
@Component
public class JobRunner {

    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);
    private static final int MAX_ERROR_MESSAGE_LENGTH = 4000;

    private final JobRegistry jobRegistry;
    private final JobQueueStore jobQueueStore;
    private final LeaseHeartbeat leaseHeartbeat;
    private final JobSchedulerMetrics metrics;
    private final Clock clock;

    public JobRunner(
            JobRegistry jobRegistry,
            JobQueueStore jobQueueStore,
            LeaseHeartbeat leaseHeartbeat,
            JobSchedulerMetrics metrics,
            Clock clock) {
        this.jobRegistry = jobRegistry;
        this.jobQueueStore = jobQueueStore;
        this.leaseHeartbeat = leaseHeartbeat;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Runs the job held by {@code lease}.
     *
     * @return {@code true} if the job body completed without throwing
     */
    public boolean run(Lease lease) {
        JobRegistry.RegisteredJob registration = jobRegistry.get(lease.name());
        log.info("Running job {} scheduled for {}", lease.name(), lease.scheduledExecutionTime());

        Exception failure = null;
        try (LeaseHeartbeat.Renewal ignored = leaseHeartbeat.start(lease)) {
            registration.job().execute(JobContext.of(lease));
        } catch (Exception e) {
            failure = e;
        }

        OffsetDateTime finishedAt = OffsetDateTime.now(clock);
        metrics.recordExecution(lease.name(), failure == null,
                nonNegative(Duration.between(lease.claimedAt(), finishedAt)));
        try {
            if (failure == null) {
                completeSuccessfully(lease, registration.settings(), finishedAt);
            } else {
                completeWithFailure(lease, registration.settings(), failure, finishedAt);
            }
        } catch (JobQueueAccessException e) {
            log.error("Could not give back lease {} on job {}; it stays in progress until the stale lease sweep "
                    + "reclaims it", lease.id(), lease.name(), e);
        }
        return failure == null;
    }

    private void completeSuccessfully(Lease lease, JobSettings settings, OffsetDateTime finishedAt) {
        OffsetDateTime next = ExecutionTimes.nextAfterSuccess(settings, lease, finishedAt);
        if (next.isBefore(finishedAt)) {
            log.warn("Next execution of job {} at {} is already in the past", lease.name(), next);
        }
        if (jobQueueStore.release(lease, next, finishedAt)) {
            log.info("Job {} completed, next execution at {}", lease.name(), next);
        }
    }

    private void completeWithFailure(Lease lease, JobSettings settings, Exception failure,
            OffsetDateTime finishedAt) {
        int failureCount = lease.consecutiveFailures() + 1;
        Duration retryDelay = ExecutionTimes.retryDelay(settings, failureCount);
        log.error("Job {} failed ({} consecutive failures), retrying in {}", lease.name(), failureCount, retryDelay,
                failure);
        jobQueueStore.fail(lease, retryDelay, describe(failure), finishedAt);
    }

    private static String describe(Exception failure) {
        String message = failure.getMessage();
        String description = message == null || message.isBlank()
                ? failure.getClass().getName()
                : failure.getClass().getSimpleName() + ": " + message;
        return description.length() > MAX_ERROR_MESSAGE_LENGTH
                ? description.substring(0, MAX_ERROR_MESSAGE_LENGTH)
                : description;
    }

    private static Duration nonNegative(Duration duration) {
        return duration.isNegative() ? Duration.ZERO : duration;
    }
}
