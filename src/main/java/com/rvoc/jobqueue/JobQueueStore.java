package com.rvoc.jobqueue;

import com.rvoc.config.RVocProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Transactional access to the {@code job_queue} table. Every scheduling decision reads and writes
 * the table through this class; nothing about the queue is cached in memory.
 * <p>
 * Each operation runs in its own transaction. Transient failures (serialization failures,
 * deadlocks, lock timeouts) are retried up to {@code rvoc.scheduler.maximum-transaction-retry-count}
 * times; anything else is reported as a {@link JobQueueAccessException}.
 */
@Component
public class JobQueueStore {

    private static final Logger log = LoggerFactory.getLogger(JobQueueStore.class);

    private final JobScheduleRepository jobScheduleRepository;
    private final TransactionTemplate transactionTemplate;
    private final int maximumTransactionRetryCount;

    public JobQueueStore(
            JobScheduleRepository jobScheduleRepository,
            TransactionTemplate transactionTemplate,
            RVocProperties properties) {
        this.jobScheduleRepository = jobScheduleRepository;
        this.transactionTemplate = transactionTemplate;
        this.maximumTransactionRetryCount = Math.max(0, properties.getScheduler().getMaximumTransactionRetryCount());
    }

    /**
     * Names of idle jobs whose scheduled execution time is at or before {@code now}, earliest first.
     */
    public List<String> findDue(OffsetDateTime now) {
        return inTransaction("poll", status -> jobScheduleRepository.findDueNames(now));
    }

    /**
     * Atomically turns an idle, due job into a leased one. The row is locked with
     * {@code FOR UPDATE SKIP LOCKED}, so a concurrent claimer either skips the row or, once this
     * transaction committed, no longer sees it as idle.
     *
     * @return the lease, or empty if the job is leased elsewhere, locked by a concurrent claim, or
     *         not due at {@code now}
     */
    public Optional<Lease> tryClaim(JobName name, OffsetDateTime now, String nodeId) {
        Optional<Lease> lease = inTransaction("claim of " + name,
                status -> jobScheduleRepository.findClaimableForUpdate(name.getKey(), now).map(schedule -> {
                    UUID leaseId = UUID.randomUUID();
                    schedule.acquireLease(leaseId, nodeId, now);
                    jobScheduleRepository.save(schedule);
                    return new Lease(leaseId, name, schedule.getScheduledExecutionTime(), now, nodeId,
                            schedule.getConsecutiveFailures(), schedule.getScheduleAnchor());
                }));
        return lease == null ? Optional.empty() : lease;
    }

    /**
     * Ends a successful execution and schedules the next one.
     *
     * @return {@code false} if the lease no longer exists, e.g. because it was reclaimed as stale
     */
    public boolean release(Lease lease, OffsetDateTime nextExecutionTime, OffsetDateTime now) {
        Integer updated = inTransaction("release of " + lease.name(),
                status -> jobScheduleRepository.markReleased(lease.name().getKey(), lease.id(), nextExecutionTime,
                        now));
        return logLostLease(lease, updated, "release");
    }

    /**
     * Ends a failed execution and schedules a retry {@code retryDelay} after {@code now}.
     *
     * @return {@code false} if the lease no longer exists
     */
    public boolean fail(Lease lease, Duration retryDelay, String errorMessage, OffsetDateTime now) {
        if (retryDelay.isNegative() || retryDelay.isZero()) {
            throw new IllegalArgumentException("Retry delay must be positive, got " + retryDelay);
        }
        OffsetDateTime retryAt = now.plus(retryDelay);
        Integer updated = inTransaction("failure of " + lease.name(),
                status -> jobScheduleRepository.markFailed(lease.name().getKey(), lease.id(), retryAt, errorMessage,
                        now));
        return logLostLease(lease, updated, "failure");
    }

    /**
     * Refreshes the lease timestamp so the stale lease sweep leaves a long running job alone.
     *
     * @return {@code false} if the lease no longer exists
     */
    public boolean renew(Lease lease, OffsetDateTime now) {
        Integer updated = inTransaction("lease renewal of " + lease.name(),
                status -> jobScheduleRepository.renewLease(lease.name().getKey(), lease.id(), now));
        return logLostLease(lease, updated, "lease renewal");
    }

    /**
     * Returns every lease acquired (or last renewed) before {@code cutoff} to idle, due at
     * {@code now}. Rows locked by a concurrent sweep are skipped.
     *
     * @return the names of the reclaimed jobs
     */
    public List<String> reclaimStale(OffsetDateTime cutoff, OffsetDateTime now) {
        return inTransaction("stale lease sweep", status -> {
            List<JobSchedule> stale = jobScheduleRepository.findStaleLeasesForUpdate(cutoff);
            for (JobSchedule schedule : stale) {
                log.warn("Reclaiming stale lease {} on job {} held by {} since {}", schedule.getLeaseId(),
                        schedule.getName(), schedule.getLeasedBy(), schedule.getLeaseAcquiredAt());
                schedule.clearLease(now);
                schedule.setLastError("Lease expired before the job finished");
            }
            jobScheduleRepository.saveAll(stale);
            return stale.stream().map(JobSchedule::getName).toList();
        });
    }

    /**
     * Creates the row of every known job that does not have one yet, due at {@code now}, and
     * optionally deletes rows whose name is not known.
     *
     * @return the names of the deleted rows
     */
    public List<String> initialise(Collection<JobName> knownNames, OffsetDateTime now, boolean deleteUnknown) {
        List<String> keys = knownNames.stream().map(JobName::getKey).toList();
        return inTransaction("initialisation", status -> {
            for (String key : keys) {
                if (jobScheduleRepository.insertIfMissing(key, now) > 0) {
                    log.info("Created schedule for job {} due at {}", key, now);
                }
            }
            if (!deleteUnknown) {
                return List.<String>of();
            }
            return jobScheduleRepository.deleteByNameNotIn(keys).stream()
                    .map(JobSchedule::getName)
                    .toList();
        });
    }

    private boolean logLostLease(Lease lease, Integer updated, String operation) {
        if (updated != null && updated > 0) {
            return true;
        }
        log.warn("Lease {} on job {} was gone at {}; it was probably reclaimed as stale", lease.id(), lease.name(),
                operation);
        return false;
    }

    private <T> T inTransaction(String operation, TransactionCallback<T> callback) {
        RuntimeException lastTemporaryFailure = null;
        for (int attempt = 1; attempt <= maximumTransactionRetryCount + 1; attempt++) {
            try {
                return transactionTemplate.execute(callback);
            } catch (TransientDataAccessException temporaryFailure) {
                lastTemporaryFailure = temporaryFailure;
                log.debug("Temporary failure during job queue {} (attempt {}): {}", operation, attempt,
                        temporaryFailure.getMessage());
            } catch (DataAccessException | TransactionException permanentFailure) {
                throw new JobQueueAccessException("Job queue " + operation + " failed", permanentFailure);
            }
        }
        throw new JobQueueAccessException("Job queue " + operation + " failed " + (maximumTransactionRetryCount + 1)
                + " times with temporary errors", lastTemporaryFailure);
    }
}
