package com.rvoc.jobqueue;

import com.rvoc.config.RVocProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Claims due jobs for this process. A claim is a single atomic read-modify-write on the job's row;
 * losing a race is reported as {@link ClaimResult.FailureReason#HELD_ELSEWHERE_OR_NOT_DUE}, not as
 * an error.
 */
@Component
public class LeaseManager {

    private static final Logger log = LoggerFactory.getLogger(LeaseManager.class);
    private static final Duration LATE_START_TOLERANCE = Duration.ofSeconds(10);

    private final JobQueueStore jobQueueStore;
    private final Clock clock;
    private final Duration pollInterval;
    private final String nodeId = "node-" + UUID.randomUUID();

    public LeaseManager(JobQueueStore jobQueueStore, Clock clock, RVocProperties properties) {
        this.jobQueueStore = jobQueueStore;
        this.clock = clock;
        this.pollInterval = properties.getScheduler().getPollInterval();
    }

    public ClaimResult claim(String name) {
        Optional<JobName> jobName = JobName.fromKey(name);
        if (jobName.isEmpty()) {
            log.warn("Not claiming job {}: no handler is registered for this name on {}", name, nodeId);
            return ClaimResult.failed(ClaimResult.FailureReason.UNKNOWN_JOB);
        }
        return claim(jobName.get());
    }

    public ClaimResult claim(JobName name) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Optional<Lease> lease = jobQueueStore.tryClaim(name, now, nodeId);
        if (lease.isEmpty()) {
            log.debug("Job {} was not claimed by {}: leased elsewhere or not due", name, nodeId);
            return ClaimResult.failed(ClaimResult.FailureReason.HELD_ELSEWHERE_OR_NOT_DUE);
        }

        Lease claimed = lease.get();
        Duration startDelay = Duration.between(claimed.scheduledExecutionTime(), claimed.claimedAt());
        if (startDelay.compareTo(pollInterval.plus(LATE_START_TOLERANCE)) > 0) {
            log.warn("Job {} started {} after its scheduled time, more than the poll interval of {}", name,
                    startDelay, pollInterval);
        }
        log.debug("Claimed job {} with lease {} on {}", name, claimed.id(), nodeId);
        return ClaimResult.claimed(claimed);
    }

    public String getNodeId() {
        return nodeId;
    }
}
