package com.rvoc.jobqueue.internal;

import com.rvoc.config.RVocProperties;
import com.rvoc.jobqueue.JobQueueAccessException;
import com.rvoc.jobqueue.JobQueueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Returns leases that were neither released nor renewed within the maximum lease duration to idle,
 * so a job whose runner crashed becomes due again.
 */
@Component
@ConditionalOnProperty(prefix = "rvoc.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class StaleLeaseReaper {

    private static final Logger log = LoggerFactory.getLogger(StaleLeaseReaper.class);

    private final JobQueueStore jobQueueStore;
    private final JobSchedulerMetrics metrics;
    private final Clock clock;
    private final Duration maxLeaseDuration;

    public StaleLeaseReaper(
            JobQueueStore jobQueueStore,
            JobSchedulerMetrics metrics,
            Clock clock,
            RVocProperties properties) {
        this.jobQueueStore = jobQueueStore;
        this.metrics = metrics;
        this.clock = clock;
        this.maxLeaseDuration = properties.getScheduler().getMaxLeaseDuration();
    }

    @Scheduled(
            initialDelayString = "${rvoc.scheduler.stale-lease-sweep-interval-in-seconds:60}000",
            fixedDelayString = "${rvoc.scheduler.stale-lease-sweep-interval-in-seconds:60}000")
    public void sweep() {
        try {
            List<String> reclaimed = reclaimStaleLeases();
            if (!reclaimed.isEmpty()) {
                log.info("Reclaimed {} stale leases: {}", reclaimed.size(), reclaimed);
            }
        } catch (JobQueueAccessException e) {
            log.error("Stale lease sweep failed, retrying on the next sweep", e);
        }
    }

    List<String> reclaimStaleLeases() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<String> reclaimed = jobQueueStore.reclaimStale(now.minus(maxLeaseDuration), now);
        metrics.recordReclaimedLeases(reclaimed.size());
        return reclaimed;
    }
}
