package com.rvoc.jobqueue.internal;

import com.rvoc.config.RVocProperties;
import com.rvoc.jobqueue.JobQueueAccessException;
import com.rvoc.jobqueue.JobQueueStore;
import com.rvoc.jobqueue.Lease;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Renews the leases of running jobs so the stale lease sweep only reclaims leases whose holder
 * stopped renewing them.
 */
@Component
public class LeaseHeartbeat {

    private static final Logger log = LoggerFactory.getLogger(LeaseHeartbeat.class);

    private final JobQueueStore jobQueueStore;
    private final Clock clock;
    private final Duration renewalInterval;
    private final ScheduledExecutorService executor;

    public LeaseHeartbeat(JobQueueStore jobQueueStore, Clock clock, RVocProperties properties) {
        this.jobQueueStore = jobQueueStore;
        this.clock = clock;
        Duration thirdOfMaxLease = properties.getScheduler().getMaxLeaseDuration().dividedBy(3);
        this.renewalInterval = thirdOfMaxLease.compareTo(Duration.ofSeconds(1)) < 0 ? Duration.ofSeconds(1)
                : thirdOfMaxLease;
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "rvoc-lease-heartbeat-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Starts renewing {@code lease} until the returned handle is closed.
     */
    public Renewal start(Lease lease) {
        long periodMs = renewalInterval.toMillis();
        ScheduledFuture<?> future = executor.scheduleAtFixedRate(() -> renew(lease), periodMs, periodMs,
                TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    Duration getRenewalInterval() {
        return renewalInterval;
    }

    private void renew(Lease lease) {
        try {
            if (jobQueueStore.renew(lease, OffsetDateTime.now(clock))) {
                log.trace("Renewed lease {} on job {}", lease.id(), lease.name());
            }
        } catch (JobQueueAccessException e) {
            log.warn("Could not renew lease {} on job {}: {}", lease.id(), lease.name(), e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    /**
     * Stops renewing a lease.
     */
    @FunctionalInterface
    public interface Renewal extends AutoCloseable {
        @Override
        void close();
    }
}
