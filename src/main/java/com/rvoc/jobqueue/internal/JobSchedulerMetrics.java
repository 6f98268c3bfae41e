package com.rvoc.jobqueue.internal;

import com.rvoc.jobqueue.JobName;
import com.rvoc.jobqueue.JobScheduleRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Micrometer view of the job queue. Does nothing when no {@link MeterRegistry} bean exists.
 */
@Component
public class JobSchedulerMetrics {

    private static final Logger log = LoggerFactory.getLogger(JobSchedulerMetrics.class);
    private static final long SNAPSHOT_TTL_NANOS = Duration.ofSeconds(1).toNanos();

    private final JobScheduleRepository jobScheduleRepository;
    private final ObjectProvider<MeterRegistry> meterRegistryProvider;
    private final Clock clock;
    private final Object snapshotMonitor = new Object();

    private MeterRegistry meterRegistry;
    private volatile ScheduleSnapshot cachedSnapshot = ScheduleSnapshot.empty();
    private volatile long snapshotCapturedAtNanos = 0L;
    private volatile boolean snapshotCaptured = false;

    public JobSchedulerMetrics(
            JobScheduleRepository jobScheduleRepository,
            ObjectProvider<MeterRegistry> meterRegistryProvider,
            Clock clock) {
        this.jobScheduleRepository = jobScheduleRepository;
        this.meterRegistryProvider = meterRegistryProvider;
        this.clock = clock;
    }

    @PostConstruct
    public void registerMetrics() {
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
        if (meterRegistry == null) {
            log.debug("No MeterRegistry available, job queue metrics are disabled");
            return;
        }

        Gauge.builder("rvoc.jobs.count", this, metrics -> metrics.getSnapshot().idleCount())
                .description("Number of scheduled jobs")
                .tag("status", "idle")
                .register(meterRegistry);

        Gauge.builder("rvoc.jobs.count", this, metrics -> metrics.getSnapshot().dueCount())
                .description("Number of scheduled jobs")
                .tag("status", "due")
                .register(meterRegistry);

        Gauge.builder("rvoc.jobs.count", this, metrics -> metrics.getSnapshot().inProgressCount())
                .description("Number of scheduled jobs")
                .tag("status", "in_progress")
                .register(meterRegistry);
    }

    void recordExecution(JobName name, boolean succeeded, Duration duration) {
        if (meterRegistry == null) {
            return;
        }
        String outcome = succeeded ? "success" : "failure";
        Counter.builder("rvoc.jobs.executions")
                .description("Finished job executions")
                .tag("job", name.getKey())
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
        Timer.builder("rvoc.jobs.duration")
                .description("Job execution time")
                .tag("job", name.getKey())
                .tag("outcome", outcome)
                .register(meterRegistry)
                .record(duration);
    }

    void recordReclaimedLeases(int count) {
        if (meterRegistry == null || count == 0) {
            return;
        }
        Counter.builder("rvoc.jobs.leases.reclaimed")
                .description("Stale leases returned to idle")
                .register(meterRegistry)
                .increment(count);
    }

    ScheduleSnapshot getSnapshot() {
        long now = System.nanoTime();
        if (snapshotCaptured && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
            return cachedSnapshot;
        }

        synchronized (snapshotMonitor) {
            now = System.nanoTime();
            if (snapshotCaptured && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
                return cachedSnapshot;
            }
            cachedSnapshot = loadSnapshot();
            snapshotCapturedAtNanos = now;
            snapshotCaptured = true;
            return cachedSnapshot;
        }
    }

    private ScheduleSnapshot loadSnapshot() {
        try {
            JobScheduleRepository.ScheduleCounts counts = jobScheduleRepository.countSchedules(
                    OffsetDateTime.now(clock));
            return new ScheduleSnapshot(
                    countOrZero(counts.getIdleCount()),
                    countOrZero(counts.getDueCount()),
                    countOrZero(counts.getInProgressCount()));
        } catch (Exception e) {
            log.trace("Failed to query schedule counts for metrics: {}", e.getMessage());
            return ScheduleSnapshot.empty();
        }
    }

    private long countOrZero(Long value) {
        return value == null ? 0L : value;
    }

    record ScheduleSnapshot(long idleCount, long dueCount, long inProgressCount) {
        private static ScheduleSnapshot empty() {
            return new ScheduleSnapshot(0, 0, 0);
        }
    }
}
