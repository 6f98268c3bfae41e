package com.rvoc.jobqueue.internal;

import com.rvoc.jobqueue.JobSettings;
import com.rvoc.jobqueue.Lease;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Computes when a job runs next, after success or failure.
 */
final class ExecutionTimes {

    private ExecutionTimes() {
    }

    /**
     * The next execution after a successful run. Always strictly after the claim time. Schedule
     * based recurrence counts from the lease's anchor, so retries do not shift the grid.
     */
    static OffsetDateTime nextAfterSuccess(JobSettings settings, Lease lease, OffsetDateTime finishedAt) {
        Duration interval = settings.getInterval();
        return switch (settings.getRecurrence()) {
            case FROM_COMPLETION -> latest(finishedAt, lease.claimedAt()).plus(interval);
            case FROM_SCHEDULE -> nextSlotAfter(lease.scheduleAnchor(), interval, lease.claimedAt());
        };
    }

    /**
     * Delay before retrying after the {@code failureCount}-th consecutive failure:
     * {@code initialBackoff * multiplier^(failureCount - 1)}, capped at {@code maxBackoff}. Valid
     * settings keep the result positive and shorter than the job's interval.
     */
    static Duration retryDelay(JobSettings settings, int failureCount) {
        long initialMs = settings.getInitialBackoff().toMillis();
        long maxMs = settings.getMaxBackoff().toMillis();
        double factor = Math.pow(settings.getBackoffMultiplier(), Math.max(0, failureCount - 1));
        double delayMs = initialMs * factor;
        long boundedMs = Double.isFinite(delayMs) ? (long) Math.min(delayMs, maxMs) : maxMs;
        return Duration.ofMillis(Math.max(1, boundedMs));
    }

    private static OffsetDateTime nextSlotAfter(OffsetDateTime anchor, Duration interval, OffsetDateTime claimedAt) {
        OffsetDateTime next = anchor.plus(interval);
        if (next.isAfter(claimedAt)) {
            return next;
        }
        long missed = Duration.between(anchor, claimedAt).toNanos() / interval.toNanos();
        next = anchor.plus(interval.multipliedBy(missed));
        while (!next.isAfter(claimedAt)) {
            next = next.plus(interval);
        }
        return next;
    }

    private static OffsetDateTime latest(OffsetDateTime a, OffsetDateTime b) {
        return a.isAfter(b) ? a : b;
    }
}
