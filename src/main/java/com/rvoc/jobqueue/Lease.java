package com.rvoc.jobqueue;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * The right to execute one named job, recorded in the store as {@code in_progress = true} with
 * {@code lease_id = id}. Only the holder of the matching lease id may release it.
 *
 * @param id                     unique per claim; guards release against a lease reclaimed in between
 * @param name                   the claimed job
 * @param scheduledExecutionTime the time the job was due when claimed
 * @param claimedAt              the time the claim committed
 * @param leasedBy               node id of the claiming process
 * @param consecutiveFailures    failed executions since the last success, before this one
 * @param scheduleAnchor         the regular slot this run belongs to; differs from
 *                               {@code scheduledExecutionTime} when the run is a retry
 */
public record Lease(
        UUID id,
        JobName name,
        OffsetDateTime scheduledExecutionTime,
        OffsetDateTime claimedAt,
        String leasedBy,
        int consecutiveFailures,
        OffsetDateTime scheduleAnchor) {

    public Lease(UUID id, JobName name, OffsetDateTime scheduledExecutionTime, OffsetDateTime claimedAt,
            String leasedBy, int consecutiveFailures) {
        this(id, name, scheduledExecutionTime, claimedAt, leasedBy, consecutiveFailures, scheduledExecutionTime);
    }
}
