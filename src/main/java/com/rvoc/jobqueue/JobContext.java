package com.rvoc.jobqueue;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * What a job body knows about the execution it is performing.
 */
public record JobContext(
        JobName name,
        OffsetDateTime scheduledExecutionTime,
        OffsetDateTime claimedAt,
        UUID leaseId) {

    public static JobContext of(Lease lease) {
        return new JobContext(lease.name(), lease.scheduledExecutionTime(), lease.claimedAt(), lease.id());
    }
}
