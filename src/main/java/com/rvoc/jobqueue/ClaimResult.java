package com.rvoc.jobqueue;

import java.util.Optional;

/**
 * Outcome of a claim attempt: either a {@link Lease}, or a failure reason. A failed claim is an
 * expected outcome, not an error.
 */
public final class ClaimResult {

    public enum FailureReason {
        /**
         * Another process holds the lease, has just taken it, or the job is not due yet.
         */
        HELD_ELSEWHERE_OR_NOT_DUE,

        /**
         * The row's name has no counterpart in {@link JobName}.
         */
        UNKNOWN_JOB
    }

    private final Lease lease;
    private final FailureReason failureReason;

    private ClaimResult(Lease lease, FailureReason failureReason) {
        this.lease = lease;
        this.failureReason = failureReason;
    }

    public static ClaimResult claimed(Lease lease) {
        return new ClaimResult(lease, null);
    }

    public static ClaimResult failed(FailureReason reason) {
        return new ClaimResult(null, reason);
    }

    public boolean isClaimed() {
        return lease != null;
    }

    public Optional<Lease> getLease() {
        return Optional.ofNullable(lease);
    }

    public Optional<FailureReason> getFailureReason() {
        return Optional.ofNullable(failureReason);
    }

    @Override
    public String toString() {
        return isClaimed() ? "Claimed[" + lease + "]" : "ClaimFailed[" + failureReason + "]";
    }
}
