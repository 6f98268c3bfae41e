package com.rvoc.jobqueue;

import java.time.Duration;

/**
 * Per-job scheduling configuration bound from {@code rvoc.jobs.<job-name>.*}.
 */
public class JobSettings {

    private Duration interval;
    private Duration initialBackoff;
    private double backoffMultiplier;
    private Duration maxBackoff;
    private Recurrence recurrence = Recurrence.FROM_COMPLETION;
    private boolean concurrent = false;

    public JobSettings() {
    }

    public JobSettings(Duration interval, Duration initialBackoff, double backoffMultiplier, Duration maxBackoff) {
        this.interval = interval;
        this.initialBackoff = initialBackoff;
        this.backoffMultiplier = backoffMultiplier;
        this.maxBackoff = maxBackoff;
    }

    /**
     * Rejects settings under which a failing job could retry immediately or no sooner than a
     * successful one.
     */
    public void validate(String jobName) {
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalStateException("Job '" + jobName + "' must have a positive interval");
        }
        if (initialBackoff == null || initialBackoff.isNegative() || initialBackoff.isZero()) {
            throw new IllegalStateException("Job '" + jobName + "' must have a positive initial-backoff");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalStateException(
                    "Job '" + jobName + "' max-backoff must be >= initial-backoff");
        }
        if (maxBackoff.compareTo(interval) >= 0) {
            throw new IllegalStateException(
                    "Job '" + jobName + "' max-backoff (" + maxBackoff + ") must be shorter than its interval ("
                            + interval + ")");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalStateException("Job '" + jobName + "' backoff-multiplier must be >= 1.0");
        }
        if (recurrence == null) {
            throw new IllegalStateException("Job '" + jobName + "' must declare a recurrence");
        }
    }

    public Duration getInterval() {
        return interval;
    }

    public void setInterval(Duration interval) {
        this.interval = interval;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
        this.initialBackoff = initialBackoff;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
        this.maxBackoff = maxBackoff;
    }

    public Recurrence getRecurrence() {
        return recurrence;
    }

    public void setRecurrence(Recurrence recurrence) {
        this.recurrence = recurrence;
    }

    public boolean isConcurrent() {
        return concurrent;
    }

    public void setConcurrent(boolean concurrent) {
        this.concurrent = concurrent;
    }
}
