package com.rvoc.jobqueue;

/**
 * How the next execution time of a recurring job is derived after a successful run.
 */
public enum Recurrence {

    /**
     * Next run is one interval after the run finished.
     */
    FROM_COMPLETION,

    /**
     * Next run is aligned to the previous scheduled time, skipping slots that already passed.
     */
    FROM_SCHEDULE
}
