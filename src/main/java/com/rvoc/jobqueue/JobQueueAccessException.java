package com.rvoc.jobqueue;

/**
 * The job queue table could not be read or written, either because of a permanent database error or
 * because a transaction kept failing transiently until the retry limit.
 */
public class JobQueueAccessException extends RuntimeException {

    public JobQueueAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
