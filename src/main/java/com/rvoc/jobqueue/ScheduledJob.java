package com.rvoc.jobqueue;

/**
 * The work body behind one {@link JobName}. Implementations must be registered as Spring beans;
 * every {@link JobName} needs exactly one.
 */
public interface ScheduledJob {

    JobName getName();

    /**
     * Runs one execution. Any exception marks this execution as failed and schedules a retry after
     * the job's backoff delay.
     *
     * @param context the claimed execution
     * @throws Exception if the execution failed
     */
    void execute(JobContext context) throws Exception;
}
