package com.rvoc.jobqueue.internal;

import com.rvoc.config.RVocProperties;
import com.rvoc.jobqueue.JobQueueAccessException;
import com.rvoc.jobqueue.JobQueueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Makes sure every registered job has its row in {@code job_queue} before the first poll, and
 * removes rows of jobs this build no longer knows. Startup fails if the store cannot be reached,
 * since a job without a row would never run.
 */
@Component
public class JobScheduleInitializer implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(JobScheduleInitializer.class);

    private final JobQueueStore jobQueueStore;
    private final JobRegistry jobRegistry;
    private final Clock clock;
    private final boolean deleteUnknownJobs;
    private volatile boolean running = false;

    public JobScheduleInitializer(
            JobQueueStore jobQueueStore,
            JobRegistry jobRegistry,
            Clock clock,
            RVocProperties properties) {
        this.jobQueueStore = jobQueueStore;
        this.jobRegistry = jobRegistry;
        this.clock = clock;
        this.deleteUnknownJobs = properties.getScheduler().isDeleteUnknownJobs();
    }

    @Override
    public void start() {
        log.info("Initializing job schedules for {}", jobRegistry.names());
        try {
            List<String> deleted = jobQueueStore.initialise(jobRegistry.names(), OffsetDateTime.now(clock),
                    deleteUnknownJobs);
            for (String name : deleted) {
                log.warn("Deleted schedule of unknown job {}", name);
            }
        } catch (JobQueueAccessException e) {
            throw new IllegalStateException("Failed to initialize job schedules for " + jobRegistry.names(), e);
        }
        this.running = true;
    }

    @Override
    public void stop() {
        this.running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MIN_VALUE + 100;
    }
}
