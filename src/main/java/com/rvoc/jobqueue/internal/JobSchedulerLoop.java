package com.rvoc.jobqueue.internal;

import com.rvoc.config.RVocProperties;
import com.rvoc.jobqueue.JobName;
import com.rvoc.jobqueue.JobQueueAccessException;
import com.rvoc.jobqueue.JobQueueStore;
import com.rvoc.jobqueue.Lease;
import com.rvoc.jobqueue.LeaseManager;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Polls the job queue for due jobs, claims them and runs them. Every process runs one loop; the
 * atomic claim decides which process runs a job.
 */
@Component
@ConditionalOnProperty(prefix = "rvoc.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobSchedulerLoop {

    private static final Logger log = LoggerFactory.getLogger(JobSchedulerLoop.class);

    enum State {
        IDLE,
        POLLING
    }

    private final JobQueueStore jobQueueStore;
    private final LeaseManager leaseManager;
    private final JobRunner jobRunner;
    private final JobRegistry jobRegistry;
    private final Clock clock;
    private final ThreadPoolExecutor workerExecutor;
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);

    public JobSchedulerLoop(
            JobQueueStore jobQueueStore,
            LeaseManager leaseManager,
            JobRunner jobRunner,
            JobRegistry jobRegistry,
            Clock clock,
            RVocProperties properties) {
        this.jobQueueStore = jobQueueStore;
        this.leaseManager = leaseManager;
        this.jobRunner = jobRunner;
        this.jobRegistry = jobRegistry;
        this.clock = clock;

        int workerCount = Math.max(1, properties.getScheduler().getWorkerCount());
        AtomicInteger threadCount = new AtomicInteger();
        this.workerExecutor = new ThreadPoolExecutor(
                workerCount,
                workerCount,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(workerCount),
                runnable -> new Thread(runnable, "rvoc-job-worker-" + threadCount.incrementAndGet()),
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Scheduled(fixedDelayString = "${rvoc.scheduler.poll-interval-in-seconds:1}000")
    public void poll() {
        if (!state.compareAndSet(State.IDLE, State.POLLING)) {
            log.debug("Previous poll still running on {}, skipping this tick", leaseManager.getNodeId());
            return;
        }
        try {
            pollOnce();
        } catch (JobQueueAccessException e) {
            log.error("Job queue is unavailable, retrying on the next poll", e);
        } finally {
            state.set(State.IDLE);
        }
    }

    State getState() {
        return state.get();
    }

    private void pollOnce() {
        List<String> dueNames = jobQueueStore.findDue(OffsetDateTime.now(clock));
        if (dueNames.isEmpty()) {
            return;
        }
        log.debug("Found {} due jobs: {}", dueNames.size(), dueNames);

        for (String dueName : dueNames) {
            Optional<JobName> name = JobName.fromKey(dueName);
            boolean concurrent = name.flatMap(jobRegistry::find)
                    .map(registration -> registration.settings().isConcurrent())
                    .orElse(false);
            if (concurrent && !hasFreeWorker()) {
                log.debug("No free worker for job {}, leaving it for the next poll", dueName);
                continue;
            }

            Optional<Lease> lease = leaseManager.claim(dueName).getLease();
            if (lease.isEmpty()) {
                continue;
            }
            if (concurrent) {
                dispatch(lease.get());
            } else {
                jobRunner.run(lease.get());
            }
        }
    }

    private boolean hasFreeWorker() {
        return workerExecutor.getActiveCount() + workerExecutor.getQueue().size()
                < workerExecutor.getMaximumPoolSize();
    }

    private void dispatch(Lease lease) {
        try {
            workerExecutor.execute(() -> jobRunner.run(lease));
        } catch (RejectedExecutionException saturated) {
            log.debug("Worker pool saturated, running job {} inline", lease.name());
            jobRunner.run(lease);
        }
    }

    @PreDestroy
    public void shutdown() {
        workerExecutor.shutdown();
        try {
            if (!workerExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Running jobs did not finish within 30s, their leases are left to the stale lease sweep");
                workerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
