package com.rvoc.user;

import com.rvoc.config.RVocProperties;
import com.rvoc.jobqueue.JobContext;
import com.rvoc.jobqueue.JobName;
import com.rvoc.jobqueue.ScheduledJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;

/**
 * Zeroes the login counters of every user whose counting interval ended at or before the job's
 * scheduled time. Using the scheduled time rather than the wall clock keeps a late or retried run
 * from resetting counters that started after the job became due.
 */
@Component
public class ResetLoginCountersJob implements ScheduledJob {

    private static final Logger log = LoggerFactory.getLogger(ResetLoginCountersJob.class);

    private final UserRepository userRepository;
    private final TransactionTemplate transactionTemplate;
    private final RVocProperties.Login properties;

    public ResetLoginCountersJob(
            UserRepository userRepository,
            TransactionTemplate transactionTemplate,
            RVocProperties properties) {
        this.userRepository = userRepository;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties.getLogin();
    }

    @Override
    public JobName getName() {
        return JobName.RESET_LOGIN_COUNTERS;
    }

    @Override
    public void execute(JobContext context) {
        OffsetDateTime cutoff = context.scheduledExecutionTime();
        OffsetDateTime nextReset = cutoff.plus(properties.getLoginAttemptCountingInterval());
        Integer reset = transactionTemplate.execute(
                status -> userRepository.resetLoginCounters(cutoff, nextReset));
        log.info("Reset login counters of {} users", reset);
    }
}
