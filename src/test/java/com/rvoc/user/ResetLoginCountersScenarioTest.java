package com.rvoc.user;

import com.rvoc.PostgresTestSupport;
import com.rvoc.RVocApplication;
import com.rvoc.config.RVocProperties;
import com.rvoc.jobqueue.ClaimResult;
import com.rvoc.jobqueue.JobName;
import com.rvoc.jobqueue.JobQueueStore;
import com.rvoc.jobqueue.JobSchedule;
import com.rvoc.jobqueue.JobScheduleRepository;
import com.rvoc.jobqueue.Lease;
import com.rvoc.jobqueue.LeaseManager;
import com.rvoc.jobqueue.internal.JobRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = RVocApplication.class, properties = {
        "rvoc.scheduler.enabled=false",
        "rvoc.jobs.reset-login-counters.recurrence=from-schedule" })
class ResetLoginCountersScenarioTest extends PostgresTestSupport {

    @Autowired
    JobQueueStore jobQueueStore;

    @Autowired
    JobScheduleRepository jobScheduleRepository;

    @Autowired
    JobRunner jobRunner;

    @Autowired
    RVocProperties properties;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @Autowired
    UserRepository userRepository;

    @Autowired
    TransactionTemplate transactionTemplate;

    OffsetDateTime scheduledAt;

    @BeforeEach
    void setUp() {
        scheduledAt = OffsetDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS).minusSeconds(1);
        jdbcTemplate.update("DELETE FROM users");
        jdbcTemplate.update("UPDATE job_queue SET in_progress = false, lease_id = NULL, leased_by = NULL, "
                + "lease_acquired_at = NULL, consecutive_failures = 0, schedule_anchor = NULL, "
                + "scheduled_execution_time = ?",
                scheduledAt.plusDays(1));
        jdbcTemplate.update("UPDATE job_queue SET scheduled_execution_time = ? WHERE name = ?",
                scheduledAt, "reset-login-counters");

        insertUser("expired", 7, 2, scheduledAt.minusMinutes(5));
        insertUser("expiring-now", 1, 1, scheduledAt);
        insertUser("active", 3, 1, scheduledAt.plusMinutes(30));
    }

    @Test
    void shouldLetExactlyOneOfTwoInstancesResetTheCounters() throws Exception {
        Clock clock = Clock.systemUTC();
        LeaseManager first = new LeaseManager(jobQueueStore, clock, properties);
        LeaseManager second = new LeaseManager(jobQueueStore, clock, properties);
        CountDownLatch start = new CountDownLatch(1);

        CompletableFuture<ClaimResult> firstClaim = CompletableFuture.supplyAsync(() -> claimAfter(start, first));
        CompletableFuture<ClaimResult> secondClaim = CompletableFuture.supplyAsync(() -> claimAfter(start, second));
        start.countDown();
        List<ClaimResult> results = List.of(firstClaim.get(30, TimeUnit.SECONDS), secondClaim.get(30, TimeUnit.SECONDS));

        List<Lease> leases = results.stream().flatMap(result -> result.getLease().stream()).toList();
        assertThat(leases).hasSize(1);
        assertThat(results).filteredOn(result -> !result.isClaimed())
                .singleElement()
                .satisfies(result -> assertThat(result.getFailureReason())
                        .contains(ClaimResult.FailureReason.HELD_ELSEWHERE_OR_NOT_DUE));

        Lease lease = leases.get(0);
        assertThat(lease.scheduledExecutionTime()).isAtSameInstantAs(scheduledAt);
        assertThat(jobRunner.run(lease)).isTrue();

        Duration countingInterval = properties.getLogin().getLoginAttemptCountingInterval();
        assertCounters("expired", 0, 0, scheduledAt.plus(countingInterval));
        assertCounters("expiring-now", 0, 0, scheduledAt.plus(countingInterval));
        assertCounters("active", 3, 1, scheduledAt.plusMinutes(30));

        JobSchedule schedule = jobScheduleRepository.findById("reset-login-counters").orElseThrow();
        assertThat(schedule.isInProgress()).isFalse();
        assertThat(schedule.getScheduledExecutionTime())
                .isAtSameInstantAs(scheduledAt.plus(properties.getJobs().getResetLoginCounters().getInterval()));
        assertThat(schedule.getScheduledExecutionTime()).isAfter(lease.claimedAt());
    }

    @Test
    void shouldOnlyAdvanceResetTimeWhenCountersAreAlreadyZero() throws Exception {
        jdbcTemplate.update("UPDATE users SET login_attempt_count = 0, failed_login_attempt_count = 0 "
                + "WHERE name = 'expired'");
        LeaseManager leaseManager = new LeaseManager(jobQueueStore, Clock.systemUTC(), properties);
        Lease lease = leaseManager.claim(JobName.RESET_LOGIN_COUNTERS).getLease().orElseThrow();

        jobRunner.run(lease);

        assertCounters("expired", 0, 0,
                scheduledAt.plus(properties.getLogin().getLoginAttemptCountingInterval()));
    }

    @Test
    void shouldMatchNoRowsWhenRepeatingResetWithSameCutoff() {
        OffsetDateTime nextReset = scheduledAt.plus(properties.getLogin().getLoginAttemptCountingInterval());

        Integer first = transactionTemplate.execute(
                status -> userRepository.resetLoginCounters(scheduledAt, nextReset));
        Integer repeated = transactionTemplate.execute(
                status -> userRepository.resetLoginCounters(scheduledAt, nextReset));

        assertThat(first).isEqualTo(2);
        assertThat(repeated).isZero();
        assertCounters("expired", 0, 0, nextReset);
        assertCounters("active", 3, 1, scheduledAt.plusMinutes(30));
    }

    @Test
    void shouldKeepResetCadenceWhenRunSucceedsAfterFailedAttempt() {
        Lease failed = new LeaseManager(jobQueueStore, Clock.systemUTC(), properties)
                .claim(JobName.RESET_LOGIN_COUNTERS).getLease().orElseThrow();
        OffsetDateTime retryAt = failed.claimedAt().plus(1, ChronoUnit.MILLIS);
        jobQueueStore.fail(failed, Duration.ofMillis(1), "IllegalStateException: database busy", failed.claimedAt());

        Lease retry = jobQueueStore.tryClaim(JobName.RESET_LOGIN_COUNTERS, retryAt.plus(1, ChronoUnit.MILLIS), "node-retry")
                .orElseThrow();
        assertThat(jobRunner.run(retry)).isTrue();

        JobSchedule schedule = jobScheduleRepository.findById("reset-login-counters").orElseThrow();
        assertThat(schedule.getScheduledExecutionTime())
                .isAtSameInstantAs(scheduledAt.plus(properties.getJobs().getResetLoginCounters().getInterval()));
    }

    private static ClaimResult claimAfter(CountDownLatch start, LeaseManager leaseManager) {
        try {
            start.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
        return leaseManager.claim("reset-login-counters");
    }

    private void insertUser(String name, int logins, int failedLogins, OffsetDateTime nextReset) {
        jdbcTemplate.update("INSERT INTO users (name, password_hash, login_attempt_count, "
                + "failed_login_attempt_count, next_login_attempt_count_reset) VALUES (?, NULL, ?, ?, ?)",
                name, logins, failedLogins, nextReset);
    }

    private void assertCounters(String name, int logins, int failedLogins, OffsetDateTime nextReset) {
        Map<String, Object> row = jdbcTemplate.queryForMap("SELECT login_attempt_count, failed_login_attempt_count, "
                + "next_login_attempt_count_reset FROM users WHERE name = ?", name);
        assertThat(row.get("login_attempt_count")).as(name).isEqualTo(logins);
        assertThat(row.get("failed_login_attempt_count")).as(name).isEqualTo(failedLogins);
        OffsetDateTime actualReset = jdbcTemplate.queryForObject(
                "SELECT next_login_attempt_count_reset FROM users WHERE name = ?", OffsetDateTime.class, name);
        assertThat(actualReset).as(name).isAtSameInstantAs(nextReset);
    }
}
