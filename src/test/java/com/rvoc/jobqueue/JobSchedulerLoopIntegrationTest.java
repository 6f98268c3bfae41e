package com.rvoc.jobqueue;

import com.rvoc.PostgresTestSupport;
import com.rvoc.RVocApplication;
import com.rvoc.vocabulary.WordRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.annotation.DirtiesContext;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@SpringBootTest(classes = RVocApplication.class, properties = {
        "rvoc.scheduler.enabled=true",
        "rvoc.scheduler.poll-interval-in-seconds=1",
        "rvoc.jobs.import-dictionary-dump.concurrent=true" })
@DirtiesContext
class JobSchedulerLoopIntegrationTest extends PostgresTestSupport {

    @Autowired
    JobScheduleRepository jobScheduleRepository;

    @Autowired
    WordRepository wordRepository;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @Test
    void shouldRunEveryDueJobAndScheduleItsNextExecution() {
        OffsetDateTime started = OffsetDateTime.now(ZoneOffset.UTC);
        jdbcTemplate.update("UPDATE job_queue SET scheduled_execution_time = now() - interval '1 second' "
                + "WHERE NOT in_progress");

        await().atMost(Duration.ofSeconds(30)).untilAsserted(() -> assertThat(jobScheduleRepository.findAll())
                .hasSize(JobName.values().length)
                .allSatisfy(schedule -> {
                    assertThat(schedule.isInProgress()).isFalse();
                    assertThat(schedule.getLastFinishedAt()).isAfter(started);
                    assertThat(schedule.getScheduledExecutionTime()).isAfter(started);
                }));

        assertThat(wordRepository.count()).isGreaterThanOrEqualTo(4);
        assertThat(jobScheduleRepository.findById("import-dictionary-dump").orElseThrow().getScheduledExecutionTime())
                .isAfter(started.plusHours(23));
    }
}
