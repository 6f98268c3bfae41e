package com.rvoc.jobqueue;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface JobScheduleRepository extends JpaRepository<JobSchedule, String> {

    /**
     * Aggregated schedule counters fetched in a single query.
     */
    interface ScheduleCounts {
        Long getIdleCount();

        Long getDueCount();

        Long getInProgressCount();
    }

    @Query("""
            SELECT j.name FROM JobSchedule j
            WHERE j.inProgress = false
              AND j.scheduledExecutionTime <= :now
            ORDER BY j.scheduledExecutionTime ASC, j.name ASC
            """)
    @QueryHints(@QueryHint(name = "org.hibernate.readOnly", value = "true"))
    List<String> findDueNames(@Param("now") OffsetDateTime now);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({ @QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2") }) // SKIP LOCKED
    @Query("""
            SELECT j FROM JobSchedule j
            WHERE j.name = :name
              AND j.inProgress = false
              AND j.scheduledExecutionTime <= :now
            """)
    Optional<JobSchedule> findClaimableForUpdate(@Param("name") String name, @Param("now") OffsetDateTime now);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({ @QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2") }) // SKIP LOCKED
    @Query("""
            SELECT j FROM JobSchedule j
            WHERE j.inProgress = true
              AND j.leaseAcquiredAt < :cutoff
            ORDER BY j.leaseAcquiredAt ASC
            """)
    List<JobSchedule> findStaleLeasesForUpdate(@Param("cutoff") OffsetDateTime cutoff);

    @Modifying
    @Query("""
            UPDATE JobSchedule j
            SET j.inProgress = false,
                j.leaseId = NULL,
                j.leasedBy = NULL,
                j.leaseAcquiredAt = NULL,
                j.scheduledExecutionTime = :nextExecutionTime,
                j.scheduleAnchor = NULL,
                j.consecutiveFailures = 0,
                j.lastError = NULL,
                j.lastFinishedAt = :now
            WHERE j.name = :name
              AND j.inProgress = true
              AND j.leaseId = :leaseId
            """)
    int markReleased(
            @Param("name") String name,
            @Param("leaseId") UUID leaseId,
            @Param("nextExecutionTime") OffsetDateTime nextExecutionTime,
            @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE JobSchedule j
            SET j.inProgress = false,
                j.leaseId = NULL,
                j.leasedBy = NULL,
                j.leaseAcquiredAt = NULL,
                j.scheduleAnchor = COALESCE(j.scheduleAnchor, j.scheduledExecutionTime),
                j.scheduledExecutionTime = :retryAt,
                j.consecutiveFailures = j.consecutiveFailures + 1,
                j.lastError = :errorMessage,
                j.lastFinishedAt = :now
            WHERE j.name = :name
              AND j.inProgress = true
              AND j.leaseId = :leaseId
            """)
    int markFailed(
            @Param("name") String name,
            @Param("leaseId") UUID leaseId,
            @Param("retryAt") OffsetDateTime retryAt,
            @Param("errorMessage") String errorMessage,
            @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE JobSchedule j
            SET j.leaseAcquiredAt = :now
            WHERE j.name = :name
              AND j.inProgress = true
              AND j.leaseId = :leaseId
            """)
    int renewLease(@Param("name") String name, @Param("leaseId") UUID leaseId, @Param("now") OffsetDateTime now);

    @Modifying
    @Query(value = """
            INSERT INTO job_queue (name, scheduled_execution_time, in_progress)
            VALUES (:name, :scheduledExecutionTime, false)
            ON CONFLICT (name) DO NOTHING
            """, nativeQuery = true)
    int insertIfMissing(@Param("name") String name,
            @Param("scheduledExecutionTime") OffsetDateTime scheduledExecutionTime);

    List<JobSchedule> deleteByNameNotIn(Collection<String> names);

    @Query("""
            SELECT
              COALESCE(SUM(CASE WHEN j.inProgress = false THEN 1 ELSE 0 END), 0) AS idleCount,
              COALESCE(SUM(CASE
                WHEN j.inProgress = false AND j.scheduledExecutionTime <= :now
                THEN 1 ELSE 0 END), 0) AS dueCount,
              COALESCE(SUM(CASE WHEN j.inProgress = true THEN 1 ELSE 0 END), 0) AS inProgressCount
            FROM JobSchedule j
            """)
    ScheduleCounts countSchedules(@Param("now") OffsetDateTime now);
}
