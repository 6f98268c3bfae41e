package com.rvoc.jobqueue;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "job_queue")
public class JobSchedule {

    @Id
    private String name;

    @Column(name = "scheduled_execution_time", nullable = false)
    private OffsetDateTime scheduledExecutionTime;

    @Column(name = "in_progress", nullable = false)
    private boolean inProgress = false;

    @Column(name = "lease_id")
    private UUID leaseId;

    @Column(name = "leased_by")
    private String leasedBy;

    @Column(name = "lease_acquired_at")
    private OffsetDateTime leaseAcquiredAt;

    @Column(name = "consecutive_failures", nullable = false)
    private int consecutiveFailures = 0;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    @Column(name = "last_started_at")
    private OffsetDateTime lastStartedAt;

    @Column(name = "last_finished_at")
    private OffsetDateTime lastFinishedAt;

    @Column(name = "schedule_anchor")
    private OffsetDateTime scheduleAnchor;

    protected JobSchedule() {
    }

    public JobSchedule(String name, OffsetDateTime scheduledExecutionTime) {
        this.name = name;
        this.scheduledExecutionTime = scheduledExecutionTime;
    }

    /**
     * Marks this row as leased. Callers must hold the row lock.
     */
    public void acquireLease(UUID leaseId, String leasedBy, OffsetDateTime now) {
        this.inProgress = true;
        this.leaseId = leaseId;
        this.leasedBy = leasedBy;
        this.leaseAcquiredAt = now;
        this.lastStartedAt = now;
    }

    /**
     * Returns this row to idle and due at {@code nextExecutionTime} without completing the current
     * slot, which stays recorded as the schedule anchor. Callers must hold the row lock.
     */
    public void clearLease(OffsetDateTime nextExecutionTime) {
        this.inProgress = false;
        this.leaseId = null;
        this.leasedBy = null;
        this.leaseAcquiredAt = null;
        if (this.scheduleAnchor == null) {
            this.scheduleAnchor = this.scheduledExecutionTime;
        }
        this.scheduledExecutionTime = nextExecutionTime;
    }

    public String getName() {
        return name;
    }

    public OffsetDateTime getScheduledExecutionTime() {
        return scheduledExecutionTime;
    }

    public boolean isInProgress() {
        return inProgress;
    }

    public UUID getLeaseId() {
        return leaseId;
    }

    public String getLeasedBy() {
        return leasedBy;
    }

    public OffsetDateTime getLeaseAcquiredAt() {
        return leaseAcquiredAt;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    /**
     * The slot the next run belongs to: the anchor of a pending retry, otherwise the scheduled
     * execution time.
     */
    public OffsetDateTime getScheduleAnchor() {
        return scheduleAnchor != null ? scheduleAnchor : scheduledExecutionTime;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public OffsetDateTime getLastStartedAt() {
        return lastStartedAt;
    }

    public OffsetDateTime getLastFinishedAt() {
        return lastFinishedAt;
    }
}
