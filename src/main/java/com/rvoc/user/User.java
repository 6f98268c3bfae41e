package com.rvoc.user;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Duration;
import java.time.OffsetDateTime;

@Entity
@Table(name = "users")
public class User {

    @Id
    private String name;

    @Column(name = "password_hash")
    private String passwordHash;

    @Column(name = "login_attempt_count", nullable = false)
    private int loginAttemptCount = 0;

    @Column(name = "failed_login_attempt_count", nullable = false)
    private int failedLoginAttemptCount = 0;

    @Column(name = "next_login_attempt_count_reset", nullable = false)
    private OffsetDateTime nextLoginAttemptCountReset;

    protected User() {
    }

    public User(String name, String passwordHash, OffsetDateTime nextLoginAttemptCountReset) {
        this.name = name;
        this.passwordHash = passwordHash;
        this.nextLoginAttemptCountReset = nextLoginAttemptCountReset;
    }

    /**
     * Records a login attempt if the limits allow it. Counters whose reset time has passed are
     * zeroed first, and the first attempt of a fresh counting interval starts that interval.
     *
     * @return {@code false} if the attempt exceeds one of the limits; nothing is recorded then
     */
    public boolean tryLoginAttempt(OffsetDateTime now, LoginLimits limits) {
        if (!now.isBefore(nextLoginAttemptCountReset)) {
            loginAttemptCount = 0;
            failedLoginAttemptCount = 0;
        }
        if (loginAttemptCount >= limits.maxLoginAttempts()
                || failedLoginAttemptCount >= limits.maxFailedLoginAttempts()) {
            return false;
        }
        if (loginAttemptCount == 0 && failedLoginAttemptCount == 0) {
            nextLoginAttemptCountReset = now.plus(limits.countingInterval());
        }
        loginAttemptCount++;
        return true;
    }

    /**
     * Marks the attempt recorded by the last successful {@link #tryLoginAttempt} as failed.
     */
    public void failLoginAttempt() {
        failedLoginAttemptCount++;
    }

    public String getName() {
        return name;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public int getLoginAttemptCount() {
        return loginAttemptCount;
    }

    public int getFailedLoginAttemptCount() {
        return failedLoginAttemptCount;
    }

    public OffsetDateTime getNextLoginAttemptCountReset() {
        return nextLoginAttemptCountReset;
    }

    public record LoginLimits(int maxLoginAttempts, int maxFailedLoginAttempts, Duration countingInterval) {
    }
}
