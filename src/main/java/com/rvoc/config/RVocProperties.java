package com.rvoc.config;

import com.rvoc.jobqueue.JobName;
import com.rvoc.jobqueue.JobSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "rvoc")
public class RVocProperties {

    private final Database database = new Database();
    private final Scheduler scheduler = new Scheduler();
    private final Jobs jobs = new Jobs();
    private final Dictionary dictionary = new Dictionary();
    private final Login login = new Login();

    public Database getDatabase() {
        return database;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public Dictionary getDictionary() {
        return dictionary;
    }

    public Login getLogin() {
        return login;
    }

    public static class Database {
        private boolean skipMigrations = false;
        private boolean failOnMigrationError = true;

        public boolean isSkipMigrations() {
            return skipMigrations;
        }

        public void setSkipMigrations(boolean skipMigrations) {
            this.skipMigrations = skipMigrations;
        }

        public boolean isFailOnMigrationError() {
            return failOnMigrationError;
        }

        public void setFailOnMigrationError(boolean failOnMigrationError) {
            this.failOnMigrationError = failOnMigrationError;
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private long pollIntervalInSeconds = 1;
        private int workerCount = 2;
        private Duration maxLeaseDuration = Duration.ofMinutes(30);
        private long staleLeaseSweepIntervalInSeconds = 60;
        private int maximumTransactionRetryCount = 10;
        private boolean deleteUnknownJobs = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getPollIntervalInSeconds() {
            return pollIntervalInSeconds;
        }

        public void setPollIntervalInSeconds(long pollIntervalInSeconds) {
            this.pollIntervalInSeconds = pollIntervalInSeconds;
        }

        public Duration getPollInterval() {
            return Duration.ofSeconds(pollIntervalInSeconds);
        }

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public Duration getMaxLeaseDuration() {
            return maxLeaseDuration;
        }

        public void setMaxLeaseDuration(Duration maxLeaseDuration) {
            this.maxLeaseDuration = maxLeaseDuration;
        }

        public long getStaleLeaseSweepIntervalInSeconds() {
            return staleLeaseSweepIntervalInSeconds;
        }

        public void setStaleLeaseSweepIntervalInSeconds(long staleLeaseSweepIntervalInSeconds) {
            this.staleLeaseSweepIntervalInSeconds = staleLeaseSweepIntervalInSeconds;
        }

        public int getMaximumTransactionRetryCount() {
            return maximumTransactionRetryCount;
        }

        public void setMaximumTransactionRetryCount(int maximumTransactionRetryCount) {
            this.maximumTransactionRetryCount = maximumTransactionRetryCount;
        }

        public boolean isDeleteUnknownJobs() {
            return deleteUnknownJobs;
        }

        public void setDeleteUnknownJobs(boolean deleteUnknownJobs) {
            this.deleteUnknownJobs = deleteUnknownJobs;
        }
    }

    public static class Jobs {
        private final JobSettings importDictionaryDump = new JobSettings(
                Duration.ofDays(1), Duration.ofMinutes(5), 2.0, Duration.ofHours(2));
        private final JobSettings resetLoginCounters = new JobSettings(
                Duration.ofMinutes(10), Duration.ofSeconds(30), 2.0, Duration.ofMinutes(5));

        public JobSettings getImportDictionaryDump() {
            return importDictionaryDump;
        }

        public JobSettings getResetLoginCounters() {
            return resetLoginCounters;
        }

        public JobSettings settingsFor(JobName name) {
            return switch (name) {
                case IMPORT_DICTIONARY_DUMP -> importDictionaryDump;
                case RESET_LOGIN_COUNTERS -> resetLoginCounters;
            };
        }
    }

    public static class Dictionary {
        private String dumpLocation = "https://kaikki.org/dictionary/English/kaikki.org-dictionary-English.jsonl.gz";
        private int batchSize = 1000;

        public String getDumpLocation() {
            return dumpLocation;
        }

        public void setDumpLocation(String dumpLocation) {
            this.dumpLocation = dumpLocation;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Login {
        private int maxLoginAttemptsPerInterval = 10;
        private int maxFailedLoginAttemptsPerInterval = 3;
        private Duration loginAttemptCountingInterval = Duration.ofHours(1);

        public int getMaxLoginAttemptsPerInterval() {
            return maxLoginAttemptsPerInterval;
        }

        public void setMaxLoginAttemptsPerInterval(int maxLoginAttemptsPerInterval) {
            this.maxLoginAttemptsPerInterval = maxLoginAttemptsPerInterval;
        }

        public int getMaxFailedLoginAttemptsPerInterval() {
            return maxFailedLoginAttemptsPerInterval;
        }

        public void setMaxFailedLoginAttemptsPerInterval(int maxFailedLoginAttemptsPerInterval) {
            this.maxFailedLoginAttemptsPerInterval = maxFailedLoginAttemptsPerInterval;
        }

        public Duration getLoginAttemptCountingInterval() {
            return loginAttemptCountingInterval;
        }

        public void setLoginAttemptCountingInterval(Duration loginAttemptCountingInterval) {
            this.loginAttemptCountingInterval = loginAttemptCountingInterval;
        }
    }
}
