package com.rvoc.jobqueue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Every recurring job known to the backend. The set of constants is the registry shared by all
 * processes that use the same {@code job_queue} table: each constant owns exactly one row, keyed by
 * {@link #getKey()}.
 */
public enum JobName {

    IMPORT_DICTIONARY_DUMP("import-dictionary-dump"),
    RESET_LOGIN_COUNTERS("reset-login-counters");

    private final String key;

    JobName(String key) {
        this.key = key;
    }

    /**
     * The value stored in {@code job_queue.name}.
     */
    public String getKey() {
        return key;
    }

    public static Optional<JobName> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(name -> name.key.equals(key))
                .findFirst();
    }

    @Override
    public String toString() {
        return key;
    }
}
