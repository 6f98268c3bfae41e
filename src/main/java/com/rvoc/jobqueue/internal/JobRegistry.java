package com.rvoc.jobqueue.internal;

import com.rvoc.config.RVocProperties;
import com.rvoc.jobqueue.JobName;
import com.rvoc.jobqueue.JobSettings;
import com.rvoc.jobqueue.ScheduledJob;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed mapping from {@link JobName} to the bean that runs it, built once at startup. Startup fails
 * unless every name has exactly one handler and valid settings, so all processes built from the same
 * code agree on the mapping.
 */
@Component
public class JobRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    private final List<ScheduledJob> jobs;
    private final RVocProperties properties;
    private volatile Map<JobName, RegisteredJob> jobsByName = Map.of();

    public JobRegistry(List<ScheduledJob> jobs, RVocProperties properties) {
        this.jobs = jobs;
        this.properties = properties;
    }

    @PostConstruct
    void init() {
        Map<JobName, RegisteredJob> registrations = new EnumMap<>(JobName.class);
        for (ScheduledJob job : jobs) {
            JobName name = job.getName();
            if (name == null) {
                throw new IllegalStateException(
                        "ScheduledJob " + ClassUtils.getUserClass(job).getName() + " must return a job name");
            }
            JobSettings settings = properties.getJobs().settingsFor(name);
            settings.validate(name.getKey());
            RegisteredJob existing = registrations.putIfAbsent(name, new RegisteredJob(name, job, settings));
            if (existing != null) {
                throw new IllegalStateException("Duplicate handler for job '" + name + "': "
                        + ClassUtils.getUserClass(existing.job()).getName() + " and "
                        + ClassUtils.getUserClass(job).getName());
            }
        }
        for (JobName name : JobName.values()) {
            if (!registrations.containsKey(name)) {
                throw new IllegalStateException("No ScheduledJob bean handles job '" + name + "'");
            }
        }
        this.jobsByName = Map.copyOf(registrations);
        log.info("Job registry initialized with {} jobs: {}", jobsByName.size(), JobName.values());
    }

    public Optional<RegisteredJob> find(JobName name) {
        return Optional.ofNullable(jobsByName.get(name));
    }

    public RegisteredJob get(JobName name) {
        return find(name).orElseThrow(() -> new IllegalStateException("Job '" + name + "' is not registered"));
    }

    public Set<JobName> names() {
        return jobsByName.keySet();
    }

    public record RegisteredJob(JobName name, ScheduledJob job, JobSettings settings) {
    }
}
