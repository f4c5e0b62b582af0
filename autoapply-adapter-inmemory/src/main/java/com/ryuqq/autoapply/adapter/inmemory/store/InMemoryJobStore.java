package com.ryuqq.autoapply.adapter.inmemory.store;

import com.ryuqq.autoapply.core.model.Job;
import com.ryuqq.autoapply.core.model.JobId;
import com.ryuqq.autoapply.core.model.Requirements;
import com.ryuqq.autoapply.core.spi.JobStore;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link JobStore} SPI.
 *
 * <p>URL deduplication and requirement attachment are atomic per key
 * ({@link ConcurrentHashMap#computeIfAbsent}, {@link ConcurrentHashMap#compute}).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryJobStore implements JobStore {

    private final ConcurrentHashMap<JobId, Job> jobs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, JobId> idsByUrl = new ConcurrentHashMap<>();

    @Override
    public Optional<Job> find(JobId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public Optional<Job> findBySourceUrl(String sourceUrl) {
        if (sourceUrl == null) {
            throw new IllegalArgumentException("sourceUrl cannot be null");
        }
        JobId id = idsByUrl.get(sourceUrl);
        return id == null ? Optional.empty() : Optional.ofNullable(jobs.get(id));
    }

    @Override
    public Job saveIfAbsent(Job job) {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        JobId id = idsByUrl.computeIfAbsent(job.sourceUrl(), url -> {
            jobs.put(job.id(), job);
            return job.id();
        });
        return jobs.get(id);
    }

    @Override
    public Job attachRequirements(JobId id, Requirements requirements) {
        if (id == null || requirements == null) {
            throw new IllegalArgumentException("id and requirements cannot be null");
        }
        Job updated = jobs.computeIfPresent(id, (key, job) -> job.hasRequirements() ? job : job.withRequirements(requirements));
        if (updated == null) {
            throw new IllegalArgumentException("Job not found: " + id);
        }
        return updated;
    }

    public int size() {
        return jobs.size();
    }

    public void clear() {
        jobs.clear();
        idsByUrl.clear();
    }
}
