package com.ryuqq.autoapply.core.spi;

import com.ryuqq.autoapply.core.model.Job;
import com.ryuqq.autoapply.core.model.JobId;
import com.ryuqq.autoapply.core.model.Requirements;

import java.util.Optional;

/**
 * Job storage SPI.
 *
 * <p>Jobs are deduplicated by source URL and become immutable once their requirements are attached.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface JobStore {

    Optional<Job> find(JobId id);

    Optional<Job> findBySourceUrl(String sourceUrl);

    /**
     * Stores the job unless one with the same source URL exists.
     *
     * @param job job to store
     * @return the stored job (existing one when the URL is already known)
     */
    Job saveIfAbsent(Job job);

    /**
     * Attaches requirements once.
     *
     * <p>If requirements are already attached (for example by a concurrent analysis of the same
     * job for another candidate) the stored job is returned unchanged.</p>
     *
     * @param id job id
     * @param requirements extracted requirements
     * @return the job with requirements
     * @throws IllegalArgumentException if the job does not exist
     */
    Job attachRequirements(JobId id, Requirements requirements);
}
