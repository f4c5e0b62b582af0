package com.ryuqq.autoapply.core.spi;

import com.ryuqq.autoapply.core.model.Resume;
import com.ryuqq.autoapply.core.model.ResumeId;

import java.util.List;
import java.util.Optional;

/**
 * Resume version storage SPI.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ResumeStore {

    Optional<Resume> find(ResumeId id);

    /**
     * Stores a resume version.
     *
     * @param resume resume to store
     * @throws IllegalStateException if the id is taken, or the parent of a tailored resume is unknown
     */
    void save(Resume resume);

    /**
     * Tailored versions derived directly from {@code parentId}, oldest first.
     */
    List<Resume> findDerivedFrom(ResumeId parentId);
}
