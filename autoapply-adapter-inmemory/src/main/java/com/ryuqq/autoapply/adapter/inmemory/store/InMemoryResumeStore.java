package com.ryuqq.autoapply.adapter.inmemory.store;

import com.ryuqq.autoapply.core.model.Resume;
import com.ryuqq.autoapply.core.model.ResumeId;
import com.ryuqq.autoapply.core.spi.ResumeStore;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link ResumeStore} SPI.
 *
 * <p>Rejects tailored resumes whose parent is unknown, so every stored version has a
 * resolvable lineage back to an original.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryResumeStore implements ResumeStore {

    private final ConcurrentHashMap<ResumeId, Resume> resumes = new ConcurrentHashMap<>();

    @Override
    public Optional<Resume> find(ResumeId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return Optional.ofNullable(resumes.get(id));
    }

    @Override
    public void save(Resume resume) {
        if (resume == null) {
            throw new IllegalArgumentException("resume cannot be null");
        }
        if (!resume.isOriginal() && !resumes.containsKey(resume.parentId())) {
            throw new IllegalStateException("Parent resume not found: " + resume.parentId());
        }
        if (resumes.putIfAbsent(resume.id(), resume) != null) {
            throw new IllegalStateException("Resume already exists: " + resume.id());
        }
    }

    @Override
    public List<Resume> findDerivedFrom(ResumeId parentId) {
        if (parentId == null) {
            throw new IllegalArgumentException("parentId cannot be null");
        }
        return resumes.values().stream()
            .filter(resume -> parentId.equals(resume.parentId()))
            .sorted(Comparator.comparing(Resume::createdAt))
            .toList();
    }

    public void clear() {
        resumes.clear();
    }
}
