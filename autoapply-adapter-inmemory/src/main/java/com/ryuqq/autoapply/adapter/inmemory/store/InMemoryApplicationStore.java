package com.ryuqq.autoapply.adapter.inmemory.store;

import com.ryuqq.autoapply.core.model.Application;
import com.ryuqq.autoapply.core.model.ApplicationId;
import com.ryuqq.autoapply.core.model.CandidateId;
import com.ryuqq.autoapply.core.model.JobId;
import com.ryuqq.autoapply.core.spi.ApplicationStore;
import com.ryuqq.autoapply.core.statemachine.ApplicationState;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link ApplicationStore} SPI for testing and reference purposes.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>applications:</strong> ConcurrentHashMap&lt;ApplicationId, Application&gt; - current projections</li>
 *   <li><strong>latestByPair:</strong> ConcurrentHashMap&lt;PairKey, ApplicationId&gt; - most recent application per (job, candidate)</li>
 * </ul>
 *
 * <p><strong>Compare-and-set:</strong> {@link ConcurrentHashMap#replace(Object, Object, Object)} on the
 * exact instance read under the expected version, so two writers holding the same version cannot both win.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Scans are O(N) over all applications</li>
 *   <li>Data lost on process restart</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryApplicationStore implements ApplicationStore {

    private final ConcurrentHashMap<ApplicationId, Application> applications;
    private final ConcurrentHashMap<PairKey, ApplicationId> latestByPair;

    public InMemoryApplicationStore() {
        this.applications = new ConcurrentHashMap<>();
        this.latestByPair = new ConcurrentHashMap<>();
    }

    @Override
    public Optional<Application> find(ApplicationId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return Optional.ofNullable(applications.get(id));
    }

    @Override
    public void insert(Application application) {
        if (application == null) {
            throw new IllegalArgumentException("application cannot be null");
        }
        Application existing = applications.putIfAbsent(application.id(), application);
        if (existing != null) {
            throw new IllegalStateException("Application already exists: " + application.id());
        }
        latestByPair.put(new PairKey(application.jobId(), application.candidateId()), application.id());
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Reads the current instance, checks its version, then replaces that exact instance</li>
     *   <li>A concurrent writer between read and replace makes {@code replace} fail</li>
     * </ul>
     */
    @Override
    public boolean compareAndSet(Application updated, long expectedVersion) {
        if (updated == null) {
            throw new IllegalArgumentException("updated cannot be null");
        }
        Application current = applications.get(updated.id());
        if (current == null || current.version() != expectedVersion) {
            return false;
        }
        return applications.replace(updated.id(), current, updated);
    }

    @Override
    public Optional<Application> findLatest(JobId jobId, CandidateId candidateId) {
        if (jobId == null || candidateId == null) {
            throw new IllegalArgumentException("jobId and candidateId cannot be null");
        }
        ApplicationId id = latestByPair.get(new PairKey(jobId, candidateId));
        return id == null ? Optional.empty() : Optional.ofNullable(applications.get(id));
    }

    @Override
    public List<Application> findByStates(Set<ApplicationState> states, int limit) {
        if (states == null) {
            throw new IllegalArgumentException("states cannot be null");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, but was: " + limit);
        }
        return applications.values().stream()
            .filter(application -> states.contains(application.state()))
            .sorted(Comparator.comparing(Application::updatedAt))
            .limit(limit)
            .toList();
    }

    @Override
    public List<Application> findByStatesAfter(Set<ApplicationState> states, ApplicationId afterId, int limit) {
        if (states == null) {
            throw new IllegalArgumentException("states cannot be null");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, but was: " + limit);
        }
        return applications.values().stream()
            .filter(application -> states.contains(application.state()))
            .filter(application -> afterId == null || application.id().compareTo(afterId) > 0)
            .sorted(Comparator.comparing(Application::id))
            .limit(limit)
            .toList();
    }

    @Override
    public List<Application> findInStateUpdatedBefore(ApplicationState state, Instant updatedBefore, int limit) {
        if (state == null || updatedBefore == null) {
            throw new IllegalArgumentException("state and updatedBefore cannot be null");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, but was: " + limit);
        }
        return applications.values().stream()
            .filter(application -> application.state() == state)
            .filter(application -> !application.updatedAt().isAfter(updatedBefore))
            .sorted(Comparator.comparing(Application::updatedAt))
            .limit(limit)
            .toList();
    }

    /**
     * Replaces a projection unconditionally. Used by tests to simulate a stale projection.
     */
    public void overwrite(Application application) {
        if (application == null) {
            throw new IllegalArgumentException("application cannot be null");
        }
        applications.put(application.id(), application);
    }

    public int size() {
        return applications.size();
    }

    public void clear() {
        applications.clear();
        latestByPair.clear();
    }

    private record PairKey(JobId jobId, CandidateId candidateId) {
    }
}
