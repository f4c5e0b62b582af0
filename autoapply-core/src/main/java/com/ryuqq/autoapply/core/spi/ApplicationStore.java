package com.ryuqq.autoapply.core.spi;

import com.ryuqq.autoapply.core.model.Application;
import com.ryuqq.autoapply.core.model.ApplicationId;
import com.ryuqq.autoapply.core.model.CandidateId;
import com.ryuqq.autoapply.core.model.JobId;
import com.ryuqq.autoapply.core.statemachine.ApplicationState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Application projection storage SPI.
 *
 * <p>Stores the current projection of each application. The event log is the source of truth;
 * this store is updated right after each event append using optimistic versioning.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called from multiple workers</li>
 *   <li>Compare-and-set: {@link #compareAndSet} succeeds only when the stored version matches</li>
 *   <li>Scans return applications ordered by {@code updatedAt} ascending (oldest first)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ApplicationStore {

    Optional<Application> find(ApplicationId id);

    /**
     * Inserts a new application.
     *
     * @param application application to insert (version 0)
     * @throws IllegalStateException if an application with the same id already exists
     */
    void insert(Application application);

    /**
     * Replaces the stored projection if its version still equals {@code expectedVersion}.
     *
     * @param updated new projection
     * @param expectedVersion version the caller read
     * @return true if replaced, false if the stored version moved on or the application is missing
     */
    boolean compareAndSet(Application updated, long expectedVersion);

    /**
     * Most recently created application for a (job, candidate) pair.
     */
    Optional<Application> findLatest(JobId jobId, CandidateId candidateId);

    /**
     * Applications currently in any of the given states.
     *
     * @param states states to match
     * @param limit maximum number of results
     * @return matches, oldest update first
     */
    List<Application> findByStates(Set<ApplicationState> states, int limit);

    /**
     * One page of applications in any of the given states, ordered by id.
     *
     * <p>Keyset paging: pass the last id of the previous page as {@code afterId} to continue.
     * Updating an application does not move it between pages.</p>
     *
     * @param states states to match
     * @param afterId exclusive lower bound of the id, or {@code null} for the first page
     * @param limit maximum number of results
     * @return matches with an id greater than {@code afterId}, ascending by id
     */
    List<Application> findByStatesAfter(Set<ApplicationState> states, ApplicationId afterId, int limit);

    /**
     * Applications that entered {@code state} no later than {@code updatedBefore}.
     *
     * @param state state to match
     * @param updatedBefore inclusive upper bound of {@code updatedAt}
     * @param limit maximum number of results
     * @return matches, oldest update first
     */
    List<Application> findInStateUpdatedBefore(ApplicationState state, Instant updatedBefore, int limit);
}
