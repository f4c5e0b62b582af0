package com.ryuqq.autoapply.core.executor;

import com.ryuqq.autoapply.core.model.ResourceId;

import java.util.Set;

/**
 * Common contract of every stage executor.
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Stateless with respect to job data: every input is passed in and every result is returned</li>
 *   <li>Never throw: failures are reported as {@link com.ryuqq.autoapply.core.outcome.Fail}
 *       with a {@link com.ryuqq.autoapply.core.outcome.FailureKind}</li>
 *   <li>Declare the shared resources each invocation consumes so the scheduler can lease them first</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StageExecutor {

    /**
     * The stage this executor implements.
     */
    Stage stage();

    /**
     * Resources leased from the governor for the duration of one invocation.
     *
     * @return resource ids (empty when the executor needs no shared resource)
     */
    default Set<ResourceId> requiredResources() {
        return Set.of();
    }
}
