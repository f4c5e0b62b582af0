package com.ryuqq.autoapply.core.executor;

import com.ryuqq.autoapply.core.model.Platform;

/**
 * Handle to an authenticated browser session on one platform.
 *
 * <p>The orchestrator never looks inside a session; it only pools and hands it to the
 * platform's {@link SubmissionExecutor}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Session {

    /**
     * Unique id of this session, stable for its lifetime.
     */
    String id();

    Platform platform();
}
