package com.ryuqq.autoapply.core.executor;

import com.ryuqq.autoapply.core.model.Platform;
import com.ryuqq.autoapply.core.outcome.Outcome;

/**
 * Opens and closes browser sessions (login included).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SessionProvider {

    Outcome<Session> open(Platform platform);

    /**
     * Closes a session. Must tolerate sessions that are already broken.
     */
    void close(Session session);
}
