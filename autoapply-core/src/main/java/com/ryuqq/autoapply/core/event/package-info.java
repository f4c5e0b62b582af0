/**
 * Lifecycle events, the append-only audit trail of every application.
 *
 * <p>Events are written before the application projection is updated, so the log is the
 * source of truth after a crash. {@link com.ryuqq.autoapply.core.event.ApplicationProjector}
 * rebuilds a projection from its events.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.autoapply.core.event;
