/**
 * Retry and backoff policy keyed by failure kind.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.autoapply.core.retry;
