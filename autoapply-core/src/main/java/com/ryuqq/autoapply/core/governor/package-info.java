/**
 * Rate/Resource Governor SPI and lease types.
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@code TokenBucketGovernor} (adapter-runner) - token bucket budgets with concurrency caps</li>
 *   <li>{@link com.ryuqq.autoapply.core.governor.noop.NoOpResourceGovernor} - always grants</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.autoapply.core.governor;
