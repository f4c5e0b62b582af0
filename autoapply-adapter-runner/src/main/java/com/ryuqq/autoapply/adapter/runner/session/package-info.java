/**
 * Browser session pooling with per-platform ceilings and application affinity.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.autoapply.adapter.runner.session;
