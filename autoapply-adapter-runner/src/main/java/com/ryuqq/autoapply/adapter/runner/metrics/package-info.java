/**
 * Per-stage execution metrics backed by Micrometer.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.autoapply.adapter.runner.metrics;
