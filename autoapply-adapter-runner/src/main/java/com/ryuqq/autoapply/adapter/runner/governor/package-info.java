/**
 * Token bucket implementation of the resource governor.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.autoapply.adapter.runner.governor;
