/**
 * Runtime port: the dispatch cycle driven by a scheduler or test harness.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.autoapply.application.runtime;
