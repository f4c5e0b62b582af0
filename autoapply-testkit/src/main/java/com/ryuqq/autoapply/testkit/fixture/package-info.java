/**
 * Scripted stage executors, fake sessions and sample data for scheduler tests.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.autoapply.testkit.fixture;
