/**
 * In-memory stores for applications, jobs and resumes.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.autoapply.adapter.inmemory.store;
