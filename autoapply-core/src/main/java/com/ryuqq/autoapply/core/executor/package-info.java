/**
 * Stage executor capability interfaces consumed by the scheduler.
 *
 * <h2>Executors</h2>
 * <ul>
 *   <li>{@link com.ryuqq.autoapply.core.executor.DiscoveryExecutor} - query to postings</li>
 *   <li>{@link com.ryuqq.autoapply.core.executor.AnalysisExecutor} - posting text to requirements</li>
 *   <li>{@link com.ryuqq.autoapply.core.executor.TailoringExecutor} - resume and requirements to tailored content</li>
 *   <li>{@link com.ryuqq.autoapply.core.executor.SubmissionExecutor} - session, resume and job to receipt (one per platform)</li>
 * </ul>
 *
 * <p>Supporting capabilities: {@link com.ryuqq.autoapply.core.executor.LlmCapability} and
 * {@link com.ryuqq.autoapply.core.executor.SessionProvider}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.autoapply.core.executor;
