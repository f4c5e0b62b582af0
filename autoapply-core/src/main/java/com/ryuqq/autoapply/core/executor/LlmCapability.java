package com.ryuqq.autoapply.core.executor;

import com.ryuqq.autoapply.core.model.ResourceId;
import com.ryuqq.autoapply.core.outcome.Outcome;

/**
 * Text completion capability shared by the analysis and tailoring executors.
 *
 * <p>Executors built on an LLM should include {@link #resource()} in their
 * {@link StageExecutor#requiredResources()} so that provider budgets are enforced by the governor.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface LlmCapability {

    /**
     * Governor resource for this provider (for example {@code llm:openai}).
     */
    ResourceId resource();

    /**
     * @param prompt prompt text
     * @param modelHint preferred model, may be null to let the provider choose
     * @return completion text, or a failure (rate_limited on HTTP 429)
     */
    Outcome<String> complete(String prompt, String modelHint);
}
