package com.ryuqq.autoapply.testkit.fixture;

import com.ryuqq.autoapply.core.executor.LlmCapability;
import com.ryuqq.autoapply.core.model.ResourceId;
import com.ryuqq.autoapply.core.outcome.Outcome;

import java.util.ArrayList;
import java.util.List;

/**
 * LLM capability that answers every prompt with a fixed completion.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScriptedLlm implements LlmCapability {

    private final ResourceId resource;
    private final String completion;
    private final List<String> prompts = new ArrayList<>();

    public ScriptedLlm(String provider, String completion) {
        this.resource = ResourceId.llm(provider);
        this.completion = completion;
    }

    @Override
    public ResourceId resource() {
        return resource;
    }

    @Override
    public synchronized Outcome<String> complete(String prompt, String modelHint) {
        prompts.add(prompt);
        return Outcome.ok(completion);
    }

    public synchronized List<String> prompts() {
        return List.copyOf(prompts);
    }
}
