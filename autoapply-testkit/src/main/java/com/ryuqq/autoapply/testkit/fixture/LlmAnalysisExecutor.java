package com.ryuqq.autoapply.testkit.fixture;

import com.ryuqq.autoapply.core.executor.AnalysisExecutor;
import com.ryuqq.autoapply.core.executor.LlmCapability;
import com.ryuqq.autoapply.core.model.Requirements;
import com.ryuqq.autoapply.core.model.ResourceId;
import com.ryuqq.autoapply.core.outcome.Fail;
import com.ryuqq.autoapply.core.outcome.Ok;
import com.ryuqq.autoapply.core.outcome.Outcome;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Analysis executor backed by an {@link LlmCapability}.
 *
 * <p>Asks the model for a comma separated skill list and declares the model's resource so the
 * governor meters every call.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LlmAnalysisExecutor implements AnalysisExecutor {

    private static final String PROMPT = "List the required skills in this job posting, comma separated:\n";

    private final LlmCapability llm;

    public LlmAnalysisExecutor(LlmCapability llm) {
        if (llm == null) {
            throw new IllegalArgumentException("llm cannot be null");
        }
        this.llm = llm;
    }

    @Override
    public Set<ResourceId> requiredResources() {
        return Set.of(llm.resource());
    }

    @Override
    public Outcome<Requirements> analyze(String postingText) {
        Outcome<String> completion = llm.complete(PROMPT + postingText, "fast");
        if (completion instanceof Ok<String> ok) {
            List<String> skills = Arrays.stream(ok.value().split(","))
                .map(String::trim)
                .filter(skill -> !skill.isEmpty())
                .toList();
            return Outcome.ok(Requirements.of(skills, List.of()));
        }
        Fail<String> fail = (Fail<String>) completion;
        return Outcome.fail(fail.kind(), fail.message(), fail.cause());
    }
}
