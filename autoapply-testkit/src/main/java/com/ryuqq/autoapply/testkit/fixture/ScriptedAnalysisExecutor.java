package com.ryuqq.autoapply.testkit.fixture;

import com.ryuqq.autoapply.core.executor.AnalysisExecutor;
import com.ryuqq.autoapply.core.model.Requirements;
import com.ryuqq.autoapply.core.model.ResourceId;
import com.ryuqq.autoapply.core.outcome.FailureKind;
import com.ryuqq.autoapply.core.outcome.Outcome;

import java.util.List;
import java.util.Set;

/**
 * Analysis executor that replays scripted outcomes.
 *
 * <p>Succeeds with the configured requirements unless a failure is scripted.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScriptedAnalysisExecutor implements AnalysisExecutor {

    private final ScriptedOutcomes<Requirements> outcomes;
    private Set<ResourceId> resources = Set.of();

    public ScriptedAnalysisExecutor(Requirements requirements) {
        this.outcomes = new ScriptedOutcomes<>(() -> Outcome.ok(requirements));
    }

    public static ScriptedAnalysisExecutor returning(String... skills) {
        return new ScriptedAnalysisExecutor(Requirements.of(List.of(skills), List.of()));
    }

    public ScriptedAnalysisExecutor thenFail(FailureKind kind, String message) {
        outcomes.then(Outcome.fail(kind, message));
        return this;
    }

    public ScriptedAnalysisExecutor alwaysFail(FailureKind kind, String message) {
        outcomes.otherwise(() -> Outcome.fail(kind, message));
        return this;
    }

    public ScriptedAnalysisExecutor requiring(ResourceId... resources) {
        this.resources = Set.of(resources);
        return this;
    }

    public ScriptedAnalysisExecutor withDelay(long delayMs) {
        outcomes.delay(delayMs);
        return this;
    }

    @Override
    public Set<ResourceId> requiredResources() {
        return resources;
    }

    @Override
    public Outcome<Requirements> analyze(String postingText) {
        return outcomes.next();
    }

    public int calls() {
        return outcomes.calls();
    }
}
