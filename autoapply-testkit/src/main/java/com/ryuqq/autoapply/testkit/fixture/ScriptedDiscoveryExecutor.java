package com.ryuqq.autoapply.testkit.fixture;

import com.ryuqq.autoapply.core.executor.DiscoveryExecutor;
import com.ryuqq.autoapply.core.model.DiscoveryQuery;
import com.ryuqq.autoapply.core.model.JobPosting;
import com.ryuqq.autoapply.core.model.ResourceId;
import com.ryuqq.autoapply.core.outcome.FailureKind;
import com.ryuqq.autoapply.core.outcome.Outcome;

import java.util.List;
import java.util.Set;

/**
 * Discovery executor that returns a fixed list of postings.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScriptedDiscoveryExecutor implements DiscoveryExecutor {

    private final ScriptedOutcomes<List<JobPosting>> outcomes;
    private Set<ResourceId> resources = Set.of();

    public ScriptedDiscoveryExecutor(List<JobPosting> postings) {
        List<JobPosting> copy = List.copyOf(postings);
        this.outcomes = new ScriptedOutcomes<>(() -> Outcome.ok(copy));
    }

    public ScriptedDiscoveryExecutor thenFail(FailureKind kind, String message) {
        outcomes.then(Outcome.fail(kind, message));
        return this;
    }

    public ScriptedDiscoveryExecutor requiring(ResourceId... resources) {
        this.resources = Set.of(resources);
        return this;
    }

    public ScriptedDiscoveryExecutor withDelay(long delayMs) {
        outcomes.delay(delayMs);
        return this;
    }

    @Override
    public Set<ResourceId> requiredResources() {
        return resources;
    }

    @Override
    public Outcome<List<JobPosting>> discover(DiscoveryQuery query) {
        return outcomes.next();
    }

    public int calls() {
        return outcomes.calls();
    }
}
