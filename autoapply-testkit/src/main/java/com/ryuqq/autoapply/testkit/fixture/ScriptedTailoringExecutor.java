package com.ryuqq.autoapply.testkit.fixture;

import com.ryuqq.autoapply.core.executor.TailoringExecutor;
import com.ryuqq.autoapply.core.model.Requirements;
import com.ryuqq.autoapply.core.model.ResourceId;
import com.ryuqq.autoapply.core.model.Resume;
import com.ryuqq.autoapply.core.model.TailoredResume;
import com.ryuqq.autoapply.core.model.TailoringMode;
import com.ryuqq.autoapply.core.outcome.FailureKind;
import com.ryuqq.autoapply.core.outcome.Outcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Tailoring executor that appends the matched skills to the resume content.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScriptedTailoringExecutor implements TailoringExecutor {

    private final ScriptedOutcomes<TailoredResume> failures = new ScriptedOutcomes<>(() -> null);
    private final List<TailoringMode> modes = new ArrayList<>();
    private Set<ResourceId> resources = Set.of();

    public ScriptedTailoringExecutor thenFail(FailureKind kind, String message) {
        failures.then(Outcome.fail(kind, message));
        return this;
    }

    public ScriptedTailoringExecutor requiring(ResourceId... resources) {
        this.resources = Set.of(resources);
        return this;
    }

    @Override
    public Set<ResourceId> requiredResources() {
        return resources;
    }

    @Override
    public Outcome<TailoredResume> tailor(Resume resume, Requirements requirements, TailoringMode mode) {
        synchronized (modes) {
            modes.add(mode);
        }
        Outcome<TailoredResume> scripted = failures.next();
        if (scripted != null) {
            return scripted;
        }
        String content = resume.content() + "\n[" + mode.name().toLowerCase() + "] " + String.join(", ", requirements.skills());
        return Outcome.ok(new TailoredResume(content, requirements.skills()));
    }

    public int calls() {
        return failures.calls();
    }

    public List<TailoringMode> modes() {
        synchronized (modes) {
            return List.copyOf(modes);
        }
    }
}
