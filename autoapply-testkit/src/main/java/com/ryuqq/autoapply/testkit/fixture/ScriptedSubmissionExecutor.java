package com.ryuqq.autoapply.testkit.fixture;

import com.ryuqq.autoapply.core.executor.Session;
import com.ryuqq.autoapply.core.executor.SubmissionExecutor;
import com.ryuqq.autoapply.core.model.Job;
import com.ryuqq.autoapply.core.model.Platform;
import com.ryuqq.autoapply.core.model.Resume;
import com.ryuqq.autoapply.core.model.SubmissionReceipt;
import com.ryuqq.autoapply.core.outcome.FailureKind;
import com.ryuqq.autoapply.core.outcome.Outcome;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Submission executor for one platform that replays scripted outcomes.
 *
 * <p>Unscripted calls are confirmed with a generated token. Every call records the session and
 * resume it was given so tests can check affinity and lineage.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScriptedSubmissionExecutor implements SubmissionExecutor {

    private final Platform platform;
    private final ScriptedOutcomes<SubmissionReceipt> outcomes;
    private final List<Submission> submissions = new ArrayList<>();

    public ScriptedSubmissionExecutor(Platform platform) {
        if (platform == null) {
            throw new IllegalArgumentException("platform cannot be null");
        }
        this.platform = platform;
        this.outcomes = new ScriptedOutcomes<>(
            () -> Outcome.ok(SubmissionReceipt.confirmed("CNF-" + System.nanoTime())));
    }

    public ScriptedSubmissionExecutor thenConfirm(String token) {
        outcomes.then(Outcome.ok(SubmissionReceipt.confirmed(token)));
        return this;
    }

    public ScriptedSubmissionExecutor thenAccept() {
        outcomes.then(Outcome.ok(SubmissionReceipt.accepted()));
        return this;
    }

    public ScriptedSubmissionExecutor thenFail(FailureKind kind, String message) {
        outcomes.then(Outcome.fail(kind, message));
        return this;
    }

    public ScriptedSubmissionExecutor thenThrow(RuntimeException exception) {
        outcomes.thenThrow(exception);
        return this;
    }

    public ScriptedSubmissionExecutor alwaysFail(FailureKind kind, String message) {
        outcomes.otherwise(() -> Outcome.fail(kind, message));
        return this;
    }

    /**
     * Blocks every submission until the latch is opened.
     */
    public ScriptedSubmissionExecutor gatedBy(CountDownLatch gate) {
        outcomes.gate(gate);
        return this;
    }

    public ScriptedSubmissionExecutor withDelay(long delayMs) {
        outcomes.delay(delayMs);
        return this;
    }

    @Override
    public Platform platform() {
        return platform;
    }

    @Override
    public Outcome<SubmissionReceipt> submit(Session session, Resume resume, Job job) {
        synchronized (submissions) {
            submissions.add(new Submission(session.id(), resume, job));
        }
        return outcomes.next();
    }

    public int calls() {
        return outcomes.calls();
    }

    /**
     * Highest number of submissions that were running at the same time.
     */
    public int maxConcurrent() {
        return outcomes.maxActive();
    }

    public List<Submission> submissions() {
        synchronized (submissions) {
            return List.copyOf(submissions);
        }
    }

    /**
     * One recorded submit call.
     */
    public record Submission(String sessionId, Resume resume, Job job) {
    }
}
