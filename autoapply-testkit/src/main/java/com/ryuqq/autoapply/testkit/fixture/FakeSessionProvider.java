package com.ryuqq.autoapply.testkit.fixture;

import com.ryuqq.autoapply.core.executor.Session;
import com.ryuqq.autoapply.core.executor.SessionProvider;
import com.ryuqq.autoapply.core.model.Platform;
import com.ryuqq.autoapply.core.outcome.FailureKind;
import com.ryuqq.autoapply.core.outcome.Outcome;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Session provider that hands out numbered fake browser sessions.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FakeSessionProvider implements SessionProvider {

    private final AtomicInteger sequence = new AtomicInteger();
    private final AtomicBoolean failOpens = new AtomicBoolean(false);
    private final AtomicInteger throwingOpens = new AtomicInteger();
    private final AtomicInteger openAttempts = new AtomicInteger();
    private final List<Session> opened = new ArrayList<>();
    private final List<Session> closed = new ArrayList<>();

    /**
     * Makes every following open fail with {@code transient_network} until reset.
     */
    public void failOpens(boolean fail) {
        failOpens.set(fail);
    }

    /**
     * Makes the next {@code count} opens throw instead of returning an outcome.
     */
    public void throwOnNextOpens(int count) {
        throwingOpens.set(count);
    }

    @Override
    public Outcome<Session> open(Platform platform) {
        openAttempts.incrementAndGet();
        if (throwingOpens.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new IllegalStateException("Browser process crashed on launch");
        }
        if (failOpens.get()) {
            return Outcome.fail(FailureKind.TRANSIENT_NETWORK, "Browser failed to start");
        }
        Session session = new FakeSession(platform.getName() + "-" + sequence.incrementAndGet(), platform);
        synchronized (this) {
            opened.add(session);
        }
        return Outcome.ok(session);
    }

    @Override
    public synchronized void close(Session session) {
        closed.add(session);
    }

    public int openAttempts() {
        return openAttempts.get();
    }

    public synchronized List<Session> opened() {
        return List.copyOf(opened);
    }

    public synchronized List<Session> closed() {
        return List.copyOf(closed);
    }

    /**
     * Session handle with an id and a platform.
     */
    public record FakeSession(String id, Platform platform) implements Session {
    }
}
