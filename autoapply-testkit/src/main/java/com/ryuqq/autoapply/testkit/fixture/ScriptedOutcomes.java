package com.ryuqq.autoapply.testkit.fixture;

import com.ryuqq.autoapply.core.outcome.Outcome;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Queue of scripted outcomes shared by the scripted executors.
 *
 * <p>Each call takes the next scripted outcome; once the script runs out the fallback is returned.
 * A gate latch, when set, blocks every call until the test opens it.</p>
 *
 * @param <T> success value type
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class ScriptedOutcomes<T> {

    private final Deque<Supplier<Outcome<T>>> script = new ArrayDeque<>();
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger maxActive = new AtomicInteger();
    private volatile Supplier<Outcome<T>> fallback;
    private volatile CountDownLatch gate;
    private volatile long delayMs;

    ScriptedOutcomes(Supplier<Outcome<T>> fallback) {
        this.fallback = fallback;
    }

    synchronized void then(Outcome<T> outcome) {
        script.addLast(() -> outcome);
    }

    synchronized void thenThrow(RuntimeException exception) {
        script.addLast(() -> {
            throw exception;
        });
    }

    void otherwise(Supplier<Outcome<T>> fallback) {
        this.fallback = fallback;
    }

    void gate(CountDownLatch gate) {
        this.gate = gate;
    }

    void delay(long delayMs) {
        this.delayMs = delayMs;
    }

    Outcome<T> next() {
        calls.incrementAndGet();
        int running = active.incrementAndGet();
        maxActive.accumulateAndGet(running, Math::max);
        try {
            await();
            Supplier<Outcome<T>> step;
            synchronized (this) {
                step = script.isEmpty() ? fallback : script.pollFirst();
            }
            return step.get();
        } finally {
            active.decrementAndGet();
        }
    }

    int calls() {
        return calls.get();
    }

    int maxActive() {
        return maxActive.get();
    }

    private void await() {
        try {
            CountDownLatch current = gate;
            if (current != null && !current.await(30, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Scripted gate was never opened");
            }
            if (delayMs > 0) {
                Thread.sleep(delayMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Scripted call interrupted", e);
        }
    }
}
