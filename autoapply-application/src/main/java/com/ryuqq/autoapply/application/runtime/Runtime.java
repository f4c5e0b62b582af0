package com.ryuqq.autoapply.application.runtime;

/**
 * Dispatch loop runtime.
 *
 * <p>One {@link #pump()} call performs a single dispatch cycle over the work queue.</p>
 *
 * <p><strong>Runtime Operation Flow:</strong></p>
 * <pre>
 * pump()
 *   ↓
 * 1. Dequeue due application ids (batch)
 * 2. For each id:
 *    a. Skip if already in flight or nothing to run in its state
 *    b. Lease declared resources (all-or-nothing), defer on denial
 *    c. Invoke the stage executor with a deadline
 *    d. Apply the outcome through the state machine:
 *       - Ok → forward transition, enqueue next stage
 *       - Fail → retry policy → STAGE_RETRY + delayed enqueue, or FAILED / NEEDS_REVIEW
 *    e. Release leases, session and the in-flight marker
 * </pre>
 *
 * <p><strong>Execution Context:</strong></p>
 * <ul>
 *   <li>pump() is typically invoked on a fixed delay by a scheduled executor</li>
 *   <li>Implementations must be thread-safe; overlapping pumps are allowed</li>
 *   <li>pump() never blocks on stage work; dispatches run on worker threads</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ScheduledExecutorService ticker = Executors.newSingleThreadScheduledExecutor();
 * ticker.scheduleWithFixedDelay(runtime::pump, 0, 100, TimeUnit.MILLISECONDS);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Runtime {

    /**
     * Executes a single dispatch cycle.
     *
     * <p>Per-application errors are caught and logged by the implementation; an exception
     * escaping this method indicates an infrastructure failure (queue or store unavailable).</p>
     */
    void pump();
}
