package com.ryuqq.autoapply.core.spi;

import com.ryuqq.autoapply.core.model.ApplicationId;

import java.util.List;

/**
 * Delayed work queue of application ids awaiting dispatch.
 *
 * <p>The queue only carries ids; the stored projection decides what to run. Duplicate
 * entries are therefore harmless and the scheduler drops ids that are already in flight.</p>
 *
 * <p><strong>Delay Behavior:</strong></p>
 * <ul>
 *   <li>delayMs = 0: immediately available</li>
 *   <li>delayMs &gt; 0: available after the delay (retry backoff, governor deferral)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface WorkQueue {

    /**
     * @param applicationId application to dispatch
     * @param delayMs delay before the entry becomes available
     * @throws IllegalArgumentException if applicationId is null or delayMs is negative
     */
    void enqueue(ApplicationId applicationId, long delayMs);

    /**
     * Removes and returns up to {@code batchSize} due entries.
     *
     * @param batchSize maximum number of entries
     * @return due entries (possibly empty)
     * @throws IllegalArgumentException if batchSize is not positive
     */
    List<ApplicationId> dequeue(int batchSize);

    /**
     * Number of entries, due or not.
     */
    int size();
}
