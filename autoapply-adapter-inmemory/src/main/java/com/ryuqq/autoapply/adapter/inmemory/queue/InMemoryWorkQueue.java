package com.ryuqq.autoapply.adapter.inmemory.queue;

import com.ryuqq.autoapply.core.model.ApplicationId;
import com.ryuqq.autoapply.core.spi.WorkQueue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link WorkQueue} SPI for testing and reference purposes.
 *
 * <p>Uses {@link DelayQueue} for delayed availability. Entries with equal due time are
 * returned in enqueue order.</p>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>enqueue:</strong> O(log N) - DelayQueue insertion</li>
 *   <li><strong>dequeue:</strong> O(M log N) where M = batchSize</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryWorkQueue implements WorkQueue {

    private final DelayQueue<DelayedEntry> queue = new DelayQueue<>();
    private final AtomicLong order = new AtomicLong();

    @Override
    public void enqueue(ApplicationId applicationId, long delayMs) {
        if (applicationId == null) {
            throw new IllegalArgumentException("applicationId cannot be null");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs cannot be negative, but was: " + delayMs);
        }
        queue.put(new DelayedEntry(applicationId, System.currentTimeMillis() + delayMs, order.incrementAndGet()));
    }

    @Override
    public List<ApplicationId> dequeue(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, but was: " + batchSize);
        }
        List<ApplicationId> result = new ArrayList<>();
        for (int i = 0; i < batchSize; i++) {
            DelayedEntry entry = queue.poll();
            if (entry == null) {
                break;
            }
            result.add(entry.applicationId);
        }
        return result;
    }

    @Override
    public int size() {
        return queue.size();
    }

    public void clear() {
        queue.clear();
    }

    /**
     * Queue entry that becomes available at {@code availableAt}.
     */
    private static final class DelayedEntry implements Delayed {
        private final ApplicationId applicationId;
        private final long availableAt;
        private final long order;

        DelayedEntry(ApplicationId applicationId, long availableAt, long order) {
            this.applicationId = applicationId;
            this.availableAt = availableAt;
            this.order = order;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(availableAt - System.currentTimeMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            DelayedEntry that = (DelayedEntry) other;
            int byTime = Long.compare(availableAt, that.availableAt);
            return byTime != 0 ? byTime : Long.compare(order, that.order);
        }
    }
}
