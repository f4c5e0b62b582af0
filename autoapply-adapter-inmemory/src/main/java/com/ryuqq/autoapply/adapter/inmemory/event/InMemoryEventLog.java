package com.ryuqq.autoapply.adapter.inmemory.event;

import com.ryuqq.autoapply.core.event.EventListener;
import com.ryuqq.autoapply.core.event.LifecycleEvent;
import com.ryuqq.autoapply.core.event.Subscription;
import com.ryuqq.autoapply.core.model.ApplicationId;
import com.ryuqq.autoapply.core.spi.EventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link EventLog} SPI for testing and reference purposes.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>events:</strong> ConcurrentSkipListMap&lt;Long, LifecycleEvent&gt; - global log ordered by sequence</li>
 *   <li><strong>byApplication:</strong> ConcurrentHashMap&lt;ApplicationId, List&gt; - per-application history</li>
 *   <li><strong>listeners:</strong> CopyOnWriteArrayList&lt;EventListener&gt; - subscribers</li>
 * </ul>
 *
 * <p>Sequence assignment and indexing happen under one lock so that sequence order equals
 * per-application order. Listeners are notified outside the lock.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryEventLog implements EventLog {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventLog.class);

    private final ConcurrentSkipListMap<Long, LifecycleEvent> events = new ConcurrentSkipListMap<>();
    private final Map<ApplicationId, List<LifecycleEvent>> byApplication = new ConcurrentHashMap<>();
    private final List<EventListener> listeners = new CopyOnWriteArrayList<>();
    private long lastSequence;

    @Override
    public LifecycleEvent append(LifecycleEvent draft) {
        if (draft == null) {
            throw new IllegalArgumentException("draft cannot be null");
        }
        if (draft.sequence() != 0) {
            throw new IllegalArgumentException("draft already has a sequence: " + draft.sequence());
        }

        LifecycleEvent stored;
        synchronized (this) {
            stored = draft.withSequence(++lastSequence);
            events.put(stored.sequence(), stored);
            byApplication.computeIfAbsent(stored.applicationId(), id -> new CopyOnWriteArrayList<>()).add(stored);
        }

        for (EventListener listener : listeners) {
            try {
                listener.onEvent(stored);
            } catch (RuntimeException e) {
                log.error("Event listener failed on event #{} for {}", stored.sequence(), stored.applicationId(), e);
            }
        }
        return stored;
    }

    @Override
    public List<LifecycleEvent> history(ApplicationId applicationId) {
        if (applicationId == null) {
            throw new IllegalArgumentException("applicationId cannot be null");
        }
        List<LifecycleEvent> history = byApplication.get(applicationId);
        return history == null ? List.of() : List.copyOf(history);
    }

    @Override
    public List<LifecycleEvent> readFrom(long afterSequence, int limit) {
        if (afterSequence < 0) {
            throw new IllegalArgumentException("afterSequence cannot be negative, but was: " + afterSequence);
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, but was: " + limit);
        }
        List<LifecycleEvent> result = new ArrayList<>();
        for (LifecycleEvent event : events.tailMap(afterSequence, false).values()) {
            if (result.size() >= limit) {
                break;
            }
            result.add(event);
        }
        return result;
    }

    @Override
    public Subscription subscribe(EventListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Total number of events. Used for test assertions.
     */
    public int size() {
        return events.size();
    }

    public synchronized void clear() {
        events.clear();
        byApplication.clear();
        listeners.clear();
        lastSequence = 0;
    }
}
