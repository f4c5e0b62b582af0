package com.ryuqq.autoapply.core.spi;

import com.ryuqq.autoapply.core.event.EventListener;
import com.ryuqq.autoapply.core.event.LifecycleEvent;
import com.ryuqq.autoapply.core.event.Subscription;
import com.ryuqq.autoapply.core.model.ApplicationId;

import java.util.List;

/**
 * Append-only lifecycle event log SPI.
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Assigns a global, strictly increasing sequence number on append</li>
 *   <li>Events of one application are returned in append order</li>
 *   <li>Notifies subscribers after the event is durable; a failing subscriber
 *       must not affect the append or other subscribers</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface EventLog {

    /**
     * Appends an event.
     *
     * @param draft event with sequence 0
     * @return the stored event with its assigned sequence
     * @throws IllegalArgumentException if the draft already carries a sequence
     */
    LifecycleEvent append(LifecycleEvent draft);

    /**
     * Full history of one application, in order.
     */
    List<LifecycleEvent> history(ApplicationId applicationId);

    /**
     * Events with sequence strictly greater than {@code afterSequence}.
     *
     * @param afterSequence last sequence the caller has seen (0 for the beginning)
     * @param limit maximum number of events
     * @return events in sequence order
     */
    List<LifecycleEvent> readFrom(long afterSequence, int limit);

    /**
     * Registers a listener for events appended from now on.
     */
    Subscription subscribe(EventListener listener);
}
