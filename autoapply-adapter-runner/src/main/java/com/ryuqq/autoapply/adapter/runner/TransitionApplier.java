package com.ryuqq.autoapply.adapter.runner;

import com.ryuqq.autoapply.core.event.ApplicationProjector;
import com.ryuqq.autoapply.core.event.EventCause;
import com.ryuqq.autoapply.core.event.LifecycleEvent;
import com.ryuqq.autoapply.core.model.Application;
import com.ryuqq.autoapply.core.model.FailureRecord;
import com.ryuqq.autoapply.core.model.ResumeId;
import com.ryuqq.autoapply.core.spi.ApplicationStore;
import com.ryuqq.autoapply.core.spi.EventLog;
import com.ryuqq.autoapply.core.statemachine.ApplicationState;
import com.ryuqq.autoapply.core.statemachine.LifecycleTrigger;
import com.ryuqq.autoapply.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * 상태 전이 기록기 (write-ahead).
 *
 * <p>모든 상태 변경은 이 클래스를 거칩니다.</p>
 *
 * <p><strong>처리 순서:</strong></p>
 * <pre>
 * 1. StateTransition.next(from, trigger) 검증 (불가능하면 IllegalTransitionException, 기록 없음)
 * 2. EventLog.append(event) → 순번 부여 (이 시점에 전이가 확정됨)
 * 3. ApplicationProjector.apply(current, event) → 새 projection
 * 4. ApplicationStore.compareAndSet(projection, current.version)
 *    실패 시 이벤트 이력 전체를 replay하여 projection 복구
 * </pre>
 *
 * <p>3~4단계가 실패해도 이벤트는 이미 기록되어 있으므로 Recovery가 이력으로 projection을 다시 맞춥니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TransitionApplier {

    private static final Logger log = LoggerFactory.getLogger(TransitionApplier.class);

    private final ApplicationStore applicationStore;
    private final EventLog eventLog;
    private final Clock clock;

    public TransitionApplier(ApplicationStore applicationStore, EventLog eventLog, Clock clock) {
        if (applicationStore == null) {
            throw new IllegalArgumentException("applicationStore cannot be null");
        }
        if (eventLog == null) {
            throw new IllegalArgumentException("eventLog cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.applicationStore = applicationStore;
        this.eventLog = eventLog;
        this.clock = clock;
    }

    /**
     * 성공 계열 전이 기록.
     */
    public Application apply(Application current, LifecycleTrigger trigger, EventCause cause, int attempt) {
        return apply(current, trigger, cause, attempt, null, null, null);
    }

    /**
     * 전이 기록.
     *
     * @param current 현재 projection
     * @param trigger 트리거
     * @param cause 전이 원인
     * @param attempt 전이 후 attemptCount
     * @param failure 실패 정보 (nullable)
     * @param resumeId 새로 연결할 이력서 (nullable)
     * @param confirmationToken 확인 번호 (nullable)
     * @return 갱신된 projection
     * @throws com.ryuqq.autoapply.core.statemachine.IllegalTransitionException 허용되지 않는 전이
     */
    public Application apply(Application current, LifecycleTrigger trigger, EventCause cause, int attempt,
                             FailureRecord failure, ResumeId resumeId, String confirmationToken) {
        if (current == null) {
            throw new IllegalArgumentException("current cannot be null");
        }
        ApplicationState to = StateTransition.next(current.state(), trigger);

        LifecycleEvent draft = new LifecycleEvent(
            0,
            current.id(),
            current.jobId(),
            current.state(),
            to,
            trigger,
            cause,
            attempt,
            failure != null ? failure.kind() : null,
            failure != null ? failure.reason() : null,
            resumeId,
            confirmationToken,
            clock.instant()
        );
        LifecycleEvent event = eventLog.append(draft);

        Application projected = ApplicationProjector.apply(current, event);
        if (applicationStore.compareAndSet(projected, current.version())) {
            log.debug("{}: {} -> {} ({}, event #{})",
                current.id(), event.from(), event.to(), trigger, event.sequence());
            return projected;
        }

        log.warn("Projection of {} was stale at version {}, rebuilding from history",
            current.id(), current.version());
        return rebuild(current);
    }

    /**
     * 이벤트 이력으로 projection 재구성 후 저장.
     *
     * @param current 저장소에 있던 (오래된) projection
     * @return 이력과 일치하는 projection
     */
    public Application rebuild(Application current) {
        Application stored = applicationStore.find(current.id()).orElse(current);
        Application replayed = ApplicationProjector.replay(stored.initial(), eventLog.history(current.id()));
        if (replayed.version() == stored.version() && replayed.state() == stored.state()) {
            return stored;
        }
        if (!applicationStore.compareAndSet(replayed, stored.version())) {
            throw new IllegalStateException("Concurrent projection update for " + current.id());
        }
        return replayed;
    }
}
