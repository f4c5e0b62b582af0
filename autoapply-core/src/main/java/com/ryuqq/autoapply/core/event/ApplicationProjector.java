package com.ryuqq.autoapply.core.event;

import com.ryuqq.autoapply.core.model.Application;
import com.ryuqq.autoapply.core.model.FailureRecord;
import com.ryuqq.autoapply.core.statemachine.ApplicationState;
import com.ryuqq.autoapply.core.statemachine.StateTransition;

import java.util.List;

/**
 * Lifecycle Event를 Application 투영에 적용.
 *
 * <p>Scheduler의 실시간 경로와 복구(replay) 경로가 모두 이 클래스를 사용하므로,
 * 이벤트 로그를 재생한 결과는 저장된 Application과 항상 같습니다.</p>
 *
 * <p><strong>적용 규칙:</strong></p>
 * <ul>
 *   <li>state = event.to, attemptCount = event.attempt, updatedAt = event.occurredAt</li>
 *   <li>failureKind가 있으면 lastError 갱신</li>
 *   <li>resumeId, confirmationToken이 있으면 갱신</li>
 *   <li>version + 1</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ApplicationProjector {

    // Utility class - prevent instantiation
    private ApplicationProjector() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 이벤트 하나 적용.
     *
     * @param current 현재 투영
     * @param event 적용할 이벤트
     * @return 새 투영
     * @throws IllegalArgumentException 다른 지원서의 이벤트인 경우
     * @throws IllegalStateException 이벤트의 이전 상태가 현재 상태와 다르거나 전이 테이블과 맞지 않는 경우
     */
    public static Application apply(Application current, LifecycleEvent event) {
        if (current == null || event == null) {
            throw new IllegalArgumentException("current and event cannot be null");
        }
        if (!current.id().equals(event.applicationId())) {
            throw new IllegalArgumentException(
                "Event belongs to " + event.applicationId() + ", not " + current.id()
            );
        }
        if (current.state() != event.from()) {
            throw new IllegalStateException(String.format(
                "Event #%d expects state %s but %s is %s",
                event.sequence(), event.from(), current.id(), current.state()));
        }
        ApplicationState expected = StateTransition.next(event.from(), event.trigger());
        if (expected != event.to()) {
            throw new IllegalStateException(String.format(
                "Event #%d records %s → %s but %s yields %s",
                event.sequence(), event.from(), event.to(), event.trigger(), expected));
        }

        FailureRecord lastError = event.isFailure()
            ? new FailureRecord(event.failureKind(), event.reason())
            : current.lastError();

        return new Application(
            current.id(),
            current.jobId(),
            current.candidateId(),
            current.baseResumeId(),
            event.resumeId() != null ? event.resumeId() : current.resumeId(),
            current.mode(),
            event.to(),
            event.attempt(),
            lastError,
            event.confirmationToken() != null ? event.confirmationToken() : current.confirmationToken(),
            current.createdAt(),
            event.occurredAt(),
            current.version() + 1
        );
    }

    /**
     * 이벤트 목록을 순서대로 재생.
     *
     * @param initial 초기 투영 (보통 {@link Application#initial()})
     * @param events sequence 오름차순 이벤트
     * @return 모든 이벤트가 적용된 투영
     */
    public static Application replay(Application initial, List<LifecycleEvent> events) {
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        Application projection = initial;
        for (LifecycleEvent event : events) {
            projection = apply(projection, event);
        }
        return projection;
    }
}
