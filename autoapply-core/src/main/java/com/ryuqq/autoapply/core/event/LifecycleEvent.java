package com.ryuqq.autoapply.core.event;

import com.ryuqq.autoapply.core.model.ApplicationId;
import com.ryuqq.autoapply.core.model.JobId;
import com.ryuqq.autoapply.core.model.ResumeId;
import com.ryuqq.autoapply.core.outcome.FailureKind;
import com.ryuqq.autoapply.core.statemachine.ApplicationState;
import com.ryuqq.autoapply.core.statemachine.LifecycleTrigger;

import java.time.Instant;

/**
 * 지원서 상태 전이 하나를 기록하는 감사 이벤트.
 *
 * <p>이벤트는 초기 투영에서 재생했을 때 저장된 Application을 그대로 재구성할 수 있는
 * 모든 정보를 담습니다 ({@link ApplicationProjector}).</p>
 *
 * <p>sequence는 Event Log가 append 시점에 부여하며, append 전의 draft는 0입니다.</p>
 *
 * @param sequence 로그 전체에서 단조 증가하는 순번 (draft는 0)
 * @param applicationId 대상 지원서
 * @param jobId 대상 공고
 * @param from 이전 상태
 * @param to 새 상태
 * @param trigger 트리거
 * @param cause 원인
 * @param attempt 전이 후 attempt 카운터
 * @param failureKind 실패 분류 (nullable)
 * @param reason 사람이 읽을 수 있는 사유 (nullable, failureKind가 있으면 필수)
 * @param resumeId 새로 연결된 이력서 (nullable)
 * @param confirmationToken 플랫폼 확인 번호 (nullable)
 * @param occurredAt 발생 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LifecycleEvent(
    long sequence,
    ApplicationId applicationId,
    JobId jobId,
    ApplicationState from,
    ApplicationState to,
    LifecycleTrigger trigger,
    EventCause cause,
    int attempt,
    FailureKind failureKind,
    String reason,
    ResumeId resumeId,
    String confirmationToken,
    Instant occurredAt
) {

    public LifecycleEvent {
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence cannot be negative (current: " + sequence + ")");
        }
        if (applicationId == null) {
            throw new IllegalArgumentException("applicationId cannot be null");
        }
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (trigger == null) {
            throw new IllegalArgumentException("trigger cannot be null");
        }
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt cannot be negative (current: " + attempt + ")");
        }
        if (failureKind != null && (reason == null || reason.isBlank())) {
            throw new IllegalArgumentException("reason is required when failureKind is present");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt cannot be null");
        }
    }

    /**
     * Event Log가 부여한 순번으로 새 인스턴스 생성.
     *
     * @param sequence 부여된 순번 (양수)
     * @return 순번이 설정된 이벤트
     */
    public LifecycleEvent withSequence(long sequence) {
        if (sequence <= 0) {
            throw new IllegalArgumentException("sequence must be positive (current: " + sequence + ")");
        }
        return new LifecycleEvent(sequence, applicationId, jobId, from, to, trigger, cause, attempt,
            failureKind, reason, resumeId, confirmationToken, occurredAt);
    }

    public boolean isFailure() {
        return failureKind != null;
    }
}
