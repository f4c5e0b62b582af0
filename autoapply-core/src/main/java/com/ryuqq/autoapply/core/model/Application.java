package com.ryuqq.autoapply.core.model;

import com.ryuqq.autoapply.core.statemachine.ApplicationState;

import java.time.Instant;

/**
 * 특정 지원자의 특정 공고에 대한 지원서.
 *
 * <p>Application은 Event Log의 투영(projection)입니다. Scheduler만이 상태를 변경하며,
 * 모든 변경은 Lifecycle Event 하나와 version 증가 하나에 대응합니다.</p>
 *
 * <p><strong>생성:</strong> {@link #create}로 DISCOVERED 상태, attempt 0, version 0으로 생성됩니다.
 * 생성 자체는 이벤트가 아니며, 생성 필드(id, jobId, candidateId, baseResumeId, mode, createdAt)는
 * 이후 변경되지 않습니다.</p>
 *
 * @param id 식별자
 * @param jobId 대상 공고
 * @param candidateId 지원자
 * @param baseResumeId 맞춤화의 부모가 되는 원본 이력서
 * @param resumeId 현재 제출 대상 이력서 (Tailoring 전에는 baseResumeId)
 * @param mode 맞춤화 강도
 * @param state 현재 상태
 * @param attemptCount 현재 단계의 실패 횟수
 * @param lastError 마지막 실패 (nullable)
 * @param confirmationToken 플랫폼 확인 번호 (nullable)
 * @param createdAt 생성 시각
 * @param updatedAt 마지막 전이 시각
 * @param version 낙관적 잠금 버전 (적용된 이벤트 수)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Application(
    ApplicationId id,
    JobId jobId,
    CandidateId candidateId,
    ResumeId baseResumeId,
    ResumeId resumeId,
    TailoringMode mode,
    ApplicationState state,
    int attemptCount,
    FailureRecord lastError,
    String confirmationToken,
    Instant createdAt,
    Instant updatedAt,
    long version
) {

    public Application {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        if (candidateId == null) {
            throw new IllegalArgumentException("candidateId cannot be null");
        }
        if (baseResumeId == null) {
            throw new IllegalArgumentException("baseResumeId cannot be null");
        }
        if (resumeId == null) {
            throw new IllegalArgumentException("resumeId cannot be null");
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (attemptCount < 0) {
            throw new IllegalArgumentException("attemptCount cannot be negative (current: " + attemptCount + ")");
        }
        if (createdAt == null || updatedAt == null) {
            throw new IllegalArgumentException("timestamps cannot be null");
        }
        if (version < 0) {
            throw new IllegalArgumentException("version cannot be negative (current: " + version + ")");
        }
    }

    /**
     * 새 지원서 생성 (DISCOVERED, attempt 0, version 0).
     */
    public static Application create(ApplicationId id, JobId jobId, CandidateId candidateId,
                                     ResumeId baseResumeId, TailoringMode mode, Instant createdAt) {
        return new Application(id, jobId, candidateId, baseResumeId, baseResumeId, mode,
            ApplicationState.DISCOVERED, 0, null, null, createdAt, createdAt, 0);
    }

    /**
     * 이 지원서의 생성 직후 투영.
     *
     * <p>이벤트 재생(replay)의 시작점입니다.</p>
     *
     * @return 생성 필드만 유지한 초기 투영
     */
    public Application initial() {
        return create(id, jobId, candidateId, baseResumeId, mode, createdAt);
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    /**
     * 동일 (공고, 지원자) 쌍의 새 지원서를 막는지 여부.
     *
     * <p>진행 중이거나 CONFIRMED인 지원서가 있으면 기존 지원서를 재사용합니다.
     * FAILED, CANCELLED인 경우에만 새 지원서를 만들 수 있습니다.</p>
     */
    public boolean blocksResubmission() {
        return !state.isTerminal() || state == ApplicationState.CONFIRMED;
    }
}
