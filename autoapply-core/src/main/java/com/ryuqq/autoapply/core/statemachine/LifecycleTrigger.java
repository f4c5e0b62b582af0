package com.ryuqq.autoapply.core.statemachine;

/**
 * 상태 전이를 일으키는 트리거.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum LifecycleTrigger {

    /** Analysis 성공, Job에 요구사항 저장. */
    ANALYSIS_SUCCEEDED,

    /** Tailoring 성공, 새 이력서 버전 연결. */
    TAILORING_SUCCEEDED,

    /** 자동 제출 경로, 제출 lease 획득 후에만 발생. */
    SUBMISSION_AUTHORIZED,

    /** 제출 전 사람의 승인이 필요함. */
    APPROVAL_REQUIRED,

    /** 검토자 승인. */
    APPROVED,

    /** 검토자 거절. */
    REJECTED,

    /** 플랫폼이 확인 번호와 함께 접수 확인. */
    PLATFORM_CONFIRMED,

    /** 플랫폼이 확인 번호 없이 접수. */
    PLATFORM_ACCEPTED,

    /** 일시적 실패 후 같은 단계 재시도 (자기 전이). */
    STAGE_RETRY,

    /** 재시도 불가 실패. */
    STAGE_FAILED,

    /** 제출 중 자동화 탐지 등 정책 위반, 사람 검토로 전환. */
    POLICY_VIOLATION,

    /** 취소 요청. */
    CANCEL_REQUESTED
}
