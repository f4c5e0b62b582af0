package com.ryuqq.autoapply.core.event;

/**
 * 전이를 일으킨 원인.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum EventCause {

    /** 단계 실행 성공. */
    STAGE_SUCCESS,

    /** 단계 실행 실패 (재시도 포함). */
    STAGE_FAILURE,

    /** 사람의 조작 (승인, 거절, 취소, 외부 확인). */
    MANUAL_OVERRIDE,

    /** 시간 초과로 인한 자동 처리 (검토 만료 등). */
    TIMEOUT
}
