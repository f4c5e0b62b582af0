package com.ryuqq.autoapply.core.statemachine;

/**
 * 지원서 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램 (CANCEL_REQUESTED는 모든 비종료 상태에서 허용):</strong></p>
 * <pre>
 * DISCOVERED ──analysis──▶ ANALYZED ──tailoring──▶ TAILORED
 *                                                    │
 *                    ┌── approval required ──────────┤
 *                    ▼                               ▼ authorized
 *              NEEDS_REVIEW ──approved──▶ SUBMITTING ──confirmed──▶ CONFIRMED
 *                    │  ▲                    │
 *            rejected│  └─policy violation───┤ accepted
 *                    ▼                       ▼
 *                CANCELLED               SUBMITTED ──confirmed──▶ CONFIRMED
 *
 * DISCOVERED / ANALYZED / SUBMITTING / SUBMITTED ──failed──▶ FAILED
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ApplicationState {

    /**
     * 공고 발견, 분석 대기.
     */
    DISCOVERED,

    /**
     * 요구사항 추출 완료, 맞춤화 대기.
     */
    ANALYZED,

    /**
     * 맞춤형 이력서 준비 완료, 제출 경로 결정 대기.
     */
    TAILORED,

    /**
     * 사람의 승인 또는 거절 대기.
     */
    NEEDS_REVIEW,

    /**
     * 제출 진행 중 (제출 lease 보유).
     */
    SUBMITTING,

    /**
     * 플랫폼이 접수했으나 확인 번호 미수신.
     */
    SUBMITTED,

    /**
     * 플랫폼 확인 완료 (종료).
     */
    CONFIRMED,

    /**
     * 영구 실패 (종료).
     */
    FAILED,

    /**
     * 취소 또는 거절 (종료).
     */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태에서는 어떤 트리거도 허용되지 않습니다.</p>
     *
     * @return CONFIRMED, FAILED, CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == CONFIRMED || this == FAILED || this == CANCELLED;
    }
}
