package com.ryuqq.autoapply.core.outcome;

/**
 * 실패 분류 상위 범주.
 *
 * <ul>
 *   <li>TRANSIENT: 재시도로 회복 가능</li>
 *   <li>PERMANENT_DATA: 입력이 잘못되어 재시도해도 실패</li>
 *   <li>PERMANENT_POLICY: 자동화 탐지 등 정책 문제, 사람 검토 필요</li>
 *   <li>RESOURCE_EXHAUSTION: Governor 거절, 실패가 아닌 연기(defer)로 처리</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum FailureCategory {
    TRANSIENT,
    PERMANENT_DATA,
    PERMANENT_POLICY,
    RESOURCE_EXHAUSTION
}
