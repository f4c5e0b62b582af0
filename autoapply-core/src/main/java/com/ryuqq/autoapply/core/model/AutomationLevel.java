package com.ryuqq.autoapply.core.model;

/**
 * 제출 단계 자동화 수준.
 *
 * <ul>
 *   <li>FULL: TAILORED 상태에서 사람 확인 없이 바로 제출</li>
 *   <li>ASSISTED: 모든 제출 전에 NEEDS_REVIEW로 보내 승인 대기</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum AutomationLevel {
    FULL,
    ASSISTED
}
