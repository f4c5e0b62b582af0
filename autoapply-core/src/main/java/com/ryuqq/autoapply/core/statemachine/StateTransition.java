package com.ryuqq.autoapply.core.statemachine;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * 지원서 상태 전이 테이블.
 *
 * <p>모든 (상태, 트리거) 조합에 대해 결과가 정의됩니다. 테이블에 없는 조합은
 * {@link IllegalTransitionException}으로 거부되며 상태는 그대로입니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>DISCOVERED: ANALYSIS_SUCCEEDED → ANALYZED, STAGE_RETRY → DISCOVERED, STAGE_FAILED → FAILED</li>
 *   <li>ANALYZED: TAILORING_SUCCEEDED → TAILORED, STAGE_RETRY → ANALYZED, STAGE_FAILED → FAILED</li>
 *   <li>TAILORED: SUBMISSION_AUTHORIZED → SUBMITTING, APPROVAL_REQUIRED → NEEDS_REVIEW</li>
 *   <li>NEEDS_REVIEW: APPROVED → SUBMITTING, REJECTED → CANCELLED</li>
 *   <li>SUBMITTING: PLATFORM_CONFIRMED → CONFIRMED, PLATFORM_ACCEPTED → SUBMITTED,
 *       STAGE_RETRY → SUBMITTING, STAGE_FAILED → FAILED, POLICY_VIOLATION → NEEDS_REVIEW</li>
 *   <li>SUBMITTED: PLATFORM_CONFIRMED → CONFIRMED, STAGE_FAILED → FAILED</li>
 *   <li>모든 비종료 상태: CANCEL_REQUESTED → CANCELLED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 종료 상태(CONFIRMED, FAILED, CANCELLED)에서는 어떤 트리거도 허용되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StateTransition {

    private static final Map<ApplicationState, Map<LifecycleTrigger, ApplicationState>> TABLE = buildTable();

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 트리거 적용 후 상태 계산.
     *
     * @param from 현재 상태
     * @param trigger 트리거
     * @return 전이된 상태
     * @throws IllegalArgumentException from 또는 trigger가 null인 경우
     * @throws IllegalTransitionException 허용되지 않은 조합인 경우
     */
    public static ApplicationState next(ApplicationState from, LifecycleTrigger trigger) {
        if (from == null || trigger == null) {
            throw new IllegalArgumentException("State and trigger cannot be null (from: " + from + ", trigger: " + trigger + ")");
        }
        ApplicationState to = TABLE.get(from).get(trigger);
        if (to == null) {
            throw new IllegalTransitionException(from, trigger);
        }
        return to;
    }

    /**
     * 조합이 허용되는지 확인 (예외 없이).
     */
    public static boolean isAllowed(ApplicationState from, LifecycleTrigger trigger) {
        if (from == null || trigger == null) {
            return false;
        }
        return TABLE.get(from).containsKey(trigger);
    }

    /**
     * 상태에서 허용되는 트리거 목록.
     *
     * @param from 현재 상태
     * @return 허용 트리거 (종료 상태면 빈 집합)
     */
    public static Set<LifecycleTrigger> allowedTriggers(ApplicationState from) {
        if (from == null) {
            throw new IllegalArgumentException("from cannot be null");
        }
        return Collections.unmodifiableSet(TABLE.get(from).keySet());
    }

    private static Map<ApplicationState, Map<LifecycleTrigger, ApplicationState>> buildTable() {
        Map<ApplicationState, Map<LifecycleTrigger, ApplicationState>> table = new EnumMap<>(ApplicationState.class);
        for (ApplicationState state : ApplicationState.values()) {
            table.put(state, new EnumMap<>(LifecycleTrigger.class));
        }

        table.get(ApplicationState.DISCOVERED).put(LifecycleTrigger.ANALYSIS_SUCCEEDED, ApplicationState.ANALYZED);
        table.get(ApplicationState.DISCOVERED).put(LifecycleTrigger.STAGE_RETRY, ApplicationState.DISCOVERED);
        table.get(ApplicationState.DISCOVERED).put(LifecycleTrigger.STAGE_FAILED, ApplicationState.FAILED);

        table.get(ApplicationState.ANALYZED).put(LifecycleTrigger.TAILORING_SUCCEEDED, ApplicationState.TAILORED);
        table.get(ApplicationState.ANALYZED).put(LifecycleTrigger.STAGE_RETRY, ApplicationState.ANALYZED);
        table.get(ApplicationState.ANALYZED).put(LifecycleTrigger.STAGE_FAILED, ApplicationState.FAILED);

        table.get(ApplicationState.TAILORED).put(LifecycleTrigger.SUBMISSION_AUTHORIZED, ApplicationState.SUBMITTING);
        table.get(ApplicationState.TAILORED).put(LifecycleTrigger.APPROVAL_REQUIRED, ApplicationState.NEEDS_REVIEW);

        table.get(ApplicationState.NEEDS_REVIEW).put(LifecycleTrigger.APPROVED, ApplicationState.SUBMITTING);
        table.get(ApplicationState.NEEDS_REVIEW).put(LifecycleTrigger.REJECTED, ApplicationState.CANCELLED);

        table.get(ApplicationState.SUBMITTING).put(LifecycleTrigger.PLATFORM_CONFIRMED, ApplicationState.CONFIRMED);
        table.get(ApplicationState.SUBMITTING).put(LifecycleTrigger.PLATFORM_ACCEPTED, ApplicationState.SUBMITTED);
        table.get(ApplicationState.SUBMITTING).put(LifecycleTrigger.STAGE_RETRY, ApplicationState.SUBMITTING);
        table.get(ApplicationState.SUBMITTING).put(LifecycleTrigger.STAGE_FAILED, ApplicationState.FAILED);
        table.get(ApplicationState.SUBMITTING).put(LifecycleTrigger.POLICY_VIOLATION, ApplicationState.NEEDS_REVIEW);

        table.get(ApplicationState.SUBMITTED).put(LifecycleTrigger.PLATFORM_CONFIRMED, ApplicationState.CONFIRMED);
        table.get(ApplicationState.SUBMITTED).put(LifecycleTrigger.STAGE_FAILED, ApplicationState.FAILED);

        for (ApplicationState state : ApplicationState.values()) {
            if (!state.isTerminal()) {
                table.get(state).put(LifecycleTrigger.CANCEL_REQUESTED, ApplicationState.CANCELLED);
            }
        }
        return table;
    }
}
