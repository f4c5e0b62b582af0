package com.ryuqq.autoapply.core.statemachine;

/**
 * 허용되지 않은 (상태, 트리거) 조합.
 *
 * <p>상태는 변경되지 않은 채로 남습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class IllegalTransitionException extends IllegalStateException {

    private final ApplicationState from;
    private final LifecycleTrigger trigger;

    public IllegalTransitionException(ApplicationState from, LifecycleTrigger trigger) {
        super(from.isTerminal()
            ? String.format("Cannot transition from terminal state: %s (trigger: %s)", from, trigger)
            : String.format("Invalid state transition: %s with trigger %s", from, trigger));
        this.from = from;
        this.trigger = trigger;
    }

    public ApplicationState getFrom() {
        return from;
    }

    public LifecycleTrigger getTrigger() {
        return trigger;
    }
}
