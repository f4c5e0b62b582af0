package com.ryuqq.autoapply.application.orchestrator;

import com.ryuqq.autoapply.core.event.LifecycleEvent;
import com.ryuqq.autoapply.core.model.Application;
import com.ryuqq.autoapply.core.statemachine.ApplicationState;

import java.util.List;

/**
 * 지원서 현재 상태와 이벤트 이력.
 *
 * @param application 현재 투영
 * @param history 이벤트 이력 (순서대로)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ApplicationStatus(Application application, List<LifecycleEvent> history) {

    public ApplicationStatus {
        if (application == null) {
            throw new IllegalArgumentException("application cannot be null");
        }
        history = history == null ? List.of() : List.copyOf(history);
    }

    public ApplicationState state() {
        return application.state();
    }
}
