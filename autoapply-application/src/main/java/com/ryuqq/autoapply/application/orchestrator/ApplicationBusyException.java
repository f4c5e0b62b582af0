package com.ryuqq.autoapply.application.orchestrator;

import com.ryuqq.autoapply.core.model.ApplicationId;

/**
 * 단계 실행 중인 지원서에 수동 조작(승인, 거절, 외부 확인)을 시도한 경우.
 *
 * <p>잠시 후 다시 시도하면 됩니다. 취소는 이 예외 없이 실행 종료 후 반영됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ApplicationBusyException extends IllegalStateException {

    private final ApplicationId applicationId;

    public ApplicationBusyException(ApplicationId applicationId) {
        super("Application is being dispatched, try again shortly: " + applicationId);
        this.applicationId = applicationId;
    }

    public ApplicationId getApplicationId() {
        return applicationId;
    }
}
