package com.ryuqq.autoapply.application.orchestrator;

import com.ryuqq.autoapply.core.model.ApplicationId;

/**
 * 존재하지 않는 지원서 ID로 조회하거나 조작한 경우.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ApplicationNotFoundException extends IllegalArgumentException {

    private final ApplicationId applicationId;

    public ApplicationNotFoundException(ApplicationId applicationId) {
        super("Application not found: " + applicationId);
        this.applicationId = applicationId;
    }

    public ApplicationId getApplicationId() {
        return applicationId;
    }
}
