package com.ryuqq.autoapply.core.governor;

import com.ryuqq.autoapply.core.executor.Stage;
import com.ryuqq.autoapply.core.model.ApplicationId;

/**
 * Lease 보유자 (지원서와 단계).
 *
 * <p>Discovery는 특정 지원서에 속하지 않으므로 ownerId가 {@value #DISCOVERY_OWNER}입니다.</p>
 *
 * @param ownerId 지원서 ID 값 또는 {@value #DISCOVERY_OWNER}
 * @param stage 단계
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LeaseHolder(String ownerId, Stage stage) {

    public static final String DISCOVERY_OWNER = "discovery";

    public LeaseHolder {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId cannot be null or blank");
        }
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
    }

    public static LeaseHolder of(ApplicationId applicationId, Stage stage) {
        if (applicationId == null) {
            throw new IllegalArgumentException("applicationId cannot be null");
        }
        return new LeaseHolder(applicationId.getValue(), stage);
    }

    public static LeaseHolder discovery() {
        return new LeaseHolder(DISCOVERY_OWNER, Stage.DISCOVERY);
    }
}
