package com.ryuqq.autoapply.core.model;

import com.ryuqq.autoapply.core.outcome.FailureKind;

/**
 * 지원서에 남는 마지막 실패 정보.
 *
 * @param kind 실패 분류
 * @param reason 사람이 읽을 수 있는 사유
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record FailureRecord(FailureKind kind, String reason) {

    public FailureRecord {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }
}
