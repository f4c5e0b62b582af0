package com.ryuqq.autoapply.core.governor;

import com.ryuqq.autoapply.core.model.ResourceId;

import java.time.Instant;

/**
 * 자원 사용권.
 *
 * <p>메모리에만 존재합니다. 만료 시각까지 반납되지 않으면 Governor가 회수합니다.</p>
 *
 * @param leaseId 고유 ID (반납 멱등성 키)
 * @param resource 자원
 * @param holder 보유자
 * @param grantedAt 발급 시각
 * @param expiresAt 만료 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Lease(
    String leaseId,
    ResourceId resource,
    LeaseHolder holder,
    Instant grantedAt,
    Instant expiresAt
) {

    public Lease {
        if (leaseId == null || leaseId.isBlank()) {
            throw new IllegalArgumentException("leaseId cannot be null or blank");
        }
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }
        if (holder == null) {
            throw new IllegalArgumentException("holder cannot be null");
        }
        if (grantedAt == null || expiresAt == null) {
            throw new IllegalArgumentException("timestamps cannot be null");
        }
        if (expiresAt.isBefore(grantedAt)) {
            throw new IllegalArgumentException("expiresAt cannot be before grantedAt");
        }
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
