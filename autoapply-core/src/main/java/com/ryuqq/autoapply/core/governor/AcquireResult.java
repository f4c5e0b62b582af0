package com.ryuqq.autoapply.core.governor;

/**
 * Lease 획득 결과.
 *
 * <p>거절은 실패가 아닙니다. 호출자는 retryAfterMs 이후로 작업을 연기합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface AcquireResult permits AcquireResult.Granted, AcquireResult.Denied {

    default boolean isGranted() {
        return this instanceof Granted;
    }

    record Granted(Lease lease) implements AcquireResult {
        public Granted {
            if (lease == null) {
                throw new IllegalArgumentException("lease cannot be null");
            }
        }
    }

    /**
     * @param reason 거절 사유
     * @param retryAfterMs 재시도 권장 대기 시간 (0이면 미상)
     */
    record Denied(DenialReason reason, long retryAfterMs) implements AcquireResult {
        public Denied {
            if (reason == null) {
                throw new IllegalArgumentException("reason cannot be null");
            }
            if (retryAfterMs < 0) {
                throw new IllegalArgumentException("retryAfterMs cannot be negative (current: " + retryAfterMs + ")");
            }
        }
    }
}
