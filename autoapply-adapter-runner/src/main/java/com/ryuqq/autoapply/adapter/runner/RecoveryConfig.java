package com.ryuqq.autoapply.adapter.runner;

/**
 * Recovery 설정 (불변 record).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param batchSize 한 번에 스캔할 비종료 지원서 최대 수 (1 이상이어야 함, 기본 1000)
 */
public record RecoveryConfig(int batchSize) {

    public RecoveryConfig() {
        this(1000);
    }

    public RecoveryConfig {
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
    }

    public RecoveryConfig withBatchSize(int batchSize) {
        return new RecoveryConfig(batchSize);
    }
}
