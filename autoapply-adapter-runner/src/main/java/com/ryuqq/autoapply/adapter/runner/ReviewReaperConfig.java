package com.ryuqq.autoapply.adapter.runner;

/**
 * ReviewReaper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 스캔 주기 (기본 3600000ms = 1시간)</li>
 *   <li>reviewTimeoutMs: NEEDS_REVIEW 최대 대기 시간 (기본 604800000ms = 7일)</li>
 *   <li>batchSize: 한 번의 스캔에서 처리할 최대 지원서 수 (기본 50)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수여야 함)
 * @param reviewTimeoutMs 검토 대기 한도 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 */
public record ReviewReaperConfig(
    long scanIntervalMs,
    long reviewTimeoutMs,
    int batchSize
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanIntervalMs=1시간, reviewTimeoutMs=7일, batchSize=50</p>
     */
    public ReviewReaperConfig() {
        this(3600000, 7L * 24 * 3600000, 50);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ReviewReaperConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (reviewTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "reviewTimeoutMs must be positive (current: " + reviewTimeoutMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
    }

    public ReviewReaperConfig withScanIntervalMs(long scanIntervalMs) {
        return new ReviewReaperConfig(scanIntervalMs, reviewTimeoutMs, batchSize);
    }

    public ReviewReaperConfig withReviewTimeoutMs(long reviewTimeoutMs) {
        return new ReviewReaperConfig(scanIntervalMs, reviewTimeoutMs, batchSize);
    }

    public ReviewReaperConfig withBatchSize(int batchSize) {
        return new ReviewReaperConfig(scanIntervalMs, reviewTimeoutMs, batchSize);
    }
}
