package com.ryuqq.autoapply.core.governor;

/**
 * 자원별 예산 및 동시성 정책 (불변 record).
 *
 * <p>예산은 token bucket으로 관리되며, capacity개의 토큰이 windowMs 동안 균등하게 보충됩니다.
 * 예: capacity=20, windowMs=86400000 → 하루 20건, 약 72분마다 1건 보충.</p>
 *
 * @param capacity 윈도우당 허용 횟수 (버킷 크기)
 * @param windowMs 윈도우 길이 (밀리초)
 * @param maxConcurrent 동시 보유 가능한 lease 수
 * @param leaseTtlMs lease 만료 시간 (밀리초)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ResourcePolicy(
    int capacity,
    long windowMs,
    int maxConcurrent,
    long leaseTtlMs
) {

    /**
     * 기본 정책: 시간당 100회, 동시 2개, lease 10분.
     */
    public ResourcePolicy() {
        this(100, 3_600_000L, 2, 600_000L);
    }

    public ResourcePolicy {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        if (windowMs <= 0) {
            throw new IllegalArgumentException("windowMs must be positive (current: " + windowMs + ")");
        }
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be positive (current: " + maxConcurrent + ")");
        }
        if (leaseTtlMs <= 0) {
            throw new IllegalArgumentException("leaseTtlMs must be positive (current: " + leaseTtlMs + ")");
        }
    }

    /**
     * 밀리초당 보충 토큰 수.
     */
    public double refillPerMs() {
        return (double) capacity / windowMs;
    }

    public ResourcePolicy withCapacity(int capacity) {
        return new ResourcePolicy(capacity, windowMs, maxConcurrent, leaseTtlMs);
    }

    public ResourcePolicy withWindowMs(long windowMs) {
        return new ResourcePolicy(capacity, windowMs, maxConcurrent, leaseTtlMs);
    }

    public ResourcePolicy withMaxConcurrent(int maxConcurrent) {
        return new ResourcePolicy(capacity, windowMs, maxConcurrent, leaseTtlMs);
    }

    public ResourcePolicy withLeaseTtlMs(long leaseTtlMs) {
        return new ResourcePolicy(capacity, windowMs, maxConcurrent, leaseTtlMs);
    }
}
