package com.ryuqq.autoapply.core.retry;

/**
 * Retry Policy의 결정.
 *
 * <ul>
 *   <li>{@link RetryAfter}: 지연 후 같은 단계 재시도</li>
 *   <li>{@link RetryNow}: 즉시 재시도</li>
 *   <li>{@link GiveUp}: 재시도 중단</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface RetryDecision
    permits RetryDecision.RetryAfter, RetryDecision.RetryNow, RetryDecision.GiveUp {

    default boolean isRetry() {
        return !(this instanceof GiveUp);
    }

    /**
     * 재시도까지 대기할 시간.
     */
    default long delayMs() {
        if (this instanceof RetryAfter retryAfter) {
            return retryAfter.delayMs();
        }
        return 0;
    }

    record RetryAfter(long delayMs) implements RetryDecision {
        public RetryAfter {
            if (delayMs < 0) {
                throw new IllegalArgumentException("delayMs cannot be negative (current: " + delayMs + ")");
            }
        }
    }

    record RetryNow() implements RetryDecision {
    }

    record GiveUp(String reason) implements RetryDecision {
        public GiveUp {
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("reason cannot be null or blank");
            }
        }
    }
}
