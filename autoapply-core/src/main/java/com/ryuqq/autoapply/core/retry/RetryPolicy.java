package com.ryuqq.autoapply.core.retry;

import com.ryuqq.autoapply.core.outcome.FailureKind;

/**
 * 실패 분류와 시도 횟수로 재시도 여부를 결정하는 정책.
 *
 * <p><strong>결정 규칙:</strong></p>
 * <ul>
 *   <li>attemptCount ≥ maxAttempts → 분류와 무관하게 GiveUp</li>
 *   <li>TRANSIENT_NETWORK → RetryAfter(exponential backoff)</li>
 *   <li>RATE_LIMITED → RetryAfter(자원 refill 시간, 알 수 없으면 backoff)</li>
 *   <li>TIMEOUT → RetryNow</li>
 *   <li>PLATFORM_REJECTED_INPUT, AUTOMATION_DETECTED → GiveUp</li>
 * </ul>
 *
 * <p>attemptCount는 현재 단계에서 이번 실패를 포함한 누적 실패 횟수입니다.
 * 단계가 전진하면 0으로 초기화되므로, 한 단계의 호출 횟수는 maxAttempts를 넘지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RetryPolicy {

    private final BackoffCalculator backoffCalculator;

    public RetryPolicy() {
        this(new BackoffCalculator());
    }

    public RetryPolicy(BackoffCalculator backoffCalculator) {
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        this.backoffCalculator = backoffCalculator;
    }

    /**
     * 재시도 결정 (refill 시간 미상).
     */
    public RetryDecision decide(FailureKind kind, int attemptCount, int maxAttempts) {
        return decide(kind, attemptCount, maxAttempts, 0);
    }

    /**
     * 재시도 결정.
     *
     * @param kind 실패 분류
     * @param attemptCount 이번 실패를 포함한 실패 횟수 (1 이상)
     * @param maxAttempts 단계당 최대 호출 횟수 (1 이상)
     * @param refillDelayMs RATE_LIMITED일 때 자원 예산이 다시 생기기까지의 시간 (0이면 미상)
     * @return 재시도 결정
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryDecision decide(FailureKind kind, int attemptCount, int maxAttempts, long refillDelayMs) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (attemptCount <= 0) {
            throw new IllegalArgumentException("attemptCount must be positive (current: " + attemptCount + ")");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        if (refillDelayMs < 0) {
            throw new IllegalArgumentException("refillDelayMs cannot be negative (current: " + refillDelayMs + ")");
        }

        if (attemptCount >= maxAttempts) {
            return new RetryDecision.GiveUp(
                "Retry budget exhausted after " + attemptCount + " attempts (" + kind.code() + ")"
            );
        }

        return switch (kind) {
            case TRANSIENT_NETWORK -> new RetryDecision.RetryAfter(backoffCalculator.calculate(attemptCount));
            case RATE_LIMITED -> new RetryDecision.RetryAfter(
                refillDelayMs > 0 ? refillDelayMs : backoffCalculator.calculate(attemptCount)
            );
            case TIMEOUT -> new RetryDecision.RetryNow();
            case PLATFORM_REJECTED_INPUT, AUTOMATION_DETECTED ->
                new RetryDecision.GiveUp(kind.description() + " (" + kind.code() + ")");
        };
    }

    public BackoffCalculator getBackoffCalculator() {
        return backoffCalculator;
    }
}
