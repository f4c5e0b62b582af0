package com.ryuqq.autoapply.core.retry;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 단계 재시도 대기 시간 계산기.
 *
 * <p>단계 호출이 TRANSIENT_NETWORK로 실패했거나, RATE_LIMITED인데 자원 refill 시간을 알 수 없을 때
 * 같은 단계를 다시 dispatch하기 전까지 지원서를 큐에서 쉬게 할 시간을 정합니다.
 * 같은 플랫폼 장애로 여러 지원서가 함께 실패하는 경우가 많으므로, 대기 시간을 조금씩 늘려
 * 복구 직후 플랫폼에 제출이 한꺼번에 몰리지 않게 합니다.</p>
 *
 * <pre>
 * n번째 실패 후 대기 = min(firstRetryDelay × 2^(n-1) × (1 + spread × r), delayCap)
 * r: [0, 1) 난수
 * </pre>
 *
 * <p>n은 현재 단계에서 누적된 실패 횟수이며 단계가 전진하면 다시 1부터 셉니다.
 * 기본값(첫 대기 2초, 상한 10분, spread 0.1)과 maxAttempts=3이면 한 단계는
 * 약 2초, 4초 뒤 두 번까지 다시 호출됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class BackoffCalculator {

    public static final long DEFAULT_FIRST_RETRY_DELAY_MS = 2_000;
    public static final long DEFAULT_DELAY_CAP_MS = 600_000;
    public static final double DEFAULT_SPREAD = 0.1;

    private final long firstRetryDelayMs;
    private final long delayCapMs;
    private final double spread;
    private final DoubleSupplier random;

    public BackoffCalculator() {
        this(DEFAULT_FIRST_RETRY_DELAY_MS, DEFAULT_DELAY_CAP_MS, DEFAULT_SPREAD);
    }

    public BackoffCalculator(long firstRetryDelayMs, long delayCapMs, double spread) {
        this(firstRetryDelayMs, delayCapMs, spread, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 생성자.
     *
     * @param firstRetryDelayMs 첫 실패 후 대기 시간 (밀리초, 양수)
     * @param delayCapMs 대기 시간 상한 (밀리초, firstRetryDelayMs 이상)
     * @param spread 대기 시간에 더할 임의 지연의 최대 비율 (0.0 ~ 1.0)
     * @param random [0, 1) 값을 돌려주는 난수 공급자
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long firstRetryDelayMs, long delayCapMs, double spread, DoubleSupplier random) {
        if (firstRetryDelayMs <= 0) {
            throw new IllegalArgumentException("firstRetryDelayMs must be positive: " + firstRetryDelayMs);
        }
        if (delayCapMs < firstRetryDelayMs) {
            throw new IllegalArgumentException(
                "delayCapMs (" + delayCapMs + ") must not be below firstRetryDelayMs (" + firstRetryDelayMs + ")");
        }
        if (!(spread >= 0.0 && spread <= 1.0)) {
            throw new IllegalArgumentException("spread must be within [0.0, 1.0]: " + spread);
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.firstRetryDelayMs = firstRetryDelayMs;
        this.delayCapMs = delayCapMs;
        this.spread = spread;
        this.random = random;
    }

    /**
     * 단계 재시도 전 대기 시간.
     *
     * @param failureCount 현재 단계에서 이번 실패를 포함한 실패 횟수 (1 이상)
     * @return 대기 시간 (밀리초, delayCap 이하)
     * @throws IllegalArgumentException failureCount가 양수가 아닌 경우
     */
    public long calculate(int failureCount) {
        if (failureCount <= 0) {
            throw new IllegalArgumentException("failureCount must be positive: " + failureCount);
        }
        long doubled = firstRetryDelayMs;
        for (int failure = 1; failure < failureCount && doubled < delayCapMs; failure++) {
            doubled = doubled > delayCapMs / 2 ? delayCapMs : doubled * 2;
        }
        if (doubled >= delayCapMs) {
            return delayCapMs;
        }
        long spreadMs = (long) (doubled * spread * random.getAsDouble());
        return Math.min(doubled + spreadMs, delayCapMs);
    }

    public long getFirstRetryDelayMs() {
        return firstRetryDelayMs;
    }

    public long getDelayCapMs() {
        return delayCapMs;
    }

    public double getSpread() {
        return spread;
    }
}
