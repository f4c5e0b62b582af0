package com.ryuqq.autoapply.adapter.runner.metrics;

import com.ryuqq.autoapply.core.executor.Stage;
import com.ryuqq.autoapply.core.outcome.Fail;
import com.ryuqq.autoapply.core.outcome.FailureKind;
import com.ryuqq.autoapply.core.outcome.Outcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * 단계 실행 지표 기록기.
 *
 * <p>단계 호출마다 소요 시간을 {@code autoapply.stage.duration} Timer에,
 * 결과를 {@code autoapply.stage.calls} Counter에 기록합니다.</p>
 *
 * <p><strong>태그:</strong></p>
 * <ul>
 *   <li>{@code stage}: 단계 이름 (ANALYSIS, TAILORING, SUBMISSION)</li>
 *   <li>{@code outcome}: 성공이면 {@code ok}, 실패면 FailureKind 코드</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StageMetrics {

    public static final String DURATION = "autoapply.stage.duration";
    public static final String CALLS = "autoapply.stage.calls";

    private static final String OK = "ok";

    private final MeterRegistry registry;
    private final Clock clock;
    private final Map<Stage, Instant> lastInvokedAt = new ConcurrentHashMap<>();

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException registry 또는 clock이 null인 경우
     */
    public StageMetrics(MeterRegistry registry, Clock clock) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.registry = registry;
        this.clock = clock;
    }

    /**
     * 호출 시작을 기록하고 측정 샘플을 반환.
     */
    public Timer.Sample start(Stage stage) {
        lastInvokedAt.put(stage, clock.instant());
        return Timer.start(registry);
    }

    /**
     * 호출 종료를 기록.
     *
     * @param stage 단계
     * @param sample {@link #start(Stage)}가 반환한 샘플
     * @param outcome 호출 결과 (deadline 초과는 TIMEOUT 실패로 전달됨)
     */
    public void record(Stage stage, Timer.Sample sample, Outcome<?> outcome) {
        sample.stop(registry.timer(DURATION, "stage", stage.name()));
        registry.counter(CALLS, "stage", stage.name(), "outcome", outcomeTag(outcome)).increment();
    }

    /**
     * 단계의 현재 통계 스냅샷.
     */
    public StageStats snapshot(Stage stage) {
        Timer timer = registry.find(DURATION).tag("stage", stage.name()).timer();
        long invocations = timer == null ? 0 : timer.count();
        Duration mean = timer == null || invocations == 0
            ? Duration.ZERO
            : Duration.ofNanos((long) timer.mean(TimeUnit.NANOSECONDS));

        Map<FailureKind, Long> failures = new EnumMap<>(FailureKind.class);
        for (FailureKind kind : FailureKind.values()) {
            long count = count(stage, kind.code());
            if (count > 0) {
                failures.put(kind, count);
            }
        }
        return new StageStats(stage, invocations, count(stage, OK), failures, mean, lastInvokedAt.get(stage));
    }

    private long count(Stage stage, String outcome) {
        Counter counter = registry.find(CALLS).tags("stage", stage.name(), "outcome", outcome).counter();
        return counter == null ? 0 : (long) counter.count();
    }

    private static String outcomeTag(Outcome<?> outcome) {
        if (outcome instanceof Fail<?> fail) {
            return fail.kind().code();
        }
        return OK;
    }
}
