package com.ryuqq.autoapply.adapter.runner.metrics;

import com.ryuqq.autoapply.core.executor.Stage;
import com.ryuqq.autoapply.core.outcome.FailureKind;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * 단계별 실행 통계 스냅샷 (읽기 전용).
 *
 * @param stage 단계
 * @param invocations 호출 횟수 (deadline 초과 포함)
 * @param successes 성공 횟수
 * @param failures 실패 종류별 횟수 (0인 종류는 제외)
 * @param meanLatency 평균 소요 시간
 * @param lastInvokedAt 마지막 호출 시각 (호출 이력이 없으면 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StageStats(
    Stage stage,
    long invocations,
    long successes,
    Map<FailureKind, Long> failures,
    Duration meanLatency,
    Instant lastInvokedAt
) {

    public StageStats {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        failures = failures == null ? Map.of() : Map.copyOf(failures);
        meanLatency = meanLatency == null ? Duration.ZERO : meanLatency;
    }

    public long failureCount() {
        return failures.values().stream().mapToLong(Long::longValue).sum();
    }

    public long failures(FailureKind kind) {
        return failures.getOrDefault(kind, 0L);
    }

    /**
     * 성공률 (호출 이력이 없으면 0).
     */
    public double successRate() {
        return invocations == 0 ? 0.0 : (double) successes / invocations;
    }
}
