package com.ryuqq.autoapply.adapter.runner;

import com.ryuqq.autoapply.core.model.AutomationLevel;

/**
 * StageScheduler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollingIntervalMs: start() 사용 시 pump 주기 (기본 100ms)</li>
 *   <li>batchSize: pump 한 번에 dequeue할 지원서 수 (기본 10)</li>
 *   <li>concurrency: 동시에 실행되는 단계 수 상한 (기본 3)</li>
 *   <li>stageTimeoutMs: 단계 호출 하나의 deadline (기본 120000ms = 2분)</li>
 *   <li>maxAttempts: 단계당 최대 호출 횟수 (기본 3)</li>
 *   <li>deferDelayMs: 자원 부족으로 연기할 때의 최소 지연 (기본 1000ms)</li>
 *   <li>automationLevel: FULL이면 자동 제출, ASSISTED면 항상 검토 요청 (기본 FULL)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param pollingIntervalMs pump 주기 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 * @param concurrency 동시 실행 상한 (1 이상이어야 함)
 * @param stageTimeoutMs 단계 deadline (밀리초, 양수여야 함)
 * @param maxAttempts 단계당 최대 호출 횟수 (1 이상이어야 함)
 * @param deferDelayMs 연기 지연 (밀리초, 양수여야 함)
 * @param automationLevel 자동화 수준 (null이 아니어야 함)
 */
public record SchedulerConfig(
    long pollingIntervalMs,
    int batchSize,
    int concurrency,
    long stageTimeoutMs,
    int maxAttempts,
    long deferDelayMs,
    AutomationLevel automationLevel
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: pollingIntervalMs=100ms, batchSize=10, concurrency=3, stageTimeoutMs=120000ms,
     * maxAttempts=3, deferDelayMs=1000ms, automationLevel=FULL</p>
     */
    public SchedulerConfig() {
        this(100, 10, 3, 120000, 3, 1000, AutomationLevel.FULL);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SchedulerConfig {
        if (pollingIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollingIntervalMs must be positive (current: " + pollingIntervalMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (stageTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "stageTimeoutMs must be positive (current: " + stageTimeoutMs + ")"
            );
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (deferDelayMs <= 0) {
            throw new IllegalArgumentException(
                "deferDelayMs must be positive (current: " + deferDelayMs + ")"
            );
        }
        if (automationLevel == null) {
            throw new IllegalArgumentException("automationLevel cannot be null");
        }
    }

    public SchedulerConfig withPollingIntervalMs(long pollingIntervalMs) {
        return new SchedulerConfig(pollingIntervalMs, batchSize, concurrency, stageTimeoutMs, maxAttempts, deferDelayMs, automationLevel);
    }

    public SchedulerConfig withBatchSize(int batchSize) {
        return new SchedulerConfig(pollingIntervalMs, batchSize, concurrency, stageTimeoutMs, maxAttempts, deferDelayMs, automationLevel);
    }

    public SchedulerConfig withConcurrency(int concurrency) {
        return new SchedulerConfig(pollingIntervalMs, batchSize, concurrency, stageTimeoutMs, maxAttempts, deferDelayMs, automationLevel);
    }

    public SchedulerConfig withStageTimeoutMs(long stageTimeoutMs) {
        return new SchedulerConfig(pollingIntervalMs, batchSize, concurrency, stageTimeoutMs, maxAttempts, deferDelayMs, automationLevel);
    }

    public SchedulerConfig withMaxAttempts(int maxAttempts) {
        return new SchedulerConfig(pollingIntervalMs, batchSize, concurrency, stageTimeoutMs, maxAttempts, deferDelayMs, automationLevel);
    }

    public SchedulerConfig withDeferDelayMs(long deferDelayMs) {
        return new SchedulerConfig(pollingIntervalMs, batchSize, concurrency, stageTimeoutMs, maxAttempts, deferDelayMs, automationLevel);
    }

    public SchedulerConfig withAutomationLevel(AutomationLevel automationLevel) {
        return new SchedulerConfig(pollingIntervalMs, batchSize, concurrency, stageTimeoutMs, maxAttempts, deferDelayMs, automationLevel);
    }
}
