package com.ryuqq.autoapply.core.governor;

/**
 * Lease 거절 사유.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum DenialReason {

    /** 동시 보유 lease 수가 maxConcurrent에 도달. */
    OVER_CONCURRENCY,

    /** 윈도우 예산 소진, refill 대기 필요. */
    BUDGET_EXHAUSTED
}
