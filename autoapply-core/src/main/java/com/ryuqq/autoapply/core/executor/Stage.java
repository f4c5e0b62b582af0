package com.ryuqq.autoapply.core.executor;

/**
 * 파이프라인 단계.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Stage {
    DISCOVERY,
    ANALYSIS,
    TAILORING,
    SUBMISSION
}
