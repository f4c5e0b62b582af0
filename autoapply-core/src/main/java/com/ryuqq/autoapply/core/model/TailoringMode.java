package com.ryuqq.autoapply.core.model;

/**
 * 이력서 맞춤화 강도.
 *
 * <p>Tailoring Executor에 그대로 전달되며, Orchestrator는 값의 의미를 해석하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum TailoringMode {

    /**
     * 표현만 다듬고 사실관계는 변경하지 않음 (기본값).
     */
    CONSERVATIVE,

    /**
     * 공고 키워드에 맞춰 항목 순서와 강조점을 조정.
     */
    MODERATE,

    /**
     * 요약과 경력 기술을 공고 중심으로 재작성.
     */
    AGGRESSIVE
}
