package com.ryuqq.autoapply.core.model;

import java.util.List;

/**
 * Tailoring Executor가 생성한 맞춤형 이력서 본문.
 *
 * <p>Scheduler가 이 결과로 부모 이력서에서 파생된 새 {@link Resume}을 만듭니다.</p>
 *
 * @param content 맞춤화된 이력서 본문
 * @param matchedKeywords 반영된 공고 키워드
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TailoredResume(String content, List<String> matchedKeywords) {

    public TailoredResume {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("content cannot be null or blank");
        }
        matchedKeywords = matchedKeywords == null ? List.of() : List.copyOf(matchedKeywords);
    }
}
