package com.ryuqq.autoapply.core.model;

import java.util.List;

/**
 * Analysis 단계가 공고에서 추출한 요구사항.
 *
 * @param skills 핵심 기술 (순서 유지, 중복 없음)
 * @param keywords ATS 키워드
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Requirements(
    List<String> skills,
    List<String> keywords
) {

    public Requirements {
        if (skills == null) {
            throw new IllegalArgumentException("skills cannot be null");
        }
        if (keywords == null) {
            throw new IllegalArgumentException("keywords cannot be null");
        }
        skills = List.copyOf(skills.stream().distinct().toList());
        keywords = List.copyOf(keywords.stream().distinct().toList());
    }

    public static Requirements of(List<String> skills, List<String> keywords) {
        return new Requirements(skills, keywords);
    }

    public boolean isEmpty() {
        return skills.isEmpty() && keywords.isEmpty();
    }
}
