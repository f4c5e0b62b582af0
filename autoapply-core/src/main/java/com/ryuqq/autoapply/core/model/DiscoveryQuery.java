package com.ryuqq.autoapply.core.model;

import java.util.List;

/**
 * Discovery Executor 검색 조건.
 *
 * @param keywords 검색 키워드
 * @param location 지역 (null이면 전체)
 * @param remoteOnly 원격 근무만 검색
 * @param limit 최대 결과 수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DiscoveryQuery(
    List<String> keywords,
    String location,
    boolean remoteOnly,
    int limit
) {

    public DiscoveryQuery {
        if (keywords == null || keywords.isEmpty()) {
            throw new IllegalArgumentException("keywords cannot be null or empty");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        keywords = List.copyOf(keywords);
    }
}
