package com.ryuqq.autoapply.core.model;

/**
 * Discovery 단계가 반환하거나 사용자가 직접 제출하는 공고 원문.
 *
 * <p>Job이 되기 전의 입력값이며, sourceUrl이 중복 제거 키입니다.</p>
 *
 * @param sourceUrl 공고 URL
 * @param platform 공고가 게시된 플랫폼
 * @param title 직무명
 * @param company 회사명
 * @param postingText 공고 본문
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record JobPosting(
    String sourceUrl,
    Platform platform,
    String title,
    String company,
    String postingText
) {

    public JobPosting {
        if (sourceUrl == null || sourceUrl.isBlank()) {
            throw new IllegalArgumentException("sourceUrl cannot be null or blank");
        }
        if (platform == null) {
            throw new IllegalArgumentException("platform cannot be null");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title cannot be null or blank");
        }
        if (company == null || company.isBlank()) {
            throw new IllegalArgumentException("company cannot be null or blank");
        }
        if (postingText == null) {
            throw new IllegalArgumentException("postingText cannot be null");
        }
    }
}
