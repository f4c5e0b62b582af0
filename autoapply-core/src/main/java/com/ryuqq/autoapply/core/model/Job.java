package com.ryuqq.autoapply.core.model;

import java.time.Instant;

/**
 * 채용 공고.
 *
 * <p>Job은 Analysis 단계 이후 불변입니다. requirements는 최초 Analysis 성공 시
 * 한 번만 설정되며, 이미 설정된 Job에 다시 설정하면 {@link IllegalStateException}이 발생합니다.</p>
 *
 * @param id 식별자
 * @param sourceUrl 공고 URL (중복 제거 키)
 * @param platform 게시 플랫폼
 * @param title 직무명
 * @param company 회사명
 * @param postingText 공고 본문
 * @param requirements 추출된 요구사항 (Analysis 전에는 null)
 * @param createdAt 생성 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Job(
    JobId id,
    String sourceUrl,
    Platform platform,
    String title,
    String company,
    String postingText,
    Requirements requirements,
    Instant createdAt
) {

    public Job {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (sourceUrl == null || sourceUrl.isBlank()) {
            throw new IllegalArgumentException("sourceUrl cannot be null or blank");
        }
        if (platform == null) {
            throw new IllegalArgumentException("platform cannot be null");
        }
        if (postingText == null) {
            throw new IllegalArgumentException("postingText cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
    }

    /**
     * 공고 원문으로 분석 전 Job 생성.
     *
     * @param id 식별자
     * @param posting 공고 원문
     * @param createdAt 생성 시각
     * @return requirements가 없는 Job
     */
    public static Job discovered(JobId id, JobPosting posting, Instant createdAt) {
        if (posting == null) {
            throw new IllegalArgumentException("posting cannot be null");
        }
        return new Job(id, posting.sourceUrl(), posting.platform(), posting.title(),
            posting.company(), posting.postingText(), null, createdAt);
    }

    public boolean hasRequirements() {
        return requirements != null;
    }

    /**
     * 요구사항을 설정한 새 Job 반환.
     *
     * @param requirements 추출된 요구사항
     * @return requirements가 설정된 Job
     * @throws IllegalStateException 이미 요구사항이 설정된 경우
     */
    public Job withRequirements(Requirements requirements) {
        if (requirements == null) {
            throw new IllegalArgumentException("requirements cannot be null");
        }
        if (hasRequirements()) {
            throw new IllegalStateException("Requirements already attached to job: " + id);
        }
        return new Job(id, sourceUrl, platform, title, company, postingText, requirements, createdAt);
    }
}
