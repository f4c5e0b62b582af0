package com.ryuqq.autoapply.core.model;

/**
 * 맞춤형 이력서가 어느 공고와 지원서, 몇 번째 시도를 위해 생성되었는지 기록.
 *
 * @param jobId 대상 공고
 * @param applicationId 대상 지원서
 * @param attempt 생성 시점의 Tailoring 시도 번호 (1부터)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ResumeLineage(JobId jobId, ApplicationId applicationId, int attempt) {

    public ResumeLineage {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        if (applicationId == null) {
            throw new IllegalArgumentException("applicationId cannot be null");
        }
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
    }
}
