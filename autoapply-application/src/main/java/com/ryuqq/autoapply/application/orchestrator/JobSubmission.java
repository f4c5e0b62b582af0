package com.ryuqq.autoapply.application.orchestrator;

import com.ryuqq.autoapply.core.model.CandidateId;
import com.ryuqq.autoapply.core.model.JobPosting;
import com.ryuqq.autoapply.core.model.ResumeId;
import com.ryuqq.autoapply.core.model.TailoringMode;

/**
 * 지원 요청.
 *
 * @param posting 공고
 * @param candidateId 지원자
 * @param baseResumeId 맞춤화의 기준이 될 원본 이력서
 * @param mode 맞춤화 강도
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record JobSubmission(
    JobPosting posting,
    CandidateId candidateId,
    ResumeId baseResumeId,
    TailoringMode mode
) {

    public JobSubmission {
        if (posting == null) {
            throw new IllegalArgumentException("posting cannot be null");
        }
        if (candidateId == null) {
            throw new IllegalArgumentException("candidateId cannot be null");
        }
        if (baseResumeId == null) {
            throw new IllegalArgumentException("baseResumeId cannot be null");
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
    }

    /**
     * 기본 맞춤화 강도(CONSERVATIVE)로 생성.
     */
    public static JobSubmission of(JobPosting posting, CandidateId candidateId, ResumeId baseResumeId) {
        return new JobSubmission(posting, candidateId, baseResumeId, TailoringMode.CONSERVATIVE);
    }
}
