package com.ryuqq.autoapply.application.orchestrator;

import com.ryuqq.autoapply.core.model.CandidateId;
import com.ryuqq.autoapply.core.model.DiscoveryQuery;
import com.ryuqq.autoapply.core.model.ResumeId;
import com.ryuqq.autoapply.core.model.TailoringMode;

/**
 * 탐색 후 일괄 지원 요청.
 *
 * <p>발견된 공고마다 {@link JobSubmission}이 만들어집니다.</p>
 *
 * @param query 검색 조건
 * @param candidateId 지원자
 * @param baseResumeId 원본 이력서
 * @param mode 맞춤화 강도
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DiscoveryRequest(
    DiscoveryQuery query,
    CandidateId candidateId,
    ResumeId baseResumeId,
    TailoringMode mode
) {

    public DiscoveryRequest {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
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
}
