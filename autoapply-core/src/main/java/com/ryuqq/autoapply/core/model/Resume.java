package com.ryuqq.autoapply.core.model;

import java.time.Instant;

/**
 * 불변 이력서 버전.
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>원본 이력서: parentId, mode, lineage 모두 null</li>
 *   <li>맞춤형 이력서: parentId, mode, lineage 모두 non-null (정확히 하나의 부모)</li>
 *   <li>맞춤형 이력서는 {@link #derive}로만 생성 가능하며 부모와 같은 지원자 소유</li>
 * </ul>
 *
 * @param id 식별자
 * @param candidateId 소유 지원자
 * @param parentId 부모 이력서 (원본이면 null)
 * @param mode 맞춤화 강도 (원본이면 null)
 * @param content 본문
 * @param lineage 생성 출처 (원본이면 null)
 * @param createdAt 생성 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Resume(
    ResumeId id,
    CandidateId candidateId,
    ResumeId parentId,
    TailoringMode mode,
    String content,
    ResumeLineage lineage,
    Instant createdAt
) {

    public Resume {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (candidateId == null) {
            throw new IllegalArgumentException("candidateId cannot be null");
        }
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("content cannot be null or blank");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        boolean tailored = parentId != null;
        if (tailored != (mode != null) || tailored != (lineage != null)) {
            throw new IllegalArgumentException(
                "parentId, mode and lineage must be all present or all absent (resume: " + id + ")"
            );
        }
        if (id.equals(parentId)) {
            throw new IllegalArgumentException("Resume cannot be its own parent: " + id);
        }
    }

    /**
     * 원본 이력서 생성.
     */
    public static Resume original(ResumeId id, CandidateId candidateId, String content, Instant createdAt) {
        return new Resume(id, candidateId, null, null, content, null, createdAt);
    }

    /**
     * 이 이력서를 부모로 하는 맞춤형 버전 생성.
     *
     * @param newId 새 버전 식별자
     * @param mode 맞춤화 강도
     * @param tailoredContent 맞춤화된 본문
     * @param lineage 생성 출처
     * @param createdAt 생성 시각
     * @return 부모가 이 이력서인 새 Resume
     */
    public Resume derive(ResumeId newId, TailoringMode mode, String tailoredContent,
                         ResumeLineage lineage, Instant createdAt) {
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        if (lineage == null) {
            throw new IllegalArgumentException("lineage cannot be null");
        }
        return new Resume(newId, candidateId, id, mode, tailoredContent, lineage, createdAt);
    }

    public boolean isOriginal() {
        return parentId == null;
    }
}
