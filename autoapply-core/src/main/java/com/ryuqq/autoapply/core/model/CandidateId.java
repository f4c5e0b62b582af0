package com.ryuqq.autoapply.core.model;

import java.util.UUID;

/**
 * 지원자(Candidate)의 식별자.
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~128자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CandidateId {

    private final String value;

    private CandidateId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CandidateId cannot be null or blank");
        }
        if (value.length() > 128) {
            throw new IllegalArgumentException("CandidateId length cannot exceed 128 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("CandidateId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * CandidateId 생성.
     *
     * @param value 식별자 값
     * @return CandidateId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static CandidateId of(String value) {
        return new CandidateId(value);
    }

    /**
     * 무작위 UUID 기반 CandidateId 생성.
     *
     * @return 새 CandidateId
     */
    public static CandidateId generate() {
        return new CandidateId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CandidateId that = (CandidateId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "CandidateId{" + value + '}';
    }
}
