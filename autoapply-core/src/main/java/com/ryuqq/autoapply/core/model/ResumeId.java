package com.ryuqq.autoapply.core.model;

import java.util.UUID;

/**
 * 이력서 버전(Resume)의 식별자.
 *
 * <p>원본 이력서와 맞춤형(tailored) 버전 모두 고유한 ResumeId를 가집니다.</p>
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
public final class ResumeId {

    private final String value;

    private ResumeId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ResumeId cannot be null or blank");
        }
        if (value.length() > 128) {
            throw new IllegalArgumentException("ResumeId length cannot exceed 128 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("ResumeId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * ResumeId 생성.
     *
     * @param value 식별자 값
     * @return ResumeId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ResumeId of(String value) {
        return new ResumeId(value);
    }

    /**
     * 무작위 UUID 기반 ResumeId 생성.
     *
     * @return 새 ResumeId
     */
    public static ResumeId generate() {
        return new ResumeId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResumeId that = (ResumeId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ResumeId{" + value + '}';
    }
}
