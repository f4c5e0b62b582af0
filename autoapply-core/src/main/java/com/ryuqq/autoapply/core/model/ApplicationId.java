package com.ryuqq.autoapply.core.model;

import java.util.UUID;

/**
 * 지원서(Application)의 전역 고유 식별자.
 *
 * <p>Scheduler, Event Log, Session Pool 등 모든 컴포넌트가 지원서를 추적할 때 사용합니다.
 * Lease holder 및 Session affinity 키로도 쓰입니다.</p>
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
public final class ApplicationId implements Comparable<ApplicationId> {

    private final String value;

    private ApplicationId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ApplicationId cannot be null or blank");
        }
        if (value.length() > 128) {
            throw new IllegalArgumentException("ApplicationId length cannot exceed 128 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("ApplicationId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * ApplicationId 생성.
     *
     * @param value 식별자 값
     * @return ApplicationId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ApplicationId of(String value) {
        return new ApplicationId(value);
    }

    /**
     * 무작위 UUID 기반 ApplicationId 생성.
     *
     * @return 새 ApplicationId
     */
    public static ApplicationId generate() {
        return new ApplicationId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(ApplicationId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ApplicationId that = (ApplicationId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ApplicationId{" + value + '}';
    }
}
