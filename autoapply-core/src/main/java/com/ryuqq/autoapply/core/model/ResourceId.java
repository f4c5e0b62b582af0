package com.ryuqq.autoapply.core.model;

/**
 * Governor가 관리하는 공유 자원 식별자.
 *
 * <p>자원은 {@code kind:name} 형태의 문자열로 표현됩니다.</p>
 * <ul>
 *   <li>{@code platform:linkedin} - 플랫폼 계정별 제출 예산 및 동시성</li>
 *   <li>{@code llm:openai} - LLM 공급자 API 예산</li>
 * </ul>
 *
 * <p>자연 순서(Comparable)는 문자열 순서이며, 여러 자원을 동시에 획득할 때
 * 획득 순서를 고정하는 데 사용됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ResourceId implements Comparable<ResourceId> {

    private final String value;

    private ResourceId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ResourceId cannot be null or blank");
        }
        if (!value.matches("^[a-z0-9\\-_]+:[a-z0-9\\-_.]+$")) {
            throw new IllegalArgumentException(
                "ResourceId must be of the form kind:name (current: " + value + ")"
            );
        }
        this.value = value;
    }

    public static ResourceId of(String value) {
        return new ResourceId(value);
    }

    /**
     * 플랫폼 제출 자원.
     *
     * @param platform 플랫폼
     * @return {@code platform:<name>} 자원
     */
    public static ResourceId platform(Platform platform) {
        if (platform == null) {
            throw new IllegalArgumentException("platform cannot be null");
        }
        return new ResourceId("platform:" + platform.getName());
    }

    /**
     * LLM 공급자 자원.
     *
     * @param provider 공급자 이름 (예: openai, anthropic)
     * @return {@code llm:<provider>} 자원
     */
    public static ResourceId llm(String provider) {
        if (provider == null || provider.isBlank()) {
            throw new IllegalArgumentException("provider cannot be null or blank");
        }
        return new ResourceId("llm:" + provider.trim().toLowerCase());
    }

    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(ResourceId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResourceId that = (ResourceId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ResourceId{" + value + '}';
    }
}
