package com.ryuqq.autoapply.core.model;

/**
 * 채용 플랫폼 식별자 (예: linkedin, indeed, greenhouse).
 *
 * <p>플랫폼 이름은 소문자로 정규화됩니다. 동일 플랫폼의 Session, Submission Executor,
 * 플랫폼 Rate budget이 모두 이 값으로 묶입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Platform {

    public static final Platform LINKEDIN = new Platform("linkedin");
    public static final Platform INDEED = new Platform("indeed");

    private final String name;

    private Platform(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Platform name cannot be null or blank");
        }
        if (!name.matches("^[a-z0-9\\-]+$")) {
            throw new IllegalArgumentException(
                "Platform name contains invalid characters (current: " + name + ")"
            );
        }
        this.name = name;
    }

    /**
     * Platform 생성 (소문자 정규화).
     *
     * @param name 플랫폼 이름
     * @return Platform 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 이름인 경우
     */
    public static Platform of(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Platform name cannot be null or blank");
        }
        return new Platform(name.trim().toLowerCase());
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Platform platform = (Platform) o;
        return name.equals(platform.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "Platform{" + name + '}';
    }
}
