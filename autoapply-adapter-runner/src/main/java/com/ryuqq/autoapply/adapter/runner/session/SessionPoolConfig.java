package com.ryuqq.autoapply.adapter.runner.session;

/**
 * SessionPool 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxSessionsPerPlatform: 플랫폼당 최대 동시 세션 수 (기본 2)</li>
 *   <li>maxConsecutiveErrors: 연속 오류가 이 값에 도달하면 세션 폐기 (기본 2)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxSessionsPerPlatform 플랫폼당 최대 세션 수 (1 이상이어야 함)
 * @param maxConsecutiveErrors 폐기 임계 연속 오류 수 (1 이상이어야 함)
 */
public record SessionPoolConfig(
    int maxSessionsPerPlatform,
    int maxConsecutiveErrors
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxSessionsPerPlatform=2, maxConsecutiveErrors=2</p>
     */
    public SessionPoolConfig() {
        this(2, 2);
    }

    public SessionPoolConfig {
        if (maxSessionsPerPlatform <= 0) {
            throw new IllegalArgumentException(
                "maxSessionsPerPlatform must be positive (current: " + maxSessionsPerPlatform + ")"
            );
        }
        if (maxConsecutiveErrors <= 0) {
            throw new IllegalArgumentException(
                "maxConsecutiveErrors must be positive (current: " + maxConsecutiveErrors + ")"
            );
        }
    }

    public SessionPoolConfig withMaxSessionsPerPlatform(int maxSessionsPerPlatform) {
        return new SessionPoolConfig(maxSessionsPerPlatform, maxConsecutiveErrors);
    }

    public SessionPoolConfig withMaxConsecutiveErrors(int maxConsecutiveErrors) {
        return new SessionPoolConfig(maxSessionsPerPlatform, maxConsecutiveErrors);
    }
}
