package com.ryuqq.autoapply.core.outcome;

/**
 * Stage Executor가 보고하는 실패 종류.
 *
 * <p>Executor는 예외를 던지지 않고 이 분류와 함께 {@link Fail}을 반환합니다.
 * Retry Policy는 분류만 보고 재시도 여부를 결정합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum FailureKind {

    TRANSIENT_NETWORK("transient_network", FailureCategory.TRANSIENT, "Network or upstream service error"),
    RATE_LIMITED("rate_limited", FailureCategory.TRANSIENT, "Rate limit reached"),
    TIMEOUT("timeout", FailureCategory.TRANSIENT, "Stage deadline exceeded"),
    PLATFORM_REJECTED_INPUT("platform_rejected_input", FailureCategory.PERMANENT_DATA, "Platform rejected the submitted data"),
    AUTOMATION_DETECTED("automation_detected", FailureCategory.PERMANENT_POLICY, "Platform detected browser automation");

    private final String code;
    private final FailureCategory category;
    private final String description;

    FailureKind(String code, FailureCategory category, String description) {
        this.code = code;
        this.category = category;
        this.description = description;
    }

    public String code() {
        return code;
    }

    public FailureCategory category() {
        return category;
    }

    public String description() {
        return description;
    }

    /**
     * 코드 문자열로 조회.
     *
     * @param code 예: {@code rate_limited}
     * @return FailureKind
     * @throws IllegalArgumentException 알 수 없는 코드인 경우
     */
    public static FailureKind fromCode(String code) {
        for (FailureKind kind : values()) {
            if (kind.code.equals(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown failure kind: " + code);
    }
}
