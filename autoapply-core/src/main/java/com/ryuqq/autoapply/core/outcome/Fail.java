package com.ryuqq.autoapply.core.outcome;

/**
 * 분류된 실패 결과.
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>Greenhouse 폼이 필수 항목 누락으로 거부 → PLATFORM_REJECTED_INPUT</li>
 *   <li>LinkedIn이 CAPTCHA 표시 → AUTOMATION_DETECTED</li>
 *   <li>LLM API 429 응답 → RATE_LIMITED</li>
 * </ul>
 *
 * @param kind 실패 분류
 * @param message 사람이 읽을 수 있는 사유
 * @param cause 원인 (선택, null 가능)
 * @param <T> 성공 시 결과 타입 (Fail에서는 사용되지 않음)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Fail<T>(
    FailureKind kind,
    String message,
    String cause
) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind가 null이거나 message가 비어있는 경우
     */
    public Fail {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    public FailureCategory category() {
        return kind.category();
    }
}
