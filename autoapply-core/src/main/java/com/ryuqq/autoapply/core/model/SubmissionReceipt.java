package com.ryuqq.autoapply.core.model;

/**
 * Submission Executor가 반환하는 플랫폼 접수 결과.
 *
 * <p>confirmationToken이 있으면 플랫폼이 즉시 접수를 확인한 것이고(CONFIRMED),
 * 없으면 접수만 되고 확인은 나중에 도착합니다(SUBMITTED).</p>
 *
 * @param confirmationToken 플랫폼 확인 번호 (nullable)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SubmissionReceipt(String confirmationToken) {

    public SubmissionReceipt {
        if (confirmationToken != null && confirmationToken.isBlank()) {
            throw new IllegalArgumentException("confirmationToken cannot be blank");
        }
    }

    public static SubmissionReceipt confirmed(String confirmationToken) {
        if (confirmationToken == null) {
            throw new IllegalArgumentException("confirmationToken cannot be null");
        }
        return new SubmissionReceipt(confirmationToken);
    }

    public static SubmissionReceipt accepted() {
        return new SubmissionReceipt(null);
    }

    public boolean isConfirmed() {
        return confirmationToken != null;
    }
}
