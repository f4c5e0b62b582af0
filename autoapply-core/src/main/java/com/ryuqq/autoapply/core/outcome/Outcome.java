package com.ryuqq.autoapply.core.outcome;

/**
 * Stage Executor 호출 결과.
 *
 * <p>Outcome은 두 가지 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공, 결과값 포함</li>
 *   <li>{@link Fail}: 실패, {@link FailureKind}로 분류</li>
 * </ul>
 *
 * <p>재시도 여부는 Executor가 아니라 Retry Policy가 결정합니다.
 * 따라서 Outcome에는 재시도 케이스가 없습니다.</p>
 *
 * <p><strong>분기 예시:</strong></p>
 * <pre>
 * if (outcome instanceof Ok&lt;Requirements&gt; ok) {
 *     jobs.attachRequirements(jobId, ok.value());
 * } else if (outcome instanceof Fail&lt;Requirements&gt; fail) {
 *     handleFailure(fail.kind(), fail.message());
 * }
 * </pre>
 *
 * @param <T> 성공 결과 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Outcome<T> permits Ok, Fail {

    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> fail(FailureKind kind, String message) {
        return new Fail<>(kind, message, null);
    }

    static <T> Outcome<T> fail(FailureKind kind, String message, String cause) {
        return new Fail<>(kind, message, cause);
    }

    default boolean isOk() {
        return this instanceof Ok;
    }

    default boolean isFail() {
        return this instanceof Fail;
    }
}
