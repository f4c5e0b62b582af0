package com.ryuqq.autoapply.core.outcome;

/**
 * 성공 결과.
 *
 * @param value 결과값 (null 불가)
 * @param <T> 결과 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Ok<T>(T value) implements Outcome<T> {

    public Ok {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }
}
