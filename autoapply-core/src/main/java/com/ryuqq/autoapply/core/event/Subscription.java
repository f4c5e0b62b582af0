package com.ryuqq.autoapply.core.event;

/**
 * 구독 해제 핸들.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Subscription extends AutoCloseable {

    /**
     * 구독 해제. 여러 번 호출해도 안전합니다.
     */
    @Override
    void close();
}
