package com.ryuqq.autoapply.core.event;

/**
 * Lifecycle Event 구독자.
 *
 * <p>Event Log가 append 직후 호출합니다. 구현체는 빠르게 반환해야 하며,
 * 던진 예외는 로그에 남고 다른 구독자와 append에는 영향을 주지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventListener {

    void onEvent(LifecycleEvent event);
}
