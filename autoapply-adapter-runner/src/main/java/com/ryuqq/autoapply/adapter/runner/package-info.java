/**
 * Runner Adapter Layer - 지원 자동화 실행 런타임.
 *
 * <p>이 패키지는 Runtime, ApplicationOrchestrator 인터페이스의 구현체와 복구 컴포넌트를 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.autoapply.adapter.runner.StageScheduler} - 단계 디스패치 + 제어 포트</li>
 *   <li>{@link com.ryuqq.autoapply.adapter.runner.Recovery} - 재시작 시 이벤트 이력 기반 projection 복구</li>
 *   <li>{@link com.ryuqq.autoapply.adapter.runner.ReviewReaper} - 방치된 검토 요청 자동 취소</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (StageScheduler, TokenBucketGovernor, SessionPool)
 *   ↓ implements
 * application (ApplicationOrchestrator, Runtime)
 *   ↓ depends on
 * core (Application, LifecycleEvent, Outcome, StateTransition)
 *   ↓ depends on
 * core/executor, core/spi (Executor, Store 인터페이스)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.autoapply.adapter.runner;
