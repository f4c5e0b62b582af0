package com.ryuqq.autoapply.application.orchestrator;

import com.ryuqq.autoapply.core.event.EventListener;
import com.ryuqq.autoapply.core.event.LifecycleEvent;
import com.ryuqq.autoapply.core.event.Subscription;
import com.ryuqq.autoapply.core.model.Application;
import com.ryuqq.autoapply.core.model.ApplicationId;
import com.ryuqq.autoapply.core.outcome.Outcome;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 지원 자동화 제어 포트.
 *
 * <p>대시보드, CLI 등 외부 계층은 이 인터페이스로만 Orchestrator를 조작합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Application application = orchestrator.submitJob(JobSubmission.of(posting, candidateId, resumeId));
 *
 * // 진행 상황 구독
 * Subscription subscription = orchestrator.subscribe(event -&gt; dashboard.push(event));
 *
 * // 검토 대기 중인 지원서 승인
 * if (orchestrator.getStatus(application.id()).state() == ApplicationState.NEEDS_REVIEW) {
 *     orchestrator.approve(application.id());
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ApplicationOrchestrator {

    /**
     * 공고에 지원 시작.
     *
     * <p><strong>멱등성:</strong> 같은 (공고, 지원자)에 진행 중이거나 CONFIRMED인 지원서가 있으면
     * 그 지원서를 그대로 반환합니다. 이전 지원서가 FAILED, CANCELLED이면 새 지원서를 만듭니다.
     * 공고는 URL로 중복 제거됩니다.</p>
     *
     * @param submission 지원 요청
     * @return DISCOVERED 상태의 새 지원서 또는 기존 지원서
     * @throws IllegalArgumentException 이력서가 없거나 지원자 소유가 아니거나, 플랫폼의 제출 Executor가 없는 경우
     */
    Application submitJob(JobSubmission submission);

    /**
     * 현재 상태와 이벤트 이력 조회.
     *
     * @throws ApplicationNotFoundException 지원서가 없는 경우
     */
    ApplicationStatus getStatus(ApplicationId id);

    /**
     * NEEDS_REVIEW 지원서 승인 → SUBMITTING.
     *
     * @throws ApplicationNotFoundException 지원서가 없는 경우
     * @throws com.ryuqq.autoapply.core.statemachine.IllegalTransitionException NEEDS_REVIEW가 아닌 경우
     * @throws ApplicationBusyException 다른 작업이 진행 중인 경우
     */
    Application approve(ApplicationId id);

    /**
     * NEEDS_REVIEW 지원서 거절 → CANCELLED.
     *
     * @throws ApplicationNotFoundException 지원서가 없는 경우
     * @throws com.ryuqq.autoapply.core.statemachine.IllegalTransitionException NEEDS_REVIEW가 아닌 경우
     * @throws ApplicationBusyException 다른 작업이 진행 중인 경우
     */
    Application reject(ApplicationId id);

    /**
     * 취소 요청 (협조적).
     *
     * <p>실행 중이 아니면 즉시 CANCELLED가 됩니다. 실행 중이면 해당 단계가 끝난 뒤 반영되며,
     * 진행 중인 제출이 성공하면 취소 대신 실제 결과가 기록됩니다. 종료 상태면 아무것도 하지 않습니다.</p>
     *
     * @return 요청 시점의 지원서 (즉시 반영된 경우 CANCELLED)
     * @throws ApplicationNotFoundException 지원서가 없는 경우
     */
    Application cancel(ApplicationId id);

    /**
     * SUBMITTED 지원서에 플랫폼 확인 번호 반영 → CONFIRMED.
     *
     * @throws com.ryuqq.autoapply.core.statemachine.IllegalTransitionException SUBMITTED가 아닌 경우
     */
    Application confirm(ApplicationId id, String confirmationToken);

    /**
     * SUBMITTED 지원서를 플랫폼이 나중에 거부한 경우 → FAILED.
     *
     * @throws com.ryuqq.autoapply.core.statemachine.IllegalTransitionException SUBMITTED가 아닌 경우
     */
    Application reportPlatformFailure(ApplicationId id, String reason);

    /**
     * 공고 탐색 후 발견된 공고마다 지원 시작.
     *
     * @param request 탐색 요청
     * @return 생성되거나 재사용된 지원서 목록, 또는 탐색 실패
     * @throws IllegalStateException Discovery Executor가 등록되지 않은 경우
     */
    CompletableFuture<Outcome<List<Application>>> discover(DiscoveryRequest request);

    /**
     * 이후 발생하는 이벤트 구독 (push).
     */
    Subscription subscribe(EventListener listener);

    /**
     * 순번 이후의 이벤트 조회 (poll).
     */
    List<LifecycleEvent> eventsSince(long afterSequence, int limit);
}
