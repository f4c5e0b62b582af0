package com.ryuqq.autoapply.adapter.runner;

import com.ryuqq.autoapply.adapter.inmemory.event.InMemoryEventLog;
import com.ryuqq.autoapply.adapter.inmemory.queue.InMemoryWorkQueue;
import com.ryuqq.autoapply.adapter.inmemory.store.InMemoryApplicationStore;
import com.ryuqq.autoapply.core.event.ApplicationProjector;
import com.ryuqq.autoapply.core.event.EventCause;
import com.ryuqq.autoapply.core.event.LifecycleEvent;
import com.ryuqq.autoapply.core.model.Application;
import com.ryuqq.autoapply.core.model.JobId;
import com.ryuqq.autoapply.core.model.ResumeId;
import com.ryuqq.autoapply.core.spi.ApplicationStore;
import com.ryuqq.autoapply.core.spi.EventLog;
import com.ryuqq.autoapply.core.spi.WorkQueue;
import com.ryuqq.autoapply.core.statemachine.ApplicationState;
import com.ryuqq.autoapply.core.statemachine.LifecycleTrigger;
import com.ryuqq.autoapply.core.statemachine.StateTransition;
import com.ryuqq.autoapply.testkit.fixture.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Recovery 유닛 테스트.
 *
 * <ul>
 *   <li>이벤트 로그와 어긋난 projection 복구</li>
 *   <li>디스패치 가능한 지원서만 재등록</li>
 *   <li>한 지원서 복구 실패가 나머지를 막지 않음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class RecoveryTest {

    private InMemoryApplicationStore applicationStore;
    private InMemoryEventLog eventLog;
    private InMemoryWorkQueue workQueue;
    private Recovery recovery;

    @Mock
    private ApplicationStore mockStore;

    @Mock
    private EventLog mockEventLog;

    @Mock
    private WorkQueue mockQueue;

    @BeforeEach
    void setUp() {
        applicationStore = new InMemoryApplicationStore();
        eventLog = new InMemoryEventLog();
        workQueue = new InMemoryWorkQueue();
        recovery = new Recovery(applicationStore, eventLog, workQueue, new RecoveryConfig());
    }

    private Application created() {
        Application application = Fixtures.application(JobId.generate(), ResumeId.generate());
        applicationStore.insert(application);
        return application;
    }

    /**
     * 이벤트를 로그에 기록하고 projection을 계산 (저장소는 건드리지 않음).
     */
    private Application record(Application current, LifecycleTrigger trigger) {
        LifecycleEvent draft = new LifecycleEvent(0, current.id(), current.jobId(), current.state(),
            StateTransition.next(current.state(), trigger), trigger, EventCause.STAGE_SUCCESS, 0,
            null, null, null, null, Fixtures.EPOCH.plusSeconds(current.version() + 1));
        return ApplicationProjector.apply(current, eventLog.append(draft));
    }

    private Application recordAndStore(Application current, LifecycleTrigger trigger) {
        Application next = record(current, trigger);
        assertThat(applicationStore.compareAndSet(next, current.version())).isTrue();
        return next;
    }

    // ============================================================
    // 1. projection 복구
    // ============================================================

    @Test
    void 이벤트보다_뒤처진_projection을_복구하고_재등록() {
        // given
        Application stale = created();
        Application analyzed = record(stale, LifecycleTrigger.ANALYSIS_SUCCEEDED);

        // when
        int requeued = recovery.recover();

        // then
        Application repaired = applicationStore.find(stale.id()).orElseThrow();
        assertThat(repaired.state()).isEqualTo(ApplicationState.ANALYZED);
        assertThat(repaired.version()).isEqualTo(1);
        assertThat(repaired).isEqualTo(analyzed);
        assertThat(requeued).isEqualTo(1);
        assertThat(workQueue.dequeue(10)).containsExactly(stale.id());
    }

    @Test
    void 일치하는_projection은_그대로_두고_재등록만() {
        // given
        Application application = recordAndStore(created(), LifecycleTrigger.ANALYSIS_SUCCEEDED);

        // when
        int requeued = recovery.recover();

        // then
        assertThat(requeued).isEqualTo(1);
        assertThat(applicationStore.find(application.id())).contains(application);
    }

    // ============================================================
    // 2. 재등록 대상
    // ============================================================

    @Test
    void 검토_대기와_접수_대기는_재등록하지_않음() {
        // given
        Application review = created();
        review = recordAndStore(review, LifecycleTrigger.ANALYSIS_SUCCEEDED);
        review = recordAndStore(review, LifecycleTrigger.TAILORING_SUCCEEDED);
        review = recordAndStore(review, LifecycleTrigger.APPROVAL_REQUIRED);

        Application submitted = created();
        submitted = recordAndStore(submitted, LifecycleTrigger.ANALYSIS_SUCCEEDED);
        submitted = recordAndStore(submitted, LifecycleTrigger.TAILORING_SUCCEEDED);
        submitted = recordAndStore(submitted, LifecycleTrigger.SUBMISSION_AUTHORIZED);
        submitted = recordAndStore(submitted, LifecycleTrigger.PLATFORM_ACCEPTED);

        // when
        int requeued = recovery.recover();

        // then
        assertThat(requeued).isZero();
        assertThat(workQueue.size()).isZero();
        assertThat(applicationStore.find(review.id()).orElseThrow().state()).isEqualTo(ApplicationState.NEEDS_REVIEW);
        assertThat(applicationStore.find(submitted.id()).orElseThrow().state()).isEqualTo(ApplicationState.SUBMITTED);
    }

    @Test
    void 제출_중이던_지원서는_재등록() {
        // given
        Application submitting = created();
        submitting = recordAndStore(submitting, LifecycleTrigger.ANALYSIS_SUCCEEDED);
        submitting = recordAndStore(submitting, LifecycleTrigger.TAILORING_SUCCEEDED);
        submitting = recordAndStore(submitting, LifecycleTrigger.SUBMISSION_AUTHORIZED);

        // when
        int requeued = recovery.recover();

        // then
        assertThat(requeued).isEqualTo(1);
        assertThat(workQueue.dequeue(10)).containsExactly(submitting.id());
    }

    @Test
    void 종료된_지원서는_건드리지_않음() {
        // given
        Application cancelled = recordAndStore(created(), LifecycleTrigger.CANCEL_REQUESTED);

        // when
        int requeued = recovery.recover();

        // then
        assertThat(requeued).isZero();
        assertThat(applicationStore.find(cancelled.id()).orElseThrow().state()).isEqualTo(ApplicationState.CANCELLED);
    }

    @Test
    void batchSize보다_많은_지원서도_모두_재등록() {
        // given
        for (int i = 0; i < 5; i++) {
            created();
        }
        Recovery paged = new Recovery(applicationStore, eventLog, workQueue, new RecoveryConfig(2));

        // when
        int requeued = paged.recover();

        // then
        assertThat(requeued).isEqualTo(5);
        assertThat(workQueue.size()).isEqualTo(5);
    }

    @Test
    void batchSize와_같은_수의_지원서도_빠짐없이_처리() {
        // given
        Application stale = created();
        record(stale, LifecycleTrigger.ANALYSIS_SUCCEEDED);
        created();
        Recovery paged = new Recovery(applicationStore, eventLog, workQueue, new RecoveryConfig(1));

        // when
        int requeued = paged.recover();

        // then
        assertThat(requeued).isEqualTo(2);
        assertThat(applicationStore.find(stale.id()).orElseThrow().state()).isEqualTo(ApplicationState.ANALYZED);
    }

    // ============================================================
    // 3. 실패 격리
    // ============================================================

    @Test
    void 복구_중_CAS_충돌이_나도_나머지는_계속_처리() {
        // given
        Application broken = Fixtures.application(JobId.generate(), ResumeId.generate());
        Application healthy = Fixtures.application(JobId.generate(), ResumeId.generate());
        LifecycleEvent analyzed = new LifecycleEvent(1, broken.id(), broken.jobId(), ApplicationState.DISCOVERED,
            ApplicationState.ANALYZED, LifecycleTrigger.ANALYSIS_SUCCEEDED, EventCause.STAGE_SUCCESS, 0,
            null, null, null, null, Fixtures.EPOCH);

        when(mockStore.findByStatesAfter(any(), isNull(), anyInt())).thenReturn(List.of(broken, healthy));
        when(mockEventLog.history(broken.id())).thenReturn(List.of(analyzed));
        when(mockEventLog.history(healthy.id())).thenReturn(List.of());
        when(mockStore.compareAndSet(any(), eq(0L))).thenReturn(false);

        Recovery mocked = new Recovery(mockStore, mockEventLog, mockQueue, new RecoveryConfig());

        // when
        int requeued = mocked.recover();

        // then
        assertThat(requeued).isEqualTo(1);
        verify(mockQueue).enqueue(healthy.id(), 0);
        verify(mockQueue, never()).enqueue(eq(broken.id()), anyLong());
    }
}
