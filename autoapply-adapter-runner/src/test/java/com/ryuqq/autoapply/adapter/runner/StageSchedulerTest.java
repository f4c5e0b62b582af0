package com.ryuqq.autoapply.adapter.runner;

import com.ryuqq.autoapply.adapter.inmemory.event.InMemoryEventLog;
import com.ryuqq.autoapply.adapter.inmemory.queue.InMemoryWorkQueue;
import com.ryuqq.autoapply.adapter.inmemory.store.InMemoryApplicationStore;
import com.ryuqq.autoapply.adapter.inmemory.store.InMemoryJobStore;
import com.ryuqq.autoapply.adapter.inmemory.store.InMemoryResumeStore;
import com.ryuqq.autoapply.adapter.runner.governor.TokenBucketGovernor;
import com.ryuqq.autoapply.adapter.runner.metrics.StageMetrics;
import com.ryuqq.autoapply.adapter.runner.metrics.StageStats;
import com.ryuqq.autoapply.adapter.runner.session.SessionPool;
import com.ryuqq.autoapply.adapter.runner.session.SessionPoolConfig;
import com.ryuqq.autoapply.application.orchestrator.ApplicationBusyException;
import com.ryuqq.autoapply.application.orchestrator.ApplicationNotFoundException;
import com.ryuqq.autoapply.application.orchestrator.DiscoveryRequest;
import com.ryuqq.autoapply.application.orchestrator.JobSubmission;
import com.ryuqq.autoapply.core.event.EventCause;
import com.ryuqq.autoapply.core.event.LifecycleEvent;
import com.ryuqq.autoapply.core.event.Subscription;
import com.ryuqq.autoapply.core.executor.AnalysisExecutor;
import com.ryuqq.autoapply.core.executor.Stage;
import com.ryuqq.autoapply.core.executor.StageExecutors;
import com.ryuqq.autoapply.core.governor.GovernorConfig;
import com.ryuqq.autoapply.core.governor.ResourcePolicy;
import com.ryuqq.autoapply.core.model.Application;
import com.ryuqq.autoapply.core.model.ApplicationId;
import com.ryuqq.autoapply.core.model.AutomationLevel;
import com.ryuqq.autoapply.core.model.CandidateId;
import com.ryuqq.autoapply.core.model.DiscoveryQuery;
import com.ryuqq.autoapply.core.model.JobPosting;
import com.ryuqq.autoapply.core.model.Platform;
import com.ryuqq.autoapply.core.model.ResourceId;
import com.ryuqq.autoapply.core.model.Resume;
import com.ryuqq.autoapply.core.model.ResumeId;
import com.ryuqq.autoapply.core.model.TailoringMode;
import com.ryuqq.autoapply.core.outcome.Fail;
import com.ryuqq.autoapply.core.outcome.FailureKind;
import com.ryuqq.autoapply.core.outcome.Ok;
import com.ryuqq.autoapply.core.outcome.Outcome;
import com.ryuqq.autoapply.core.retry.BackoffCalculator;
import com.ryuqq.autoapply.core.retry.RetryPolicy;
import com.ryuqq.autoapply.core.statemachine.ApplicationState;
import com.ryuqq.autoapply.core.statemachine.IllegalTransitionException;
import com.ryuqq.autoapply.core.statemachine.LifecycleTrigger;
import com.ryuqq.autoapply.testkit.fixture.FakeSessionProvider;
import com.ryuqq.autoapply.testkit.fixture.Fixtures;
import com.ryuqq.autoapply.testkit.fixture.LlmAnalysisExecutor;
import com.ryuqq.autoapply.testkit.fixture.ScriptedAnalysisExecutor;
import com.ryuqq.autoapply.testkit.fixture.ScriptedDiscoveryExecutor;
import com.ryuqq.autoapply.testkit.fixture.ScriptedLlm;
import com.ryuqq.autoapply.testkit.fixture.ScriptedSubmissionExecutor;
import com.ryuqq.autoapply.testkit.fixture.ScriptedTailoringExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StageScheduler 통합 테스트.
 *
 * <p>인메모리 어댑터와 스크립트 실행기로 전체 파이프라인을 검증합니다:</p>
 * <ul>
 *   <li>정상 흐름: DISCOVERED → ANALYZED → TAILORED → SUBMITTING → CONFIRMED</li>
 *   <li>자동화 탐지 시 재시도 없이 NEEDS_REVIEW, 승인 후 재제출</li>
 *   <li>플랫폼 동시 제출 상한 준수</li>
 *   <li>재시도 예산 소진 시 FAILED</li>
 *   <li>대기 중 및 실행 중 취소</li>
 *   <li>단계 deadline 초과</li>
 *   <li>ASSISTED 모드, 탐색, 외부 결과 반영</li>
 *   <li>단계별 실행 지표</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StageSchedulerTest {

    private static final long WAIT_TIMEOUT_MS = 5_000;

    private InMemoryApplicationStore applicationStore;
    private InMemoryJobStore jobStore;
    private InMemoryResumeStore resumeStore;
    private InMemoryEventLog eventLog;
    private InMemoryWorkQueue workQueue;
    private FakeSessionProvider sessionProvider;
    private SessionPool sessionPool;

    private AnalysisExecutor analysis;
    private ScriptedTailoringExecutor tailoring;
    private ScriptedSubmissionExecutor linkedin;
    private ScriptedSubmissionExecutor indeed;
    private ScriptedDiscoveryExecutor discovery;
    private GovernorConfig governorConfig;
    private SchedulerConfig config;
    private SimpleMeterRegistry meterRegistry;

    private Resume baseResume;
    private StageScheduler scheduler;

    @BeforeEach
    void setUp() {
        applicationStore = new InMemoryApplicationStore();
        jobStore = new InMemoryJobStore();
        resumeStore = new InMemoryResumeStore();
        eventLog = new InMemoryEventLog();
        workQueue = new InMemoryWorkQueue();
        sessionProvider = new FakeSessionProvider();
        sessionPool = new SessionPool(sessionProvider, new SessionPoolConfig(2, 2));

        analysis = ScriptedAnalysisExecutor.returning("Python", "SQL");
        tailoring = new ScriptedTailoringExecutor();
        linkedin = new ScriptedSubmissionExecutor(Platform.LINKEDIN);
        indeed = new ScriptedSubmissionExecutor(Platform.INDEED);
        discovery = null;
        governorConfig = new GovernorConfig();
        config = new SchedulerConfig()
            .withDeferDelayMs(20)
            .withStageTimeoutMs(2_000);
        meterRegistry = new SimpleMeterRegistry();

        baseResume = Fixtures.resume("Data engineer with Python and SQL");
        resumeStore.save(baseResume);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        if (scheduler != null) {
            scheduler.shutdown();
        }
    }

    private StageScheduler newScheduler() {
        StageExecutors executors = StageExecutors.of(analysis, tailoring, List.of(linkedin, indeed));
        if (discovery != null) {
            executors = executors.withDiscovery(discovery);
        }
        scheduler = new StageScheduler(
            applicationStore, jobStore, resumeStore, eventLog, workQueue,
            new TokenBucketGovernor(governorConfig), sessionPool, executors,
            new RetryPolicy(new BackoffCalculator(10, 50, 0.0)), config, new ReviewReaperConfig(),
            Clock.systemUTC(), meterRegistry
        );
        return scheduler;
    }

    private Application submit(String slug) {
        return submit(Fixtures.posting(slug));
    }

    private Application submit(JobPosting posting) {
        return scheduler.submitJob(new JobSubmission(posting, Fixtures.CANDIDATE, baseResume.id(),
            TailoringMode.MODERATE));
    }

    /**
     * 지원서가 기대 상태에 도달하고 in-flight 마커가 풀릴 때까지 pump 반복.
     */
    private Application pumpUntil(ApplicationId id, ApplicationState expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + WAIT_TIMEOUT_MS;
        Application current = null;
        while (System.currentTimeMillis() < deadline) {
            scheduler.pump();
            Thread.sleep(20);
            current = applicationStore.find(id).orElseThrow();
            if (current.state() == expected && !scheduler.isInFlight(id)) {
                return current;
            }
        }
        throw new AssertionError("Expected " + id + " to reach " + expected + " but was "
            + (current == null ? "unknown" : current.state()));
    }

    private void pumpWhile(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + WAIT_TIMEOUT_MS;
        while (condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("Condition did not settle within " + WAIT_TIMEOUT_MS + "ms");
            }
            scheduler.pump();
            Thread.sleep(20);
        }
    }

    private void pumpFor(long millis) throws InterruptedException {
        long until = System.currentTimeMillis() + millis;
        while (System.currentTimeMillis() < until) {
            scheduler.pump();
            Thread.sleep(20);
        }
    }

    private ApplicationState state(ApplicationId id) {
        return applicationStore.find(id).orElseThrow().state();
    }

    private List<LifecycleTrigger> triggers(ApplicationId id) {
        return eventLog.history(id).stream().map(LifecycleEvent::trigger).toList();
    }

    // ============================================================
    // 1. 정상 흐름
    // ============================================================

    @Test
    void 정상_흐름은_확인번호와_함께_CONFIRMED로_끝남() throws InterruptedException {
        // given
        linkedin.thenConfirm("CNF-123");
        newScheduler();

        // when
        Application created = submit("backend");
        Application confirmed = pumpUntil(created.id(), ApplicationState.CONFIRMED);

        // then
        assertThat(confirmed.confirmationToken()).isEqualTo("CNF-123");
        assertThat(confirmed.attemptCount()).isZero();
        assertThat(triggers(created.id())).containsExactly(
            LifecycleTrigger.ANALYSIS_SUCCEEDED,
            LifecycleTrigger.TAILORING_SUCCEEDED,
            LifecycleTrigger.SUBMISSION_AUTHORIZED,
            LifecycleTrigger.PLATFORM_CONFIRMED
        );
        assertThat(eventLog.history(created.id()))
            .extracting(LifecycleEvent::sequence)
            .isSorted()
            .doesNotHaveDuplicates();
    }

    @Test
    void 제출에는_맞춤_이력서가_쓰이고_원본은_보존됨() throws InterruptedException {
        // given
        newScheduler();

        // when
        Application created = submit("backend");
        Application confirmed = pumpUntil(created.id(), ApplicationState.CONFIRMED);

        // then
        Resume tailored = resumeStore.find(confirmed.resumeId()).orElseThrow();
        assertThat(tailored.parentId()).isEqualTo(baseResume.id());
        assertThat(tailored.mode()).isEqualTo(TailoringMode.MODERATE);
        assertThat(tailored.lineage().applicationId()).isEqualTo(created.id());
        assertThat(tailored.lineage().attempt()).isEqualTo(1);
        assertThat(resumeStore.find(baseResume.id()).orElseThrow().content())
            .isEqualTo("Data engineer with Python and SQL");
        assertThat(linkedin.submissions()).singleElement()
            .satisfies(submission -> assertThat(submission.resume().id()).isEqualTo(tailored.id()));
        assertThat(tailoring.modes()).containsExactly(TailoringMode.MODERATE);
    }

    @Test
    void 구독자는_모든_전이_이벤트를_받음() throws InterruptedException {
        // given
        newScheduler();
        List<LifecycleEvent> received = new CopyOnWriteArrayList<>();
        Subscription subscription = scheduler.subscribe(received::add);

        // when
        Application created = submit("backend");
        pumpUntil(created.id(), ApplicationState.CONFIRMED);
        subscription.close();

        // then
        assertThat(received).hasSize(4);
        assertThat(scheduler.eventsSince(0, 100)).isEqualTo(received);
        assertThat(scheduler.eventsSince(2, 100)).hasSize(2);
    }

    @Test
    void 이미_요구사항이_있는_공고는_분석을_다시_하지_않음() throws InterruptedException {
        // given
        ScriptedAnalysisExecutor scripted = ScriptedAnalysisExecutor.returning("Python");
        analysis = scripted;
        newScheduler();
        Application first = submit("backend");
        pumpUntil(first.id(), ApplicationState.CONFIRMED);

        // when
        Application second = scheduler.submitJob(new JobSubmission(Fixtures.posting("backend"),
            CandidateId.of("candidate-2"), resumeFor("candidate-2"), TailoringMode.CONSERVATIVE));
        pumpUntil(second.id(), ApplicationState.CONFIRMED);

        // then
        assertThat(scripted.calls()).isEqualTo(1);
        assertThat(second.jobId()).isEqualTo(first.jobId());
    }

    private ResumeId resumeFor(String candidate) {
        Resume resume = Resume.original(ResumeId.generate(),
            CandidateId.of(candidate), "Analyst with SQL", Fixtures.EPOCH);
        resumeStore.save(resume);
        return resume.id();
    }

    // ============================================================
    // 2. 정책 위반과 검토
    // ============================================================

    @Test
    void 자동화_탐지는_재시도_없이_NEEDS_REVIEW로_이동() throws InterruptedException {
        // given
        linkedin.thenFail(FailureKind.AUTOMATION_DETECTED, "captcha challenge");
        newScheduler();

        // when
        Application created = submit("backend");
        Application review = pumpUntil(created.id(), ApplicationState.NEEDS_REVIEW);
        pumpFor(100);

        // then
        assertThat(linkedin.calls()).isEqualTo(1);
        assertThat(review.attemptCount()).isEqualTo(1);
        assertThat(review.lastError().kind()).isEqualTo(FailureKind.AUTOMATION_DETECTED);
        assertThat(triggers(created.id())).doesNotContain(LifecycleTrigger.STAGE_RETRY);
        assertThat(triggers(created.id())).endsWith(LifecycleTrigger.POLICY_VIOLATION);
    }

    @Test
    void 검토_승인_후_제출을_다시_시도함() throws InterruptedException {
        // given
        linkedin.thenFail(FailureKind.AUTOMATION_DETECTED, "captcha challenge").thenConfirm("CNF-777");
        newScheduler();
        Application created = submit("backend");
        pumpUntil(created.id(), ApplicationState.NEEDS_REVIEW);

        // when
        Application approved = scheduler.approve(created.id());
        Application confirmed = pumpUntil(created.id(), ApplicationState.CONFIRMED);

        // then
        assertThat(approved.state()).isEqualTo(ApplicationState.SUBMITTING);
        assertThat(approved.attemptCount()).isZero();
        assertThat(confirmed.confirmationToken()).isEqualTo("CNF-777");
        assertThat(linkedin.calls()).isEqualTo(2);
        assertThat(eventLog.history(created.id()))
            .filteredOn(event -> event.trigger() == LifecycleTrigger.APPROVED)
            .singleElement()
            .satisfies(event -> assertThat(event.cause()).isEqualTo(EventCause.MANUAL_OVERRIDE));
    }

    @Test
    void 검토_거절은_CANCELLED() throws InterruptedException {
        // given
        linkedin.thenFail(FailureKind.AUTOMATION_DETECTED, "captcha challenge");
        newScheduler();
        Application created = submit("backend");
        pumpUntil(created.id(), ApplicationState.NEEDS_REVIEW);

        // when
        Application rejected = scheduler.reject(created.id());

        // then
        assertThat(rejected.state()).isEqualTo(ApplicationState.CANCELLED);
        assertThat(scheduler.getStatus(created.id()).state()).isEqualTo(ApplicationState.CANCELLED);
    }

    @Test
    void ASSISTED_모드는_맞춤화_후_승인을_기다림() throws InterruptedException {
        // given
        config = config.withAutomationLevel(AutomationLevel.ASSISTED);
        newScheduler();

        // when
        Application created = submit("backend");
        Application waiting = pumpUntil(created.id(), ApplicationState.NEEDS_REVIEW);
        pumpFor(100);

        // then
        assertThat(linkedin.calls()).isZero();
        assertThat(waiting.resumeId()).isNotEqualTo(baseResume.id());
        assertThat(waiting.lastError()).isNull();
        assertThat(triggers(created.id())).endsWith(LifecycleTrigger.APPROVAL_REQUIRED);

        scheduler.approve(created.id());
        pumpUntil(created.id(), ApplicationState.CONFIRMED);
        assertThat(linkedin.calls()).isEqualTo(1);
    }

    // ============================================================
    // 3. 동시 제출 상한
    // ============================================================

    @Test
    void 플랫폼_동시_제출_상한_1이면_두번째_지원서는_대기() throws InterruptedException {
        // given
        CountDownLatch gate = new CountDownLatch(1);
        linkedin.gatedBy(gate);
        newScheduler();
        Application first = submit("backend");
        Application second = submit("platform");

        // when
        pumpWhile(() -> linkedin.calls() < 1
            || (state(first.id()) != ApplicationState.TAILORED && state(second.id()) != ApplicationState.TAILORED));
        pumpFor(200);

        // then
        assertThat(linkedin.calls()).isEqualTo(1);
        assertThat(List.of(state(first.id()), state(second.id())))
            .containsExactlyInAnyOrder(ApplicationState.SUBMITTING, ApplicationState.TAILORED);

        gate.countDown();
        pumpUntil(first.id(), ApplicationState.CONFIRMED);
        pumpUntil(second.id(), ApplicationState.CONFIRMED);
        assertThat(linkedin.maxConcurrent()).isEqualTo(1);
        assertThat(linkedin.calls()).isEqualTo(2);
    }

    @Test
    void 다른_플랫폼은_서로_막지_않음() throws InterruptedException {
        // given
        CountDownLatch gate = new CountDownLatch(1);
        linkedin.gatedBy(gate);
        newScheduler();
        Application blocked = submit("backend");

        // when
        Application other = submit(Fixtures.posting("analyst", Platform.INDEED));
        Application confirmed = pumpUntil(other.id(), ApplicationState.CONFIRMED);

        // then
        assertThat(confirmed.state()).isEqualTo(ApplicationState.CONFIRMED);
        assertThat(state(blocked.id())).isEqualTo(ApplicationState.SUBMITTING);

        gate.countDown();
        pumpUntil(blocked.id(), ApplicationState.CONFIRMED);
    }

    // ============================================================
    // 4. 재시도와 실패
    // ============================================================

    @Test
    void 일시적_실패가_반복되면_재시도_예산_소진_후_FAILED() throws InterruptedException {
        // given
        ScriptedAnalysisExecutor failing = ScriptedAnalysisExecutor.returning("Python")
            .alwaysFail(FailureKind.TRANSIENT_NETWORK, "connection reset");
        analysis = failing;
        newScheduler();

        // when
        Application created = submit("backend");
        Application failed = pumpUntil(created.id(), ApplicationState.FAILED);

        // then
        assertThat(failing.calls()).isEqualTo(3);
        assertThat(failed.attemptCount()).isEqualTo(3);
        assertThat(failed.lastError().kind()).isEqualTo(FailureKind.TRANSIENT_NETWORK);
        assertThat(triggers(created.id())).containsExactly(
            LifecycleTrigger.STAGE_RETRY,
            LifecycleTrigger.STAGE_RETRY,
            LifecycleTrigger.STAGE_FAILED
        );
        assertThat(eventLog.history(created.id())).extracting(LifecycleEvent::attempt).containsExactly(1, 2, 3);
    }

    @Test
    void 일시적_실패_후_성공하면_계속_진행() throws InterruptedException {
        // given
        linkedin.thenFail(FailureKind.TRANSIENT_NETWORK, "502 from platform").thenConfirm("CNF-2");
        newScheduler();

        // when
        Application created = submit("backend");
        Application confirmed = pumpUntil(created.id(), ApplicationState.CONFIRMED);

        // then
        assertThat(confirmed.attemptCount()).isZero();
        assertThat(confirmed.lastError().kind()).isEqualTo(FailureKind.TRANSIENT_NETWORK);
        assertThat(triggers(created.id())).containsSubsequence(
            LifecycleTrigger.SUBMISSION_AUTHORIZED, LifecycleTrigger.STAGE_RETRY, LifecycleTrigger.PLATFORM_CONFIRMED);
    }

    @Test
    void 입력_거부는_즉시_FAILED() throws InterruptedException {
        // given
        linkedin.thenFail(FailureKind.PLATFORM_REJECTED_INPUT, "missing phone number");
        newScheduler();

        // when
        Application created = submit("backend");
        Application failed = pumpUntil(created.id(), ApplicationState.FAILED);

        // then
        assertThat(linkedin.calls()).isEqualTo(1);
        assertThat(failed.lastError().reason()).isEqualTo("missing phone number");
        assertThat(sessionProvider.closed()).isEmpty();
    }

    @Test
    void 실행기가_던진_예외는_일시적_실패로_처리() throws InterruptedException {
        // given
        linkedin.thenThrow(new IllegalStateException("driver crashed")).thenConfirm("CNF-3");
        newScheduler();

        // when
        Application created = submit("backend");
        Application confirmed = pumpUntil(created.id(), ApplicationState.CONFIRMED);

        // then
        assertThat(confirmed.lastError().kind()).isEqualTo(FailureKind.TRANSIENT_NETWORK);
        assertThat(linkedin.calls()).isEqualTo(2);
    }

    @Test
    void 단계_deadline을_넘기면_TIMEOUT으로_기록() throws InterruptedException {
        // given
        ScriptedAnalysisExecutor slow = ScriptedAnalysisExecutor.returning("Python").withDelay(500);
        analysis = slow;
        config = config.withStageTimeoutMs(100).withMaxAttempts(2);
        newScheduler();

        // when
        Application created = submit("backend");
        Application failed = pumpUntil(created.id(), ApplicationState.FAILED);

        // then
        assertThat(failed.lastError().kind()).isEqualTo(FailureKind.TIMEOUT);
        assertThat(triggers(created.id())).containsExactly(LifecycleTrigger.STAGE_RETRY, LifecycleTrigger.STAGE_FAILED);
        assertThat(jobStore.find(created.jobId()).orElseThrow().hasRequirements()).isFalse();
    }

    @Test
    void 제출_deadline_초과시_세션을_폐기() throws InterruptedException {
        // given
        linkedin.withDelay(500);
        config = config.withStageTimeoutMs(200).withMaxAttempts(1);
        newScheduler();

        // when
        Application created = submit("backend");
        Application failed = pumpUntil(created.id(), ApplicationState.FAILED);

        // then
        assertThat(failed.lastError().kind()).isEqualTo(FailureKind.TIMEOUT);
        pumpWhile(() -> sessionProvider.closed().isEmpty());
        assertThat(sessionProvider.closed()).hasSize(1);
        assertThat(sessionPool.openSessions(Platform.LINKEDIN)).isZero();
    }

    @Test
    void 제출_deadline_초과_후_늦게_도착한_접수를_기록하고_재제출하지_않음() throws InterruptedException {
        // given
        linkedin.withDelay(600).thenConfirm("CNF-LATE");
        config = config.withStageTimeoutMs(200).withMaxAttempts(3);
        newScheduler();

        // when
        Application created = submit("backend");
        pumpWhile(() -> !triggers(created.id()).contains(LifecycleTrigger.STAGE_RETRY));
        pumpFor(100);

        // then
        assertThat(linkedin.calls()).isEqualTo(1);
        assertThat(sessionProvider.closed()).isEmpty();
        assertThat(scheduler.isInFlight(created.id())).isTrue();

        Application confirmed = pumpUntil(created.id(), ApplicationState.CONFIRMED);
        assertThat(confirmed.confirmationToken()).isEqualTo("CNF-LATE");
        assertThat(linkedin.calls()).isEqualTo(1);
        assertThat(linkedin.maxConcurrent()).isEqualTo(1);
        assertThat(triggers(created.id())).containsExactly(
            LifecycleTrigger.ANALYSIS_SUCCEEDED,
            LifecycleTrigger.TAILORING_SUCCEEDED,
            LifecycleTrigger.SUBMISSION_AUTHORIZED,
            LifecycleTrigger.STAGE_RETRY,
            LifecycleTrigger.PLATFORM_CONFIRMED
        );
        pumpWhile(() -> sessionProvider.closed().isEmpty());
        assertThat(sessionPool.openSessions(Platform.LINKEDIN)).isZero();
    }

    @Test
    void 제출_deadline_초과_후에도_제출은_한_번에_하나만_실행() throws InterruptedException {
        // given
        linkedin.withDelay(600)
            .thenFail(FailureKind.TRANSIENT_NETWORK, "connection reset")
            .thenConfirm("CNF-SECOND");
        config = config.withStageTimeoutMs(200).withMaxAttempts(3);
        newScheduler();

        // when
        Application created = submit("backend");
        Application confirmed = pumpUntil(created.id(), ApplicationState.CONFIRMED);

        // then
        assertThat(confirmed.confirmationToken()).isEqualTo("CNF-SECOND");
        assertThat(linkedin.calls()).isEqualTo(2);
        assertThat(linkedin.maxConcurrent()).isEqualTo(1);
        pumpWhile(() -> sessionProvider.closed().size() < 2);
        assertThat(sessionProvider.closed()).hasSize(2);
    }

    @Test
    void 늦은_제출이_진행중일때_취소하면_접수_결과가_우선() throws InterruptedException {
        // given
        linkedin.withDelay(600).thenConfirm("CNF-WINS");
        config = config.withStageTimeoutMs(200).withMaxAttempts(3);
        newScheduler();
        Application created = submit("backend");
        pumpWhile(() -> !triggers(created.id()).contains(LifecycleTrigger.STAGE_RETRY));

        // when
        Application afterCancel = scheduler.cancel(created.id());

        // then
        assertThat(afterCancel.state()).isEqualTo(ApplicationState.SUBMITTING);
        assertThat(scheduler.isCancelRequested(created.id())).isTrue();

        Application confirmed = pumpUntil(created.id(), ApplicationState.CONFIRMED);
        assertThat(confirmed.confirmationToken()).isEqualTo("CNF-WINS");
        assertThat(scheduler.isCancelRequested(created.id())).isFalse();
        assertThat(linkedin.calls()).isEqualTo(1);
    }

    @Test
    void 세션_제공자가_예외를_던져도_다음_시도에서_세션을_엶() throws InterruptedException {
        // given
        sessionPool = new SessionPool(sessionProvider, new SessionPoolConfig(1, 2));
        sessionProvider.throwOnNextOpens(1);
        newScheduler();

        // when
        Application created = submit("backend");
        Application confirmed = pumpUntil(created.id(), ApplicationState.CONFIRMED);

        // then
        assertThat(confirmed.confirmationToken()).isNotBlank();
        assertThat(sessionProvider.openAttempts()).isEqualTo(2);
        assertThat(linkedin.calls()).isEqualTo(1);
    }

    // ============================================================
    // 5. 취소
    // ============================================================

    @Test
    void 대기중인_지원서는_즉시_취소() throws InterruptedException {
        // given
        config = config.withAutomationLevel(AutomationLevel.ASSISTED);
        newScheduler();
        Application created = submit("backend");
        pumpUntil(created.id(), ApplicationState.NEEDS_REVIEW);

        // when
        Application cancelled = scheduler.cancel(created.id());

        // then
        assertThat(cancelled.state()).isEqualTo(ApplicationState.CANCELLED);
        LifecycleEvent last = eventLog.history(created.id()).get(eventLog.history(created.id()).size() - 1);
        assertThat(last.trigger()).isEqualTo(LifecycleTrigger.CANCEL_REQUESTED);
        assertThat(last.cause()).isEqualTo(EventCause.MANUAL_OVERRIDE);
    }

    @Test
    void 종료된_지원서_취소는_변화없음() throws InterruptedException {
        // given
        newScheduler();
        Application created = submit("backend");
        Application confirmed = pumpUntil(created.id(), ApplicationState.CONFIRMED);

        // when
        Application result = scheduler.cancel(created.id());

        // then
        assertThat(result).isEqualTo(confirmed);
        assertThat(eventLog.history(created.id())).hasSize(4);
    }

    @Test
    void 분석_중_취소는_단계가_끝난_뒤_반영() throws InterruptedException {
        // given
        ScriptedAnalysisExecutor slow = ScriptedAnalysisExecutor.returning("Python").withDelay(300);
        analysis = slow;
        newScheduler();
        Application created = submit("backend");
        pumpWhile(() -> slow.calls() < 1);

        // when
        Application pending = scheduler.cancel(created.id());
        Application cancelled = pumpUntil(created.id(), ApplicationState.CANCELLED);

        // then
        assertThat(pending.state()).isEqualTo(ApplicationState.DISCOVERED);
        assertThat(cancelled.state()).isEqualTo(ApplicationState.CANCELLED);
        assertThat(triggers(created.id())).containsExactly(
            LifecycleTrigger.ANALYSIS_SUCCEEDED, LifecycleTrigger.CANCEL_REQUESTED);
        assertThat(tailoring.calls()).isZero();
        assertThat(scheduler.isCancelRequested(created.id())).isFalse();
    }

    @Test
    void 제출_중_취소_후_제출이_실패하면_CANCELLED() throws InterruptedException {
        // given
        CountDownLatch gate = new CountDownLatch(1);
        linkedin.gatedBy(gate).thenFail(FailureKind.TRANSIENT_NETWORK, "connection reset");
        newScheduler();
        Application created = submit("backend");
        pumpWhile(() -> linkedin.calls() < 1);

        // when
        scheduler.cancel(created.id());
        assertThat(scheduler.isCancelRequested(created.id())).isTrue();
        gate.countDown();
        Application cancelled = pumpUntil(created.id(), ApplicationState.CANCELLED);

        // then
        assertThat(cancelled.lastError().kind()).isEqualTo(FailureKind.TRANSIENT_NETWORK);
        assertThat(triggers(created.id())).doesNotContain(LifecycleTrigger.STAGE_RETRY);
        assertThat(linkedin.calls()).isEqualTo(1);
    }

    @Test
    void 제출_중_취소되어도_제출이_성공하면_결과를_그대로_기록() throws InterruptedException {
        // given
        CountDownLatch gate = new CountDownLatch(1);
        linkedin.gatedBy(gate).thenConfirm("CNF-LATE");
        newScheduler();
        Application created = submit("backend");
        pumpWhile(() -> linkedin.calls() < 1);

        // when
        Application pending = scheduler.cancel(created.id());
        gate.countDown();
        Application confirmed = pumpUntil(created.id(), ApplicationState.CONFIRMED);

        // then
        assertThat(pending.state()).isEqualTo(ApplicationState.SUBMITTING);
        assertThat(confirmed.confirmationToken()).isEqualTo("CNF-LATE");
        assertThat(scheduler.isCancelRequested(created.id())).isFalse();
    }

    @Test
    void 실행_중인_지원서의_수동_조작은_ApplicationBusyException() throws InterruptedException {
        // given
        CountDownLatch gate = new CountDownLatch(1);
        linkedin.gatedBy(gate);
        newScheduler();
        Application created = submit("backend");
        pumpWhile(() -> linkedin.calls() < 1);

        // when & then
        assertThatThrownBy(() -> scheduler.confirm(created.id(), "CNF-X"))
            .isInstanceOf(ApplicationBusyException.class);

        gate.countDown();
        pumpUntil(created.id(), ApplicationState.CONFIRMED);
    }

    // ============================================================
    // 6. 제출 요청 멱등성
    // ============================================================

    @Test
    void 같은_공고를_다시_제출하면_기존_지원서를_반환() {
        // given
        newScheduler();
        Application first = submit("backend");

        // when
        Application again = submit("backend");

        // then
        assertThat(again.id()).isEqualTo(first.id());
        assertThat(jobStore.size()).isEqualTo(1);
        assertThat(applicationStore.size()).isEqualTo(1);
    }

    @Test
    void 실패한_지원서는_새_지원서로_다시_시도() throws InterruptedException {
        // given
        analysis = ScriptedAnalysisExecutor.returning("Python")
            .thenFail(FailureKind.PLATFORM_REJECTED_INPUT, "posting could not be parsed");
        newScheduler();
        Application first = submit("backend");
        pumpUntil(first.id(), ApplicationState.FAILED);

        // when
        Application retry = submit("backend");

        // then
        assertThat(retry.id()).isNotEqualTo(first.id());
        assertThat(retry.jobId()).isEqualTo(first.jobId());
        assertThat(retry.state()).isEqualTo(ApplicationState.DISCOVERED);
        pumpUntil(retry.id(), ApplicationState.CONFIRMED);
    }

    @Test
    void 확인된_지원서는_다시_제출해도_그대로() throws InterruptedException {
        // given
        newScheduler();
        Application first = submit("backend");
        pumpUntil(first.id(), ApplicationState.CONFIRMED);

        // when
        Application again = submit("backend");

        // then
        assertThat(again.id()).isEqualTo(first.id());
        assertThat(again.state()).isEqualTo(ApplicationState.CONFIRMED);
    }

    @Test
    void 제출_요청_검증() {
        // given
        newScheduler();
        Resume foreign = Resume.original(ResumeId.generate(),
            CandidateId.of("candidate-2"), "Someone else", Fixtures.EPOCH);
        resumeStore.save(foreign);

        // when & then
        assertThatThrownBy(() -> submit(Fixtures.posting("ops", Platform.of("glassdoor"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("glassdoor");
        assertThatThrownBy(() -> scheduler.submitJob(new JobSubmission(Fixtures.posting("ops"),
            Fixtures.CANDIDATE, foreign.id(), TailoringMode.MODERATE)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("does not belong");
        assertThat(applicationStore.size()).isZero();
    }

    // ============================================================
    // 7. 외부 결과 반영
    // ============================================================

    @Test
    void 접수만_된_지원서는_외부_확인으로_CONFIRMED() throws InterruptedException {
        // given
        linkedin.thenAccept();
        newScheduler();
        Application created = submit("backend");
        Application submitted = pumpUntil(created.id(), ApplicationState.SUBMITTED);

        // when
        Application confirmed = scheduler.confirm(created.id(), "CNF-EMAIL-42");

        // then
        assertThat(submitted.confirmationToken()).isNull();
        assertThat(confirmed.state()).isEqualTo(ApplicationState.CONFIRMED);
        assertThat(confirmed.confirmationToken()).isEqualTo("CNF-EMAIL-42");
    }

    @Test
    void 접수_후_플랫폼_거절_보고는_FAILED() throws InterruptedException {
        // given
        linkedin.thenAccept();
        newScheduler();
        Application created = submit("backend");
        pumpUntil(created.id(), ApplicationState.SUBMITTED);

        // when
        Application failed = scheduler.reportPlatformFailure(created.id(), "position closed");

        // then
        assertThat(failed.state()).isEqualTo(ApplicationState.FAILED);
        assertThat(failed.lastError().kind()).isEqualTo(FailureKind.PLATFORM_REJECTED_INPUT);
        assertThat(failed.lastError().reason()).isEqualTo("position closed");
    }

    @Test
    void 허용되지_않은_수동_조작은_IllegalTransitionException() throws InterruptedException {
        // given
        config = config.withAutomationLevel(AutomationLevel.ASSISTED);
        newScheduler();
        Application created = submit("backend");
        pumpUntil(created.id(), ApplicationState.NEEDS_REVIEW);

        // when & then
        assertThatThrownBy(() -> scheduler.confirm(created.id(), "CNF-1"))
            .isInstanceOf(IllegalTransitionException.class);
        assertThat(state(created.id())).isEqualTo(ApplicationState.NEEDS_REVIEW);
    }

    @Test
    void 없는_지원서_조회는_ApplicationNotFoundException() {
        newScheduler();

        assertThatThrownBy(() -> scheduler.getStatus(ApplicationId.of("missing")))
            .isInstanceOf(ApplicationNotFoundException.class);
        assertThatThrownBy(() -> scheduler.cancel(ApplicationId.of("missing")))
            .isInstanceOf(ApplicationNotFoundException.class);
    }

    // ============================================================
    // 8. 탐색
    // ============================================================

    @Test
    void 탐색된_공고마다_지원서를_만들고_지원하지_않는_플랫폼은_건너뜀() throws Exception {
        // given
        discovery = new ScriptedDiscoveryExecutor(List.of(
            Fixtures.posting("backend"),
            Fixtures.posting("analyst", Platform.INDEED),
            Fixtures.posting("ops", Platform.of("glassdoor"))
        ));
        newScheduler();
        DiscoveryRequest request = new DiscoveryRequest(
            new DiscoveryQuery(List.of("data engineer"), "Seoul", true, 20),
            Fixtures.CANDIDATE, baseResume.id(), TailoringMode.CONSERVATIVE);

        // when
        Outcome<List<Application>> outcome = scheduler.discover(request).get(5, TimeUnit.SECONDS);

        // then
        assertThat(outcome).isInstanceOf(Ok.class);
        List<Application> created = ((Ok<List<Application>>) outcome).value();
        assertThat(created).hasSize(2);
        assertThat(created).extracting(Application::mode).containsOnly(TailoringMode.CONSERVATIVE);
        assertThat(jobStore.size()).isEqualTo(2);
        for (Application application : created) {
            pumpUntil(application.id(), ApplicationState.CONFIRMED);
        }
    }

    @Test
    void 탐색_실패는_Fail로_반환() throws Exception {
        // given
        discovery = new ScriptedDiscoveryExecutor(List.of())
            .thenFail(FailureKind.RATE_LIMITED, "search quota exceeded");
        newScheduler();
        DiscoveryRequest request = new DiscoveryRequest(
            new DiscoveryQuery(List.of("data engineer"), null, false, 10),
            Fixtures.CANDIDATE, baseResume.id(), TailoringMode.MODERATE);

        // when
        Outcome<List<Application>> outcome = scheduler.discover(request).get(5, TimeUnit.SECONDS);

        // then
        assertThat(outcome).isInstanceOf(Fail.class);
        assertThat(((Fail<List<Application>>) outcome).kind()).isEqualTo(FailureKind.RATE_LIMITED);
        assertThat(applicationStore.size()).isZero();
    }

    @Test
    void 탐색_실행기가_없으면_IllegalStateException() {
        newScheduler();
        DiscoveryRequest request = new DiscoveryRequest(
            new DiscoveryQuery(List.of("data engineer"), null, false, 10),
            Fixtures.CANDIDATE, baseResume.id(), TailoringMode.MODERATE);

        assertThatThrownBy(() -> scheduler.discover(request))
            .isInstanceOf(IllegalStateException.class);
    }

    // ============================================================
    // 9. LLM 리소스 통제
    // ============================================================

    @Test
    void LLM_예산이_소진되면_분석을_연기() throws InterruptedException {
        // given
        ScriptedLlm llm = new ScriptedLlm("openai", "Python, SQL");
        analysis = new LlmAnalysisExecutor(llm);
        governorConfig = governorConfig.withPolicy(ResourceId.llm("openai"), new ResourcePolicy(1, 60_000, 5, 60_000));
        newScheduler();
        Application first = submit("backend");
        pumpUntil(first.id(), ApplicationState.CONFIRMED);

        // when
        Application second = submit("analyst");
        pumpFor(200);

        // then
        Application waiting = applicationStore.find(second.id()).orElseThrow();
        assertThat(waiting.state()).isEqualTo(ApplicationState.DISCOVERED);
        assertThat(waiting.attemptCount()).isZero();
        assertThat(eventLog.history(second.id())).isEmpty();
        assertThat(llm.prompts()).hasSize(1);
        assertThat(jobStore.find(first.jobId()).orElseThrow().requirements().skills()).containsExactly("Python", "SQL");
    }

    // ============================================================
    // 10. 생명주기
    // ============================================================

    @Test
    void start는_한번만_가능하고_주기적으로_pump함() throws InterruptedException {
        // given
        config = config.withPollingIntervalMs(20);
        newScheduler();

        // when
        scheduler.start();
        Application created = submit("backend");

        // then
        assertThatThrownBy(() -> scheduler.start()).isInstanceOf(IllegalStateException.class);
        long deadline = System.currentTimeMillis() + WAIT_TIMEOUT_MS;
        while (state(created.id()) != ApplicationState.CONFIRMED && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertThat(state(created.id())).isEqualTo(ApplicationState.CONFIRMED);
    }

    @Test
    void shutdown은_열린_세션을_모두_닫음() throws InterruptedException {
        // given
        newScheduler();
        Application created = submit("backend");
        pumpUntil(created.id(), ApplicationState.CONFIRMED);

        // when
        scheduler.shutdown();
        scheduler = null;

        // then
        assertThat(sessionProvider.opened()).hasSize(1);
        assertThat(sessionProvider.closed()).containsExactlyElementsOf(sessionProvider.opened());
    }

    // ============================================================
    // 단계 지표
    // ============================================================

    @Test
    void 단계마다_호출과_성공_횟수를_집계() throws InterruptedException {
        // given
        linkedin.thenFail(FailureKind.TRANSIENT_NETWORK, "502 from platform").thenConfirm("CNF-M");
        newScheduler();

        // when
        Application created = submit("backend");
        pumpUntil(created.id(), ApplicationState.CONFIRMED);

        // then
        StageStats analysisStats = scheduler.stageStats(Stage.ANALYSIS);
        assertThat(analysisStats.invocations()).isEqualTo(1);
        assertThat(analysisStats.successes()).isEqualTo(1);
        assertThat(analysisStats.failures()).isEmpty();
        assertThat(analysisStats.lastInvokedAt()).isNotNull();

        StageStats submissionStats = scheduler.stageStats(Stage.SUBMISSION);
        assertThat(submissionStats.invocations()).isEqualTo(2);
        assertThat(submissionStats.successes()).isEqualTo(1);
        assertThat(submissionStats.failures(FailureKind.TRANSIENT_NETWORK)).isEqualTo(1);
        assertThat(submissionStats.successRate()).isEqualTo(0.5);
        assertThat(submissionStats.meanLatency()).isPositive();

        assertThat(meterRegistry.counter(StageMetrics.CALLS, "stage", "SUBMISSION", "outcome", "ok").count())
            .isEqualTo(1.0);
    }

    @Test
    void 단계_deadline_초과는_TIMEOUT_실패로_집계() throws InterruptedException {
        // given
        analysis = ScriptedAnalysisExecutor.returning("Python").withDelay(500);
        config = config.withStageTimeoutMs(100).withMaxAttempts(1);
        newScheduler();

        // when
        Application created = submit("backend");
        pumpUntil(created.id(), ApplicationState.FAILED);

        // then
        StageStats stats = scheduler.stageStats(Stage.ANALYSIS);
        assertThat(stats.invocations()).isEqualTo(1);
        assertThat(stats.successes()).isZero();
        assertThat(stats.failures()).containsOnlyKeys(FailureKind.TIMEOUT);
        assertThat(scheduler.stageStats(Stage.SUBMISSION).invocations()).isZero();
    }

    @Test
    void 요구사항을_재사용하면_분석_호출로_집계하지_않음() throws InterruptedException {
        // given
        newScheduler();
        Application first = submit("backend");
        pumpUntil(first.id(), ApplicationState.CONFIRMED);

        // when
        Application retried = scheduler.submitJob(new JobSubmission(Fixtures.posting("backend"),
            CandidateId.of("candidate-2"), resumeFor("candidate-2"), TailoringMode.MODERATE));
        pumpUntil(retried.id(), ApplicationState.CONFIRMED);

        // then
        assertThat(scheduler.stageStats(Stage.ANALYSIS).invocations()).isEqualTo(1);
        assertThat(scheduler.stageStats(Stage.TAILORING).invocations()).isEqualTo(2);
    }

    @Test
    void 탐색도_단계_지표에_기록() throws Exception {
        // given
        discovery = new ScriptedDiscoveryExecutor(List.of())
            .thenFail(FailureKind.RATE_LIMITED, "search quota exceeded");
        newScheduler();
        DiscoveryRequest request = new DiscoveryRequest(
            new DiscoveryQuery(List.of("data engineer"), null, false, 10),
            Fixtures.CANDIDATE, baseResume.id(), TailoringMode.MODERATE);

        // when
        scheduler.discover(request).get(5, TimeUnit.SECONDS);

        // then
        StageStats stats = scheduler.stageStats(Stage.DISCOVERY);
        assertThat(stats.invocations()).isEqualTo(1);
        assertThat(stats.failures(FailureKind.RATE_LIMITED)).isEqualTo(1);
    }
}
