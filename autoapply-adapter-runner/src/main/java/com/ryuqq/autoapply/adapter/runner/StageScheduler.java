package com.ryuqq.autoapply.adapter.runner;

import com.ryuqq.autoapply.adapter.runner.metrics.StageMetrics;
import com.ryuqq.autoapply.adapter.runner.metrics.StageStats;
import com.ryuqq.autoapply.adapter.runner.session.SessionPool;
import com.ryuqq.autoapply.application.orchestrator.ApplicationBusyException;
import com.ryuqq.autoapply.application.orchestrator.ApplicationNotFoundException;
import com.ryuqq.autoapply.application.orchestrator.ApplicationOrchestrator;
import com.ryuqq.autoapply.application.orchestrator.ApplicationStatus;
import com.ryuqq.autoapply.application.orchestrator.DiscoveryRequest;
import com.ryuqq.autoapply.application.orchestrator.JobSubmission;
import com.ryuqq.autoapply.application.runtime.Runtime;
import com.ryuqq.autoapply.core.event.EventCause;
import com.ryuqq.autoapply.core.event.EventListener;
import com.ryuqq.autoapply.core.event.LifecycleEvent;
import com.ryuqq.autoapply.core.event.Subscription;
import com.ryuqq.autoapply.core.executor.DiscoveryExecutor;
import com.ryuqq.autoapply.core.executor.Session;
import com.ryuqq.autoapply.core.executor.Stage;
import com.ryuqq.autoapply.core.executor.StageExecutors;
import com.ryuqq.autoapply.core.executor.SubmissionExecutor;
import com.ryuqq.autoapply.core.governor.LeaseHolder;
import com.ryuqq.autoapply.core.governor.ResourceGovernor;
import com.ryuqq.autoapply.core.model.Application;
import com.ryuqq.autoapply.core.model.ApplicationId;
import com.ryuqq.autoapply.core.model.AutomationLevel;
import com.ryuqq.autoapply.core.model.FailureRecord;
import com.ryuqq.autoapply.core.model.Job;
import com.ryuqq.autoapply.core.model.JobId;
import com.ryuqq.autoapply.core.model.JobPosting;
import com.ryuqq.autoapply.core.model.Requirements;
import com.ryuqq.autoapply.core.model.ResourceId;
import com.ryuqq.autoapply.core.model.Resume;
import com.ryuqq.autoapply.core.model.ResumeId;
import com.ryuqq.autoapply.core.model.ResumeLineage;
import com.ryuqq.autoapply.core.model.SubmissionReceipt;
import com.ryuqq.autoapply.core.model.TailoredResume;
import com.ryuqq.autoapply.core.outcome.Fail;
import com.ryuqq.autoapply.core.outcome.FailureCategory;
import com.ryuqq.autoapply.core.outcome.FailureKind;
import com.ryuqq.autoapply.core.outcome.Ok;
import com.ryuqq.autoapply.core.outcome.Outcome;
import com.ryuqq.autoapply.core.retry.RetryDecision;
import com.ryuqq.autoapply.core.retry.RetryPolicy;
import com.ryuqq.autoapply.core.spi.ApplicationStore;
import com.ryuqq.autoapply.core.spi.EventLog;
import com.ryuqq.autoapply.core.spi.JobStore;
import com.ryuqq.autoapply.core.spi.ResumeStore;
import com.ryuqq.autoapply.core.spi.WorkQueue;
import com.ryuqq.autoapply.core.statemachine.ApplicationState;
import com.ryuqq.autoapply.core.statemachine.LifecycleTrigger;
import com.ryuqq.autoapply.core.statemachine.StateTransition;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 단계 스케줄러 (Runtime + ApplicationOrchestrator 구현체).
 *
 * <p>WorkQueue에서 지원서를 꺼내 현재 상태에 맞는 단계를 실행하고, 결과를 상태 머신에 반영합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump() 호출
 *   ↓
 * dequeue(batchSize) → [A1, A2, ...]
 *   ↓
 * For each ApplicationId:
 *   1. worker 슬롯 없음 → deferDelay 후 재시도
 *   2. in-flight 마커 획득 실패 → 건너뜀 (보유자가 끝난 뒤 다시 enqueue함)
 *   3. dispatch:
 *      - 종료 상태 → 무시
 *      - 취소 요청 있음 → CANCEL_REQUESTED
 *      - DISCOVERED → Analysis (공고에 요구사항이 있으면 호출 생략)
 *      - ANALYZED → Tailoring (새 Resume 버전 저장)
 *      - TAILORED → ASSISTED면 APPROVAL_REQUIRED, FULL이면 lease + 세션 확보 후 SUBMISSION_AUTHORIZED + 제출
 *      - SUBMITTING → lease + 세션 확보 후 제출
 *   4. lease/세션 반납, 마커 해제
 *   5. 후속 enqueue, 대기 중인 취소 반영
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>지원서 하나에는 in-flight 마커를 가진 쪽만 상태를 바꿀 수 있음</li>
 *   <li>lease는 all-or-nothing으로 획득하고 거절되면 대기하지 않고 연기</li>
 *   <li>단계 호출은 stage pool에서 deadline과 함께 실행되며, 초과 시 TIMEOUT 실패로 기록</li>
 *   <li>deadline을 넘긴 호출이 실제로 끝날 때까지 해당 지원서는 다시 dispatch되지 않음</li>
 *   <li>늦게 도착한 제출 성공은 그대로 기록하고, 그 밖의 늦은 결과는 WARN 로그와 함께 폐기</li>
 * </ul>
 *
 * <p>모든 단계 호출은 {@link StageMetrics}에 소요 시간과 결과 종류가 기록되며
 * {@link #stageStats(Stage)}로 조회할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StageScheduler implements Runtime, ApplicationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(StageScheduler.class);

    private static final long NO_FOLLOW_UP = -1;
    private static final long LEASE_RECLAIM_INTERVAL_MS = 1000;

    private final ApplicationStore applicationStore;
    private final JobStore jobStore;
    private final ResumeStore resumeStore;
    private final EventLog eventLog;
    private final WorkQueue workQueue;
    private final ResourceGovernor governor;
    private final SessionPool sessionPool;
    private final StageExecutors executors;
    private final RetryPolicy retryPolicy;
    private final SchedulerConfig config;
    private final ReviewReaperConfig reviewReaperConfig;
    private final Clock clock;

    private final StageMetrics metrics;
    private final TransitionApplier transitions;
    private final InFlightRegistry inFlight = new InFlightRegistry();
    private final Set<ApplicationId> cancelRequests = ConcurrentHashMap.newKeySet();
    private final Map<ApplicationId, AbandonedCall> abandonedCalls = new ConcurrentHashMap<>();
    private final Object submitLock = new Object();
    private final Semaphore workerSlots;
    private final ExecutorService workerExecutor;
    private final ExecutorService stageExecutor;
    private ScheduledExecutorService ticker;

    /**
     * 생성자 (기본 RetryPolicy, ReviewReaperConfig, 시스템 시계 사용).
     */
    public StageScheduler(ApplicationStore applicationStore, JobStore jobStore, ResumeStore resumeStore,
                          EventLog eventLog, WorkQueue workQueue, ResourceGovernor governor,
                          SessionPool sessionPool, StageExecutors executors, SchedulerConfig config) {
        this(applicationStore, jobStore, resumeStore, eventLog, workQueue, governor, sessionPool, executors,
            new RetryPolicy(), config, new ReviewReaperConfig(), Clock.systemUTC());
    }

    /**
     * 생성자 (지표는 내부 SimpleMeterRegistry에 기록).
     */
    public StageScheduler(ApplicationStore applicationStore, JobStore jobStore, ResumeStore resumeStore,
                          EventLog eventLog, WorkQueue workQueue, ResourceGovernor governor,
                          SessionPool sessionPool, StageExecutors executors, RetryPolicy retryPolicy,
                          SchedulerConfig config, ReviewReaperConfig reviewReaperConfig, Clock clock) {
        this(applicationStore, jobStore, resumeStore, eventLog, workQueue, governor, sessionPool, executors,
            retryPolicy, config, reviewReaperConfig, clock, new SimpleMeterRegistry());
    }

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StageScheduler(ApplicationStore applicationStore, JobStore jobStore, ResumeStore resumeStore,
                          EventLog eventLog, WorkQueue workQueue, ResourceGovernor governor,
                          SessionPool sessionPool, StageExecutors executors, RetryPolicy retryPolicy,
                          SchedulerConfig config, ReviewReaperConfig reviewReaperConfig, Clock clock,
                          MeterRegistry meterRegistry) {
        if (applicationStore == null) {
            throw new IllegalArgumentException("applicationStore cannot be null");
        }
        if (jobStore == null) {
            throw new IllegalArgumentException("jobStore cannot be null");
        }
        if (resumeStore == null) {
            throw new IllegalArgumentException("resumeStore cannot be null");
        }
        if (eventLog == null) {
            throw new IllegalArgumentException("eventLog cannot be null");
        }
        if (workQueue == null) {
            throw new IllegalArgumentException("workQueue cannot be null");
        }
        if (governor == null) {
            throw new IllegalArgumentException("governor cannot be null");
        }
        if (sessionPool == null) {
            throw new IllegalArgumentException("sessionPool cannot be null");
        }
        if (executors == null) {
            throw new IllegalArgumentException("executors cannot be null");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (reviewReaperConfig == null) {
            throw new IllegalArgumentException("reviewReaperConfig cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (meterRegistry == null) {
            throw new IllegalArgumentException("meterRegistry cannot be null");
        }

        this.applicationStore = applicationStore;
        this.jobStore = jobStore;
        this.resumeStore = resumeStore;
        this.eventLog = eventLog;
        this.workQueue = workQueue;
        this.governor = governor;
        this.sessionPool = sessionPool;
        this.executors = executors;
        this.retryPolicy = retryPolicy;
        this.config = config;
        this.reviewReaperConfig = reviewReaperConfig;
        this.clock = clock;
        this.metrics = new StageMetrics(meterRegistry, clock);
        this.transitions = new TransitionApplier(applicationStore, eventLog, clock);
        this.workerSlots = new Semaphore(config.concurrency());
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency());
        this.stageExecutor = Executors.newFixedThreadPool(config.concurrency() * 2);
    }

    // ============================================================
    // Runtime
    // ============================================================

    @Override
    public void pump() {
        List<ApplicationId> ids = workQueue.dequeue(config.batchSize());

        for (ApplicationId id : ids) {
            if (!workerSlots.tryAcquire()) {
                workQueue.enqueue(id, config.deferDelayMs());
                log.debug("No free worker for {}, deferred {}ms", id, config.deferDelayMs());
                continue;
            }
            if (!inFlight.tryMark(id)) {
                workerSlots.release();
                log.debug("{} is already in flight, skipping", id);
                continue;
            }
            workerExecutor.submit(() -> runGuarded(id));
        }
    }

    /**
     * 주기 실행 시작 (pump, 만료 lease 회수, 검토 만료 스캔).
     *
     * @throws IllegalStateException 이미 시작된 경우
     */
    public synchronized void start() {
        if (ticker != null) {
            throw new IllegalStateException("StageScheduler already started");
        }
        ReviewReaper reviewReaper = new ReviewReaper(applicationStore, this, reviewReaperConfig, clock);
        ticker = Executors.newScheduledThreadPool(1);
        ticker.scheduleWithFixedDelay(() -> runQuietly("pump", this::pump),
            0, config.pollingIntervalMs(), TimeUnit.MILLISECONDS);
        ticker.scheduleWithFixedDelay(() -> runQuietly("lease reclaim", governor::reclaimExpired),
            LEASE_RECLAIM_INTERVAL_MS, LEASE_RECLAIM_INTERVAL_MS, TimeUnit.MILLISECONDS);
        ticker.scheduleWithFixedDelay(() -> runQuietly("review reaper", reviewReaper::scan),
            reviewReaperConfig.scanIntervalMs(), reviewReaperConfig.scanIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("StageScheduler started (concurrency: {}, automation: {})",
            config.concurrency(), config.automationLevel());
    }

    /**
     * Scheduler 종료 (리소스 정리).
     *
     * <p>주기 실행을 멈추고 진행 중인 단계가 끝나기를 기다린 뒤 세션을 모두 닫습니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        synchronized (this) {
            if (ticker != null) {
                ticker.shutdown();
            }
        }
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(60, TimeUnit.SECONDS)) {
            workerExecutor.shutdownNow();
        }
        stageExecutor.shutdown();
        if (!stageExecutor.awaitTermination(60, TimeUnit.SECONDS)) {
            stageExecutor.shutdownNow();
        }
        sessionPool.closeAll();
        log.info("StageScheduler stopped");
    }

    private void runQuietly(String task, Runnable runnable) {
        try {
            runnable.run();
        } catch (RuntimeException e) {
            log.error("Scheduled {} failed", task, e);
        }
    }

    // ============================================================
    // Dispatch
    // ============================================================

    private void runGuarded(ApplicationId id) {
        long followUp = NO_FOLLOW_UP;
        try {
            followUp = dispatch(id);
        } catch (RuntimeException e) {
            log.error("Dispatch of {} failed, re-enqueueing", id, e);
            followUp = config.deferDelayMs();
        } finally {
            inFlight.clear(id);
            workerSlots.release();
        }

        if (followUp == NO_FOLLOW_UP && abandonedCalls.containsKey(id)) {
            followUp = config.deferDelayMs();
        }
        if (honorPendingCancel(id)) {
            return;
        }
        if (followUp != NO_FOLLOW_UP) {
            workQueue.enqueue(id, followUp);
        }
    }

    /**
     * 지원서 하나의 다음 단계 실행. in-flight 마커를 보유한 상태에서만 호출됩니다.
     *
     * @return 후속 enqueue 지연 (없으면 NO_FOLLOW_UP)
     */
    private long dispatch(ApplicationId id) {
        Optional<Application> found = applicationStore.find(id);
        if (found.isEmpty()) {
            log.warn("Dequeued unknown application {}", id);
            return NO_FOLLOW_UP;
        }
        Application application = found.get();

        AbandonedCall late = abandonedCalls.get(id);
        if (late != null) {
            if (!late.future().isDone()) {
                log.debug("{} still has a timed-out {} call running, deferring", id, late.stage());
                return config.deferDelayMs();
            }
            abandonedCalls.remove(id);
            if (settleLateSubmission(application, late)) {
                return NO_FOLLOW_UP;
            }
        }

        if (application.isTerminal()) {
            cancelRequests.remove(id);
            return NO_FOLLOW_UP;
        }
        if (cancelRequests.remove(id)) {
            cancelNow(application);
            return NO_FOLLOW_UP;
        }
        if (!StageDispatchTable.isDispatchable(application.state())) {
            log.debug("{} is waiting in {}", id, application.state());
            return NO_FOLLOW_UP;
        }

        return switch (application.state()) {
            case DISCOVERED -> runAnalysis(application);
            case ANALYZED -> runTailoring(application);
            case TAILORED -> routeTailored(application);
            case SUBMITTING -> runSubmission(application, false);
            default -> NO_FOLLOW_UP;
        };
    }

    private long runAnalysis(Application application) {
        Job job = loadJob(application.jobId());
        if (job.hasRequirements()) {
            transitions.apply(application, LifecycleTrigger.ANALYSIS_SUCCEEDED, EventCause.STAGE_SUCCESS, 0);
            return 0;
        }

        Set<ResourceId> resources = executors.analysis().requiredResources();
        LeaseBundle leases = LeaseBundle.acquire(governor, resources, LeaseHolder.of(application.id(), Stage.ANALYSIS));
        if (!leases.isGranted()) {
            return defer(application, Stage.ANALYSIS, leases.getDenial().retryAfterMs());
        }

        Outcome<Requirements> outcome;
        try {
            outcome = invoke(application.id(), Stage.ANALYSIS, () -> executors.analysis().analyze(job.postingText()));
        } finally {
            leases.release();
        }

        if (outcome instanceof Ok<Requirements> ok) {
            jobStore.attachRequirements(job.id(), ok.value());
            transitions.apply(application, LifecycleTrigger.ANALYSIS_SUCCEEDED, EventCause.STAGE_SUCCESS, 0);
            return 0;
        }
        return handleFailure(application, Stage.ANALYSIS, (Fail<Requirements>) outcome, resources);
    }

    private long runTailoring(Application application) {
        Job job = loadJob(application.jobId());
        if (!job.hasRequirements()) {
            throw new IllegalStateException("Job " + job.id() + " has no requirements for " + application.id());
        }
        Resume base = resumeStore.find(application.baseResumeId())
            .orElseThrow(() -> new IllegalStateException("Base resume missing: " + application.baseResumeId()));

        Set<ResourceId> resources = executors.tailoring().requiredResources();
        LeaseBundle leases = LeaseBundle.acquire(governor, resources, LeaseHolder.of(application.id(), Stage.TAILORING));
        if (!leases.isGranted()) {
            return defer(application, Stage.TAILORING, leases.getDenial().retryAfterMs());
        }

        Outcome<TailoredResume> outcome;
        try {
            outcome = invoke(application.id(), Stage.TAILORING,
                () -> executors.tailoring().tailor(base, job.requirements(), application.mode()));
        } finally {
            leases.release();
        }

        if (outcome instanceof Ok<TailoredResume> ok) {
            ResumeLineage lineage = new ResumeLineage(job.id(), application.id(), application.attemptCount() + 1);
            Resume tailored = base.derive(ResumeId.generate(), application.mode(), ok.value().content(),
                lineage, clock.instant());
            resumeStore.save(tailored);
            transitions.apply(application, LifecycleTrigger.TAILORING_SUCCEEDED, EventCause.STAGE_SUCCESS, 0,
                null, tailored.id(), null);
            return 0;
        }
        return handleFailure(application, Stage.TAILORING, (Fail<TailoredResume>) outcome, resources);
    }

    private long routeTailored(Application application) {
        if (config.automationLevel() == AutomationLevel.ASSISTED) {
            transitions.apply(application, LifecycleTrigger.APPROVAL_REQUIRED, EventCause.STAGE_SUCCESS, 0);
            log.info("{} is waiting for approval", application.id());
            return NO_FOLLOW_UP;
        }
        return runSubmission(application, true);
    }

    /**
     * 제출 단계. authorize가 true면 lease와 세션을 확보한 뒤 TAILORED → SUBMITTING 전이를 먼저 기록합니다.
     */
    private long runSubmission(Application application, boolean authorize) {
        Job job = loadJob(application.jobId());
        Optional<SubmissionExecutor> executor = executors.submissionFor(job.platform());
        if (executor.isEmpty()) {
            return handleMissingSubmitter(application, job);
        }
        SubmissionExecutor submitter = executor.get();
        Resume resume = resumeStore.find(application.resumeId())
            .orElseThrow(() -> new IllegalStateException("Resume missing: " + application.resumeId()));

        Set<ResourceId> resources = submitter.requiredResources();
        LeaseBundle leases = LeaseBundle.acquire(governor, resources, LeaseHolder.of(application.id(), Stage.SUBMISSION));
        if (!leases.isGranted()) {
            return defer(application, Stage.SUBMISSION, leases.getDenial().retryAfterMs());
        }

        Optional<Session> checkedOut;
        try {
            checkedOut = sessionPool.checkout(job.platform(), application.id());
        } catch (RuntimeException e) {
            leases.release();
            throw e;
        }
        if (checkedOut.isEmpty()) {
            leases.release();
            log.debug("No {} session available for {}", job.platform().getName(), application.id());
            return defer(application, Stage.SUBMISSION, 0);
        }
        Session session = checkedOut.get();

        Application submitting = application;
        Outcome<SubmissionReceipt> outcome;
        try {
            if (authorize) {
                submitting = transitions.apply(application, LifecycleTrigger.SUBMISSION_AUTHORIZED,
                    EventCause.STAGE_SUCCESS, 0);
            }
            outcome = invoke(application.id(), Stage.SUBMISSION, () -> submitter.submit(session, resume, job));
        } catch (RuntimeException e) {
            sessionPool.checkin(session, true);
            throw e;
        } finally {
            leases.release();
        }

        AbandonedCall late = abandonedCalls.get(application.id());
        if (late != null) {
            late.future().whenComplete((result, error) -> sessionPool.discard(session));
        } else {
            sessionPool.checkin(session, isSessionHealthy(outcome));
        }

        if (outcome instanceof Ok<SubmissionReceipt> ok) {
            recordSubmission(submitting, ok.value());
            return NO_FOLLOW_UP;
        }
        return handleFailure(submitting, Stage.SUBMISSION, (Fail<SubmissionReceipt>) outcome, resources);
    }

    private void recordSubmission(Application application, SubmissionReceipt receipt) {
        if (cancelRequests.remove(application.id())) {
            log.info("Submission of {} completed before cancellation took effect", application.id());
        }
        if (receipt.isConfirmed()) {
            transitions.apply(application, LifecycleTrigger.PLATFORM_CONFIRMED, EventCause.STAGE_SUCCESS, 0,
                null, null, receipt.confirmationToken());
            log.info("{} confirmed by platform ({})", application.id(), receipt.confirmationToken());
        } else {
            transitions.apply(application, LifecycleTrigger.PLATFORM_ACCEPTED, EventCause.STAGE_SUCCESS, 0);
            log.info("{} accepted by platform, awaiting confirmation", application.id());
        }
    }

    /**
     * deadline 이후에 끝난 제출 호출의 결과 반영.
     *
     * <p>플랫폼이 늦게라도 접수했다면 재제출하지 않고 그 결과를 기록합니다.</p>
     *
     * @return 늦은 접수를 기록했으면 true
     */
    private boolean settleLateSubmission(Application application, AbandonedCall late) {
        if (late.stage() != Stage.SUBMISSION || late.future().isCompletedExceptionally()) {
            return false;
        }
        Outcome<?> outcome = late.future().join();
        if (!(outcome instanceof Ok<?> ok) || !(ok.value() instanceof SubmissionReceipt receipt)) {
            return false;
        }
        if (application.state() != ApplicationState.SUBMITTING) {
            log.warn("Late submission receipt for {} ignored in state {}", application.id(), application.state());
            return false;
        }
        log.info("Timed-out submission of {} was accepted by the platform", application.id());
        recordSubmission(application, receipt);
        return true;
    }

    private long handleMissingSubmitter(Application application, Job job) {
        if (application.state() == ApplicationState.TAILORED) {
            log.warn("No submission executor for {}, routing {} to review", job.platform().getName(), application.id());
            transitions.apply(application, LifecycleTrigger.APPROVAL_REQUIRED, EventCause.STAGE_SUCCESS, 0);
            return NO_FOLLOW_UP;
        }
        FailureRecord failure = new FailureRecord(FailureKind.PLATFORM_REJECTED_INPUT,
            "No submission executor for platform " + job.platform().getName());
        transitions.apply(application, LifecycleTrigger.STAGE_FAILED, EventCause.STAGE_FAILURE,
            application.attemptCount() + 1, failure, null, null);
        log.warn("{} failed: {}", application.id(), failure.reason());
        return NO_FOLLOW_UP;
    }

    private static boolean isSessionHealthy(Outcome<SubmissionReceipt> outcome) {
        if (outcome instanceof Fail<SubmissionReceipt> fail) {
            return fail.category() == FailureCategory.PERMANENT_DATA;
        }
        return true;
    }

    /**
     * 단계 실패 처리: 취소 요청 → CANCELLED, 재시도 가능 → STAGE_RETRY, 정책 위반 → NEEDS_REVIEW, 그 외 → FAILED.
     *
     * @return 후속 enqueue 지연
     */
    private long handleFailure(Application application, Stage stage, Fail<?> fail, Set<ResourceId> resources) {
        ApplicationId id = application.id();
        int attempt = application.attemptCount() + 1;
        FailureRecord failure = new FailureRecord(fail.kind(), fail.message());

        if (cancelRequests.remove(id)) {
            transitions.apply(application, LifecycleTrigger.CANCEL_REQUESTED, EventCause.MANUAL_OVERRIDE,
                application.attemptCount(), failure, null, null);
            log.info("{} cancelled after failed {} attempt: {}", id, stage, fail.kind().code());
            return NO_FOLLOW_UP;
        }

        long refillDelayMs = fail.kind() == FailureKind.RATE_LIMITED ? maxRefillDelay(resources) : 0;
        RetryDecision decision = retryPolicy.decide(fail.kind(), attempt, config.maxAttempts(), refillDelayMs);

        if (decision.isRetry()) {
            transitions.apply(application, LifecycleTrigger.STAGE_RETRY, EventCause.STAGE_FAILURE, attempt,
                failure, null, null);
            log.info("Retry scheduled for {} {} after {}ms (attempt {}/{}): {}",
                id, stage, decision.delayMs(), attempt, config.maxAttempts(), fail.kind().code());
            return decision.delayMs();
        }

        String giveUpReason = ((RetryDecision.GiveUp) decision).reason();
        if (fail.category() == FailureCategory.PERMANENT_POLICY
            && StateTransition.isAllowed(application.state(), LifecycleTrigger.POLICY_VIOLATION)) {
            transitions.apply(application, LifecycleTrigger.POLICY_VIOLATION, EventCause.STAGE_FAILURE, attempt,
                failure, null, null);
            log.warn("{} flagged for review at {}: {}", id, stage, giveUpReason);
            return NO_FOLLOW_UP;
        }

        transitions.apply(application, LifecycleTrigger.STAGE_FAILED, EventCause.STAGE_FAILURE, attempt,
            failure, null, null);
        log.warn("{} failed at {}: {} - {}", id, stage, giveUpReason, fail.message());
        return NO_FOLLOW_UP;
    }

    private long maxRefillDelay(Set<ResourceId> resources) {
        long delay = 0;
        for (ResourceId resource : resources) {
            delay = Math.max(delay, governor.timeUntilRefill(resource));
        }
        return delay;
    }

    private long defer(Application application, Stage stage, long retryAfterMs) {
        long delay = Math.max(config.deferDelayMs(), retryAfterMs);
        log.debug("Deferring {} {} for {}ms", application.id(), stage, delay);
        return delay;
    }

    /**
     * 단계 호출 (deadline 적용, 지표 기록).
     *
     * <p>deadline을 넘기면 TIMEOUT 실패를 반환합니다.
     * Executor가 던진 예외는 TRANSIENT_NETWORK 실패로 변환합니다.</p>
     */
    private <T> Outcome<T> invoke(ApplicationId id, Stage stage, Supplier<Outcome<T>> call) {
        Timer.Sample sample = metrics.start(stage);
        Outcome<T> outcome = awaitWithDeadline(id, stage, call);
        metrics.record(stage, sample, outcome);
        return outcome;
    }

    private <T> Outcome<T> awaitWithDeadline(ApplicationId id, Stage stage, Supplier<Outcome<T>> call) {
        AtomicBoolean abandoned = new AtomicBoolean(false);
        CompletableFuture<Outcome<T>> raw = CompletableFuture.supplyAsync(call, stageExecutor);
        raw.whenComplete((result, error) -> {
            if (abandoned.get()) {
                log.warn("Late {} result for {} arrived after the deadline: {}",
                    stage, id, error != null ? error.toString() : result);
            }
        });

        Outcome<T> outcome;
        try {
            outcome = raw.copy().orTimeout(config.stageTimeoutMs(), TimeUnit.MILLISECONDS).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TimeoutException) {
                abandoned.set(true);
                abandonedCalls.put(id, new AbandonedCall(stage, raw));
                log.warn("{} of {} exceeded {}ms deadline", stage, id, config.stageTimeoutMs());
                return Outcome.fail(FailureKind.TIMEOUT,
                    stage + " exceeded " + config.stageTimeoutMs() + "ms deadline");
            }
            log.error("{} executor threw for {}", stage, id, cause);
            return Outcome.fail(FailureKind.TRANSIENT_NETWORK,
                stage + " executor error: " + cause, cause.getClass().getName());
        }

        if (outcome == null) {
            log.error("{} executor returned no outcome for {}", stage, id);
            return Outcome.fail(FailureKind.TRANSIENT_NETWORK, stage + " executor returned no outcome");
        }
        return outcome;
    }

    // ============================================================
    // Cancellation
    // ============================================================

    /**
     * 마커가 풀린 뒤 대기 중인 취소를 반영.
     *
     * @return 취소를 반영했으면 true
     */
    private boolean honorPendingCancel(ApplicationId id) {
        if (!cancelRequests.contains(id) || abandonedCalls.containsKey(id) || !inFlight.tryMark(id)) {
            return false;
        }
        try {
            if (!cancelRequests.remove(id)) {
                return false;
            }
            Optional<Application> current = applicationStore.find(id);
            if (current.isEmpty() || current.get().isTerminal()) {
                return false;
            }
            cancelNow(current.get());
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to apply pending cancellation of {}", id, e);
            return false;
        } finally {
            inFlight.clear(id);
        }
    }

    private Application cancelNow(Application application) {
        Application cancelled = transitions.apply(application, LifecycleTrigger.CANCEL_REQUESTED,
            EventCause.MANUAL_OVERRIDE, application.attemptCount());
        log.info("{} cancelled from {}", application.id(), application.state());
        return cancelled;
    }

    /**
     * NEEDS_REVIEW에 너무 오래 머문 지원서 자동 취소 (ReviewReaper 전용).
     *
     * @return 취소했으면 true, 다른 작업 중이거나 이미 해결된 경우 false
     */
    boolean expireReview(ApplicationId id, Duration waited) {
        if (!inFlight.tryMark(id)) {
            return false;
        }
        try {
            Optional<Application> current = applicationStore.find(id);
            if (current.isEmpty() || current.get().state() != ApplicationState.NEEDS_REVIEW) {
                return false;
            }
            Application application = current.get();
            transitions.apply(application, LifecycleTrigger.CANCEL_REQUESTED, EventCause.TIMEOUT,
                application.attemptCount());
            log.info("{} cancelled after waiting {} for review", id, waited);
            return true;
        } finally {
            inFlight.clear(id);
        }
    }

    // ============================================================
    // ApplicationOrchestrator
    // ============================================================

    @Override
    public Application submitJob(JobSubmission submission) {
        if (submission == null) {
            throw new IllegalArgumentException("submission cannot be null");
        }
        JobPosting posting = submission.posting();
        if (executors.submissionFor(posting.platform()).isEmpty()) {
            throw new IllegalArgumentException("No submission executor registered for " + posting.platform().getName());
        }
        Resume base = resumeStore.find(submission.baseResumeId())
            .orElseThrow(() -> new IllegalArgumentException("Resume not found: " + submission.baseResumeId()));
        if (!base.candidateId().equals(submission.candidateId())) {
            throw new IllegalArgumentException(
                "Resume " + base.id() + " does not belong to " + submission.candidateId());
        }

        Job job = jobStore.saveIfAbsent(Job.discovered(JobId.generate(), posting, clock.instant()));

        Application created;
        synchronized (submitLock) {
            Optional<Application> latest = applicationStore.findLatest(job.id(), submission.candidateId());
            if (latest.isPresent() && latest.get().blocksResubmission()) {
                log.debug("Reusing {} for job {}", latest.get().id(), job.id());
                return latest.get();
            }
            created = Application.create(ApplicationId.generate(), job.id(), submission.candidateId(),
                base.id(), submission.mode(), clock.instant());
            applicationStore.insert(created);
        }

        workQueue.enqueue(created.id(), 0);
        log.info("Created {} for {} at {} ({})", created.id(), job.id(), job.company(), job.platform().getName());
        return created;
    }

    @Override
    public ApplicationStatus getStatus(ApplicationId id) {
        Application application = load(id);
        return new ApplicationStatus(application, eventLog.history(id));
    }

    @Override
    public Application approve(ApplicationId id) {
        Application approved = withMarker(id, application ->
            transitions.apply(application, LifecycleTrigger.APPROVED, EventCause.MANUAL_OVERRIDE, 0));
        workQueue.enqueue(id, 0);
        log.info("{} approved for submission", id);
        return approved;
    }

    @Override
    public Application reject(ApplicationId id) {
        Application rejected = withMarker(id, application ->
            transitions.apply(application, LifecycleTrigger.REJECTED, EventCause.MANUAL_OVERRIDE,
                application.attemptCount()));
        log.info("{} rejected by reviewer", id);
        return rejected;
    }

    @Override
    public Application cancel(ApplicationId id) {
        Application application = load(id);
        if (application.isTerminal()) {
            return application;
        }

        cancelRequests.add(id);
        if (abandonedCalls.containsKey(id) || !inFlight.tryMark(id)) {
            log.info("Cancellation of {} requested while in flight", id);
            return application;
        }
        try {
            if (!cancelRequests.remove(id)) {
                return load(id);
            }
            Application current = load(id);
            if (current.isTerminal()) {
                return current;
            }
            return cancelNow(current);
        } finally {
            inFlight.clear(id);
        }
    }

    @Override
    public Application confirm(ApplicationId id, String confirmationToken) {
        if (confirmationToken == null || confirmationToken.isBlank()) {
            throw new IllegalArgumentException("confirmationToken cannot be null or blank");
        }
        Application confirmed = withMarker(id, application ->
            transitions.apply(application, LifecycleTrigger.PLATFORM_CONFIRMED, EventCause.MANUAL_OVERRIDE, 0,
                null, null, confirmationToken));
        log.info("{} confirmed externally ({})", id, confirmationToken);
        return confirmed;
    }

    @Override
    public Application reportPlatformFailure(ApplicationId id, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        Application failed = withMarker(id, application ->
            transitions.apply(application, LifecycleTrigger.STAGE_FAILED, EventCause.MANUAL_OVERRIDE,
                application.attemptCount(), new FailureRecord(FailureKind.PLATFORM_REJECTED_INPUT, reason),
                null, null));
        log.warn("{} rejected by platform after submission: {}", id, reason);
        return failed;
    }

    @Override
    public CompletableFuture<Outcome<List<Application>>> discover(DiscoveryRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        DiscoveryExecutor discovery = executors.discoveryExecutor()
            .orElseThrow(() -> new IllegalStateException("No discovery executor registered"));

        LeaseBundle leases = LeaseBundle.acquire(governor, discovery.requiredResources(), LeaseHolder.discovery());
        if (!leases.isGranted()) {
            return CompletableFuture.completedFuture(Outcome.fail(FailureKind.RATE_LIMITED,
                "Discovery resources unavailable: " + leases.getDenial().reason()));
        }

        Timer.Sample sample = metrics.start(Stage.DISCOVERY);
        return CompletableFuture.supplyAsync(() -> discovery.discover(request.query()), stageExecutor)
            .orTimeout(config.stageTimeoutMs(), TimeUnit.MILLISECONDS)
            .<Outcome<List<Application>>>handle((outcome, error) -> {
                leases.release();
                if (error != null) {
                    Outcome<List<Application>> failed = discoveryFailure(error);
                    metrics.record(Stage.DISCOVERY, sample, failed);
                    return failed;
                }
                metrics.record(Stage.DISCOVERY, sample, outcome);
                if (outcome instanceof Ok<List<JobPosting>> ok) {
                    return Outcome.ok(submitDiscovered(request, ok.value()));
                }
                Fail<List<JobPosting>> fail = (Fail<List<JobPosting>>) outcome;
                log.warn("Discovery failed: {} - {}", fail.kind().code(), fail.message());
                return Outcome.fail(fail.kind(), fail.message(), fail.cause());
            });
    }

    private List<Application> submitDiscovered(DiscoveryRequest request, List<JobPosting> postings) {
        List<Application> applications = new ArrayList<>();
        int skipped = 0;
        for (JobPosting posting : postings) {
            if (executors.submissionFor(posting.platform()).isEmpty()) {
                log.warn("Skipping discovered posting on unsupported platform {}: {}",
                    posting.platform().getName(), posting.sourceUrl());
                skipped++;
                continue;
            }
            applications.add(submitJob(new JobSubmission(posting, request.candidateId(),
                request.baseResumeId(), request.mode())));
        }
        log.info("Discovery completed: {} applications from {} postings ({} skipped)",
            applications.size(), postings.size(), skipped);
        return List.copyOf(applications);
    }

    private static Outcome<List<Application>> discoveryFailure(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            log.warn("Discovery exceeded its deadline");
            return Outcome.fail(FailureKind.TIMEOUT, "Discovery exceeded deadline");
        }
        log.error("Discovery failed unexpectedly", cause);
        return Outcome.fail(FailureKind.TRANSIENT_NETWORK, "Discovery error: " + cause, cause.getClass().getName());
    }

    @Override
    public Subscription subscribe(EventListener listener) {
        return eventLog.subscribe(listener);
    }

    @Override
    public List<LifecycleEvent> eventsSince(long afterSequence, int limit) {
        return eventLog.readFrom(afterSequence, limit);
    }

    // ============================================================
    // Helpers
    // ============================================================

    private Application withMarker(ApplicationId id, Function<Application, Application> action) {
        load(id);
        if (!inFlight.tryMark(id)) {
            throw new ApplicationBusyException(id);
        }
        try {
            return action.apply(load(id));
        } finally {
            inFlight.clear(id);
        }
    }

    private Application load(ApplicationId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return applicationStore.find(id).orElseThrow(() -> new ApplicationNotFoundException(id));
    }

    private Job loadJob(JobId jobId) {
        return jobStore.find(jobId)
            .orElseThrow(() -> new IllegalStateException("Job missing: " + jobId));
    }

    /**
     * 단계별 실행 통계 스냅샷.
     */
    public StageStats stageStats(Stage stage) {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        return metrics.snapshot(stage);
    }

    /**
     * dispatch 중이거나, deadline을 넘긴 호출이 아직 결과를 반영하지 않은 경우 true.
     */
    public boolean isInFlight(ApplicationId id) {
        return inFlight.isInFlight(id) || abandonedCalls.containsKey(id);
    }

    public boolean isCancelRequested(ApplicationId id) {
        return cancelRequests.contains(id);
    }

    /**
     * deadline을 넘겼지만 stage pool에서 아직 실행 중이거나 결과가 반영되지 않은 호출.
     */
    private record AbandonedCall(Stage stage, CompletableFuture<? extends Outcome<?>> future) {
    }
}
