package com.ryuqq.autoapply.adapter.runner;

import com.ryuqq.autoapply.core.event.ApplicationProjector;
import com.ryuqq.autoapply.core.model.Application;
import com.ryuqq.autoapply.core.model.ApplicationId;
import com.ryuqq.autoapply.core.spi.ApplicationStore;
import com.ryuqq.autoapply.core.spi.EventLog;
import com.ryuqq.autoapply.core.spi.WorkQueue;
import com.ryuqq.autoapply.core.statemachine.ApplicationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 재시작 복구 컴포넌트.
 *
 * <p>이벤트는 projection보다 먼저 기록되므로, 프로세스가 그 사이에 중단되면 저장된 지원서가
 * 이벤트 이력보다 뒤처질 수 있습니다. Recovery는 이력을 기준으로 projection을 다시 맞추고,
 * 진행 가능한 지원서를 WorkQueue에 다시 넣습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. findByStatesAfter(비종료 상태, cursor, batchSize) → [A1, A2, ...] (id 순 페이지)
 * 2. For each Application:
 *    a. replay(initial, history) → 이력 기준 projection
 *    b. 버전이 다르면 compareAndSet으로 복구
 *    c. 복구된 상태에 다음 단계가 있으면 enqueue(0)
 * 3. 페이지가 batchSize보다 작을 때까지 1-2 반복
 * 4. 복구/재등록 카운트 로깅
 * </pre>
 *
 * <p>lease와 세션은 메모리에만 있으므로 재시작 후 비어 있는 상태로 시작합니다.
 * 여러 번 실행해도 결과는 같습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Recovery {

    private static final Logger log = LoggerFactory.getLogger(Recovery.class);

    private static final Set<ApplicationState> NON_TERMINAL = EnumSet.of(
        ApplicationState.DISCOVERED,
        ApplicationState.ANALYZED,
        ApplicationState.TAILORED,
        ApplicationState.NEEDS_REVIEW,
        ApplicationState.SUBMITTING,
        ApplicationState.SUBMITTED
    );

    private final ApplicationStore applicationStore;
    private final EventLog eventLog;
    private final WorkQueue workQueue;
    private final RecoveryConfig config;

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public Recovery(ApplicationStore applicationStore, EventLog eventLog, WorkQueue workQueue, RecoveryConfig config) {
        if (applicationStore == null) {
            throw new IllegalArgumentException("applicationStore cannot be null");
        }
        if (eventLog == null) {
            throw new IllegalArgumentException("eventLog cannot be null");
        }
        if (workQueue == null) {
            throw new IllegalArgumentException("workQueue cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.applicationStore = applicationStore;
        this.eventLog = eventLog;
        this.workQueue = workQueue;
        this.config = config;
    }

    /**
     * 복구 실행. Scheduler 시작 전에 한 번 호출합니다.
     *
     * @return 다시 enqueue한 지원서 수
     */
    public int recover() {
        log.info("Recovery started");

        int scanned = 0;
        int repaired = 0;
        int requeued = 0;
        ApplicationId cursor = null;
        while (true) {
            List<Application> page = applicationStore.findByStatesAfter(NON_TERMINAL, cursor, config.batchSize());
            for (Application application : page) {
                try {
                    Application current = repair(application);
                    if (current != application) {
                        repaired++;
                    }
                    if (StageDispatchTable.isDispatchable(current.state())) {
                        workQueue.enqueue(current.id(), 0);
                        requeued++;
                    }
                } catch (Exception e) {
                    log.error("Failed to recover {}", application.id(), e);
                }
            }
            scanned += page.size();
            if (page.size() < config.batchSize()) {
                break;
            }
            cursor = page.get(page.size() - 1).id();
        }

        log.info("Recovery completed: {} repaired, {} re-enqueued out of {}", repaired, requeued, scanned);
        return requeued;
    }

    /**
     * 이력 replay 후 projection 복구.
     *
     * @return 복구되었으면 새 projection, 이미 일치하면 입력 그대로
     */
    private Application repair(Application stored) {
        Application replayed = ApplicationProjector.replay(stored.initial(), eventLog.history(stored.id()));
        if (replayed.version() == stored.version()) {
            return stored;
        }
        if (!applicationStore.compareAndSet(replayed, stored.version())) {
            throw new IllegalStateException("Projection of " + stored.id() + " changed during recovery");
        }
        log.warn("Repaired {}: {} (v{}) -> {} (v{})",
            stored.id(), stored.state(), stored.version(), replayed.state(), replayed.version());
        return replayed;
    }
}
