package com.ryuqq.autoapply.adapter.runner;

import com.ryuqq.autoapply.core.model.Application;
import com.ryuqq.autoapply.core.spi.ApplicationStore;
import com.ryuqq.autoapply.core.statemachine.ApplicationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * ReviewReaper 컴포넌트.
 *
 * <p>NEEDS_REVIEW 상태로 너무 오래 방치된 지원서를 자동 취소합니다.</p>
 *
 * <p><strong>처리 시나리오:</strong></p>
 * <pre>
 * 1. 제출 중 automation_detected → NEEDS_REVIEW
 * 2. 검토자가 approve/reject 하지 않음
 * 3. ReviewReaper가 주기적 스캔 (기본 1시간마다)
 * 4. reviewTimeoutMs 초과 NEEDS_REVIEW 지원서 발견 (기본 7일)
 * 5. CANCEL_REQUESTED (cause: TIMEOUT) → CANCELLED
 * </pre>
 *
 * <p>다른 작업이 마커를 보유 중인 지원서는 다음 스캔으로 미룹니다.
 * 한 지원서 처리 실패가 나머지 처리를 막지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ReviewReaper {

    private static final Logger log = LoggerFactory.getLogger(ReviewReaper.class);

    private final ApplicationStore applicationStore;
    private final StageScheduler scheduler;
    private final ReviewReaperConfig config;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ReviewReaper(ApplicationStore applicationStore, StageScheduler scheduler,
                        ReviewReaperConfig config, Clock clock) {
        if (applicationStore == null) {
            throw new IllegalArgumentException("applicationStore cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.applicationStore = applicationStore;
        this.scheduler = scheduler;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 방치된 NEEDS_REVIEW 지원서 스캔 및 취소.
     *
     * @return 취소한 지원서 수
     */
    public int scan() {
        Instant now = clock.instant();
        Instant threshold = now.minusMillis(config.reviewTimeoutMs());
        List<Application> stale = applicationStore.findInStateUpdatedBefore(
            ApplicationState.NEEDS_REVIEW, threshold, config.batchSize());

        int expired = 0;
        for (Application application : stale) {
            if (tryExpire(application, now)) {
                expired++;
            }
        }

        log.info("ReviewReaper scan completed: {} expired out of {} stale", expired, stale.size());
        return expired;
    }

    private boolean tryExpire(Application application, Instant now) {
        try {
            Duration waited = Duration.between(application.updatedAt(), now);
            return scheduler.expireReview(application.id(), waited);
        } catch (Exception e) {
            log.error("Failed to expire review of {}", application.id(), e);
            return false;
        }
    }
}
