package com.ryuqq.autoapply.adapter.runner.session;

import com.ryuqq.autoapply.core.executor.Session;
import com.ryuqq.autoapply.core.executor.SessionProvider;
import com.ryuqq.autoapply.core.model.ApplicationId;
import com.ryuqq.autoapply.core.model.Platform;
import com.ryuqq.autoapply.core.outcome.Fail;
import com.ryuqq.autoapply.core.outcome.Ok;
import com.ryuqq.autoapply.core.outcome.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 플랫폼별 브라우저 세션 풀.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>플랫폼당 열린 세션은 maxSessionsPerPlatform을 넘지 않음</li>
 *   <li>checkout은 대기하지 않음: 여유가 없으면 empty, 호출자가 작업을 연기</li>
 *   <li>같은 지원서가 마지막으로 사용한 유휴 세션을 우선 배정 (affinity)</li>
 *   <li>연속 오류가 maxConsecutiveErrors에 도달한 세션은 닫고 폐기</li>
 *   <li>checkout된 세션은 정확히 하나의 지원서에 배정됨</li>
 * </ul>
 *
 * <p>세션 열기/닫기는 느릴 수 있으므로 풀 잠금 밖에서 수행합니다.
 * 열기 전에 슬롯을 예약하여 상한을 지킵니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SessionPool {

    private static final Logger log = LoggerFactory.getLogger(SessionPool.class);

    private final SessionProvider provider;
    private final SessionPoolConfig config;
    private final Map<Platform, PlatformSlots> slots = new HashMap<>();
    private final Map<String, PooledSession> checkedOut = new HashMap<>();

    /**
     * 생성자.
     *
     * @param provider 세션 생성/종료 제공자
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SessionPool(SessionProvider provider, SessionPoolConfig config) {
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.provider = provider;
        this.config = config;
    }

    /**
     * 세션 배정 (비블로킹).
     *
     * @param platform 플랫폼
     * @param holder 세션을 사용할 지원서
     * @return 배정된 세션, 여유가 없거나 열기에 실패하면 empty
     */
    public Optional<Session> checkout(Platform platform, ApplicationId holder) {
        if (platform == null || holder == null) {
            throw new IllegalArgumentException("platform and holder cannot be null");
        }

        synchronized (this) {
            PlatformSlots platformSlots = slots.computeIfAbsent(platform, p -> new PlatformSlots());
            PooledSession idle = platformSlots.takeIdle(holder);
            if (idle != null) {
                idle.holder = holder;
                checkedOut.put(idle.session.id(), idle);
                return Optional.of(idle.session);
            }
            if (platformSlots.open >= config.maxSessionsPerPlatform()) {
                return Optional.empty();
            }
            platformSlots.open++;
        }

        Outcome<Session> opened;
        try {
            opened = provider.open(platform);
        } catch (RuntimeException e) {
            releaseSlot(platform);
            log.error("Session provider threw while opening a session on {}", platform.getName(), e);
            return Optional.empty();
        }
        if (opened instanceof Ok<Session> ok) {
            PooledSession pooled = new PooledSession(ok.value());
            pooled.holder = holder;
            synchronized (this) {
                checkedOut.put(pooled.session.id(), pooled);
            }
            log.info("Opened session {} on {} for {}", pooled.session.id(), platform.getName(), holder);
            return Optional.of(pooled.session);
        }

        releaseSlot(platform);
        Fail<Session> fail = (Fail<Session>) opened;
        log.warn("Failed to open session on {}: {} - {}", platform.getName(), fail.kind().code(), fail.message());
        return Optional.empty();
    }

    /**
     * 세션 반납.
     *
     * @param session 반납할 세션
     * @param healthy 이번 사용이 정상이었는지 (false면 연속 오류 +1)
     */
    public void checkin(Session session, boolean healthy) {
        if (session == null) {
            throw new IllegalArgumentException("session cannot be null");
        }
        PooledSession toClose = null;
        synchronized (this) {
            PooledSession pooled = checkedOut.remove(session.id());
            if (pooled == null) {
                log.warn("Ignoring checkin of unknown session {}", session.id());
                return;
            }
            pooled.consecutiveErrors = healthy ? 0 : pooled.consecutiveErrors + 1;
            PlatformSlots platformSlots = slots.get(session.platform());
            if (pooled.consecutiveErrors >= config.maxConsecutiveErrors()) {
                platformSlots.open--;
                toClose = pooled;
            } else {
                platformSlots.idle.add(pooled);
            }
        }
        if (toClose != null) {
            log.warn("Discarding session {} on {} after {} consecutive errors",
                session.id(), session.platform().getName(), toClose.consecutiveErrors);
            closeQuietly(toClose.session);
        }
    }

    /**
     * 세션을 즉시 폐기 (타임아웃 등으로 상태를 신뢰할 수 없는 경우).
     */
    public void discard(Session session) {
        if (session == null) {
            throw new IllegalArgumentException("session cannot be null");
        }
        synchronized (this) {
            if (checkedOut.remove(session.id()) == null) {
                return;
            }
            slots.get(session.platform()).open--;
        }
        log.warn("Discarding session {} on {}", session.id(), session.platform().getName());
        closeQuietly(session);
    }

    /**
     * 모든 세션 종료 (shutdown 시).
     */
    public void closeAll() {
        List<Session> sessions = new ArrayList<>();
        synchronized (this) {
            for (PlatformSlots platformSlots : slots.values()) {
                for (PooledSession pooled : platformSlots.idle) {
                    sessions.add(pooled.session);
                }
            }
            for (PooledSession pooled : checkedOut.values()) {
                sessions.add(pooled.session);
            }
            slots.clear();
            checkedOut.clear();
        }
        for (Session session : sessions) {
            closeQuietly(session);
        }
        log.info("Session pool closed: {} sessions", sessions.size());
    }

    private synchronized void releaseSlot(Platform platform) {
        PlatformSlots platformSlots = slots.get(platform);
        if (platformSlots != null && platformSlots.open > 0) {
            platformSlots.open--;
        }
    }

    public synchronized int openSessions(Platform platform) {
        PlatformSlots platformSlots = slots.get(platform);
        return platformSlots == null ? 0 : platformSlots.open;
    }

    public synchronized int idleSessions(Platform platform) {
        PlatformSlots platformSlots = slots.get(platform);
        return platformSlots == null ? 0 : platformSlots.idle.size();
    }

    /**
     * 세션을 현재 사용 중인 지원서.
     */
    public synchronized Optional<ApplicationId> holderOf(Session session) {
        PooledSession pooled = checkedOut.get(session.id());
        return pooled == null ? Optional.empty() : Optional.of(pooled.holder);
    }

    private void closeQuietly(Session session) {
        try {
            provider.close(session);
        } catch (RuntimeException e) {
            log.warn("Failed to close session {} on {}", session.id(), session.platform().getName(), e);
        }
    }

    private static final class PlatformSlots {
        private final List<PooledSession> idle = new ArrayList<>();
        private int open;

        PooledSession takeIdle(ApplicationId holder) {
            Iterator<PooledSession> iterator = idle.iterator();
            while (iterator.hasNext()) {
                PooledSession pooled = iterator.next();
                if (holder.equals(pooled.holder)) {
                    iterator.remove();
                    return pooled;
                }
            }
            return idle.isEmpty() ? null : idle.remove(0);
        }
    }

    private static final class PooledSession {
        private final Session session;
        private int consecutiveErrors;
        private ApplicationId holder;

        PooledSession(Session session) {
            this.session = session;
        }
    }
}
