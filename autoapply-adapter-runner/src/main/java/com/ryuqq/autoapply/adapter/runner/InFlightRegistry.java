package com.ryuqq.autoapply.adapter.runner;

import com.ryuqq.autoapply.core.model.ApplicationId;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 지원서별 in-flight 마커.
 *
 * <p>마커를 가진 쪽만 지원서 상태를 바꿀 수 있습니다. 단계 실행, 승인/거절, 즉시 취소,
 * 검토 만료 처리가 모두 이 마커로 직렬화됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InFlightRegistry {

    private final Set<ApplicationId> inFlight = ConcurrentHashMap.newKeySet();

    /**
     * 마커 획득 시도.
     *
     * @return 획득했으면 true, 이미 다른 쪽이 보유 중이면 false
     */
    public boolean tryMark(ApplicationId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return inFlight.add(id);
    }

    public void clear(ApplicationId id) {
        inFlight.remove(id);
    }

    public boolean isInFlight(ApplicationId id) {
        return inFlight.contains(id);
    }

    public int size() {
        return inFlight.size();
    }
}
