package com.ryuqq.autoapply.core.governor.noop;

import com.ryuqq.autoapply.core.governor.AcquireResult;
import com.ryuqq.autoapply.core.governor.Lease;
import com.ryuqq.autoapply.core.governor.LeaseHolder;
import com.ryuqq.autoapply.core.governor.ResourceGovernor;
import com.ryuqq.autoapply.core.model.ResourceId;

import java.time.Instant;
import java.util.UUID;

/**
 * Resource Governor NoOp 구현.
 *
 * <p>모든 요청을 항상 허용합니다.
 * 개발 및 테스트 환경에서 사용하거나, 예산 제한 없이 실행하고자 할 때 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>acquire(): 항상 Granted (만료 없음)</li>
 *   <li>release(): 항상 true</li>
 *   <li>outstanding(), timeUntilRefill(), reclaimExpired(): 항상 0</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoOpResourceGovernor implements ResourceGovernor {

    @Override
    public AcquireResult acquire(ResourceId resource, LeaseHolder holder) {
        return new AcquireResult.Granted(
            new Lease(UUID.randomUUID().toString(), resource, holder, Instant.EPOCH, Instant.MAX)
        );
    }

    @Override
    public boolean release(Lease lease) {
        return true;
    }

    @Override
    public int outstanding(ResourceId resource) {
        return 0;
    }

    @Override
    public long timeUntilRefill(ResourceId resource) {
        return 0;
    }

    @Override
    public int reclaimExpired() {
        return 0;
    }
}
