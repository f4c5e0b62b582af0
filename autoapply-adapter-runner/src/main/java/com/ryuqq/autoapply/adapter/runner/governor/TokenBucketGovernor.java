package com.ryuqq.autoapply.adapter.runner.governor;

import com.ryuqq.autoapply.core.governor.AcquireResult;
import com.ryuqq.autoapply.core.governor.DenialReason;
import com.ryuqq.autoapply.core.governor.GovernorConfig;
import com.ryuqq.autoapply.core.governor.Lease;
import com.ryuqq.autoapply.core.governor.LeaseHolder;
import com.ryuqq.autoapply.core.governor.ResourceGovernor;
import com.ryuqq.autoapply.core.governor.ResourcePolicy;
import com.ryuqq.autoapply.core.model.ResourceId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Token bucket 기반 Resource Governor.
 *
 * <p>자원마다 하나의 버킷을 두고, 버킷 단위로 동기화합니다.</p>
 *
 * <p><strong>획득 흐름:</strong></p>
 * <pre>
 * acquire(resource, holder)
 *   ↓
 * 1. 만료된 lease 회수
 * 2. 경과 시간만큼 토큰 보충 (capacity / windowMs 속도, capacity 상한)
 * 3. outstanding ≥ maxConcurrent → Denied(OVER_CONCURRENCY, 0)
 * 4. tokens &lt; 1 → Denied(BUDGET_EXHAUSTED, timeUntilRefill)
 * 5. 토큰 1개 소비 → Granted(lease, ttl=leaseTtlMs)
 * </pre>
 *
 * <p>반납(release)은 동시성 슬롯만 돌려주며 소비한 예산은 환불하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TokenBucketGovernor implements ResourceGovernor {

    private static final Logger log = LoggerFactory.getLogger(TokenBucketGovernor.class);

    private final GovernorConfig config;
    private final Clock clock;
    private final ConcurrentHashMap<ResourceId, Bucket> buckets = new ConcurrentHashMap<>();

    public TokenBucketGovernor(GovernorConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param config 자원별 정책
     * @param clock 시계 (테스트에서 고정 시계 주입)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public TokenBucketGovernor(GovernorConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
    }

    @Override
    public AcquireResult acquire(ResourceId resource, LeaseHolder holder) {
        if (resource == null || holder == null) {
            throw new IllegalArgumentException("resource and holder cannot be null");
        }
        Bucket bucket = bucket(resource);
        Instant now = clock.instant();

        synchronized (bucket) {
            bucket.reclaim(now);
            bucket.refill(now);

            if (bucket.outstanding.size() >= bucket.policy.maxConcurrent()) {
                return new AcquireResult.Denied(DenialReason.OVER_CONCURRENCY, 0);
            }
            if (bucket.tokens < 1.0) {
                return new AcquireResult.Denied(DenialReason.BUDGET_EXHAUSTED, bucket.millisUntilToken());
            }

            bucket.tokens -= 1.0;
            Lease lease = new Lease(
                UUID.randomUUID().toString(),
                resource,
                holder,
                now,
                now.plusMillis(bucket.policy.leaseTtlMs())
            );
            bucket.outstanding.put(lease.leaseId(), lease);
            return new AcquireResult.Granted(lease);
        }
    }

    @Override
    public boolean release(Lease lease) {
        if (lease == null) {
            throw new IllegalArgumentException("lease cannot be null");
        }
        Bucket bucket = buckets.get(lease.resource());
        if (bucket == null) {
            return false;
        }
        synchronized (bucket) {
            return bucket.outstanding.remove(lease.leaseId()) != null;
        }
    }

    @Override
    public int outstanding(ResourceId resource) {
        Bucket bucket = buckets.get(resource);
        if (bucket == null) {
            return 0;
        }
        synchronized (bucket) {
            return bucket.outstanding.size();
        }
    }

    @Override
    public long timeUntilRefill(ResourceId resource) {
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }
        Bucket bucket = bucket(resource);
        synchronized (bucket) {
            bucket.refill(clock.instant());
            return bucket.tokens >= 1.0 ? 0 : bucket.millisUntilToken();
        }
    }

    @Override
    public int reclaimExpired() {
        Instant now = clock.instant();
        int reclaimed = 0;
        for (Bucket bucket : buckets.values()) {
            synchronized (bucket) {
                reclaimed += bucket.reclaim(now);
            }
        }
        return reclaimed;
    }

    /**
     * 현재 남은 토큰 수 (보충 반영). Used for test assertions.
     */
    public double availableTokens(ResourceId resource) {
        Bucket bucket = bucket(resource);
        synchronized (bucket) {
            bucket.refill(clock.instant());
            return bucket.tokens;
        }
    }

    private Bucket bucket(ResourceId resource) {
        return buckets.computeIfAbsent(resource, id -> new Bucket(id, config.policyFor(id), clock.instant()));
    }

    /**
     * 자원 하나의 토큰과 보유 lease. 모든 접근은 인스턴스 모니터로 보호됩니다.
     */
    private static final class Bucket {
        private final ResourceId resource;
        private final ResourcePolicy policy;
        private final Map<String, Lease> outstanding = new HashMap<>();
        private double tokens;
        private Instant lastRefill;

        Bucket(ResourceId resource, ResourcePolicy policy, Instant now) {
            this.resource = resource;
            this.policy = policy;
            this.tokens = policy.capacity();
            this.lastRefill = now;
        }

        void refill(Instant now) {
            long elapsed = now.toEpochMilli() - lastRefill.toEpochMilli();
            if (elapsed <= 0) {
                return;
            }
            tokens = Math.min(policy.capacity(), tokens + elapsed * policy.refillPerMs());
            lastRefill = now;
        }

        long millisUntilToken() {
            double missing = 1.0 - tokens;
            return Math.max(1L, (long) Math.ceil(missing / policy.refillPerMs()));
        }

        int reclaim(Instant now) {
            List<Lease> expired = new ArrayList<>();
            Iterator<Lease> iterator = outstanding.values().iterator();
            while (iterator.hasNext()) {
                Lease lease = iterator.next();
                if (lease.isExpired(now)) {
                    iterator.remove();
                    expired.add(lease);
                }
            }
            for (Lease lease : expired) {
                log.warn("Reclaimed expired lease {} on {} held by {}", lease.leaseId(), resource.getValue(), lease.holder());
            }
            return expired.size();
        }
    }
}
