package com.ryuqq.autoapply.adapter.runner;

import com.ryuqq.autoapply.core.governor.AcquireResult;
import com.ryuqq.autoapply.core.governor.Lease;
import com.ryuqq.autoapply.core.governor.LeaseHolder;
import com.ryuqq.autoapply.core.governor.ResourceGovernor;
import com.ryuqq.autoapply.core.model.ResourceId;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 한 번의 단계 실행에 필요한 lease 묶음 (all-or-nothing).
 *
 * <p>자원은 ResourceId 순서로 획득합니다. 하나라도 거절되면 이미 받은 lease를 모두 반납하고
 * 거절 정보를 담은 묶음을 반환합니다. 부분 보유 상태로 대기하지 않으므로 교착이 생기지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LeaseBundle {

    private final ResourceGovernor governor;
    private final List<Lease> leases;
    private final Set<ResourceId> resources;
    private final AcquireResult.Denied denial;

    private LeaseBundle(ResourceGovernor governor, List<Lease> leases, Set<ResourceId> resources, AcquireResult.Denied denial) {
        this.governor = governor;
        this.leases = leases;
        this.resources = resources;
        this.denial = denial;
    }

    /**
     * 모든 자원 획득 시도.
     *
     * @param governor governor
     * @param resources 필요한 자원
     * @param holder 보유자
     * @return 전부 획득했거나, 아무것도 보유하지 않은 거절 묶음
     */
    public static LeaseBundle acquire(ResourceGovernor governor, Set<ResourceId> resources, LeaseHolder holder) {
        if (governor == null || resources == null || holder == null) {
            throw new IllegalArgumentException("governor, resources and holder cannot be null");
        }
        Set<ResourceId> ordered = new TreeSet<>(resources);
        List<Lease> granted = new ArrayList<>();
        for (ResourceId resource : ordered) {
            AcquireResult result = governor.acquire(resource, holder);
            if (result instanceof AcquireResult.Denied denied) {
                for (Lease lease : granted) {
                    governor.release(lease);
                }
                return new LeaseBundle(governor, List.of(), ordered, denied);
            }
            granted.add(((AcquireResult.Granted) result).lease());
        }
        return new LeaseBundle(governor, List.copyOf(granted), ordered, null);
    }

    public boolean isGranted() {
        return denial == null;
    }

    public AcquireResult.Denied getDenial() {
        return denial;
    }

    public List<Lease> getLeases() {
        return leases;
    }

    public Set<ResourceId> getResources() {
        return resources;
    }

    /**
     * 보유 중인 lease 반납. 여러 번 호출해도 안전합니다.
     */
    public void release() {
        for (Lease lease : leases) {
            governor.release(lease);
        }
    }
}
