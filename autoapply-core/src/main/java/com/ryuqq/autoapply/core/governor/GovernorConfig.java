package com.ryuqq.autoapply.core.governor;

import com.ryuqq.autoapply.core.model.Platform;
import com.ryuqq.autoapply.core.model.ResourceId;

import java.util.HashMap;
import java.util.Map;

/**
 * Governor 설정 (불변 record).
 *
 * <p><strong>기본 정책:</strong></p>
 * <ul>
 *   <li>platform:linkedin - 하루 20건, 동시 1개</li>
 *   <li>platform:indeed - 하루 50건, 동시 1개</li>
 *   <li>llm:openai - 분당 60회, 동시 5개</li>
 *   <li>llm:anthropic - 분당 50회, 동시 5개</li>
 *   <li>그 외 자원 - {@link ResourcePolicy#ResourcePolicy()}</li>
 * </ul>
 *
 * @param policies 자원별 정책
 * @param defaultPolicy 정책이 없는 자원에 적용할 정책
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record GovernorConfig(
    Map<ResourceId, ResourcePolicy> policies,
    ResourcePolicy defaultPolicy
) {

    private static final long DAY_MS = 86_400_000L;
    private static final long MINUTE_MS = 60_000L;

    public GovernorConfig() {
        this(defaultPolicies(), new ResourcePolicy());
    }

    public GovernorConfig {
        if (policies == null) {
            throw new IllegalArgumentException("policies cannot be null");
        }
        if (defaultPolicy == null) {
            throw new IllegalArgumentException("defaultPolicy cannot be null");
        }
        policies = Map.copyOf(policies);
    }

    public ResourcePolicy policyFor(ResourceId resource) {
        return policies.getOrDefault(resource, defaultPolicy);
    }

    /**
     * 자원 하나의 정책만 추가하거나 교체한 새 인스턴스 생성.
     */
    public GovernorConfig withPolicy(ResourceId resource, ResourcePolicy policy) {
        if (resource == null || policy == null) {
            throw new IllegalArgumentException("resource and policy cannot be null");
        }
        Map<ResourceId, ResourcePolicy> updated = new HashMap<>(policies);
        updated.put(resource, policy);
        return new GovernorConfig(updated, defaultPolicy);
    }

    public GovernorConfig withDefaultPolicy(ResourcePolicy defaultPolicy) {
        return new GovernorConfig(policies, defaultPolicy);
    }

    private static Map<ResourceId, ResourcePolicy> defaultPolicies() {
        Map<ResourceId, ResourcePolicy> defaults = new HashMap<>();
        defaults.put(ResourceId.platform(Platform.LINKEDIN), new ResourcePolicy(20, DAY_MS, 1, 600_000L));
        defaults.put(ResourceId.platform(Platform.INDEED), new ResourcePolicy(50, DAY_MS, 1, 600_000L));
        defaults.put(ResourceId.llm("openai"), new ResourcePolicy(60, MINUTE_MS, 5, 120_000L));
        defaults.put(ResourceId.llm("anthropic"), new ResourcePolicy(50, MINUTE_MS, 5, 120_000L));
        return defaults;
    }
}
