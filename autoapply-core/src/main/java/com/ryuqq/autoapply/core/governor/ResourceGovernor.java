package com.ryuqq.autoapply.core.governor;

import com.ryuqq.autoapply.core.model.ResourceId;

/**
 * Rate/Resource Governor SPI.
 *
 * <p>Arbitrates scarce shared resources: platform submission budgets, LLM API budgets and
 * per-resource concurrency.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: acquire and release may race from any number of workers</li>
 *   <li>Conservation: outstanding leases of a resource never exceed its {@code maxConcurrent}</li>
 *   <li>Non-blocking: {@link #acquire} answers immediately, a denial carries a retry hint</li>
 *   <li>Idempotent release: releasing the same lease twice is a no-op</li>
 *   <li>Expired leases are reclaimed so a crashed holder cannot pin a resource forever</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ResourceGovernor {

    /**
     * Tries to lease one unit of a resource.
     *
     * @param resource the resource
     * @param holder who will hold the lease
     * @return granted lease or a denial with reason and retry hint
     */
    AcquireResult acquire(ResourceId resource, LeaseHolder holder);

    /**
     * Returns a lease. Budget consumed by the lease is not refunded.
     *
     * @param lease lease to return
     * @return true if the lease was outstanding, false if already released or reclaimed
     */
    boolean release(Lease lease);

    /**
     * Number of outstanding leases of a resource.
     */
    int outstanding(ResourceId resource);

    /**
     * Milliseconds until at least one unit of budget is available (0 if available now).
     */
    long timeUntilRefill(ResourceId resource);

    /**
     * Reclaims every expired lease.
     *
     * @return number of reclaimed leases
     */
    int reclaimExpired();
}
