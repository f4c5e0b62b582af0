package com.ryuqq.autoapply.core.executor;

import com.ryuqq.autoapply.core.model.DiscoveryQuery;
import com.ryuqq.autoapply.core.model.JobPosting;
import com.ryuqq.autoapply.core.outcome.Outcome;

import java.util.List;

/**
 * Finds job postings matching a query.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface DiscoveryExecutor extends StageExecutor {

    @Override
    default Stage stage() {
        return Stage.DISCOVERY;
    }

    Outcome<List<JobPosting>> discover(DiscoveryQuery query);
}
