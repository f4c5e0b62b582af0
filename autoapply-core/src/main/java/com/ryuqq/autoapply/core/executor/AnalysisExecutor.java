package com.ryuqq.autoapply.core.executor;

import com.ryuqq.autoapply.core.model.Requirements;
import com.ryuqq.autoapply.core.outcome.Outcome;

/**
 * Extracts structured requirements from a raw posting.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface AnalysisExecutor extends StageExecutor {

    @Override
    default Stage stage() {
        return Stage.ANALYSIS;
    }

    Outcome<Requirements> analyze(String postingText);
}
