package com.ryuqq.autoapply.core.executor;

import com.ryuqq.autoapply.core.model.Requirements;
import com.ryuqq.autoapply.core.model.Resume;
import com.ryuqq.autoapply.core.model.TailoredResume;
import com.ryuqq.autoapply.core.model.TailoringMode;
import com.ryuqq.autoapply.core.outcome.Outcome;

/**
 * Produces a tailored resume body for a set of requirements.
 *
 * <p>The executor only returns content; the scheduler derives and stores the new
 * {@link Resume} version so that lineage is always recorded.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface TailoringExecutor extends StageExecutor {

    @Override
    default Stage stage() {
        return Stage.TAILORING;
    }

    Outcome<TailoredResume> tailor(Resume resume, Requirements requirements, TailoringMode mode);
}
