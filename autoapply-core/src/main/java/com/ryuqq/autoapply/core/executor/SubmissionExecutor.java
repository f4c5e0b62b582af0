package com.ryuqq.autoapply.core.executor;

import com.ryuqq.autoapply.core.model.Job;
import com.ryuqq.autoapply.core.model.Platform;
import com.ryuqq.autoapply.core.model.ResourceId;
import com.ryuqq.autoapply.core.model.Resume;
import com.ryuqq.autoapply.core.model.SubmissionReceipt;
import com.ryuqq.autoapply.core.outcome.Outcome;

import java.util.Set;

/**
 * Submits an application through a platform-specific browser session.
 *
 * <p>One implementation per platform. Adding a platform means registering a new
 * submission executor; the lifecycle does not change.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SubmissionExecutor extends StageExecutor {

    @Override
    default Stage stage() {
        return Stage.SUBMISSION;
    }

    /**
     * The platform this executor submits to.
     */
    Platform platform();

    /**
     * Submissions always consume the platform budget.
     */
    @Override
    default Set<ResourceId> requiredResources() {
        return Set.of(ResourceId.platform(platform()));
    }

    Outcome<SubmissionReceipt> submit(Session session, Resume resume, Job job);
}
