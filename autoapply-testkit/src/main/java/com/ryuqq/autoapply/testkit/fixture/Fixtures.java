package com.ryuqq.autoapply.testkit.fixture;

import com.ryuqq.autoapply.core.model.Application;
import com.ryuqq.autoapply.core.model.ApplicationId;
import com.ryuqq.autoapply.core.model.CandidateId;
import com.ryuqq.autoapply.core.model.Job;
import com.ryuqq.autoapply.core.model.JobId;
import com.ryuqq.autoapply.core.model.JobPosting;
import com.ryuqq.autoapply.core.model.Platform;
import com.ryuqq.autoapply.core.model.Resume;
import com.ryuqq.autoapply.core.model.ResumeId;
import com.ryuqq.autoapply.core.model.TailoringMode;

import java.time.Instant;

/**
 * Sample domain objects for tests.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Fixtures {

    public static final Instant EPOCH = Instant.parse("2024-03-01T09:00:00Z");
    public static final CandidateId CANDIDATE = CandidateId.of("candidate-1");

    // Utility class - prevent instantiation
    private Fixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static JobPosting posting(String slug) {
        return posting(slug, Platform.LINKEDIN);
    }

    public static JobPosting posting(String slug, Platform platform) {
        return new JobPosting(
            "https://" + platform.getName() + ".example.com/jobs/" + slug,
            platform,
            "Data Engineer " + slug,
            "Acme " + slug,
            "We need Python and SQL for pipeline work (" + slug + ")"
        );
    }

    public static Job job(String slug) {
        return Job.discovered(JobId.generate(), posting(slug), EPOCH);
    }

    public static Resume resume(String content) {
        return Resume.original(ResumeId.generate(), CANDIDATE, content, EPOCH);
    }

    public static Application application(JobId jobId, ResumeId resumeId) {
        return Application.create(ApplicationId.generate(), jobId, CANDIDATE, resumeId, TailoringMode.MODERATE, EPOCH);
    }
}
