package com.ryuqq.autoapply.core.executor;

import com.ryuqq.autoapply.core.model.Platform;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 단계별 Executor 묶음.
 *
 * <p>Submission Executor는 플랫폼별로 하나씩 등록됩니다. Discovery Executor는 선택입니다.</p>
 *
 * @param analysis 분석 Executor
 * @param tailoring 맞춤화 Executor
 * @param submissions 플랫폼별 제출 Executor
 * @param discovery 탐색 Executor (nullable)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StageExecutors(
    AnalysisExecutor analysis,
    TailoringExecutor tailoring,
    Map<Platform, SubmissionExecutor> submissions,
    DiscoveryExecutor discovery
) {

    public StageExecutors {
        if (analysis == null) {
            throw new IllegalArgumentException("analysis cannot be null");
        }
        if (tailoring == null) {
            throw new IllegalArgumentException("tailoring cannot be null");
        }
        if (submissions == null || submissions.isEmpty()) {
            throw new IllegalArgumentException("at least one submission executor is required");
        }
        submissions = Map.copyOf(submissions);
    }

    /**
     * 제출 Executor 목록으로 생성 (플랫폼 중복 불가).
     */
    public static StageExecutors of(AnalysisExecutor analysis, TailoringExecutor tailoring,
                                    Collection<? extends SubmissionExecutor> submissions) {
        if (submissions == null) {
            throw new IllegalArgumentException("submissions cannot be null");
        }
        Map<Platform, SubmissionExecutor> byPlatform = new HashMap<>();
        for (SubmissionExecutor executor : submissions) {
            if (byPlatform.putIfAbsent(executor.platform(), executor) != null) {
                throw new IllegalArgumentException("Duplicate submission executor for " + executor.platform());
            }
        }
        return new StageExecutors(analysis, tailoring, byPlatform, null);
    }

    public StageExecutors withDiscovery(DiscoveryExecutor discovery) {
        return new StageExecutors(analysis, tailoring, submissions, discovery);
    }

    public Optional<SubmissionExecutor> submissionFor(Platform platform) {
        return Optional.ofNullable(submissions.get(platform));
    }

    public Optional<DiscoveryExecutor> discoveryExecutor() {
        return Optional.ofNullable(discovery);
    }
}
