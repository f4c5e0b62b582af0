package com.ryuqq.autoapply.adapter.runner;

import com.ryuqq.autoapply.core.executor.Stage;
import com.ryuqq.autoapply.core.statemachine.ApplicationState;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * 상태 → 실행할 단계 매핑.
 *
 * <p>다음 단계는 상태만으로 결정됩니다.</p>
 * <ul>
 *   <li>DISCOVERED → ANALYSIS</li>
 *   <li>ANALYZED → TAILORING</li>
 *   <li>TAILORED → SUBMISSION (자동화 수준에 따라 검토 요청으로 분기)</li>
 *   <li>SUBMITTING → SUBMISSION</li>
 *   <li>그 외 → 없음 (외부 입력 대기 또는 종료)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StageDispatchTable {

    private static final Map<ApplicationState, Stage> TABLE = new EnumMap<>(ApplicationState.class);

    static {
        TABLE.put(ApplicationState.DISCOVERED, Stage.ANALYSIS);
        TABLE.put(ApplicationState.ANALYZED, Stage.TAILORING);
        TABLE.put(ApplicationState.TAILORED, Stage.SUBMISSION);
        TABLE.put(ApplicationState.SUBMITTING, Stage.SUBMISSION);
    }

    // Utility class - prevent instantiation
    private StageDispatchTable() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static Optional<Stage> stageFor(ApplicationState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        return Optional.ofNullable(TABLE.get(state));
    }

    public static boolean isDispatchable(ApplicationState state) {
        return stageFor(state).isPresent();
    }
}
