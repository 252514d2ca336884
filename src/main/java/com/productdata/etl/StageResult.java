package com.productdata.etl;

import java.util.Map;

/**
 * Outcome of one stage within a run.
 *
 * @param stage task id of the stage
 * @param outcome success, skip for missing input, or failure
 * @param attempts number of attempts made; 0 when the stage never ran
 * @param rowCount rows read or written, when the stage has one to report
 * @param message human-readable summary
 * @param metrics additional stage-specific counts
 */
public record StageResult(
    String stage,
    StageOutcome outcome,
    int attempts,
    Integer rowCount,
    String message,
    Map<String, Object> metrics
) {
    public StageResult {
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }

    public static StageResult success(String stage, Integer rowCount, String message, Map<String, Object> metrics) {
        return new StageResult(stage, StageOutcome.SUCCESS, 1, rowCount, message, metrics);
    }

    public static StageResult skipped(String stage, String message) {
        return new StageResult(stage, StageOutcome.SKIPPED_NO_INPUT, 1, null, message, Map.of());
    }

    public static StageResult failed(String stage, int attempts, String message) {
        return new StageResult(stage, StageOutcome.FAILED, attempts, null, message, Map.of());
    }

    public StageResult withAttempts(int attempts) {
        return new StageResult(stage, outcome, attempts, rowCount, message, metrics);
    }
}
