package com.productdata.etl;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Record of one pipeline run, as logged by the runner and stored in the run history.
 *
 * @param runId unique id, e.g. {@code scheduled__2025-12-19T00:00}
 * @param trigger scheduled or manual
 * @param logicalDate start of the schedule interval the run covers
 * @param startedAt when the first stage started
 * @param finishedAt when the last stage finished or the run was abandoned
 * @param status SUCCESS when no stage failed
 * @param stages one result per pipeline stage, in pipeline order
 */
public record RunReport(
    String runId,
    RunTrigger trigger,
    LocalDateTime logicalDate,
    Instant startedAt,
    Instant finishedAt,
    RunStatus status,
    List<StageResult> stages
) {
    public RunReport {
        stages = stages == null ? List.of() : List.copyOf(stages);
    }

    /**
     * Returns the result of the named stage, or null if the run has none.
     */
    public StageResult stage(String name) {
        for (StageResult result : stages) {
            if (result.stage().equals(name)) return result;
        }
        return null;
    }
}
