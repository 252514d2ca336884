package com.productdata.etl;

/**
 * One named unit of work in the pipeline.
 * <p>
 * A stage reads and writes only through the file paths it was constructed with; nothing is handed
 * from one stage to the next in memory. Returning normally means the stage completed, either with
 * {@link StageOutcome#SUCCESS} or {@link StageOutcome#SKIPPED_NO_INPUT}. Throwing means it failed,
 * and the runner may retry it.
 */
public interface Stage {
    /**
     * Task id used in logs and run reports, e.g. {@code transform_products}.
     */
    String name();

    /**
     * Runs the stage once.
     * @return the completed outcome with optional row count and metrics
     * @throws Exception if the stage failed
     */
    StageResult execute() throws Exception;
}
