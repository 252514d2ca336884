package com.productdata.etl;

/**
 * How the extract, transform and load stages react to an absent input file.
 * The archive stage is best-effort and always skips.
 */
public enum MissingInputPolicy {
    /** Log an error and report {@link StageOutcome#SKIPPED_NO_INPUT}; downstream stages still run. */
    SKIP,
    /** Throw {@link MissingInputException} so the runner's retry budget engages. */
    FAIL
}
