package com.productdata.etl;

/**
 * What started a run.
 */
public enum RunTrigger {
    /** Fired by {@link PipelineScheduler} for a schedule interval. */
    SCHEDULED,
    /** Started by hand, e.g. {@code Main run}. */
    MANUAL
}
