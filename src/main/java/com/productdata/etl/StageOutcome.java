package com.productdata.etl;

public enum StageOutcome {
    SUCCESS,
    SKIPPED_NO_INPUT,
    FAILED
}
