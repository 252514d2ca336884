package com.productdata.etl;

public enum RunStatus {
    SUCCESS,
    FAILED
}
