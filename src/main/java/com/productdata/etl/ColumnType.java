package com.productdata.etl;

/**
 * Type of a CSV column, inferred from its cells at read time.
 */
public enum ColumnType {
    NUMERIC,
    TEXT
}
