package com.productdata.etl;

/**
 * Thrown when a CSV file cannot be read as a table: no header row, or a row
 * with more fields than the header declares.
 */
public class DataShapeException extends Exception {
    public DataShapeException(String message) {
        super(message);
    }

    public DataShapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
