package com.productdata.etl;

/**
 * Destination for the cleaned product records handed over by the load stage.
 */
public interface RecordSinkInterface {
    /**
     * Consumes the cleaned records.
     * @param records Cleaned records read from the transformed CSV
     * @throws Exception if the sink cannot accept the records; the load stage then fails
     */
    void accept(RecordSet records) throws Exception;

    /**
     * Short description for logs and run reports.
     */
    String describe();
}
