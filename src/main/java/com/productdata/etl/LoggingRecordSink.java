package com.productdata.etl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default sink: persists nothing and logs the records as ready for a downstream consumer.
 */
public class LoggingRecordSink implements RecordSinkInterface {
    private static final Logger logger = LoggerFactory.getLogger(LoggingRecordSink.class);

    @Override
    public void accept(RecordSet records) {
        logger.info("{} rows with columns {} ready for downstream consumers", records.rowCount(), records.columns());
    }

    @Override
    public String describe() {
        return "log";
    }
}
