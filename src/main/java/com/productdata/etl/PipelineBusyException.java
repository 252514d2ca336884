package com.productdata.etl;

/**
 * Raised when a run is requested while another run of the same pipeline is still in progress.
 */
public class PipelineBusyException extends IllegalStateException {
    public PipelineBusyException(String message) {
        super(message);
    }
}
