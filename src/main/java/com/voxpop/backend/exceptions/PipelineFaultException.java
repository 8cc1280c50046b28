package com.voxpop.backend.exceptions;

/**
 * The import worker cannot continue (unreadable file, storage failure). Fatal to the job.
 */
public class PipelineFaultException extends RuntimeException {

    public PipelineFaultException(String message) {
        super(message);
    }

    public PipelineFaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
