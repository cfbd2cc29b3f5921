package com.batchpredict.worker.resume;

/**
 * The orchestration service could not be reached to deliver an outcome. Unlike a rejected delivery, the
 * handle may still be valid and the delivery can be retried.
 */
public class ResumptionUnavailableException extends RuntimeException {

    public ResumptionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
