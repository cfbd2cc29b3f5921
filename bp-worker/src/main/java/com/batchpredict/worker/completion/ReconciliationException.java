package com.batchpredict.worker.completion;

/** Prediction output cannot be safely matched to the submitted rows. Not retried. */
public class ReconciliationException extends RuntimeException {

    public ReconciliationException(String message) {
        super(message);
    }
}
