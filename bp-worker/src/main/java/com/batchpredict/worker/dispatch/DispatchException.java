package com.batchpredict.worker.dispatch;

import com.batchpredict.model.DispatchErrorCode;

/** A dispatch step failed in a way that maps to a specific error code. */
public class DispatchException extends RuntimeException {

    private final DispatchErrorCode errorCode;

    public DispatchException(DispatchErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public DispatchErrorCode getErrorCode() {
        return errorCode;
    }
}
