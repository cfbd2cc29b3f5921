package com.batchpredict.worker.workflow;

/**
 * Error codes of a failed run. Timeouts have their own codes so "never answered" is distinguishable from
 * "answered with an error".
 */
public enum RunErrorCode {
    QUERY_FAILED("QueryFailed"),
    QUERY_TIMEOUT("QueryTimeout"),
    DISPATCH_FAILED("DispatchFailed"),
    DISPATCH_TIMEOUT("DispatchTimeout"),
    JOB_FAILED("JobFailed"),
    WRITE_FAILED("WriteFailed"),
    WRITE_TIMEOUT("WriteTimeout");

    private final String code;

    RunErrorCode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
