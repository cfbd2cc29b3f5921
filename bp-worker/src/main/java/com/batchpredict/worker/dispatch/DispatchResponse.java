package com.batchpredict.worker.dispatch;

import com.batchpredict.model.DispatchErrorCode;
import com.batchpredict.model.StatusCodes;

/**
 * Immediate answer of {@link JobDispatcher}: 202 when a job was submitted and the workflow stays suspended,
 * 200 when "no records" was signaled, the error code's status otherwise.
 */
public final class DispatchResponse {

    private final int statusCode;
    private final DispatchErrorCode errorCode;
    private final String message;
    private final String jobName;
    private final int records;

    private DispatchResponse(int statusCode, DispatchErrorCode errorCode, String message, String jobName, int records) {
        this.statusCode = statusCode;
        this.errorCode = errorCode;
        this.message = message;
        this.jobName = jobName;
        this.records = records;
    }

    static DispatchResponse accepted(String jobName, int records) {
        return new DispatchResponse(StatusCodes.ACCEPTED, null,
                "Batch transform job started, waiting for completion", jobName, records);
    }

    static DispatchResponse noRecords() {
        return new DispatchResponse(StatusCodes.OK, null, "No records found", null, 0);
    }

    static DispatchResponse failed(DispatchErrorCode code, String message) {
        return new DispatchResponse(code.getStatusCode(), code, message, null, 0);
    }

    public int getStatusCode() {
        return statusCode;
    }

    /** Null unless the dispatch failed. */
    public DispatchErrorCode getErrorCode() {
        return errorCode;
    }

    public String getMessage() {
        return message;
    }

    public String getJobName() {
        return jobName;
    }

    public int getRecords() {
        return records;
    }

    public boolean isAccepted() {
        return statusCode == StatusCodes.ACCEPTED;
    }

    @Override
    public String toString() {
        return "DispatchResponse{statusCode=" + statusCode + ", errorCode=" + errorCode + ", jobName=" + jobName
                + ", message=" + message + "}";
    }
}
