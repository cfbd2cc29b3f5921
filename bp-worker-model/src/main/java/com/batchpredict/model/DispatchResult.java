package com.batchpredict.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Success outcome delivered to a suspended dispatch: either "no records" (nothing submitted) or the
 * reconciled predictions file produced after the external job completed.
 */
public final class DispatchResult {

    public static final String STATUS_COMPLETED = "COMPLETED";
    public static final String STATUS_NO_RECORDS = "NO_RECORDS";

    private final int statusCode;
    private final int records;
    private final String fileKey;
    private final String jobName;
    private final String status;
    private final String message;

    @JsonCreator
    public DispatchResult(
            @JsonProperty("statusCode") int statusCode,
            @JsonProperty("records") int records,
            @JsonProperty("fileKey") String fileKey,
            @JsonProperty("jobName") String jobName,
            @JsonProperty("status") String status,
            @JsonProperty("message") String message) {
        this.statusCode = statusCode;
        this.records = records;
        this.fileKey = fileKey;
        this.jobName = jobName;
        this.status = status;
        this.message = message;
    }

    public static DispatchResult completed(int records, String fileKey, String jobName) {
        return new DispatchResult(StatusCodes.OK, records, fileKey, jobName, STATUS_COMPLETED,
                "Batch transform completed successfully");
    }

    public static DispatchResult noRecords(String fileKey) {
        return new DispatchResult(StatusCodes.OK, 0, fileKey, null, STATUS_NO_RECORDS, "No records found");
    }

    public int getStatusCode() {
        return statusCode;
    }

    public int getRecords() {
        return records;
    }

    /** Object key of the reconciled predictions file; null or the query file when no records. */
    public String getFileKey() {
        return fileKey;
    }

    public String getJobName() {
        return jobName;
    }

    public String getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "DispatchResult{status=" + status + ", records=" + records + ", fileKey=" + fileKey
                + ", jobName=" + jobName + "}";
    }
}
