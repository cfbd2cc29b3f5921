package com.batchpredict.worker.workflow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Terminal outcome of a prediction run. {@code errorCode} and {@code errorDetail} are null on success. */
public final class PredictionRunResult {

    private final WorkflowStage stage;
    private final int statusCode;
    private final String errorCode;
    private final String errorDetail;
    private final int records;
    private final int updatedRecords;
    private final String fileKey;

    @JsonCreator
    public PredictionRunResult(
            @JsonProperty("stage") WorkflowStage stage,
            @JsonProperty("statusCode") int statusCode,
            @JsonProperty("errorCode") String errorCode,
            @JsonProperty("errorDetail") String errorDetail,
            @JsonProperty("records") int records,
            @JsonProperty("updatedRecords") int updatedRecords,
            @JsonProperty("fileKey") String fileKey) {
        this.stage = stage;
        this.statusCode = statusCode;
        this.errorCode = errorCode;
        this.errorDetail = errorDetail;
        this.records = records;
        this.updatedRecords = updatedRecords;
        this.fileKey = fileKey;
    }

    public WorkflowStage getStage() {
        return stage;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getErrorDetail() {
        return errorDetail;
    }

    public int getRecords() {
        return records;
    }

    public int getUpdatedRecords() {
        return updatedRecords;
    }

    /** Final predictions file when the run got that far. */
    public String getFileKey() {
        return fileKey;
    }

    @Override
    public String toString() {
        return "PredictionRunResult{stage=" + stage + ", statusCode=" + statusCode + ", errorCode=" + errorCode
                + ", records=" + records + ", updatedRecords=" + updatedRecords + ", errorDetail=" + errorDetail + "}";
    }
}
