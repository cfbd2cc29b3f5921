package com.batchpredict.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Output of the query stage: status 200 with the exported file, 204 when no candidate matched,
 * 500 when the store or storage failed.
 */
public final class QueryResult {

    private final int statusCode;
    private final int records;
    private final String fileKey;
    private final String message;
    private final int durationHours;

    @JsonCreator
    public QueryResult(
            @JsonProperty("statusCode") int statusCode,
            @JsonProperty("records") int records,
            @JsonProperty("fileKey") String fileKey,
            @JsonProperty("message") String message,
            @JsonProperty("durationHours") int durationHours) {
        this.statusCode = statusCode;
        this.records = records;
        this.fileKey = fileKey;
        this.message = message;
        this.durationHours = durationHours;
    }

    public static QueryResult found(int records, String fileKey, int durationHours) {
        return new QueryResult(StatusCodes.OK, records, fileKey, "Query executed successfully", durationHours);
    }

    public static QueryResult noRecords(int durationHours) {
        return new QueryResult(StatusCodes.NO_CONTENT, 0, null, "No records found", durationHours);
    }

    public static QueryResult failed(String message, int durationHours) {
        return new QueryResult(StatusCodes.INTERNAL_ERROR, 0, null, message, durationHours);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public int getRecords() {
        return records;
    }

    /** Object key of the exported candidates (null when nothing was exported). */
    public String getFileKey() {
        return fileKey;
    }

    public String getMessage() {
        return message;
    }

    public int getDurationHours() {
        return durationHours;
    }

    @JsonIgnore
    public boolean isNoContent() {
        return statusCode == StatusCodes.NO_CONTENT;
    }

    @JsonIgnore
    public boolean isError() {
        return StatusCodes.isError(statusCode);
    }

    @Override
    public String toString() {
        return "QueryResult{statusCode=" + statusCode + ", records=" + records + ", fileKey=" + fileKey
                + ", message=" + message + "}";
    }
}
