package com.batchpredict.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/** DB writer outcome: parsed rows and rows actually updated. */
public final class WriteResult {

    private final int totalRecords;
    private final int updatedRecords;

    @JsonCreator
    public WriteResult(
            @JsonProperty("totalRecords") int totalRecords,
            @JsonProperty("updatedRecords") int updatedRecords) {
        this.totalRecords = totalRecords;
        this.updatedRecords = updatedRecords;
    }

    public static WriteResult empty() {
        return new WriteResult(0, 0);
    }

    public int getTotalRecords() {
        return totalRecords;
    }

    public int getUpdatedRecords() {
        return updatedRecords;
    }

    @Override
    public String toString() {
        return "WriteResult{totalRecords=" + totalRecords + ", updatedRecords=" + updatedRecords + "}";
    }
}
