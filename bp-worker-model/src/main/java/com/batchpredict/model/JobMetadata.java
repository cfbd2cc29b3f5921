package com.batchpredict.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * State handed from the job dispatcher to the completion handler through the metadata store, keyed by
 * the external job name. Written once at submission; read and deleted when the job's outcome arrives.
 */
public final class JobMetadata {

    private final String jobName;
    private final String batchId;
    private final long createdAtMillis;
    private final String timestamp;
    private final ResumptionHandle resumption;
    private final String inputFileKey;
    private final String outputFileKey;
    private final String outputPrefix;
    private final String sourceFileKey;
    private final int recordCount;
    private final List<String> originalColumns;
    private final String bucket;
    private final String modelId;
    private final int durationHours;

    @JsonCreator
    public JobMetadata(
            @JsonProperty("jobName") String jobName,
            @JsonProperty("batchId") String batchId,
            @JsonProperty("createdAtMillis") long createdAtMillis,
            @JsonProperty("timestamp") String timestamp,
            @JsonProperty("resumption") ResumptionHandle resumption,
            @JsonProperty("inputFileKey") String inputFileKey,
            @JsonProperty("outputFileKey") String outputFileKey,
            @JsonProperty("outputPrefix") String outputPrefix,
            @JsonProperty("sourceFileKey") String sourceFileKey,
            @JsonProperty("recordCount") int recordCount,
            @JsonProperty("originalColumns") List<String> originalColumns,
            @JsonProperty("bucket") String bucket,
            @JsonProperty("modelId") String modelId,
            @JsonProperty("durationHours") int durationHours) {
        this.jobName = Objects.requireNonNull(jobName, "jobName");
        this.batchId = batchId;
        this.createdAtMillis = createdAtMillis;
        this.timestamp = timestamp;
        this.resumption = resumption;
        this.inputFileKey = inputFileKey;
        this.outputFileKey = outputFileKey;
        this.outputPrefix = outputPrefix;
        this.sourceFileKey = sourceFileKey;
        this.recordCount = recordCount;
        this.originalColumns = originalColumns != null ? List.copyOf(originalColumns) : List.of();
        this.bucket = bucket;
        this.modelId = modelId;
        this.durationHours = durationHours;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getJobName() {
        return jobName;
    }

    /** Locally generated correlation id used in the input file name. */
    public String getBatchId() {
        return batchId;
    }

    public long getCreatedAtMillis() {
        return createdAtMillis;
    }

    /** yyyyMMdd_HHmmss stamp shared by the input file and the final predictions file. */
    public String getTimestamp() {
        return timestamp;
    }

    public ResumptionHandle getResumption() {
        return resumption;
    }

    public String getInputFileKey() {
        return inputFileKey;
    }

    /** Key of the raw output object the job writes for {@link #getInputFileKey()}. */
    public String getOutputFileKey() {
        return outputFileKey;
    }

    public String getOutputPrefix() {
        return outputPrefix;
    }

    /** Key of the exported query file: the original rows, in submission order. */
    public String getSourceFileKey() {
        return sourceFileKey;
    }

    public int getRecordCount() {
        return recordCount;
    }

    public List<String> getOriginalColumns() {
        return originalColumns;
    }

    public String getBucket() {
        return bucket;
    }

    public String getModelId() {
        return modelId;
    }

    public int getDurationHours() {
        return durationHours;
    }

    public String toJson() {
        return ModelJson.write(this);
    }

    /** Deserializes from JSON. Throws {@link java.io.UncheckedIOException} on malformed input. */
    public static JobMetadata fromJson(String json) {
        return ModelJson.read(json, JobMetadata.class);
    }

    public static final class Builder {
        private String jobName;
        private String batchId;
        private long createdAtMillis;
        private String timestamp;
        private ResumptionHandle resumption;
        private String inputFileKey;
        private String outputFileKey;
        private String outputPrefix;
        private String sourceFileKey;
        private int recordCount;
        private List<String> originalColumns = List.of();
        private String bucket;
        private String modelId;
        private int durationHours;

        public Builder jobName(String jobName) {
            this.jobName = jobName;
            return this;
        }

        public Builder batchId(String batchId) {
            this.batchId = batchId;
            return this;
        }

        public Builder createdAtMillis(long createdAtMillis) {
            this.createdAtMillis = createdAtMillis;
            return this;
        }

        public Builder timestamp(String timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder resumption(ResumptionHandle resumption) {
            this.resumption = resumption;
            return this;
        }

        public Builder inputFileKey(String inputFileKey) {
            this.inputFileKey = inputFileKey;
            return this;
        }

        public Builder outputFileKey(String outputFileKey) {
            this.outputFileKey = outputFileKey;
            return this;
        }

        public Builder outputPrefix(String outputPrefix) {
            this.outputPrefix = outputPrefix;
            return this;
        }

        public Builder sourceFileKey(String sourceFileKey) {
            this.sourceFileKey = sourceFileKey;
            return this;
        }

        public Builder recordCount(int recordCount) {
            this.recordCount = recordCount;
            return this;
        }

        public Builder originalColumns(List<String> originalColumns) {
            this.originalColumns = originalColumns;
            return this;
        }

        public Builder bucket(String bucket) {
            this.bucket = bucket;
            return this;
        }

        public Builder modelId(String modelId) {
            this.modelId = modelId;
            return this;
        }

        public Builder durationHours(int durationHours) {
            this.durationHours = durationHours;
            return this;
        }

        public JobMetadata build() {
            return new JobMetadata(jobName, batchId, createdAtMillis, timestamp, resumption, inputFileKey,
                    outputFileKey, outputPrefix, sourceFileKey, recordCount, originalColumns, bucket, modelId,
                    durationHours);
        }
    }
}
