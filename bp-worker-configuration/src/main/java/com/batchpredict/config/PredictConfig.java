package com.batchpredict.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Configuration for the batch prediction worker. Built once per process (from environment variables
 * via {@link #fromEnvironment()}, or with {@link #builder()} in tests) and passed to every component.
 * No other class reads the environment.
 * <p>
 * Temporal: BP_TEMPORAL_TARGET, BP_TEMPORAL_NAMESPACE, BP_TASK_QUEUE.
 * Metadata store: BP_CACHE_HOST, BP_CACHE_PORT, BP_METADATA_KEY_PREFIX.
 * DB: BP_DB_HOST, BP_DB_PORT, BP_DB_NAME, BP_DB_USER, BP_DB_PASSWORD, BP_DB_TABLE.
 * Object storage: BP_SOURCE_BUCKET, BP_AWS_REGION. Prediction service: BP_MODEL_ID, BP_INSTANCE_TYPE,
 * BP_INSTANCE_COUNT, BP_FEATURE_COLUMNS (comma-separated).
 */
public final class PredictConfig {

    private static final String ENV_TEMPORAL_TARGET = "BP_TEMPORAL_TARGET";
    private static final String ENV_TEMPORAL_NAMESPACE = "BP_TEMPORAL_NAMESPACE";
    private static final String ENV_TASK_QUEUE = "BP_TASK_QUEUE";
    private static final String ENV_CACHE_HOST = "BP_CACHE_HOST";
    private static final String ENV_CACHE_PORT = "BP_CACHE_PORT";
    private static final String ENV_METADATA_KEY_PREFIX = "BP_METADATA_KEY_PREFIX";
    private static final String ENV_DB_HOST = "BP_DB_HOST";
    private static final String ENV_DB_PORT = "BP_DB_PORT";
    private static final String ENV_DB_NAME = "BP_DB_NAME";
    private static final String ENV_DB_USER = "BP_DB_USER";
    private static final String ENV_DB_PASSWORD = "BP_DB_PASSWORD";
    private static final String ENV_DB_TABLE = "BP_DB_TABLE";
    private static final String ENV_ID_COLUMN = "BP_ID_COLUMN";
    private static final String ENV_VALUE_COLUMN = "BP_VALUE_COLUMN";
    private static final String ENV_PARAMETER_COLUMN = "BP_PARAMETER_COLUMN";
    private static final String ENV_PREDICTED_FLAG_COLUMN = "BP_PREDICTED_FLAG_COLUMN";
    private static final String ENV_TARGET_PARAMETER = "BP_TARGET_PARAMETER";
    private static final String ENV_SENTINEL_VALUE = "BP_SENTINEL_VALUE";
    private static final String ENV_LOOKBACK_HOURS = "BP_LOOKBACK_HOURS";
    private static final String ENV_TIME_COLUMN = "BP_TIME_COLUMN";
    private static final String ENV_SOURCE_BUCKET = "BP_SOURCE_BUCKET";
    private static final String ENV_AWS_REGION = "BP_AWS_REGION";
    private static final String ENV_MODEL_ID = "BP_MODEL_ID";
    private static final String ENV_INSTANCE_TYPE = "BP_INSTANCE_TYPE";
    private static final String ENV_INSTANCE_COUNT = "BP_INSTANCE_COUNT";
    private static final String ENV_FEATURE_COLUMNS = "BP_FEATURE_COLUMNS";
    private static final String ENV_QUERY_TIMEOUT_MINUTES = "BP_QUERY_TIMEOUT_MINUTES";
    private static final String ENV_DISPATCH_TIMEOUT_MINUTES = "BP_DISPATCH_TIMEOUT_MINUTES";
    private static final String ENV_WRITE_TIMEOUT_MINUTES = "BP_WRITE_TIMEOUT_MINUTES";
    private static final String ENV_EXECUTION_TIMEOUT_MINUTES = "BP_EXECUTION_TIMEOUT_MINUTES";
    private static final String ENV_CRON_SCHEDULE = "BP_CRON_SCHEDULE";
    private static final String ENV_DURATION_HOURS = "BP_DURATION_HOURS";

    public static final String RETRIEVAL_PREFIX = "retrieved_from_db";
    public static final String INPUT_BATCH_PREFIX = "input_batch";
    public static final String OUTPUT_BATCH_PREFIX = "output_batch";
    public static final String PREDICTED_PREFIX = "predicted_values_output";

    private static final int DEFAULT_SENTINEL_VALUE = 65535;
    private static final String DEFAULT_INSTANCE_TYPE = "ml.m5.xlarge";
    private static final List<String> DEFAULT_FEATURE_COLUMNS =
            List.of("timestamp", "parameter", "device_id", "location_id", "deployment_date");
    public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofHours(2);
    public static final Duration DEFAULT_DISPATCH_TIMEOUT = Duration.ofHours(6);
    public static final Duration DEFAULT_WRITE_TIMEOUT = Duration.ofHours(2);
    private static final Duration DEFAULT_EXECUTION_TIMEOUT = Duration.ofHours(12);
    private static final int DEFAULT_DURATION_HOURS = 24;

    private final String temporalTarget;
    private final String temporalNamespace;
    private final String taskQueue;
    private final String cacheHost;
    private final int cachePort;
    private final String metadataKeyPrefix;
    private final String dbHost;
    private final int dbPort;
    private final String dbName;
    private final String dbUser;
    private final String dbPassword;
    private final String tableName;
    private final String idColumn;
    private final String valueColumn;
    private final String parameterColumn;
    private final String predictedFlagColumn;
    private final String targetParameter;
    private final int sentinelValue;
    private final int lookbackHours;
    private final String timeColumn;
    private final String sourceBucket;
    private final String awsRegion;
    private final String modelId;
    private final String instanceType;
    private final int instanceCount;
    private final List<String> featureColumns;
    private final Duration queryTimeout;
    private final Duration dispatchTimeout;
    private final Duration writeTimeout;
    private final Duration executionTimeout;
    private final String cronSchedule;
    private final int durationHours;

    private PredictConfig(Builder b) {
        this.temporalTarget = b.temporalTarget;
        this.temporalNamespace = b.temporalNamespace;
        this.taskQueue = b.taskQueue;
        this.cacheHost = b.cacheHost;
        this.cachePort = b.cachePort;
        this.metadataKeyPrefix = b.metadataKeyPrefix;
        this.dbHost = b.dbHost;
        this.dbPort = b.dbPort;
        this.dbName = b.dbName;
        this.dbUser = b.dbUser;
        this.dbPassword = b.dbPassword != null ? b.dbPassword : "";
        this.tableName = b.tableName;
        this.idColumn = b.idColumn;
        this.valueColumn = b.valueColumn;
        this.parameterColumn = b.parameterColumn;
        this.predictedFlagColumn = b.predictedFlagColumn;
        this.targetParameter = blankToNull(b.targetParameter);
        this.sentinelValue = b.sentinelValue;
        this.lookbackHours = Math.max(0, b.lookbackHours);
        this.timeColumn = blankToNull(b.timeColumn);
        this.sourceBucket = b.sourceBucket;
        this.awsRegion = b.awsRegion;
        this.modelId = blankToNull(b.modelId);
        this.instanceType = b.instanceType;
        this.instanceCount = b.instanceCount > 0 ? b.instanceCount : 1;
        this.featureColumns = Collections.unmodifiableList(new ArrayList<>(b.featureColumns));
        this.queryTimeout = b.queryTimeout;
        this.dispatchTimeout = b.dispatchTimeout;
        this.writeTimeout = b.writeTimeout;
        this.executionTimeout = b.executionTimeout;
        this.cronSchedule = blankToNull(b.cronSchedule);
        this.durationHours = b.durationHours;
    }

    public String getTemporalTarget() {
        return temporalTarget;
    }

    public String getTemporalNamespace() {
        return temporalNamespace;
    }

    /** Task queue polled by the worker and used by the starter. */
    public String getTaskQueue() {
        return taskQueue;
    }

    public String getCacheHost() {
        return cacheHost;
    }

    public int getCachePort() {
        return cachePort;
    }

    /**
     * Redis key for a job's metadata entry: {@code <prefix>:batch-transform:<jobId>:metadata}.
     */
    public String getJobMetadataKey(String jobId) {
        return metadataKeyPrefix + ":batch-transform:" + (jobId != null ? jobId : "") + ":metadata";
    }

    public String getMetadataKeyPrefix() {
        return metadataKeyPrefix;
    }

    public String getDbHost() {
        return dbHost;
    }

    public int getDbPort() {
        return dbPort;
    }

    public String getDbName() {
        return dbName;
    }

    public String getDbUser() {
        return dbUser;
    }

    public String getDbPassword() {
        return dbPassword;
    }

    /** JDBC URL for the relational store (PostgreSQL). */
    public String getJdbcUrl() {
        return "jdbc:postgresql://" + dbHost + ":" + dbPort + "/" + dbName;
    }

    public String getTableName() {
        return tableName;
    }

    public String getIdColumn() {
        return idColumn;
    }

    public String getValueColumn() {
        return valueColumn;
    }

    public String getParameterColumn() {
        return parameterColumn;
    }

    public String getPredictedFlagColumn() {
        return predictedFlagColumn;
    }

    /** Parameter the query is restricted to; null selects every parameter. */
    public String getTargetParameter() {
        return targetParameter;
    }

    /** Value marking a row as missing (default 65535). */
    public int getSentinelValue() {
        return sentinelValue;
    }

    /** Recency window for the candidate query; 0 disables the time filter. */
    public int getLookbackHours() {
        return lookbackHours;
    }

    /** Explicit time column for the recency filter; null means detect from the table's columns. */
    public String getTimeColumn() {
        return timeColumn;
    }

    public String getSourceBucket() {
        return sourceBucket;
    }

    public String getAwsRegion() {
        return awsRegion;
    }

    /** Prediction model identifier; null when not configured. */
    public String getModelId() {
        return modelId;
    }

    public String getInstanceType() {
        return instanceType;
    }

    public int getInstanceCount() {
        return instanceCount;
    }

    /** Columns sent to the prediction service, in submission order. */
    public List<String> getFeatureColumns() {
        return featureColumns;
    }

    public Duration getQueryTimeout() {
        return queryTimeout;
    }

    /** Ceiling for dispatch plus the wait for the external job's completion signal. */
    public Duration getDispatchTimeout() {
        return dispatchTimeout;
    }

    public Duration getWriteTimeout() {
        return writeTimeout;
    }

    public Duration getExecutionTimeout() {
        return executionTimeout;
    }

    /** Cron expression for the scheduled trigger, or null for a single run. */
    public String getCronSchedule() {
        return cronSchedule;
    }

    public int getDurationHours() {
        return durationHours;
    }

    public static PredictConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    /**
     * Builds a config from a variable map with the same names and defaults as {@link #fromEnvironment()}.
     */
    public static PredictConfig fromMap(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        Function<String, String> get = env::get;
        List<String> features = parseCommaSeparated(get.apply(ENV_FEATURE_COLUMNS));
        return builder()
                .temporalTarget(getEnv(get, ENV_TEMPORAL_TARGET, "localhost:7233"))
                .temporalNamespace(getEnv(get, ENV_TEMPORAL_NAMESPACE, "default"))
                .taskQueue(getEnv(get, ENV_TASK_QUEUE, "bp-batch-predict-queue"))
                .cacheHost(getEnv(get, ENV_CACHE_HOST, "localhost"))
                .cachePort(parseInt(get.apply(ENV_CACHE_PORT), 6379))
                .metadataKeyPrefix(getEnv(get, ENV_METADATA_KEY_PREFIX, "bp"))
                .dbHost(getEnv(get, ENV_DB_HOST, "localhost"))
                .dbPort(parseInt(get.apply(ENV_DB_PORT), 5432))
                .dbName(getEnv(get, ENV_DB_NAME, "predictions"))
                .dbUser(getEnv(get, ENV_DB_USER, "writer"))
                .dbPassword(getEnv(get, ENV_DB_PASSWORD, ""))
                .tableName(getEnv(get, ENV_DB_TABLE, "aqdataset"))
                .idColumn(getEnv(get, ENV_ID_COLUMN, "id"))
                .valueColumn(getEnv(get, ENV_VALUE_COLUMN, "value"))
                .parameterColumn(getEnv(get, ENV_PARAMETER_COLUMN, "parameter"))
                .predictedFlagColumn(getEnv(get, ENV_PREDICTED_FLAG_COLUMN, "predicted_label"))
                .targetParameter(getEnv(get, ENV_TARGET_PARAMETER, null))
                .sentinelValue(parseInt(get.apply(ENV_SENTINEL_VALUE), DEFAULT_SENTINEL_VALUE))
                .lookbackHours(parseInt(get.apply(ENV_LOOKBACK_HOURS), 0))
                .timeColumn(getEnv(get, ENV_TIME_COLUMN, null))
                .sourceBucket(getEnv(get, ENV_SOURCE_BUCKET, "batch-predict-data"))
                .awsRegion(getEnv(get, ENV_AWS_REGION, "us-east-1"))
                .modelId(getEnv(get, ENV_MODEL_ID, null))
                .instanceType(getEnv(get, ENV_INSTANCE_TYPE, DEFAULT_INSTANCE_TYPE))
                .instanceCount(parseInt(get.apply(ENV_INSTANCE_COUNT), 1))
                .featureColumns(features.isEmpty() ? DEFAULT_FEATURE_COLUMNS : features)
                .queryTimeout(parseMinutes(get.apply(ENV_QUERY_TIMEOUT_MINUTES), DEFAULT_QUERY_TIMEOUT))
                .dispatchTimeout(parseMinutes(get.apply(ENV_DISPATCH_TIMEOUT_MINUTES), DEFAULT_DISPATCH_TIMEOUT))
                .writeTimeout(parseMinutes(get.apply(ENV_WRITE_TIMEOUT_MINUTES), DEFAULT_WRITE_TIMEOUT))
                .executionTimeout(parseMinutes(get.apply(ENV_EXECUTION_TIMEOUT_MINUTES), DEFAULT_EXECUTION_TIMEOUT))
                .cronSchedule(getEnv(get, ENV_CRON_SCHEDULE, null))
                .durationHours(parseInt(get.apply(ENV_DURATION_HOURS), DEFAULT_DURATION_HOURS))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static Duration parseMinutes(String value, Duration defaultValue) {
        int minutes = parseInt(value, -1);
        return minutes > 0 ? Duration.ofMinutes(minutes) : defaultValue;
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String v = env.apply(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }

    public static final class Builder {
        private String temporalTarget = "localhost:7233";
        private String temporalNamespace = "default";
        private String taskQueue = "bp-batch-predict-queue";
        private String cacheHost = "localhost";
        private int cachePort = 6379;
        private String metadataKeyPrefix = "bp";
        private String dbHost = "localhost";
        private int dbPort = 5432;
        private String dbName = "predictions";
        private String dbUser = "writer";
        private String dbPassword = "";
        private String tableName = "aqdataset";
        private String idColumn = "id";
        private String valueColumn = "value";
        private String parameterColumn = "parameter";
        private String predictedFlagColumn = "predicted_label";
        private String targetParameter;
        private int sentinelValue = DEFAULT_SENTINEL_VALUE;
        private int lookbackHours;
        private String timeColumn;
        private String sourceBucket = "batch-predict-data";
        private String awsRegion = "us-east-1";
        private String modelId;
        private String instanceType = DEFAULT_INSTANCE_TYPE;
        private int instanceCount = 1;
        private List<String> featureColumns = DEFAULT_FEATURE_COLUMNS;
        private Duration queryTimeout = DEFAULT_QUERY_TIMEOUT;
        private Duration dispatchTimeout = DEFAULT_DISPATCH_TIMEOUT;
        private Duration writeTimeout = DEFAULT_WRITE_TIMEOUT;
        private Duration executionTimeout = DEFAULT_EXECUTION_TIMEOUT;
        private String cronSchedule;
        private int durationHours = DEFAULT_DURATION_HOURS;

        public Builder temporalTarget(String temporalTarget) {
            this.temporalTarget = Objects.requireNonNull(temporalTarget, "temporalTarget");
            return this;
        }

        public Builder temporalNamespace(String temporalNamespace) {
            this.temporalNamespace = Objects.requireNonNull(temporalNamespace, "temporalNamespace");
            return this;
        }

        public Builder taskQueue(String taskQueue) {
            this.taskQueue = Objects.requireNonNull(taskQueue, "taskQueue");
            return this;
        }

        public Builder cacheHost(String cacheHost) {
            this.cacheHost = cacheHost;
            return this;
        }

        public Builder cachePort(int cachePort) {
            this.cachePort = cachePort;
            return this;
        }

        public Builder metadataKeyPrefix(String metadataKeyPrefix) {
            this.metadataKeyPrefix = metadataKeyPrefix != null ? metadataKeyPrefix : "bp";
            return this;
        }

        public Builder dbHost(String dbHost) {
            this.dbHost = dbHost;
            return this;
        }

        public Builder dbPort(int dbPort) {
            this.dbPort = dbPort;
            return this;
        }

        public Builder dbName(String dbName) {
            this.dbName = dbName;
            return this;
        }

        public Builder dbUser(String dbUser) {
            this.dbUser = dbUser;
            return this;
        }

        public Builder dbPassword(String dbPassword) {
            this.dbPassword = dbPassword;
            return this;
        }

        public Builder tableName(String tableName) {
            this.tableName = Objects.requireNonNull(tableName, "tableName");
            return this;
        }

        public Builder idColumn(String idColumn) {
            this.idColumn = Objects.requireNonNull(idColumn, "idColumn");
            return this;
        }

        public Builder valueColumn(String valueColumn) {
            this.valueColumn = Objects.requireNonNull(valueColumn, "valueColumn");
            return this;
        }

        public Builder parameterColumn(String parameterColumn) {
            this.parameterColumn = Objects.requireNonNull(parameterColumn, "parameterColumn");
            return this;
        }

        public Builder predictedFlagColumn(String predictedFlagColumn) {
            this.predictedFlagColumn = Objects.requireNonNull(predictedFlagColumn, "predictedFlagColumn");
            return this;
        }

        public Builder targetParameter(String targetParameter) {
            this.targetParameter = targetParameter;
            return this;
        }

        public Builder sentinelValue(int sentinelValue) {
            this.sentinelValue = sentinelValue;
            return this;
        }

        public Builder lookbackHours(int lookbackHours) {
            this.lookbackHours = lookbackHours;
            return this;
        }

        public Builder timeColumn(String timeColumn) {
            this.timeColumn = timeColumn;
            return this;
        }

        public Builder sourceBucket(String sourceBucket) {
            this.sourceBucket = Objects.requireNonNull(sourceBucket, "sourceBucket");
            return this;
        }

        public Builder awsRegion(String awsRegion) {
            this.awsRegion = Objects.requireNonNull(awsRegion, "awsRegion");
            return this;
        }

        public Builder modelId(String modelId) {
            this.modelId = modelId;
            return this;
        }

        public Builder instanceType(String instanceType) {
            this.instanceType = instanceType != null ? instanceType : DEFAULT_INSTANCE_TYPE;
            return this;
        }

        public Builder instanceCount(int instanceCount) {
            this.instanceCount = instanceCount;
            return this;
        }

        public Builder featureColumns(List<String> featureColumns) {
            this.featureColumns = featureColumns != null ? new ArrayList<>(featureColumns) : DEFAULT_FEATURE_COLUMNS;
            return this;
        }

        public Builder queryTimeout(Duration queryTimeout) {
            this.queryTimeout = Objects.requireNonNull(queryTimeout, "queryTimeout");
            return this;
        }

        public Builder dispatchTimeout(Duration dispatchTimeout) {
            this.dispatchTimeout = Objects.requireNonNull(dispatchTimeout, "dispatchTimeout");
            return this;
        }

        public Builder writeTimeout(Duration writeTimeout) {
            this.writeTimeout = Objects.requireNonNull(writeTimeout, "writeTimeout");
            return this;
        }

        public Builder executionTimeout(Duration executionTimeout) {
            this.executionTimeout = Objects.requireNonNull(executionTimeout, "executionTimeout");
            return this;
        }

        public Builder cronSchedule(String cronSchedule) {
            this.cronSchedule = cronSchedule;
            return this;
        }

        public Builder durationHours(int durationHours) {
            this.durationHours = durationHours;
            return this;
        }

        public PredictConfig build() {
            return new PredictConfig(this);
        }
    }
}
