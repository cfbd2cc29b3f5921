package com.batchpredict.worker.workflow;

import com.batchpredict.config.PredictConfig;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Start payload of a prediction run. {@code durationHours} only annotates output; timeouts of 0 or less
 * fall back to the worker defaults.
 */
public final class PredictionRunRequest {

    private final int durationHours;
    private final long queryTimeoutSeconds;
    private final long dispatchTimeoutSeconds;
    private final long writeTimeoutSeconds;

    @JsonCreator
    public PredictionRunRequest(
            @JsonProperty("durationHours") int durationHours,
            @JsonProperty("queryTimeoutSeconds") long queryTimeoutSeconds,
            @JsonProperty("dispatchTimeoutSeconds") long dispatchTimeoutSeconds,
            @JsonProperty("writeTimeoutSeconds") long writeTimeoutSeconds) {
        this.durationHours = durationHours;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
        this.dispatchTimeoutSeconds = dispatchTimeoutSeconds;
        this.writeTimeoutSeconds = writeTimeoutSeconds;
    }

    public static PredictionRunRequest fromConfig(PredictConfig config) {
        return new PredictionRunRequest(config.getDurationHours(),
                config.getQueryTimeout().getSeconds(),
                config.getDispatchTimeout().getSeconds(),
                config.getWriteTimeout().getSeconds());
    }

    public int getDurationHours() {
        return durationHours;
    }

    public long getQueryTimeoutSeconds() {
        return queryTimeoutSeconds;
    }

    public long getDispatchTimeoutSeconds() {
        return dispatchTimeoutSeconds;
    }

    public long getWriteTimeoutSeconds() {
        return writeTimeoutSeconds;
    }

    Duration queryTimeout() {
        return orDefault(queryTimeoutSeconds, PredictConfig.DEFAULT_QUERY_TIMEOUT);
    }

    /** Covers submission and the wait for the job's completion event. */
    Duration dispatchTimeout() {
        return orDefault(dispatchTimeoutSeconds, PredictConfig.DEFAULT_DISPATCH_TIMEOUT);
    }

    Duration writeTimeout() {
        return orDefault(writeTimeoutSeconds, PredictConfig.DEFAULT_WRITE_TIMEOUT);
    }

    private static Duration orDefault(long seconds, Duration defaultValue) {
        return seconds > 0 ? Duration.ofSeconds(seconds) : defaultValue;
    }

    @Override
    public String toString() {
        return "PredictionRunRequest{durationHours=" + durationHours + ", timeouts(s)=" + queryTimeoutSeconds + "/"
                + dispatchTimeoutSeconds + "/" + writeTimeoutSeconds + "}";
    }
}
