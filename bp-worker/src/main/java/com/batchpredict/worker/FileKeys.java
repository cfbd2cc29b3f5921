package com.batchpredict.worker;

import com.batchpredict.config.PredictConfig;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/** Object keys and job names used across stages. Timestamps are UTC. */
public final class FileKeys {

    private static final DateTimeFormatter FILE_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter JOB_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private FileKeys() {
    }

    public static String timestamp(Instant instant) {
        return FILE_STAMP.format(instant);
    }

    public static String queryResults(String timestamp) {
        return PredictConfig.RETRIEVAL_PREFIX + "/query_results_" + timestamp + ".csv";
    }

    public static String inputBatch(String batchId, String timestamp) {
        return PredictConfig.INPUT_BATCH_PREFIX + "/" + batchId + "_" + timestamp + ".csv";
    }

    /** Where the prediction service writes the output for an input object: same file name plus {@code .out}. */
    public static String outputFor(String inputKey) {
        int slash = inputKey.lastIndexOf('/');
        String fileName = slash >= 0 ? inputKey.substring(slash + 1) : inputKey;
        return PredictConfig.OUTPUT_BATCH_PREFIX + "/" + fileName + ".out";
    }

    public static String finalOutput(String timestamp) {
        return PredictConfig.PREDICTED_PREFIX + "/output_results_" + timestamp + ".csv";
    }

    /** Job names allow only letters, digits and hyphens. */
    public static String jobName(String batchId, Instant instant) {
        return "batch-transform-" + batchId + "-" + JOB_STAMP.format(instant);
    }
}
