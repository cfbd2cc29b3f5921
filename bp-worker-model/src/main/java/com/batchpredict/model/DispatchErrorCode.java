package com.batchpredict.model;

/**
 * Error codes delivered with a failure signal on a suspended dispatch. The code's {@link #getType()} is the
 * failure type seen by the workflow; {@link #isJobFailure()} separates failures of the external job (or of
 * its output) from failures to get the job started.
 */
public enum DispatchErrorCode {
    MISSING_TASK_TOKEN("MissingTaskToken", StatusCodes.BAD_REQUEST, false),
    MISSING_MODEL_ID("MissingModelId", StatusCodes.INTERNAL_ERROR, false),
    MISSING_FILE_KEY("MissingFileKey", StatusCodes.BAD_REQUEST, false),
    MISSING_COLUMNS("MissingColumns", StatusCodes.BAD_REQUEST, false),
    INVALID_FEATURE_VALUE("InvalidFeatureValue", StatusCodes.BAD_REQUEST, false),
    MODEL_NOT_FOUND("ModelNotFound", StatusCodes.BAD_REQUEST, false),
    INITIATION_FAILED("BatchTransformInitiationFailed", StatusCodes.INTERNAL_ERROR, false),
    JOB_FAILED("BatchTransformFailed", StatusCodes.INTERNAL_ERROR, true),
    RESULT_PROCESSING_FAILED("BatchResultProcessingFailed", StatusCodes.INTERNAL_ERROR, true);

    private final String type;
    private final int statusCode;
    private final boolean jobFailure;

    DispatchErrorCode(String type, int statusCode, boolean jobFailure) {
        this.type = type;
        this.statusCode = statusCode;
        this.jobFailure = jobFailure;
    }

    public String getType() {
        return type;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isJobFailure() {
        return jobFailure;
    }

    /** Looks up a code by its failure type; null when the type is not one of ours. */
    public static DispatchErrorCode fromType(String type) {
        if (type == null) return null;
        for (DispatchErrorCode c : values()) {
            if (c.type.equals(type)) {
                return c;
            }
        }
        return null;
    }
}
