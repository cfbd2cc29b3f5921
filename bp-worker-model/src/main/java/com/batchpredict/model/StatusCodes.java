package com.batchpredict.model;

/**
 * Outcome status families passed between stages: 2xx success/accepted, 204 no candidates,
 * 4xx caller or data error, 5xx submission or processing fault.
 */
public final class StatusCodes {

    public static final int OK = 200;
    public static final int ACCEPTED = 202;
    public static final int NO_CONTENT = 204;
    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;
    public static final int INTERNAL_ERROR = 500;

    private StatusCodes() {
    }

    public static boolean isError(int statusCode) {
        return statusCode >= 400;
    }
}
