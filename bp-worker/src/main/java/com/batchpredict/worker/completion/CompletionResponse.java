package com.batchpredict.worker.completion;

import com.batchpredict.model.StatusCodes;

/** What the completion handler did with one event. {@code resumed} is false when nothing was delivered. */
public final class CompletionResponse {

    private final int statusCode;
    private final String message;
    private final boolean resumed;

    CompletionResponse(int statusCode, String message, boolean resumed) {
        this.statusCode = statusCode;
        this.message = message;
        this.resumed = resumed;
    }

    static CompletionResponse badRequest(String message) {
        return new CompletionResponse(StatusCodes.BAD_REQUEST, message, false);
    }

    static CompletionResponse notFound(String message) {
        return new CompletionResponse(StatusCodes.NOT_FOUND, message, false);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getMessage() {
        return message;
    }

    public boolean isResumed() {
        return resumed;
    }

    @Override
    public String toString() {
        return "CompletionResponse{statusCode=" + statusCode + ", resumed=" + resumed + ", message=" + message + "}";
    }
}
