package com.signaldesk.pipeline.fetch;

/**
 * Final, unrecoverable outcome of a provider call. Retryable failures never surface here
 * until the attempt budget is spent.
 */
public abstract class FetchException extends RuntimeException {
    private final String url;
    private final int attempts;
    private final int statusCode;

    protected FetchException(String url, String message, int attempts, int statusCode, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.attempts = attempts;
        this.statusCode = statusCode;
    }

    public abstract FetchFailure failure();

    public String url() {
        return url;
    }

    public int attempts() {
        return attempts;
    }

    /**
     * Last HTTP status seen, or 0 when the call never produced a response.
     */
    public int statusCode() {
        return statusCode;
    }
}
