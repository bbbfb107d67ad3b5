package com.signaldesk.pipeline.fetch;

public class MalformedResponseException extends FetchException {
    public MalformedResponseException(String url, String message, Throwable cause) {
        this(url, message, 1, 200, cause);
    }

    public MalformedResponseException(String url, String message, int attempts, int statusCode, Throwable cause) {
        super(url, message, attempts, statusCode, cause);
    }

    @Override
    public FetchFailure failure() {
        return FetchFailure.MALFORMED_RESPONSE;
    }
}
