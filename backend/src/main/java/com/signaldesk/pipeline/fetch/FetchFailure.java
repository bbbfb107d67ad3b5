package com.signaldesk.pipeline.fetch;

public enum FetchFailure {
    TRANSPORT,
    THROTTLED,
    SERVER_ERROR,
    MALFORMED_RESPONSE;

    public boolean isRetryable() {
        return this != MALFORMED_RESPONSE;
    }
}
