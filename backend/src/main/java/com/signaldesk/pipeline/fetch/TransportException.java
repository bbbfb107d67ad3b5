package com.signaldesk.pipeline.fetch;

public class TransportException extends FetchException {
    public TransportException(String url, String message, int attempts, Throwable cause) {
        super(url, message, attempts, 0, cause);
    }

    @Override
    public FetchFailure failure() {
        return FetchFailure.TRANSPORT;
    }
}
