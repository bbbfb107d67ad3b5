package com.signaldesk.pipeline.fetch;

public class ServerErrorException extends FetchException {
    public ServerErrorException(String url, String message, int attempts, int statusCode) {
        super(url, message, attempts, statusCode, null);
    }

    @Override
    public FetchFailure failure() {
        return FetchFailure.SERVER_ERROR;
    }
}
