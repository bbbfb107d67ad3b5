package com.signaldesk.pipeline.fetch;

import java.time.Duration;

public class ThrottledException extends FetchException {
    private final Duration cooldown;

    public ThrottledException(String url, String message, int attempts, int statusCode, Duration cooldown) {
        super(url, message, attempts, statusCode, null);
        this.cooldown = cooldown;
    }

    @Override
    public FetchFailure failure() {
        return FetchFailure.THROTTLED;
    }

    public Duration cooldown() {
        return cooldown;
    }
}
