package com.signaldesk.pipeline.scheduler;

import java.time.Duration;
import java.time.Instant;

public record ExecutionResult(
    String jobName,
    Instant startedAt,
    Instant finishedAt,
    boolean succeeded,
    String error
) {
    public Duration duration() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }

    public String status() {
        return succeeded ? "PASS" : "FAIL";
    }
}
