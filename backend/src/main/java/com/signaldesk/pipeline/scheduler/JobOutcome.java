package com.signaldesk.pipeline.scheduler;

public record JobOutcome(boolean succeeded, String detail) {

    public static JobOutcome success(String detail) {
        return new JobOutcome(true, detail);
    }

    public static JobOutcome failure(String detail) {
        return new JobOutcome(false, detail);
    }
}
