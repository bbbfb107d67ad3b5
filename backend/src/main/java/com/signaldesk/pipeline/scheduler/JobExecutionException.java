package com.signaldesk.pipeline.scheduler;

public class JobExecutionException extends RuntimeException {
    public JobExecutionException(String message) {
        super(message);
    }

    public JobExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
