package com.signaldesk.pipeline.scheduler;

public enum SchedulerState {
    STOPPED,
    RUNNING
}
