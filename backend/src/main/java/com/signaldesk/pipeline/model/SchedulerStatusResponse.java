package com.signaldesk.pipeline.model;

import com.signaldesk.pipeline.scheduler.ExecutionResult;
import com.signaldesk.pipeline.scheduler.SchedulerState;

import java.util.List;

public record SchedulerStatusResponse(
    SchedulerState state,
    boolean demoMode,
    List<JobStatusView> jobs,
    List<ExecutionResult> recentResults
) {
}
