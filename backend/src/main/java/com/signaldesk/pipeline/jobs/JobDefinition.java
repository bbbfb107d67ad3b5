package com.signaldesk.pipeline.jobs;

import com.signaldesk.pipeline.scheduler.JobHandler;

import java.time.Duration;

public record JobDefinition(String name, Duration defaultCadence, JobHandler handler) {
}
