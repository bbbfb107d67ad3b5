package com.signaldesk.pipeline.model;

import java.time.Duration;
import java.time.Instant;

public record JobStatusView(
    String name,
    Duration cadence,
    Instant lastRunAt,
    Instant nextDueAt,
    boolean running
) {
}
