package com.signaldesk.pipeline.model;

import com.signaldesk.pipeline.scheduler.ExecutionResult;

import java.time.Instant;
import java.util.List;

public record RunSummary(
    Instant startedAt,
    Instant finishedAt,
    List<ExecutionResult> results,
    List<String> skipped
) {
    public RunSummary {
        results = results == null ? List.of() : List.copyOf(results);
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }

    public long succeededCount() {
        return results.stream().filter(ExecutionResult::succeeded).count();
    }

    public long failedCount() {
        return results.stream().filter(result -> !result.succeeded()).count();
    }

    public boolean allSucceeded() {
        return failedCount() == 0;
    }

    public int exitCode() {
        return allSucceeded() ? 0 : 1;
    }
}
