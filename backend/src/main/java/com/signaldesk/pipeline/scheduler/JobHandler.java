package com.signaldesk.pipeline.scheduler;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Unit of work behind a {@link Job}. Implementations: {@link BlockingJobHandler}, {@link AsyncJobHandler}.
 * The scheduler only ever sees the returned future, so dispatch is the same for both.
 */
public interface JobHandler {

    CompletableFuture<JobOutcome> start(Executor executor);
}
