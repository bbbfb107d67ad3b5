package com.signaldesk.pipeline.scheduler;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

public final class AsyncJobHandler implements JobHandler {
    private final Supplier<? extends CompletionStage<JobOutcome>> task;

    public AsyncJobHandler(Supplier<? extends CompletionStage<JobOutcome>> task) {
        this.task = task;
    }

    @Override
    public CompletableFuture<JobOutcome> start(Executor executor) {
        return CompletableFuture
            .<CompletionStage<JobOutcome>>supplyAsync(task::get, executor)
            .thenCompose(stage -> stage);
    }
}
