package com.signaldesk.pipeline.scheduler;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

public final class BlockingJobHandler implements JobHandler {
    private final Callable<JobOutcome> task;

    public BlockingJobHandler(Callable<JobOutcome> task) {
        this.task = task;
    }

    @Override
    public CompletableFuture<JobOutcome> start(Executor executor) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return task.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, executor);
    }
}
