package com.signaldesk.pipeline.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

public final class Job {
    private final String name;
    private final Duration cadence;
    private final JobHandler handler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Instant lastRunAt;

    Job(String name, Duration cadence, JobHandler handler) {
        this.name = name;
        this.cadence = cadence;
        this.handler = handler;
    }

    public String name() {
        return name;
    }

    public Duration cadence() {
        return cadence;
    }

    public JobHandler handler() {
        return handler;
    }

    public Instant lastRunAt() {
        return lastRunAt;
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isDue(Instant now) {
        if (running.get()) {
            return false;
        }
        Instant last = lastRunAt;
        return last == null || Duration.between(last, now).compareTo(cadence) >= 0;
    }

    /**
     * Earliest instant this job becomes due, or {@code null} if it has never run.
     */
    public Instant nextDueAt() {
        Instant last = lastRunAt;
        return last == null ? null : last.plus(cadence);
    }

    public boolean markRunning() {
        return running.compareAndSet(false, true);
    }

    public void markDone(ExecutionResult result) {
        if (result != null && result.startedAt() != null) {
            lastRunAt = result.startedAt();
        }
        running.set(false);
    }

    @Override
    public String toString() {
        return "Job{" + name + ", cadence=" + cadence + "}";
    }
}
