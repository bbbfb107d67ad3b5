package com.signaldesk.pipeline.scheduler;

import com.signaldesk.pipeline.config.PipelineProperties;
import com.signaldesk.pipeline.model.JobStatusView;
import com.signaldesk.pipeline.model.RunSummary;
import com.signaldesk.pipeline.model.SchedulerStatusResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

@Service
public class JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);
    private static final int STATUS_RESULT_LIMIT = 20;

    private final JobRegistry registry;
    private final ExecutorService jobExecutor;
    private final Clock clock;
    private final Duration tickInterval;
    private final Duration jobTimeout;
    private final boolean demoMode;
    private final ExecutionHistory history;
    private final Object lifecycleLock = new Object();

    private ExecutorService tickExecutor;
    private volatile AtomicBoolean activeLoop = new AtomicBoolean(false);

    public JobScheduler(
        JobRegistry registry,
        PipelineProperties properties,
        @Qualifier("jobExecutor") ExecutorService jobExecutor,
        Clock clock
    ) {
        this.registry = registry;
        this.jobExecutor = jobExecutor;
        this.clock = clock;
        this.tickInterval = properties.getScheduler().getTickInterval();
        this.jobTimeout = properties.getScheduler().getJobTimeout();
        this.demoMode = properties.isDemoMode();
        this.history = new ExecutionHistory(properties.getScheduler().getHistorySize());
    }

    /**
     * Enters RUNNING and starts the tick loop. The first tick fires immediately, so jobs that
     * have never run are dispatched without waiting a cadence.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (activeLoop.get()) {
                log.warn("Scheduler is already running");
                return;
            }
            AtomicBoolean loop = new AtomicBoolean(true);
            activeLoop = loop;
            tickExecutor = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("pipeline-scheduler-tick");
                return thread;
            });
            log.info(
                "Starting scheduler with {} jobs tickInterval={}ms jobTimeout={}",
                registry.size(),
                tickInterval.toMillis(),
                jobTimeout == null ? "none" : jobTimeout
            );
            tickExecutor.submit(() -> tickLoop(loop));
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!activeLoop.get()) {
                return;
            }
            log.info("Stopping scheduler");
            activeLoop.set(false);
            if (tickExecutor != null) {
                tickExecutor.shutdownNow();
                tickExecutor = null;
            }
        }
    }

    public SchedulerState state() {
        return activeLoop.get() ? SchedulerState.RUNNING : SchedulerState.STOPPED;
    }

    public boolean isRunning() {
        return state() == SchedulerState.RUNNING;
    }

    public List<String> tick() {
        Instant now = clock.instant();
        List<Job> due;
        try {
            due = registry.due(now);
        } catch (RuntimeException e) {
            log.warn("Failed to compute due jobs", e);
            return List.of();
        }
        List<String> dispatched = new ArrayList<>();
        for (Job job : due) {
            try {
                if (dispatch(job, now).isPresent()) {
                    dispatched.add(job.name());
                }
            } catch (RuntimeException e) {
                log.warn("Failed to dispatch job {}", job.name(), e);
            }
        }
        return dispatched;
    }

    public RunSummary runAllNow() {
        Instant startedAt = clock.instant();
        log.info("Running all {} jobs now", registry.size());
        Map<String, CompletableFuture<ExecutionResult>> pending = new LinkedHashMap<>();
        List<String> skipped = new ArrayList<>();
        for (Job job : registry.all()) {
            Optional<CompletableFuture<ExecutionResult>> execution = dispatch(job, clock.instant());
            if (execution.isPresent()) {
                pending.put(job.name(), execution.get());
            } else {
                skipped.add(job.name());
            }
        }
        CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0])).join();
        List<ExecutionResult> results = pending.values().stream()
            .map(CompletableFuture::join)
            .toList();
        RunSummary summary = new RunSummary(startedAt, clock.instant(), results, skipped);
        logSummary(summary);
        return summary;
    }

    public ExecutionResult runOneNow(String name) {
        Job job = registry.find(name).orElseThrow(() -> new UnknownJobException(name));
        CompletableFuture<ExecutionResult> execution = dispatch(job, clock.instant())
            .orElseThrow(() -> new JobAlreadyRunningException(job.name()));
        return execution.join();
    }

    public SchedulerStatusResponse status() {
        List<JobStatusView> jobs = registry.all().stream()
            .map(job -> new JobStatusView(job.name(), job.cadence(), job.lastRunAt(), job.nextDueAt(), job.isRunning()))
            .toList();
        return new SchedulerStatusResponse(state(), demoMode, jobs, history.recent(STATUS_RESULT_LIMIT));
    }

    public ExecutionHistory history() {
        return history;
    }

    public JobRegistry registry() {
        return registry;
    }

    @PreDestroy
    public void shutdown() {
        stop();
        jobExecutor.shutdown();
        try {
            if (!jobExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Jobs still running at shutdown; interrupting");
                jobExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            jobExecutor.shutdownNow();
        }
    }

    Optional<CompletableFuture<ExecutionResult>> dispatch(Job job, Instant startedAt) {
        if (!job.markRunning()) {
            log.debug("Skipping job {}: previous execution still running", job.name());
            return Optional.empty();
        }
        log.info("Dispatching job {}", job.name());

        CompletableFuture<JobOutcome> execution;
        try {
            execution = job.handler().start(jobExecutor);
        } catch (RuntimeException e) {
            execution = CompletableFuture.failedFuture(e);
        }
        if (execution == null) {
            execution = CompletableFuture.failedFuture(new IllegalStateException("handler returned no completion"));
        }

        CompletableFuture<ExecutionResult> result = new CompletableFuture<>();
        AtomicBoolean reported = new AtomicBoolean(false);
        execution.whenComplete((outcome, error) -> {
            ExecutionResult executionResult = toResult(job, startedAt, outcome, error);
            boolean first = reported.compareAndSet(false, true);
            try {
                if (first) {
                    record(executionResult, error);
                } else {
                    log.info(
                        "Job {} finished after its timeout was reported: {}",
                        job.name(),
                        executionResult.status()
                    );
                }
            } finally {
                job.markDone(executionResult);
                if (first) {
                    result.complete(executionResult);
                }
            }
        });

        if (jobTimeout != null) {
            CompletableFuture<JobOutcome> watched = execution;
            CompletableFuture.delayedExecutor(jobTimeout.toMillis(), TimeUnit.MILLISECONDS).execute(() -> {
                if (!watched.isDone() && reported.compareAndSet(false, true)) {
                    ExecutionResult timedOut = new ExecutionResult(
                        job.name(),
                        startedAt,
                        clock.instant(),
                        false,
                        "timed out after " + jobTimeout
                    );
                    record(timedOut, null);
                    log.warn("Job {} exceeded {}; it stays marked running until the handler returns", job.name(), jobTimeout);
                    result.complete(timedOut);
                }
            });
        }
        return Optional.of(result);
    }

    private ExecutionResult toResult(Job job, Instant startedAt, JobOutcome outcome, Throwable error) {
        Instant finishedAt = clock.instant();
        if (error != null) {
            Throwable cause = unwrap(error);
            String message = cause.getClass().getSimpleName() + (cause.getMessage() == null ? "" : ": " + cause.getMessage());
            return new ExecutionResult(job.name(), startedAt, finishedAt, false, message);
        }
        if (outcome == null) {
            return new ExecutionResult(job.name(), startedAt, finishedAt, false, "handler returned no outcome");
        }
        return new ExecutionResult(
            job.name(),
            startedAt,
            finishedAt,
            outcome.succeeded(),
            outcome.succeeded() ? null : outcome.detail()
        );
    }

    private void record(ExecutionResult result, Throwable error) {
        history.append(result);
        if (result.succeeded()) {
            log.info("Job {} PASS in {}ms", result.jobName(), result.duration().toMillis());
        } else if (error != null) {
            log.warn("Job {} FAIL in {}ms: {}", result.jobName(), result.duration().toMillis(), result.error(), unwrap(error));
        } else {
            log.warn("Job {} FAIL in {}ms: {}", result.jobName(), result.duration().toMillis(), result.error());
        }
    }

    private void tickLoop(AtomicBoolean loop) {
        log.info("Scheduler loop started");
        try {
            while (loop.get() && !Thread.currentThread().isInterrupted()) {
                tick();
                try {
                    TimeUnit.MILLISECONDS.sleep(tickInterval.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        } catch (RuntimeException e) {
            log.error("Scheduler loop failed; scheduler stopped", e);
        } finally {
            loop.set(false);
            log.info("Scheduler loop ended");
        }
    }

    private void logSummary(RunSummary summary) {
        log.info(
            "Run finished: {} passed, {} failed, {} skipped",
            summary.succeededCount(),
            summary.failedCount(),
            summary.skipped().size()
        );
        for (ExecutionResult result : summary.results()) {
            if (result.succeeded()) {
                log.info("{}: PASS ({}ms)", result.jobName(), result.duration().toMillis());
            } else {
                log.info("{}: FAIL ({}ms) {}", result.jobName(), result.duration().toMillis(), result.error());
            }
        }
        for (String name : summary.skipped()) {
            log.info("{}: SKIPPED (already running)", name);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
