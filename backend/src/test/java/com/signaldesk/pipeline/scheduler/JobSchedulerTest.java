package com.signaldesk.pipeline.scheduler;

import com.signaldesk.pipeline.config.PipelineProperties;
import com.signaldesk.pipeline.model.JobStatusView;
import com.signaldesk.pipeline.model.RunSummary;
import com.signaldesk.pipeline.model.SchedulerStatusResponse;
import com.signaldesk.pipeline.support.ManualClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobSchedulerTest {
    private static final Instant T0 = Instant.parse("2024-05-10T12:00:00Z");

    private final ManualClock clock = new ManualClock(T0);
    private final ExecutorService jobExecutor = Executors.newFixedThreadPool(4);
    private final PipelineProperties properties = new PipelineProperties();
    private JobScheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.stop();
        }
        jobExecutor.shutdownNow();
    }

    private JobScheduler scheduler(JobRegistry registry) {
        scheduler = new JobScheduler(registry, properties, jobExecutor, clock);
        return scheduler;
    }

    private static JobHandler counting(AtomicInteger counter) {
        return new BlockingJobHandler(() -> {
            counter.incrementAndGet();
            return JobOutcome.success("ok");
        });
    }

    private static void awaitIdle(Job job) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (job.isRunning() && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertThat(job.isRunning()).as("job %s still running", job.name()).isFalse();
    }

    @Test
    void ticksAtZeroTenTwentyDispatchAtZeroAndTwenty() throws Exception {
        JobRegistry registry = new JobRegistry();
        AtomicInteger runs = new AtomicInteger();
        Job job = registry.register("quotes", Duration.ofSeconds(15), counting(runs));
        JobScheduler scheduler = scheduler(registry);

        assertThat(scheduler.tick()).containsExactly("quotes");
        awaitIdle(job);

        clock.advance(Duration.ofSeconds(10));
        assertThat(scheduler.tick()).isEmpty();

        clock.advance(Duration.ofSeconds(10));
        assertThat(scheduler.tick()).containsExactly("quotes");
        awaitIdle(job);

        assertThat(runs.get()).isEqualTo(2);
        assertThat(job.lastRunAt()).isEqualTo(T0.plusSeconds(20));
    }

    @Test
    void runningJobIsNotDispatchedTwice() throws Exception {
        JobRegistry registry = new JobRegistry();
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger runs = new AtomicInteger();
        Job job = registry.register("slow", Duration.ofSeconds(1), new BlockingJobHandler(() -> {
            runs.incrementAndGet();
            release.await();
            return JobOutcome.success("done");
        }));
        JobScheduler scheduler = scheduler(registry);

        assertThat(scheduler.tick()).containsExactly("slow");
        clock.advance(Duration.ofMinutes(5));
        assertThat(scheduler.tick()).isEmpty();
        assertThat(scheduler.dispatch(job, clock.instant())).isEmpty();
        assertThatThrownBy(() -> scheduler.runOneNow("slow")).isInstanceOf(JobAlreadyRunningException.class);

        release.countDown();
        awaitIdle(job);
        assertThat(runs.get()).isEqualTo(1);
    }

    @Test
    void failingJobDoesNotAffectSiblingsOrLaterTicks() throws Exception {
        JobRegistry registry = new JobRegistry();
        AtomicInteger healthyRuns = new AtomicInteger();
        Job broken = registry.register("broken", Duration.ofSeconds(10), new BlockingJobHandler(() -> {
            throw new IllegalStateException("provider exploded");
        }));
        Job healthy = registry.register("healthy", Duration.ofSeconds(10), counting(healthyRuns));
        JobScheduler scheduler = scheduler(registry);

        assertThat(scheduler.tick()).containsExactly("broken", "healthy");
        awaitIdle(broken);
        awaitIdle(healthy);

        clock.advance(Duration.ofSeconds(10));
        assertThat(scheduler.tick()).containsExactly("broken", "healthy");
        awaitIdle(broken);
        awaitIdle(healthy);

        assertThat(healthyRuns.get()).isEqualTo(2);
        List<ExecutionResult> brokenResults = scheduler.history().forJob("broken");
        assertThat(brokenResults).hasSize(2).allSatisfy(result -> {
            assertThat(result.succeeded()).isFalse();
            assertThat(result.error()).contains("provider exploded");
        });
        assertThat(broken.lastRunAt()).isEqualTo(T0.plusSeconds(10));
    }

    @Test
    void handlerThatThrowsSynchronouslyIsContained() {
        JobRegistry registry = new JobRegistry();
        registry.register("eager", Duration.ofSeconds(10), executor -> {
            throw new IllegalArgumentException("bad wiring");
        });
        JobScheduler scheduler = scheduler(registry);

        ExecutionResult result = scheduler.runOneNow("eager");

        assertThat(result.succeeded()).isFalse();
        assertThat(result.error()).contains("bad wiring");
        assertThat(registry.find("eager").orElseThrow().isRunning()).isFalse();
    }

    @Test
    void runAllNowReportsOneFailureAmongFive() {
        JobRegistry registry = new JobRegistry();
        AtomicInteger runs = new AtomicInteger();
        for (int i = 1; i <= 4; i++) {
            registry.register("job-" + i, Duration.ofHours(1), counting(runs));
        }
        registry.register("job-5", Duration.ofHours(1), new BlockingJobHandler(() -> {
            throw new JobExecutionException("all units failed");
        }));
        JobScheduler scheduler = scheduler(registry);

        RunSummary summary = scheduler.runAllNow();

        assertThat(summary.results()).hasSize(5);
        assertThat(summary.succeededCount()).isEqualTo(4);
        assertThat(summary.failedCount()).isEqualTo(1);
        assertThat(summary.exitCode()).isNotZero();
        assertThat(runs.get()).isEqualTo(4);
    }

    @Test
    void runAllNowSkipsJobsAlreadyInFlight() throws Exception {
        JobRegistry registry = new JobRegistry();
        CountDownLatch release = new CountDownLatch(1);
        registry.register("busy", Duration.ofHours(1), new BlockingJobHandler(() -> {
            release.await();
            return JobOutcome.success("done");
        }));
        Job idle = registry.register("idle", Duration.ofHours(1), counting(new AtomicInteger()));
        JobScheduler scheduler = scheduler(registry);
        scheduler.tick();
        awaitIdle(idle);

        RunSummary summary;
        try {
            summary = scheduler.runAllNow();
        } finally {
            release.countDown();
        }

        assertThat(summary.skipped()).containsExactly("busy");
        assertThat(summary.results()).extracting(ExecutionResult::jobName).containsExactly("idle");
    }

    @Test
    void runOneNowMatchesCaseInsensitivelyAndRejectsUnknownNames() {
        JobRegistry registry = new JobRegistry();
        registry.register("financial-news", Duration.ofHours(3), new AsyncJobHandler(
            () -> CompletableFuture.completedFuture(JobOutcome.success("stored=3"))
        ));
        JobScheduler scheduler = scheduler(registry);

        ExecutionResult result = scheduler.runOneNow("FINANCIAL-NEWS");

        assertThat(result.jobName()).isEqualTo("financial-news");
        assertThat(result.succeeded()).isTrue();
        assertThatThrownBy(() -> scheduler.runOneNow("nope")).isInstanceOf(UnknownJobException.class);
    }

    @Test
    void asyncHandlerFailureIsRecorded() {
        JobRegistry registry = new JobRegistry();
        registry.register("feeds", Duration.ofHours(3), new AsyncJobHandler(
            () -> CompletableFuture.failedFuture(new JobExecutionException("all feeds failed"))
        ));
        JobScheduler scheduler = scheduler(registry);

        ExecutionResult result = scheduler.runOneNow("feeds");

        assertThat(result.succeeded()).isFalse();
        assertThat(result.error()).isEqualTo("JobExecutionException: all feeds failed");
    }

    @Test
    void failedOutcomeIsRecordedAsFailure() {
        JobRegistry registry = new JobRegistry();
        registry.register("partial", Duration.ofHours(1), new BlockingJobHandler(() -> JobOutcome.failure("nothing stored")));
        JobScheduler scheduler = scheduler(registry);

        ExecutionResult result = scheduler.runOneNow("partial");

        assertThat(result.succeeded()).isFalse();
        assertThat(result.error()).isEqualTo("nothing stored");
    }

    @Test
    void jobTimeoutReportsFailureButKeepsJobExclusiveUntilItReturns() throws Exception {
        properties.getScheduler().setJobTimeout(Duration.ofMillis(100));
        JobRegistry registry = new JobRegistry();
        CountDownLatch release = new CountDownLatch(1);
        Job job = registry.register("hung", Duration.ofSeconds(1), new BlockingJobHandler(() -> {
            release.await();
            return JobOutcome.success("late");
        }));
        JobScheduler scheduler = scheduler(registry);

        ExecutionResult result = scheduler.runOneNow("hung");

        assertThat(result.succeeded()).isFalse();
        assertThat(result.error()).startsWith("timed out after");
        assertThat(job.isRunning()).isTrue();

        release.countDown();
        awaitIdle(job);
        assertThat(scheduler.history().forJob("hung")).hasSize(1);
    }

    @Test
    void startRunsEveryJobOnFirstTickAndStopReturnsToStopped() throws Exception {
        properties.getScheduler().setTickInterval(Duration.ofMillis(20));
        JobRegistry registry = new JobRegistry();
        AtomicInteger runs = new AtomicInteger();
        registry.register("a", Duration.ofHours(1), counting(runs));
        registry.register("b", Duration.ofHours(1), counting(runs));
        JobScheduler scheduler = scheduler(registry);

        scheduler.start();
        assertThat(scheduler.state()).isEqualTo(SchedulerState.RUNNING);
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (scheduler.history().size() < 2 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        scheduler.stop();

        assertThat(scheduler.state()).isEqualTo(SchedulerState.STOPPED);
        assertThat(runs.get()).isEqualTo(2);
        SchedulerStatusResponse status = scheduler.status();
        assertThat(status.jobs()).extracting(JobStatusView::name).containsExactly("a", "b");
        assertThat(status.recentResults()).hasSize(2);
    }
}
