package com.signaldesk.pipeline.service;

import com.signaldesk.pipeline.config.PipelineProperties;
import com.signaldesk.pipeline.model.RunSummary;
import com.signaldesk.pipeline.scheduler.ExecutionResult;
import com.signaldesk.pipeline.scheduler.JobScheduler;
import com.signaldesk.pipeline.scheduler.UnknownJobException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.OptionalInt;

@Component
public class PipelineCliRunner implements ApplicationRunner {
    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE = 2;
    private static final Logger log = LoggerFactory.getLogger(PipelineCliRunner.class);

    private final PipelineProperties properties;
    private final JobScheduler scheduler;
    private final ConfigurableApplicationContext applicationContext;

    public PipelineCliRunner(
        PipelineProperties properties,
        JobScheduler scheduler,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.scheduler = scheduler;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        OptionalInt exitCode = execute();
        if (exitCode.isPresent() && properties.getCli().isExitAfterRun()) {
            int code = exitCode.getAsInt();
            int exit = SpringApplication.exit(applicationContext, () -> code);
            System.exit(exit);
        }
    }

    /**
     * @return the exit code for one-shot modes, empty when the process should keep running
     */
    OptionalInt execute() {
        String mode = properties.getCli().getMode();
        if (properties.isDemoMode()) {
            log.info("Demo mode enabled: exhausted or unreachable providers serve cached or synthetic data");
        }
        switch (mode) {
            case "none":
                return OptionalInt.empty();
            case "scheduler":
                scheduler.start();
                return OptionalInt.empty();
            case "once":
                return OptionalInt.of(runOnce());
            case "job":
                return OptionalInt.of(runJob(properties.getCli().getJob()));
            default:
                log.error("Unknown pipeline.cli.mode '{}'; expected scheduler, once, job or none", mode);
                return OptionalInt.of(EXIT_USAGE);
        }
    }

    private int runOnce() {
        RunSummary summary = scheduler.runAllNow();
        log.info("=== Pipeline run summary ===");
        for (ExecutionResult result : summary.results()) {
            log.info("{}: {}", result.jobName(), result.status());
        }
        log.info(
            "Completed {}/{} jobs successfully",
            summary.succeededCount(),
            summary.results().size()
        );
        return summary.exitCode();
    }

    private int runJob(String name) {
        if (name == null || name.isBlank()) {
            log.error("pipeline.cli.job is required in job mode. Available jobs: {}", scheduler.registry().names());
            return EXIT_USAGE;
        }
        ExecutionResult result;
        try {
            result = scheduler.runOneNow(name);
        } catch (UnknownJobException e) {
            log.error("Unknown job '{}'. Available jobs: {}", name, scheduler.registry().names());
            return EXIT_USAGE;
        }
        if (result.succeeded()) {
            log.info("{}: PASS", result.jobName());
            return EXIT_OK;
        }
        log.error("{}: FAIL {}", result.jobName(), result.error());
        return EXIT_FAILED;
    }
}
