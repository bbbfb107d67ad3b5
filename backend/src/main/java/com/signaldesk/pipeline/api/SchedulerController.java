package com.signaldesk.pipeline.api;

import com.signaldesk.pipeline.model.RunSummary;
import com.signaldesk.pipeline.model.SchedulerStatusResponse;
import com.signaldesk.pipeline.scheduler.ExecutionResult;
import com.signaldesk.pipeline.scheduler.JobScheduler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/scheduler")
public class SchedulerController {
    private final JobScheduler scheduler;

    public SchedulerController(JobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @PostMapping("/start")
    public SchedulerStatusResponse start() {
        scheduler.start();
        return scheduler.status();
    }

    @PostMapping("/stop")
    public SchedulerStatusResponse stop() {
        scheduler.stop();
        return scheduler.status();
    }

    @GetMapping("/status")
    public SchedulerStatusResponse status() {
        return scheduler.status();
    }

    @PostMapping("/run-all")
    public RunSummary runAll() {
        return scheduler.runAllNow();
    }

    @PostMapping("/jobs/{name}/run")
    public ExecutionResult runJob(@PathVariable("name") String name) {
        return scheduler.runOneNow(name);
    }
}
