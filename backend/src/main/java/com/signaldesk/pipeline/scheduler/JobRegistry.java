package com.signaldesk.pipeline.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public class JobRegistry {
    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private volatile boolean sealed;

    public synchronized Job register(String name, Duration cadence, JobHandler handler) {
        if (sealed) {
            throw new IllegalStateException("Job registry is sealed; cannot register " + name);
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("job name is required");
        }
        if (cadence == null || cadence.isZero() || cadence.isNegative()) {
            throw new IllegalArgumentException("cadence must be positive for job " + name);
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler is required for job " + name);
        }
        String key = name.trim();
        if (jobs.containsKey(key)) {
            throw new IllegalArgumentException("Duplicate job name: " + key);
        }
        Job job = new Job(key, cadence, handler);
        jobs.put(key, job);
        return job;
    }

    public synchronized void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    public List<Job> due(Instant now) {
        List<Job> due = new ArrayList<>();
        for (Job job : all()) {
            if (job.isDue(now)) {
                due.add(job);
            }
        }
        return due;
    }

    public Optional<Job> find(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String wanted = name.trim();
        synchronized (this) {
            Job exact = jobs.get(wanted);
            if (exact != null) {
                return Optional.of(exact);
            }
            String lower = wanted.toLowerCase(Locale.ROOT);
            return jobs.values().stream()
                .filter(job -> job.name().toLowerCase(Locale.ROOT).equals(lower))
                .findFirst();
        }
    }

    public synchronized List<Job> all() {
        return Collections.unmodifiableList(new ArrayList<>(jobs.values()));
    }

    public synchronized List<String> names() {
        return List.copyOf(jobs.keySet());
    }

    public synchronized int size() {
        return jobs.size();
    }
}
