package com.signaldesk.pipeline.scheduler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public class ExecutionHistory {
    private final int capacity;
    private final Deque<ExecutionResult> results = new ArrayDeque<>();

    public ExecutionHistory(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    public synchronized void append(ExecutionResult result) {
        if (result == null) {
            return;
        }
        if (results.size() >= capacity) {
            results.pollFirst();
        }
        results.addLast(result);
    }

    public synchronized List<ExecutionResult> recent(int limit) {
        List<ExecutionResult> all = new ArrayList<>(results);
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return List.copyOf(all.subList(from, all.size()));
    }

    public synchronized List<ExecutionResult> forJob(String jobName) {
        return results.stream()
            .filter(result -> result.jobName().equals(jobName))
            .toList();
    }

    public synchronized int size() {
        return results.size();
    }
}
