package com.signaldesk.pipeline.fetch;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

public class SlidingWindowRateLimiter {
    private final String name;
    private final int limit;
    private final Duration window;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Deque<Instant> windowCalls = new ArrayDeque<>();
    private final Object lock = new Object();

    public SlidingWindowRateLimiter(String name, int limit, Duration window, Clock clock, Sleeper sleeper) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.name = name;
        this.limit = limit;
        this.window = window;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public void acquire() {
        while (true) {
            Duration wait;
            synchronized (lock) {
                Instant now = clock.instant();
                evictExpired(now);
                if (windowCalls.size() < limit) {
                    windowCalls.addLast(now);
                    return;
                }
                wait = window.minus(Duration.between(windowCalls.peekFirst(), now));
            }
            if (wait.isNegative() || wait.isZero()) {
                continue;
            }
            try {
                sleeper.sleep(wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Rate limiter " + name + " interrupted", e);
            }
        }
    }

    // records the call only when the budget has room now
    public boolean tryAcquire() {
        synchronized (lock) {
            Instant now = clock.instant();
            evictExpired(now);
            if (windowCalls.size() < limit) {
                windowCalls.addLast(now);
                return true;
            }
            return false;
        }
    }

    public int callsInWindow() {
        synchronized (lock) {
            evictExpired(clock.instant());
            return windowCalls.size();
        }
    }

    public String name() {
        return name;
    }

    public int limit() {
        return limit;
    }

    public Duration window() {
        return window;
    }

    private void evictExpired(Instant now) {
        Instant cutoff = now.minus(window);
        while (!windowCalls.isEmpty() && !windowCalls.peekFirst().isAfter(cutoff)) {
            windowCalls.pollFirst();
        }
    }
}
