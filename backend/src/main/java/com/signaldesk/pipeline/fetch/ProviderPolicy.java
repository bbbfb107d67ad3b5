package com.signaldesk.pipeline.fetch;

import java.time.Duration;
import java.util.List;

public record ProviderPolicy(
    String provider,
    int maxAttempts,
    Duration baseDelay,
    Duration maxDelay,
    Duration cacheTtl,
    List<String> throttleMarkers,
    Duration throttleCooldown,
    boolean demoMode
) {
    public ProviderPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        baseDelay = baseDelay == null ? Duration.ZERO : baseDelay;
        maxDelay = maxDelay == null ? Duration.ZERO : maxDelay;
        cacheTtl = cacheTtl == null ? Duration.ZERO : cacheTtl;
        throttleMarkers = throttleMarkers == null ? List.of() : List.copyOf(throttleMarkers);
        throttleCooldown = throttleCooldown == null ? Duration.ZERO : throttleCooldown;
    }

    /**
     * {@code min(maxDelay, baseDelay * 2^attempt)} for a zero-based attempt.
     */
    public Duration backoff(int attempt) {
        long base = baseDelay.toMillis();
        if (base <= 0) {
            return Duration.ZERO;
        }
        long exponential = base * (1L << Math.min(Math.max(0, attempt), 20));
        long max = maxDelay.toMillis();
        if (max > 0) {
            exponential = Math.min(exponential, max);
        }
        return Duration.ofMillis(exponential);
    }
}
