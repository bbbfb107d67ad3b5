package com.signaldesk.pipeline.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

public class RetryingFetchClient {
    private static final Logger log = LoggerFactory.getLogger(RetryingFetchClient.class);

    private final ProviderPolicy policy;
    private final HttpTransport transport;
    private final SlidingWindowRateLimiter rateLimiter;
    private final ResponseCache cache;
    private final SyntheticResponses syntheticResponses;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Sleeper sleeper;

    public RetryingFetchClient(
        ProviderPolicy policy,
        HttpTransport transport,
        SlidingWindowRateLimiter rateLimiter,
        ResponseCache cache,
        SyntheticResponses syntheticResponses,
        ObjectMapper objectMapper,
        Clock clock,
        Sleeper sleeper
    ) {
        this.policy = policy;
        this.transport = transport;
        this.rateLimiter = rateLimiter;
        this.cache = cache;
        this.syntheticResponses = syntheticResponses;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public FetchResponse fetch(FetchRequest request) {
        String key = request.cacheKey();
        if (request.useCache()) {
            Optional<FetchResponse> cached = cache.get(key);
            if (cached.isPresent()) {
                log.debug("Provider {} served {} from cache", policy.provider(), request.describe());
                return cached.get().asCached();
            }
        }

        int attempt = 0;
        while (true) {
            if (!acquirePermit()) {
                Optional<FetchResponse> substitute = demoSubstitute(request, key);
                if (substitute.isPresent()) {
                    log.info("Provider {} budget exhausted; demo mode served {}", policy.provider(), request.describe());
                    return substitute.get();
                }
                rateLimiter.acquire();
            }
            attempt++;
            try {
                FetchResponse response = executeOnce(request, attempt);
                cache.put(key, response, policy.cacheTtl());
                return response;
            } catch (FetchException e) {
                boolean interrupted = Thread.currentThread().isInterrupted();
                if (!e.failure().isRetryable() || interrupted || attempt >= policy.maxAttempts()) {
                    return recover(request, key, e);
                }
                Duration delay = policy.backoff(attempt - 1);
                if (e instanceof ThrottledException throttled && throttled.cooldown().compareTo(delay) > 0) {
                    delay = throttled.cooldown();
                }
                log.warn(
                    "Provider {} attempt {}/{} failed for {}: failure={} status={} message={}; retrying in {}ms",
                    policy.provider(),
                    attempt,
                    policy.maxAttempts(),
                    request.describe(),
                    e.failure(),
                    e.statusCode(),
                    e.getMessage(),
                    delay.toMillis()
                );
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return recover(request, key, e);
                }
            }
        }
    }

    public JsonNode fetchJson(FetchRequest request) {
        FetchResponse response = fetch(request);
        return response.json(objectMapper);
    }

    public String provider() {
        return policy.provider();
    }

    public SlidingWindowRateLimiter rateLimiter() {
        return rateLimiter;
    }

    private boolean acquirePermit() {
        if (policy.demoMode()) {
            return rateLimiter.tryAcquire();
        }
        rateLimiter.acquire();
        return true;
    }

    private FetchResponse executeOnce(FetchRequest request, int attempt) {
        String url = request.uri().toString();
        TransportResponse response;
        try {
            response = transport.execute(request);
        } catch (HttpTimeoutException e) {
            throw new TransportException(url, "timeout: " + e.getMessage(), attempt, e);
        } catch (IOException e) {
            throw new TransportException(url, "io_error: " + e.getMessage(), attempt, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(url, "interrupted", attempt, e);
        }

        int status = response.statusCode();
        String marker = throttleMarker(response);
        if (status == 429 || marker != null) {
            Duration cooldown = retryAfter(response).orElse(policy.throttleCooldown());
            String reason = marker != null ? "provider_throttle_marker" : "http_429";
            throw new ThrottledException(url, reason, attempt, status, cooldown);
        }
        if (status >= 400 || status < 200) {
            throw new ServerErrorException(url, "http_" + status, attempt, status);
        }
        if (request.expectJson()) {
            validateJson(url, response, attempt);
        }
        String contentType = response.header("Content-Type").orElse(null);
        return new FetchResponse(url, status, response.body(), contentType, clock.instant(), false, false);
    }

    private void validateJson(String url, TransportResponse response, int attempt) {
        byte[] body = response.body();
        if (body == null || body.length == 0) {
            throw new MalformedResponseException(url, "empty_body", attempt, response.statusCode(), null);
        }
        try {
            objectMapper.readTree(body);
        } catch (IOException e) {
            throw new MalformedResponseException(url, "invalid_json: " + e.getMessage(), attempt, response.statusCode(), e);
        }
    }

    private String throttleMarker(TransportResponse response) {
        if (policy.throttleMarkers().isEmpty()) {
            return null;
        }
        String body = response.bodyAsString();
        for (String marker : policy.throttleMarkers()) {
            if (marker != null && !marker.isBlank() && body.contains(marker)) {
                return marker;
            }
        }
        return null;
    }

    private Optional<Duration> retryAfter(TransportResponse response) {
        return response.header("Retry-After").flatMap(value -> {
            try {
                long seconds = Long.parseLong(value.trim());
                return seconds > 0 ? Optional.of(Duration.ofSeconds(seconds)) : Optional.empty();
            } catch (NumberFormatException ignored) {
                // HTTP-date form; fall back to the configured cooldown
                return Optional.empty();
            }
        });
    }

    private FetchResponse recover(FetchRequest request, String key, FetchException failure) {
        if (request.fallbackToCache()) {
            Optional<FetchResponse> cached = cache.get(key);
            if (cached.isPresent()) {
                log.warn(
                    "Provider {} gave up on {} after {} attempts ({}); serving cached response",
                    policy.provider(),
                    request.describe(),
                    failure.attempts(),
                    failure.failure()
                );
                return cached.get().asCached();
            }
        }
        Optional<FetchResponse> substitute = demoSubstitute(request, key);
        if (substitute.isPresent()) {
            log.warn(
                "Provider {} unreachable for {} ({}); demo mode served substitute",
                policy.provider(),
                request.describe(),
                failure.failure()
            );
            return substitute.get();
        }
        log.warn(
            "Provider {} gave up on {} after {} attempts: failure={} status={} message={}",
            policy.provider(),
            request.describe(),
            failure.attempts(),
            failure.failure(),
            failure.statusCode(),
            failure.getMessage()
        );
        throw failure;
    }

    private Optional<FetchResponse> demoSubstitute(FetchRequest request, String key) {
        if (!policy.demoMode()) {
            return Optional.empty();
        }
        Optional<FetchResponse> cached = cache.get(key);
        if (cached.isPresent()) {
            return Optional.of(cached.get().asCached());
        }
        if (syntheticResponses == null) {
            return Optional.empty();
        }
        return syntheticResponses.responseFor(policy.provider(), request);
    }
}
