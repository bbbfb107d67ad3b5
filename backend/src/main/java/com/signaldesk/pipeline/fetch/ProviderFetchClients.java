package com.signaldesk.pipeline.fetch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.signaldesk.pipeline.config.PipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;

@Component
public class ProviderFetchClients {
    private static final Logger log = LoggerFactory.getLogger(ProviderFetchClients.class);

    private final Map<String, RetryingFetchClient> clients;

    public ProviderFetchClients(
        PipelineProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        SyntheticResponses syntheticResponses = new SyntheticResponses("demo", clock);
        Map<String, RetryingFetchClient> built = new LinkedHashMap<>();
        for (Map.Entry<String, PipelineProperties.Provider> entry : properties.getProviders().entrySet()) {
            String name = entry.getKey();
            PipelineProperties.Provider provider = entry.getValue();
            HttpTransport transport = new JdkHttpTransport(
                properties.getUserAgent(),
                provider.getRequestTimeoutSeconds(),
                provider.getHeaders(),
                httpExecutor
            );
            built.put(name, create(name, provider, properties, transport, syntheticResponses, objectMapper, clock, Sleeper.SYSTEM));
            log.info(
                "Provider {} budget={} calls/{}s cacheTtl={} demoMode={}",
                name,
                provider.getCallsPerWindow(),
                provider.getWindowSeconds(),
                provider.getCacheTtl(),
                properties.isDemoMode()
            );
        }
        this.clients = Collections.unmodifiableMap(built);
    }

    public static RetryingFetchClient create(
        String name,
        PipelineProperties.Provider provider,
        PipelineProperties properties,
        HttpTransport transport,
        SyntheticResponses syntheticResponses,
        ObjectMapper objectMapper,
        Clock clock,
        Sleeper sleeper
    ) {
        ProviderPolicy policy = new ProviderPolicy(
            name,
            properties.getRetry().getMaxAttempts(),
            properties.getRetry().getBaseDelay(),
            properties.getRetry().getMaxDelay(),
            provider.getCacheTtl(),
            provider.getThrottleMarkers(),
            provider.getThrottleCooldown(),
            properties.isDemoMode()
        );
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(
            name,
            provider.getCallsPerWindow(),
            Duration.ofSeconds(provider.getWindowSeconds()),
            clock,
            sleeper
        );
        ResponseCache cache = new ResponseCache(name, clock, ResponseCache.DEFAULT_MAXIMUM_SIZE);
        return new RetryingFetchClient(policy, transport, limiter, cache, syntheticResponses, objectMapper, clock, sleeper);
    }

    public RetryingFetchClient client(String provider) {
        RetryingFetchClient client = clients.get(provider);
        if (client == null) {
            throw new IllegalStateException("No fetch client for provider " + provider);
        }
        return client;
    }
}
