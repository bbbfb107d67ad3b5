package com.signaldesk.pipeline.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class SyntheticResponses {
    private static final Logger log = LoggerFactory.getLogger(SyntheticResponses.class);
    private static final byte[] MISSING = new byte[0];

    private final String resourceRoot;
    private final Clock clock;
    private final Map<String, byte[]> payloads = new ConcurrentHashMap<>();

    public SyntheticResponses(String resourceRoot, Clock clock) {
        this.resourceRoot = resourceRoot;
        this.clock = clock;
    }

    public Optional<FetchResponse> responseFor(String provider, FetchRequest request) {
        byte[] payload = payloads.computeIfAbsent(provider, this::load);
        if (payload == MISSING) {
            return Optional.empty();
        }
        return Optional.of(new FetchResponse(
            request.uri().toString(),
            200,
            payload,
            "application/json",
            clock.instant(),
            false,
            true
        ));
    }

    private byte[] load(String provider) {
        String path = resourceRoot + "/" + provider + ".json";
        try (InputStream in = SyntheticResponses.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                log.debug("No synthetic payload at classpath:{}", path);
                return MISSING;
            }
            return in.readAllBytes();
        } catch (IOException e) {
            log.warn("Failed to read synthetic payload classpath:{}", path, e);
            return MISSING;
        }
    }
}
