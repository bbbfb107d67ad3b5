package com.signaldesk.pipeline.fetch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.signaldesk.pipeline.support.ManualClock;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryingFetchClientTest {
    private static final Instant START = Instant.parse("2024-05-10T12:00:00Z");

    private final ManualClock clock = new ManualClock(START);
    private final List<Duration> sleeps = new ArrayList<>();
    private final Sleeper sleeper = duration -> {
        sleeps.add(duration);
        clock.advance(duration);
    };
    private final ScriptedTransport transport = new ScriptedTransport();
    private final ObjectMapper objectMapper = new ObjectMapper();

    private RetryingFetchClient client(int limit, List<String> markers, boolean demoMode) {
        ProviderPolicy policy = new ProviderPolicy(
            "fred",
            3,
            Duration.ofSeconds(2),
            Duration.ofSeconds(10),
            Duration.ofMinutes(5),
            markers,
            Duration.ofSeconds(30),
            demoMode
        );
        return new RetryingFetchClient(
            policy,
            transport,
            new SlidingWindowRateLimiter("fred", limit, Duration.ofSeconds(60), clock, sleeper),
            new ResponseCache("fred", clock, 100),
            new SyntheticResponses("demo", clock),
            objectMapper,
            clock,
            sleeper
        );
    }

    private RetryingFetchClient client() {
        return client(100, List.of(), false);
    }

    private static FetchRequest request(String series) {
        return FetchRequest.get("https://api.example.com/series")
            .param("series_id", series)
            .param("api_key", "secret")
            .expectJson(true)
            .build();
    }

    @Test
    void identicalRequestWithinTtlIsServedFromCache() {
        transport.respond(200, "{\"ok\":true}");
        RetryingFetchClient client = client();

        FetchResponse first = client.fetch(request("GDP"));
        clock.advance(Duration.ofMinutes(1));
        FetchResponse second = client.fetch(request("GDP"));

        assertThat(transport.calls).isEqualTo(1);
        assertThat(first.fromCache()).isFalse();
        assertThat(second.fromCache()).isTrue();
        assertThat(second.bodyAsString()).isEqualTo("{\"ok\":true}");
        assertThat(client.rateLimiter().callsInWindow()).isEqualTo(1);
    }

    @Test
    void parameterOrderDoesNotSplitTheCache() {
        transport.respond(200, "{}");
        RetryingFetchClient client = client();

        client.fetch(FetchRequest.get("https://api.example.com/q").param("a", "1").param("b", "2").build());
        client.fetch(FetchRequest.get("https://api.example.com/q").param("b", "2").param("a", "1").build());

        assertThat(transport.calls).isEqualTo(1);
    }

    @Test
    void postBodiesWithEqualHashCodesGetSeparateCacheEntries() {
        transport.respond(200, "echo:Aa");
        transport.respond(200, "echo:BB");
        RetryingFetchClient client = client();
        assertThat("Aa".hashCode()).isEqualTo("BB".hashCode());

        FetchResponse first = client.fetch(FetchRequest.post("https://api.example.com/search").jsonBody("Aa").build());
        FetchResponse second = client.fetch(FetchRequest.post("https://api.example.com/search").jsonBody("BB").build());

        assertThat(first.bodyAsString()).isEqualTo("echo:Aa");
        assertThat(second.bodyAsString()).isEqualTo("echo:BB");
        assertThat(transport.calls).isEqualTo(2);
    }

    @Test
    void sameBodyWithDifferentContentTypeIsNotShared() {
        FetchRequest json = FetchRequest.post("https://api.example.com/search").jsonBody("q=1").build();
        FetchRequest form = FetchRequest.post("https://api.example.com/search").formBody("q=1").build();

        assertThat(json.cacheKey()).isNotEqualTo(form.cacheKey());
        assertThat(json.cacheKey()).isEqualTo(FetchRequest.post("https://api.example.com/search").jsonBody("q=1").build().cacheKey());
    }

    @Test
    void retryableFailureIsAttemptedExactlyMaxAttemptsTimes() {
        transport.fail(new IOException("connection reset"));
        transport.fail(new HttpTimeoutException("timed out"));
        transport.fail(new IOException("connection reset"));
        RetryingFetchClient client = client();

        assertThatThrownBy(() -> client.fetch(request("GDP")))
            .isInstanceOf(TransportException.class)
            .satisfies(error -> {
                FetchException fetchError = (FetchException) error;
                assertThat(fetchError.failure()).isEqualTo(FetchFailure.TRANSPORT);
                assertThat(fetchError.attempts()).isEqualTo(3);
            });
        assertThat(transport.calls).isEqualTo(3);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(4));
    }

    @Test
    void serverErrorRecoversOnRetry() {
        transport.respond(503, "unavailable");
        transport.respond(200, "{\"value\":1}");

        FetchResponse response = client().fetch(request("GDP"));

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(transport.calls).isEqualTo(2);
    }

    @Test
    void exhaustedServerErrorsCarryLastStatus() {
        transport.respond(500, "boom");
        transport.respond(502, "boom");
        transport.respond(504, "boom");

        assertThatThrownBy(() -> client().fetch(request("GDP")))
            .isInstanceOf(ServerErrorException.class)
            .satisfies(error -> assertThat(((FetchException) error).statusCode()).isEqualTo(504));
    }

    @Test
    void throttleHonoursRetryAfterHeader() {
        transport.respond(new TransportResponse(429, Map.of("Retry-After", List.of("7")), new byte[0]));
        transport.respond(200, "{}");

        client().fetch(request("GDP"));

        assertThat(sleeps).containsExactly(Duration.ofSeconds(7));
        assertThat(transport.calls).isEqualTo(2);
    }

    @Test
    void throttleMarkerInBodyUsesProviderCooldown() {
        transport.respond(200, "{\"Note\":\"Our standard API rate limit is 25 requests per day.\"}");
        transport.respond(200, "{\"Global Quote\":{}}");

        FetchResponse response = client(100, List.of("Our standard API rate limit"), false).fetch(request("GDP"));

        assertThat(response.bodyAsString()).contains("Global Quote");
        assertThat(sleeps).containsExactly(Duration.ofSeconds(30));
    }

    @Test
    void malformedJsonIsNotRetried() {
        transport.respond(200, "<html>not json</html>");
        transport.respond(200, "{}");

        assertThatThrownBy(() -> client().fetch(request("GDP")))
            .isInstanceOf(MalformedResponseException.class);
        assertThat(transport.calls).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void fallsBackToCachedResponseAfterRetriesWhenRequested() {
        transport.respond(200, "{\"cached\":true}");
        transport.fail(new IOException("down"));
        transport.fail(new IOException("down"));
        transport.fail(new IOException("down"));
        RetryingFetchClient client = client();
        client.fetch(request("GDP"));

        FetchRequest refresh = FetchRequest.get("https://api.example.com/series")
            .param("series_id", "GDP")
            .param("api_key", "secret")
            .expectJson(true)
            .useCache(false)
            .fallbackToCache(true)
            .build();
        FetchResponse response = client.fetch(refresh);

        assertThat(response.fromCache()).isTrue();
        assertThat(response.bodyAsString()).isEqualTo("{\"cached\":true}");
        assertThat(transport.calls).isEqualTo(4);
    }

    @Test
    void demoModeServesSyntheticPayloadWhenProviderIsDown() {
        transport.fail(new IOException("down"));
        transport.fail(new IOException("down"));
        transport.fail(new IOException("down"));

        FetchResponse response = client(100, List.of(), true).fetch(request("UNRATE"));

        assertThat(response.synthetic()).isTrue();
        assertThat(response.json(objectMapper).path("observations").isArray()).isTrue();
    }

    @Test
    void demoModeServesSyntheticPayloadWhenBudgetIsExhausted() {
        transport.respond(200, "{}");
        RetryingFetchClient client = client(1, List.of(), true);

        client.fetch(request("GDP"));
        FetchResponse second = client.fetch(request("UNRATE"));

        assertThat(second.synthetic()).isTrue();
        assertThat(transport.calls).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void interruptedTransportIsNotRetried() {
        transport.fail(new InterruptedException("shutdown"));

        try {
            assertThatThrownBy(() -> client().fetch(request("GDP")))
                .isInstanceOf(TransportException.class);
            assertThat(transport.calls).isEqualTo(1);
        } finally {
            Thread.interrupted();
        }
    }

    private static final class ScriptedTransport implements HttpTransport {
        private final Deque<Object> script = new ArrayDeque<>();
        private Object last;
        private int calls;

        void respond(int status, String body) {
            script.add(TransportResponse.of(status, body));
        }

        void respond(TransportResponse response) {
            script.add(response);
        }

        void fail(Exception error) {
            script.add(error);
        }

        @Override
        public TransportResponse execute(FetchRequest request) throws IOException, InterruptedException {
            calls++;
            Object next = script.isEmpty() ? last : script.poll();
            last = next;
            if (next instanceof IOException io) {
                throw io;
            }
            if (next instanceof InterruptedException interrupted) {
                throw interrupted;
            }
            return (TransportResponse) next;
        }
    }
}
