package com.signaldesk.pipeline.fetch;

import com.signaldesk.pipeline.config.PipelineProperties;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;

public class JdkHttpTransport implements HttpTransport {
    private final HttpClient client;
    private final String userAgent;
    private final int timeoutSeconds;
    private final Map<String, String> defaultHeaders;

    public JdkHttpTransport(String userAgent, int timeoutSeconds, Map<String, String> defaultHeaders, ExecutorService httpExecutor) {
        HttpClient.Builder builder = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(Math.max(1, timeoutSeconds)))
            .version(HttpClient.Version.HTTP_1_1);
        if (httpExecutor != null) {
            builder.executor(httpExecutor);
        }
        this.client = builder.build();
        this.userAgent = PipelineProperties.normalizeUserAgent(userAgent);
        this.timeoutSeconds = Math.max(1, timeoutSeconds);
        this.defaultHeaders = defaultHeaders == null ? Map.of() : new LinkedHashMap<>(defaultHeaders);
    }

    @Override
    public TransportResponse execute(FetchRequest request) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri())
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .header("User-Agent", userAgent)
            .header("Accept", request.expectJson() ? "application/json" : "*/*")
            .header("Accept-Language", "en-US,en;q=0.8");
        defaultHeaders.forEach(builder::setHeader);
        request.headers().forEach(builder::setHeader);

        HttpRequest httpRequest;
        if (request.isPost()) {
            httpRequest = builder
                .header("Content-Type", request.effectiveContentType())
                .POST(HttpRequest.BodyPublishers.ofString(request.body() == null ? "" : request.body(), StandardCharsets.UTF_8))
                .build();
        } else {
            httpRequest = builder.GET().build();
        }

        HttpResponse<byte[]> response = client.send(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
        return new TransportResponse(response.statusCode(), response.headers().map(), response.body());
    }
}
