package com.signaldesk.pipeline.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

public record FetchResponse(
    String url,
    int statusCode,
    byte[] body,
    String contentType,
    Instant fetchedAt,
    boolean fromCache,
    boolean synthetic
) {
    public String bodyAsString() {
        return body == null ? "" : new String(body, StandardCharsets.UTF_8);
    }

    public JsonNode json(ObjectMapper objectMapper) {
        try {
            return objectMapper.readTree(body == null ? new byte[0] : body);
        } catch (IOException e) {
            throw new MalformedResponseException(url, "invalid_json: " + e.getMessage(), e);
        }
    }

    public FetchResponse asCached() {
        return new FetchResponse(url, statusCode, body, contentType, fetchedAt, true, synthetic);
    }
}
