package com.signaldesk.pipeline.fetch;

import com.signaldesk.pipeline.util.HashUtils;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

public final class FetchRequest {
    private static final Set<String> SECRET_PARAMS = Set.of("apikey", "api_key", "token", "access_token");

    private final String method;
    private final String url;
    private final Map<String, String> params;
    private final String body;
    private final String contentType;
    private final Map<String, String> headers;
    private final boolean useCache;
    private final boolean fallbackToCache;
    private final boolean expectJson;

    private FetchRequest(Builder builder) {
        this.method = builder.method;
        this.url = builder.url;
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(builder.params));
        this.body = builder.body;
        this.contentType = builder.contentType;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.useCache = builder.useCache;
        this.fallbackToCache = builder.fallbackToCache;
        this.expectJson = builder.expectJson;
    }

    public static Builder get(String url) {
        return new Builder("GET", url);
    }

    public static Builder post(String url) {
        return new Builder("POST", url);
    }

    public String method() {
        return method;
    }

    public String url() {
        return url;
    }

    public Map<String, String> params() {
        return params;
    }

    public String body() {
        return body;
    }

    public String contentType() {
        return contentType;
    }

    public String effectiveContentType() {
        return contentType == null ? "application/json" : contentType;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public boolean useCache() {
        return useCache;
    }

    public boolean fallbackToCache() {
        return fallbackToCache;
    }

    public boolean expectJson() {
        return expectJson;
    }

    public boolean isPost() {
        return "POST".equals(method);
    }

    public String cacheKey() {
        StringBuilder key = new StringBuilder(method).append(' ').append(url);
        if (!params.isEmpty()) {
            key.append('?').append(encode(new TreeMap<>(params)));
        }
        if (body != null && !body.isEmpty()) {
            key.append('#').append(effectiveContentType()).append(':').append(HashUtils.sha256Hex(body));
        }
        return key.toString();
    }

    public URI uri() {
        if (isPost() || params.isEmpty()) {
            return URI.create(url);
        }
        String separator = url.contains("?") ? "&" : "?";
        return URI.create(url + separator + encode(params));
    }

    public String describe() {
        Map<String, String> safe = new LinkedHashMap<>();
        params.forEach((k, v) -> safe.put(k, SECRET_PARAMS.contains(k.toLowerCase(Locale.ROOT)) ? "***" : v));
        return method + " " + url + (safe.isEmpty() ? "" : " " + safe);
    }

    private static String encode(Map<String, String> values) {
        return values.entrySet().stream()
            .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)
                + "="
                + URLEncoder.encode(e.getValue() == null ? "" : e.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));
    }

    @Override
    public String toString() {
        return describe();
    }

    public static final class Builder {
        private final String method;
        private final String url;
        private final Map<String, String> params = new LinkedHashMap<>();
        private final Map<String, String> headers = new LinkedHashMap<>();
        private String body;
        private String contentType;
        private boolean useCache = true;
        private boolean fallbackToCache;
        private boolean expectJson;

        private Builder(String method, String url) {
            if (url == null || url.isBlank()) {
                throw new IllegalArgumentException("url is required");
            }
            this.method = method;
            this.url = url.trim();
        }

        public Builder param(String name, Object value) {
            if (name != null && value != null) {
                params.put(name, String.valueOf(value));
            }
            return this;
        }

        public Builder params(Map<String, ?> values) {
            if (values != null) {
                values.forEach(this::param);
            }
            return this;
        }

        public Builder header(String name, String value) {
            if (name != null && value != null) {
                headers.put(name, value);
            }
            return this;
        }

        public Builder jsonBody(String json) {
            this.body = json;
            this.contentType = "application/json";
            return this;
        }

        public Builder formBody(String form) {
            this.body = form;
            this.contentType = "application/x-www-form-urlencoded";
            return this;
        }

        public Builder useCache(boolean useCache) {
            this.useCache = useCache;
            return this;
        }

        public Builder fallbackToCache(boolean fallbackToCache) {
            this.fallbackToCache = fallbackToCache;
            return this;
        }

        public Builder expectJson(boolean expectJson) {
            this.expectJson = expectJson;
            return this;
        }

        public FetchRequest build() {
            return new FetchRequest(this);
        }
    }
}
