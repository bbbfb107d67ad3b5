package com.signaldesk.pipeline.model;

import java.time.Instant;

public record NewsArticle(
    String url,
    String title,
    String source,
    String summary,
    Instant publishedAt,
    Instant fetchedAt
) {
}
