package com.signaldesk.pipeline.jobs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signaldesk.pipeline.config.PipelineProperties;
import com.signaldesk.pipeline.fetch.FetchException;
import com.signaldesk.pipeline.fetch.FetchRequest;
import com.signaldesk.pipeline.fetch.FetchResponse;
import com.signaldesk.pipeline.fetch.ProviderFetchClients;
import com.signaldesk.pipeline.fetch.RetryingFetchClient;
import com.signaldesk.pipeline.model.NewsArticle;
import com.signaldesk.pipeline.persistence.PipelineJdbcRepository;
import com.signaldesk.pipeline.scheduler.JobExecutionException;
import com.signaldesk.pipeline.scheduler.JobOutcome;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

@Component
public class FinancialNewsJob {
    public static final String NAME = "financial-news";
    static final String PROVIDER = "news-feeds";
    static final List<String> DEFAULT_FEEDS = List.of(
        "https://feeds.marketwatch.com/marketwatch/topstories/",
        "https://www.cnbc.com/id/100003114/device/rss/rss.html"
    );
    private static final List<DateTimeFormatter> FEED_DATE_FORMATS = List.of(
        DateTimeFormatter.RFC_1123_DATE_TIME,
        DateTimeFormatter.ISO_OFFSET_DATE_TIME
    );
    private static final Logger log = LoggerFactory.getLogger(FinancialNewsJob.class);

    private final ProviderFetchClients clients;
    private final PipelineProperties properties;
    private final PipelineJdbcRepository repository;
    private final ExecutorService feedExecutor;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FinancialNewsJob(
        ProviderFetchClients clients,
        PipelineProperties properties,
        PipelineJdbcRepository repository,
        @Qualifier("feedExecutor") ExecutorService feedExecutor,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        this.clients = clients;
        this.properties = properties;
        this.repository = repository;
        this.feedExecutor = feedExecutor;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public CompletableFuture<JobOutcome> run() {
        RetryingFetchClient client = clients.client(PROVIDER);
        UnitTally tally = new UnitTally(NAME);
        List<CompletableFuture<Void>> feeds = new ArrayList<>();
        for (String feedUrl : feedUrls()) {
            feeds.add(CompletableFuture.runAsync(() -> collectFeed(client, feedUrl, tally), feedExecutor));
        }
        return CompletableFuture.allOf(feeds.toArray(new CompletableFuture[0]))
            .thenApply(ignored -> tally.finish());
    }

    List<String> feedUrls() {
        List<String> configured = properties.job(NAME).getSources();
        List<String> urls = new ArrayList<>();
        for (String url : configured.isEmpty() ? DEFAULT_FEEDS : configured) {
            if (url != null && !url.isBlank()) {
                urls.add(url.trim());
            }
        }
        return urls;
    }

    private void collectFeed(RetryingFetchClient client, String feedUrl, UnitTally tally) {
        FetchResponse response;
        try {
            response = client.fetch(FetchRequest.get(feedUrl).fallbackToCache(true).build());
        } catch (FetchException e) {
            log.warn("Feed fetch failed url={} failure={} attempts={}", feedUrl, e.failure(), e.attempts());
            tally.failed(feedUrl, e.failure().name().toLowerCase(Locale.ROOT));
            return;
        }
        List<NewsArticle> articles;
        try {
            articles = isJson(response)
                ? parseJsonItems(response.json(objectMapper), feedUrl, clock.instant())
                : parseFeed(response.bodyAsString(), feedUrl, clock.instant());
        } catch (FetchException e) {
            log.warn("Feed {} returned an unreadable body: {}", feedUrl, e.getMessage());
            tally.failed(feedUrl, e.failure().name().toLowerCase(Locale.ROOT));
            return;
        }
        if (articles.isEmpty()) {
            tally.failed(feedUrl, "no_items");
            return;
        }
        try {
            articles.forEach(repository::upsertNewsArticle);
        } catch (DataAccessException e) {
            throw new JobExecutionException(NAME + ": failed to store articles from " + feedUrl, e);
        }
        log.debug("Stored {} articles from {}", articles.size(), feedUrl);
        tally.succeeded(articles.size());
    }

    private static boolean isJson(FetchResponse response) {
        if (response.synthetic()) {
            return true;
        }
        String contentType = response.contentType();
        return contentType != null && contentType.toLowerCase(Locale.ROOT).contains("json");
    }

    static List<NewsArticle> parseFeed(String xml, String feedUrl, Instant fetchedAt) {
        List<NewsArticle> articles = new ArrayList<>();
        if (xml == null || xml.isBlank()) {
            return articles;
        }
        Document document = Jsoup.parse(xml, feedUrl, Parser.xmlParser());
        String source = firstText(document, "channel > title", "feed > title");
        if (source == null) {
            source = hostOf(feedUrl);
        }
        for (Element item : document.select("item, entry")) {
            String link = childText(item, "link");
            if (link == null) {
                Element atomLink = item.selectFirst("link[href]");
                link = atomLink == null ? null : atomLink.attr("href").trim();
            }
            if (link == null || link.isEmpty()) {
                link = childText(item, "guid");
            }
            if (link == null || link.isEmpty()) {
                continue;
            }
            String summary = childText(item, "description");
            if (summary == null) {
                summary = childText(item, "summary");
            }
            articles.add(new NewsArticle(
                link,
                childText(item, "title"),
                source,
                summary == null ? null : Jsoup.parse(summary).text(),
                parseInstant(firstNonNull(childText(item, "pubDate"), childText(item, "published"), childText(item, "updated"))),
                fetchedAt
            ));
        }
        return articles;
    }

    static List<NewsArticle> parseJsonItems(JsonNode root, String feedUrl, Instant fetchedAt) {
        List<NewsArticle> articles = new ArrayList<>();
        if (root == null) {
            return articles;
        }
        for (JsonNode node : root.path("items")) {
            String link = JsonValues.text(node, "link", "url");
            if (link == null) {
                continue;
            }
            String source = JsonValues.text(node, "source");
            articles.add(new NewsArticle(
                link,
                JsonValues.text(node, "title"),
                source == null ? hostOf(feedUrl) : source,
                JsonValues.text(node, "summary", "description"),
                parseInstant(JsonValues.text(node, "published", "pubDate")),
                fetchedAt
            ));
        }
        return articles;
    }

    static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        for (DateTimeFormatter format : FEED_DATE_FORMATS) {
            try {
                return format.parse(trimmed, Instant::from);
            } catch (DateTimeParseException e) {
                log.trace("Feed date {} does not match {}", trimmed, format);
            }
        }
        log.debug("Unparseable feed date {}", trimmed);
        return null;
    }

    private static String childText(Element item, String tag) {
        for (Element child : item.children()) {
            if (child.tagName().equalsIgnoreCase(tag)) {
                String text = child.text().trim();
                return text.isEmpty() ? null : text;
            }
        }
        return null;
    }

    private static String firstText(Document document, String... queries) {
        for (String query : queries) {
            Element element = document.selectFirst(query);
            if (element != null && !element.text().isBlank()) {
                return element.text().trim();
            }
        }
        return null;
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String hostOf(String url) {
        try {
            String host = URI.create(url).getHost();
            return host == null ? url : host;
        } catch (IllegalArgumentException e) {
            return url;
        }
    }
}
