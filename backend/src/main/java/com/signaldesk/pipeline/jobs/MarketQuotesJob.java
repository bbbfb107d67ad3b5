package com.signaldesk.pipeline.jobs;

import com.fasterxml.jackson.databind.JsonNode;
import com.signaldesk.pipeline.config.PipelineProperties;
import com.signaldesk.pipeline.fetch.FetchException;
import com.signaldesk.pipeline.fetch.FetchRequest;
import com.signaldesk.pipeline.fetch.ProviderFetchClients;
import com.signaldesk.pipeline.fetch.RetryingFetchClient;
import com.signaldesk.pipeline.model.MarketQuote;
import com.signaldesk.pipeline.persistence.PipelineJdbcRepository;
import com.signaldesk.pipeline.scheduler.JobExecutionException;
import com.signaldesk.pipeline.scheduler.JobOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

@Component
public class MarketQuotesJob {
    public static final String NAME = "market-quotes";
    static final String PROVIDER = "alpha-vantage";
    private static final Logger log = LoggerFactory.getLogger(MarketQuotesJob.class);

    private final ProviderFetchClients clients;
    private final PipelineProperties properties;
    private final WatchlistService watchlist;
    private final PipelineJdbcRepository repository;
    private final Clock clock;

    public MarketQuotesJob(
        ProviderFetchClients clients,
        PipelineProperties properties,
        WatchlistService watchlist,
        PipelineJdbcRepository repository,
        Clock clock
    ) {
        this.clients = clients;
        this.properties = properties;
        this.watchlist = watchlist;
        this.repository = repository;
        this.clock = clock;
    }

    public JobOutcome run() {
        RetryingFetchClient client = clients.client(PROVIDER);
        PipelineProperties.Provider provider = properties.provider(PROVIDER);
        List<String> tickers = watchlist.tickers();
        UnitTally tally = new UnitTally(NAME);
        log.info("Fetching quotes for {} tickers", tickers.size());

        for (String ticker : tickers) {
            if (Thread.currentThread().isInterrupted()) {
                tally.failed(ticker, "interrupted");
                break;
            }
            MarketQuote quote;
            try {
                JsonNode root = client.fetchJson(
                    FetchRequest.get(provider.getBaseUrl())
                        .param("function", "GLOBAL_QUOTE")
                        .param("symbol", ticker)
                        .param("apikey", provider.getApiKey())
                        .expectJson(true)
                        .fallbackToCache(true)
                        .build()
                );
                quote = parseQuote(ticker, root);
            } catch (FetchException e) {
                log.warn("Quote fetch failed ticker={} failure={} attempts={}", ticker, e.failure(), e.attempts());
                tally.failed(ticker, e.failure().name().toLowerCase(Locale.ROOT));
                continue;
            }
            if (quote == null) {
                tally.failed(ticker, "no_quote");
                continue;
            }
            try {
                repository.upsertMarketQuote(quote);
            } catch (DataAccessException e) {
                throw new JobExecutionException(NAME + ": failed to store quote for " + ticker, e);
            }
            tally.succeeded(1);
        }
        return tally.finish();
    }

    MarketQuote parseQuote(String ticker, JsonNode root) {
        if (root == null) {
            return null;
        }
        if (root.hasNonNull("Error Message")) {
            log.warn("Alpha Vantage rejected {}: {}", ticker, root.get("Error Message").asText());
            return null;
        }
        JsonNode quote = root.path("Global Quote");
        if (!quote.isObject() || quote.isEmpty()) {
            return null;
        }
        LocalDate tradingDay = JsonValues.date(quote.path("07. latest trading day").asText(null));
        if (tradingDay == null) {
            return null;
        }
        return new MarketQuote(
            ticker,
            tradingDay,
            JsonValues.decimal(quote.path("02. open")),
            JsonValues.decimal(quote.path("03. high")),
            JsonValues.decimal(quote.path("04. low")),
            JsonValues.decimal(quote.path("05. price")),
            JsonValues.longValue(quote.path("06. volume")),
            JsonValues.decimal(quote.path("08. previous close")),
            JsonValues.decimal(quote.path("10. change percent")),
            clock.instant()
        );
    }
}
