package com.signaldesk.pipeline.jobs;

import com.fasterxml.jackson.databind.JsonNode;
import com.signaldesk.pipeline.config.PipelineProperties;
import com.signaldesk.pipeline.fetch.FetchException;
import com.signaldesk.pipeline.fetch.FetchRequest;
import com.signaldesk.pipeline.fetch.ProviderFetchClients;
import com.signaldesk.pipeline.fetch.RetryingFetchClient;
import com.signaldesk.pipeline.model.InsiderTrade;
import com.signaldesk.pipeline.persistence.PipelineJdbcRepository;
import com.signaldesk.pipeline.scheduler.JobExecutionException;
import com.signaldesk.pipeline.scheduler.JobOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class InsiderTradesJob {
    public static final String NAME = "insider-trades";
    static final String PROVIDER = "unusual-whales";
    private static final int LOOKBACK_DAYS = 7;
    private static final int PAGE_LIMIT = 100;
    private static final Logger log = LoggerFactory.getLogger(InsiderTradesJob.class);

    private final ProviderFetchClients clients;
    private final PipelineProperties properties;
    private final PipelineJdbcRepository repository;
    private final Clock clock;

    public InsiderTradesJob(
        ProviderFetchClients clients,
        PipelineProperties properties,
        PipelineJdbcRepository repository,
        Clock clock
    ) {
        this.clients = clients;
        this.properties = properties;
        this.repository = repository;
        this.clock = clock;
    }

    public JobOutcome run() {
        RetryingFetchClient client = clients.client(PROVIDER);
        PipelineProperties.Provider provider = properties.provider(PROVIDER);
        UnitTally tally = new UnitTally(NAME);

        FetchRequest.Builder request = FetchRequest.get(provider.getBaseUrl() + "/insider/trades")
            .param("days", LOOKBACK_DAYS)
            .param("limit", PAGE_LIMIT)
            .expectJson(true)
            .fallbackToCache(true);
        if (provider.hasApiKey()) {
            request.header("Authorization", "Bearer " + provider.getApiKey());
        }

        List<InsiderTrade> trades;
        try {
            trades = parseTrades(client.fetchJson(request.build()), clock.instant());
        } catch (FetchException e) {
            log.warn("Insider trades fetch failed failure={} attempts={} status={}", e.failure(), e.attempts(), e.statusCode());
            tally.failed("insider/trades", e.failure().name().toLowerCase(Locale.ROOT));
            return tally.finish();
        }

        try {
            trades.forEach(repository::upsertInsiderTrade);
        } catch (DataAccessException e) {
            throw new JobExecutionException(NAME + ": failed to store insider trades", e);
        }
        log.info("Stored {} insider trades", trades.size());
        tally.succeeded(trades.size());
        return tally.finish();
    }

    static List<InsiderTrade> parseTrades(JsonNode root, Instant fetchedAt) {
        List<InsiderTrade> trades = new ArrayList<>();
        if (root == null) {
            return trades;
        }
        for (JsonNode node : root.path("data")) {
            String ticker = JsonValues.text(node, "symbol", "ticker");
            String owner = JsonValues.text(node, "insider_name", "owner_name");
            LocalDate transactionDate = JsonValues.date(JsonValues.text(node, "transaction_date"));
            String tradeId = JsonValues.text(node, "filing_id", "id");
            if (tradeId == null) {
                if (ticker == null || owner == null || transactionDate == null) {
                    continue;
                }
                tradeId = ticker + "|" + owner + "|" + transactionDate + "|" + JsonValues.text(node, "shares");
            }
            trades.add(new InsiderTrade(
                tradeId,
                ticker,
                owner,
                JsonValues.text(node, "transaction_type", "transaction_code"),
                transactionDate,
                JsonValues.decimal(node.path("shares")),
                JsonValues.decimal(node.path("price")),
                fetchedAt
            ));
        }
        return trades;
    }
}
