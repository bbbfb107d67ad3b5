package com.signaldesk.pipeline.jobs;

import com.fasterxml.jackson.databind.JsonNode;
import com.signaldesk.pipeline.config.PipelineProperties;
import com.signaldesk.pipeline.fetch.FetchException;
import com.signaldesk.pipeline.fetch.FetchRequest;
import com.signaldesk.pipeline.fetch.ProviderFetchClients;
import com.signaldesk.pipeline.fetch.RetryingFetchClient;
import com.signaldesk.pipeline.model.EconomicObservation;
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
public class EconomicIndicatorsJob {
    public static final String NAME = "economic-indicators";
    static final String PROVIDER = "fred";
    static final List<String> DEFAULT_SERIES = List.of("GDP", "UNRATE", "CPIAUCSL", "FEDFUNDS", "DGS10");
    private static final int OBSERVATION_LIMIT = 10;
    private static final Logger log = LoggerFactory.getLogger(EconomicIndicatorsJob.class);

    private final ProviderFetchClients clients;
    private final PipelineProperties properties;
    private final PipelineJdbcRepository repository;
    private final Clock clock;

    public EconomicIndicatorsJob(
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
        List<String> series = seriesIds();
        UnitTally tally = new UnitTally(NAME);

        for (String seriesId : series) {
            List<EconomicObservation> observations;
            try {
                JsonNode root = client.fetchJson(
                    FetchRequest.get(provider.getBaseUrl() + "/series/observations")
                        .param("series_id", seriesId)
                        .param("api_key", provider.getApiKey())
                        .param("file_type", "json")
                        .param("sort_order", "desc")
                        .param("limit", OBSERVATION_LIMIT)
                        .expectJson(true)
                        .fallbackToCache(true)
                        .build()
                );
                observations = parseObservations(seriesId, root, clock.instant());
            } catch (FetchException e) {
                log.warn("FRED fetch failed series={} failure={} attempts={}", seriesId, e.failure(), e.attempts());
                tally.failed(seriesId, e.failure().name().toLowerCase(Locale.ROOT));
                continue;
            }
            if (observations.isEmpty()) {
                tally.failed(seriesId, "no_observations");
                continue;
            }
            try {
                observations.forEach(repository::upsertEconomicObservation);
            } catch (DataAccessException e) {
                throw new JobExecutionException(NAME + ": failed to store observations for " + seriesId, e);
            }
            log.debug("Stored {} observations for {}", observations.size(), seriesId);
            tally.succeeded(observations.size());
        }
        return tally.finish();
    }

    List<String> seriesIds() {
        List<String> configured = properties.job(NAME).getSources();
        List<String> series = new ArrayList<>();
        for (String id : configured.isEmpty() ? DEFAULT_SERIES : configured) {
            if (id != null && !id.isBlank()) {
                series.add(id.trim().toUpperCase(Locale.ROOT));
            }
        }
        return series;
    }

    static List<EconomicObservation> parseObservations(String seriesId, JsonNode root, Instant fetchedAt) {
        List<EconomicObservation> observations = new ArrayList<>();
        if (root == null) {
            return observations;
        }
        for (JsonNode node : root.path("observations")) {
            LocalDate date = JsonValues.date(JsonValues.text(node, "date"));
            if (date == null) {
                continue;
            }
            observations.add(new EconomicObservation(seriesId, date, JsonValues.decimal(node.path("value")), fetchedAt));
        }
        return observations;
    }
}
