package com.signaldesk.pipeline.jobs;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.signaldesk.pipeline.config.PipelineProperties;
import com.signaldesk.pipeline.fetch.FetchRequest;
import com.signaldesk.pipeline.fetch.ProviderFetchClients;
import com.signaldesk.pipeline.fetch.RetryingFetchClient;
import com.signaldesk.pipeline.fetch.ServerErrorException;
import com.signaldesk.pipeline.model.MarketQuote;
import com.signaldesk.pipeline.persistence.PipelineJdbcRepository;
import com.signaldesk.pipeline.scheduler.JobExecutionException;
import com.signaldesk.pipeline.scheduler.JobOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MarketQuotesJobTest {
    private static final String AAPL_QUOTE = """
        {"Global Quote": {
          "01. symbol": "AAPL",
          "02. open": "187.15",
          "03. high": "189.49",
          "04. low": "186.33",
          "05. price": "188.63",
          "06. volume": "51234567",
          "07. latest trading day": "2024-05-10",
          "08. previous close": "187.04",
          "10. change percent": "0.8501%"
        }}
        """;

    @Mock
    private ProviderFetchClients clients;
    @Mock
    private RetryingFetchClient client;
    @Mock
    private WatchlistService watchlist;
    @Mock
    private PipelineJdbcRepository repository;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MarketQuotesJob job;

    @BeforeEach
    void setUp() {
        PipelineProperties properties = new PipelineProperties();
        PipelineProperties.Provider provider = new PipelineProperties.Provider();
        provider.setBaseUrl("https://www.alphavantage.co/query");
        provider.setApiKey("demo-key");
        properties.getProviders().put("alpha-vantage", provider);
        Clock clock = Clock.fixed(Instant.parse("2024-05-10T21:00:00Z"), ZoneOffset.UTC);
        job = new MarketQuotesJob(clients, properties, watchlist, repository, clock);
        when(clients.client("alpha-vantage")).thenReturn(client);
    }

    @Test
    void storesQuotesAndToleratesPartialFailure() throws Exception {
        when(watchlist.tickers()).thenReturn(List.of("AAPL", "MSFT"));
        when(client.fetchJson(argThat(request -> request != null && "AAPL".equals(request.params().get("symbol")))))
            .thenReturn(objectMapper.readTree(AAPL_QUOTE));
        when(client.fetchJson(argThat(request -> request != null && "MSFT".equals(request.params().get("symbol")))))
            .thenThrow(new ServerErrorException("https://www.alphavantage.co/query", "http_503", 3, 503));

        JobOutcome outcome = job.run();

        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.detail()).contains("succeeded=1").contains("failed=1").contains("MSFT: server_error");
        ArgumentCaptor<MarketQuote> captor = ArgumentCaptor.forClass(MarketQuote.class);
        verify(repository).upsertMarketQuote(captor.capture());
        MarketQuote quote = captor.getValue();
        assertThat(quote.symbol()).isEqualTo("AAPL");
        assertThat(quote.tradingDay()).isEqualTo(LocalDate.of(2024, 5, 10));
        assertThat(quote.price()).isEqualByComparingTo(new BigDecimal("188.63"));
        assertThat(quote.volume()).isEqualTo(51_234_567L);
        assertThat(quote.changePercent()).isEqualByComparingTo(new BigDecimal("0.8501"));
    }

    @Test
    void failsWhenEveryTickerFails() throws Exception {
        when(watchlist.tickers()).thenReturn(List.of("AAPL", "MSFT"));
        when(client.fetchJson(any(FetchRequest.class))).thenReturn(objectMapper.readTree("{\"Global Quote\": {}}"));

        assertThatThrownBy(job::run)
            .isInstanceOf(JobExecutionException.class)
            .hasMessageContaining("all 2 units failed");
        verify(repository, never()).upsertMarketQuote(any());
    }

    @Test
    void requestCarriesQuoteFunctionAndKey() throws Exception {
        when(watchlist.tickers()).thenReturn(List.of("NVDA"));
        ArgumentCaptor<FetchRequest> captor = ArgumentCaptor.forClass(FetchRequest.class);
        when(client.fetchJson(captor.capture())).thenReturn(objectMapper.readTree(AAPL_QUOTE));

        job.run();

        FetchRequest request = captor.getValue();
        assertThat(request.params())
            .containsEntry("function", "GLOBAL_QUOTE")
            .containsEntry("symbol", "NVDA")
            .containsEntry("apikey", "demo-key");
        assertThat(request.expectJson()).isTrue();
        assertThat(request.fallbackToCache()).isTrue();
    }
}
