package com.signaldesk.pipeline.persistence;

import com.signaldesk.pipeline.model.EconomicObservation;
import com.signaldesk.pipeline.model.InsiderTrade;
import com.signaldesk.pipeline.model.MarketQuote;
import com.signaldesk.pipeline.model.NewsArticle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Set;

@Repository
public class PipelineJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(PipelineJdbcRepository.class);
    private static final Set<String> TABLES = Set.of("market_quotes", "economic_indicators", "insider_trades", "news_articles");
    private static final int MAX_TITLE = 500;
    private static final int MAX_SUMMARY = 4000;

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public PipelineJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = detectPostgres(jdbc);
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public long countRows(String table) {
        if (!TABLES.contains(table)) {
            throw new IllegalArgumentException("Unknown table " + table);
        }
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return count == null ? 0L : count;
    }

    public void upsertMarketQuote(MarketQuote quote) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("symbol", quote.symbol().toUpperCase(Locale.ROOT))
            .addValue("tradingDay", toDate(quote.tradingDay()))
            .addValue("openPrice", quote.open())
            .addValue("highPrice", quote.high())
            .addValue("lowPrice", quote.low())
            .addValue("price", quote.price())
            .addValue("volume", quote.volume())
            .addValue("previousClose", quote.previousClose())
            .addValue("changePercent", quote.changePercent())
            .addValue("fetchedAt", toTimestamp(quote.fetchedAt()));
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO market_quotes (
                        symbol, trading_day, open_price, high_price, low_price, price,
                        volume, previous_close, change_percent, fetched_at
                    )
                    VALUES (
                        :symbol, :tradingDay, :openPrice, :highPrice, :lowPrice, :price,
                        :volume, :previousClose, :changePercent, :fetchedAt
                    )
                    ON CONFLICT (symbol, trading_day)
                    DO UPDATE SET
                        open_price = EXCLUDED.open_price,
                        high_price = EXCLUDED.high_price,
                        low_price = EXCLUDED.low_price,
                        price = EXCLUDED.price,
                        volume = EXCLUDED.volume,
                        previous_close = EXCLUDED.previous_close,
                        change_percent = EXCLUDED.change_percent,
                        fetched_at = EXCLUDED.fetched_at
                    """,
                params
            );
            return;
        }
        jdbc.update(
            """
                MERGE INTO market_quotes (
                    symbol, trading_day, open_price, high_price, low_price, price,
                    volume, previous_close, change_percent, fetched_at
                )
                KEY (symbol, trading_day)
                VALUES (
                    :symbol, :tradingDay, :openPrice, :highPrice, :lowPrice, :price,
                    :volume, :previousClose, :changePercent, :fetchedAt
                )
                """,
            params
        );
    }

    public void upsertEconomicObservation(EconomicObservation observation) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("seriesId", observation.seriesId().toUpperCase(Locale.ROOT))
            .addValue("observationDate", toDate(observation.observationDate()))
            .addValue("obsValue", observation.value())
            .addValue("fetchedAt", toTimestamp(observation.fetchedAt()));
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO economic_indicators (series_id, observation_date, obs_value, fetched_at)
                    VALUES (:seriesId, :observationDate, :obsValue, :fetchedAt)
                    ON CONFLICT (series_id, observation_date)
                    DO UPDATE SET
                        obs_value = EXCLUDED.obs_value,
                        fetched_at = EXCLUDED.fetched_at
                    """,
                params
            );
            return;
        }
        jdbc.update(
            """
                MERGE INTO economic_indicators (series_id, observation_date, obs_value, fetched_at)
                KEY (series_id, observation_date)
                VALUES (:seriesId, :observationDate, :obsValue, :fetchedAt)
                """,
            params
        );
    }

    public void upsertInsiderTrade(InsiderTrade trade) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tradeId", trade.tradeId())
            .addValue("ticker", trade.ticker() == null ? null : trade.ticker().toUpperCase(Locale.ROOT))
            .addValue("ownerName", trade.ownerName())
            .addValue("transactionCode", trade.transactionCode())
            .addValue("transactionDate", toDate(trade.transactionDate()))
            .addValue("shares", trade.shares())
            .addValue("price", trade.price())
            .addValue("fetchedAt", toTimestamp(trade.fetchedAt()));
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO insider_trades (
                        trade_id, ticker, owner_name, transaction_code, transaction_date, shares, price, fetched_at
                    )
                    VALUES (
                        :tradeId, :ticker, :ownerName, :transactionCode, :transactionDate, :shares, :price, :fetchedAt
                    )
                    ON CONFLICT (trade_id)
                    DO UPDATE SET
                        ticker = EXCLUDED.ticker,
                        owner_name = EXCLUDED.owner_name,
                        transaction_code = EXCLUDED.transaction_code,
                        transaction_date = EXCLUDED.transaction_date,
                        shares = EXCLUDED.shares,
                        price = EXCLUDED.price,
                        fetched_at = EXCLUDED.fetched_at
                    """,
                params
            );
            return;
        }
        jdbc.update(
            """
                MERGE INTO insider_trades (
                    trade_id, ticker, owner_name, transaction_code, transaction_date, shares, price, fetched_at
                )
                KEY (trade_id)
                VALUES (
                    :tradeId, :ticker, :ownerName, :transactionCode, :transactionDate, :shares, :price, :fetchedAt
                )
                """,
            params
        );
    }

    public void upsertNewsArticle(NewsArticle article) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("url", article.url())
            .addValue("title", truncate(article.title(), MAX_TITLE))
            .addValue("source", article.source())
            .addValue("summary", truncate(article.summary(), MAX_SUMMARY))
            .addValue("publishedAt", toTimestamp(article.publishedAt()))
            .addValue("fetchedAt", toTimestamp(article.fetchedAt()));
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO news_articles (url, title, source, summary, published_at, fetched_at)
                    VALUES (:url, :title, :source, :summary, :publishedAt, :fetchedAt)
                    ON CONFLICT (url)
                    DO UPDATE SET
                        title = EXCLUDED.title,
                        source = EXCLUDED.source,
                        summary = EXCLUDED.summary,
                        published_at = COALESCE(EXCLUDED.published_at, news_articles.published_at),
                        fetched_at = EXCLUDED.fetched_at
                    """,
                params
            );
            return;
        }
        jdbc.update(
            """
                MERGE INTO news_articles (url, title, source, summary, published_at, fetched_at)
                KEY (url)
                VALUES (
                    :url, :title, :source, :summary,
                    COALESCE(
                        CAST(:publishedAt AS TIMESTAMP WITH TIME ZONE),
                        (SELECT existing.published_at FROM news_articles existing WHERE existing.url = :url)
                    ),
                    :fetchedAt
                )
                """,
            params
        );
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Date toDate(LocalDate date) {
        return date == null ? null : Date.valueOf(date);
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.length() <= max ? trimmed : trimmed.substring(0, max);
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; defaulting to MERGE upserts", e);
            return false;
        }
    }
}
