package com.signaldesk.pipeline.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

public record MarketQuote(
    String symbol,
    LocalDate tradingDay,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal price,
    Long volume,
    BigDecimal previousClose,
    BigDecimal changePercent,
    Instant fetchedAt
) {
}
