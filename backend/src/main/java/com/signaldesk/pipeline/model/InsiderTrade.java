package com.signaldesk.pipeline.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

public record InsiderTrade(
    String tradeId,
    String ticker,
    String ownerName,
    String transactionCode,
    LocalDate transactionDate,
    BigDecimal shares,
    BigDecimal price,
    Instant fetchedAt
) {
}
