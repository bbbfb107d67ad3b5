package com.signaldesk.pipeline.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

public record EconomicObservation(
    String seriesId,
    LocalDate observationDate,
    BigDecimal value,
    Instant fetchedAt
) {
}
