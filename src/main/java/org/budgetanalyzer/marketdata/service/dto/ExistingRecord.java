package org.budgetanalyzer.marketdata.service.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A stored reading as seen by the reconciler. {@code id} is only ever handed back to the store.
 */
public record ExistingRecord(
    Long id,
    String seriesType,
    LocalDate date,
    BigDecimal value,
    BigDecimal high,
    BigDecimal low,
    JsonNode rawPayload) {}
