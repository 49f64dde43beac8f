package org.budgetanalyzer.marketdata.service.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Canonical reading produced by a source adapter.
 *
 * <p>Immutable: a revised value is a new Observation. {@code high} and {@code low} equal {@code
 * value} when the source reports a single point.
 *
 * @param seriesType logical series tag, e.g. cpi or gold
 * @param date period the value represents, first of month for monthly series
 * @param value primary reading
 * @param high highest reading in the period
 * @param low lowest reading in the period
 * @param rawPayload the source record this reading came from
 */
public record Observation(
    String seriesType,
    LocalDate date,
    BigDecimal value,
    BigDecimal high,
    BigDecimal low,
    JsonNode rawPayload) {

  public Observation {
    Objects.requireNonNull(seriesType, "seriesType");
    Objects.requireNonNull(date, "date");
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(high, "high");
    Objects.requireNonNull(low, "low");
  }

  /** Creates a single-point observation where high and low equal the value. */
  public static Observation singlePoint(
      String seriesType, LocalDate date, BigDecimal value, JsonNode rawPayload) {
    return new Observation(seriesType, date, value, value, value, rawPayload);
  }
}
