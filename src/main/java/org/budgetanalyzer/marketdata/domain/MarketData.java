package org.budgetanalyzer.marketdata.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.validation.constraints.NotNull;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One stored reading of a market data series.
 *
 * <p>Rows are keyed by (seriesType, date); the unique constraint is the last line of defense
 * against duplicate rows when two writers race on the same key. Values are stored as unscaled
 * {@code numeric} so a re-imported value compares exactly equal to the stored one.
 */
@Entity
@Table(
    name = "market_data",
    uniqueConstraints = @UniqueConstraint(columnNames = {"series_type", "observation_date"}))
public class MarketData extends AuditableEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  /** Logical series tag, e.g. cpi, gold, silver. */
  @NotNull
  @Column(name = "series_type", nullable = false, length = 50)
  private String seriesType;

  /** Period the value represents; monthly series use the first day of the month. */
  @NotNull
  @Column(name = "observation_date", nullable = false)
  private LocalDate date;

  @NotNull
  @Column(nullable = false)
  private BigDecimal value;

  @NotNull
  @Column(nullable = false)
  private BigDecimal high;

  @NotNull
  @Column(nullable = false)
  private BigDecimal low;

  /** Source record this row was built from, kept for audit. */
  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "raw_data")
  private JsonNode rawData;

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public String getSeriesType() {
    return seriesType;
  }

  public void setSeriesType(String seriesType) {
    this.seriesType = seriesType;
  }

  public LocalDate getDate() {
    return date;
  }

  public void setDate(LocalDate date) {
    this.date = date;
  }

  public BigDecimal getValue() {
    return value;
  }

  public void setValue(BigDecimal value) {
    this.value = value;
  }

  public BigDecimal getHigh() {
    return high;
  }

  public void setHigh(BigDecimal high) {
    this.high = high;
  }

  public BigDecimal getLow() {
    return low;
  }

  public void setLow(BigDecimal low) {
    this.low = low;
  }

  public JsonNode getRawData() {
    return rawData;
  }

  public void setRawData(JsonNode rawData) {
    this.rawData = rawData;
  }
}
