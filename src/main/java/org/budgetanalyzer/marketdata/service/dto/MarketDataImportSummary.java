package org.budgetanalyzer.marketdata.service.dto;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one import run.
 *
 * <p>Counts are keyed by series type in the order sources were processed. Series whose source was
 * skipped appear only in {@code skippedSources}.
 */
public record MarketDataImportSummary(
    Map<String, SeriesImportCounts> countsBySeriesType,
    List<SkippedSource> skippedSources,
    Instant timestamp) {

  public MarketDataImportSummary {
    countsBySeriesType = Collections.unmodifiableMap(new LinkedHashMap<>(countsBySeriesType));
    skippedSources = List.copyOf(skippedSources);
  }

  public MarketDataImportSummary(
      Map<String, SeriesImportCounts> countsBySeriesType, List<SkippedSource> skippedSources) {
    this(countsBySeriesType, skippedSources, Instant.now());
  }

  public SeriesImportCounts countsFor(String seriesType) {
    return countsBySeriesType.getOrDefault(seriesType, SeriesImportCounts.EMPTY);
  }

  public SeriesImportCounts totals() {
    return countsBySeriesType.values().stream()
        .reduce(SeriesImportCounts.EMPTY, SeriesImportCounts::plus);
  }
}
