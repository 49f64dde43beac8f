package org.budgetanalyzer.marketdata.api.response;

import java.time.Instant;
import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.marketdata.service.dto.MarketDataImportSummary;

@Schema(description = "Outcome of a market data import run")
public record MarketDataImportResultResponse(
    @Schema(
            description = "Per series counts, in the order the sources ran",
            requiredMode = Schema.RequiredMode.REQUIRED)
        List<SeriesResult> series,
    @Schema(
            description = "Sources that could not be fetched or parsed in this run",
            requiredMode = Schema.RequiredMode.REQUIRED)
        List<SkippedSourceResult> skippedSources,
    @Schema(
            description = "Timestamp of the import execution",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2025-10-31T06:00:00Z")
        Instant timestamp) {

  public static MarketDataImportResultResponse from(MarketDataImportSummary summary) {
    var series =
        summary.countsBySeriesType().entrySet().stream()
            .map(
                entry ->
                    new SeriesResult(
                        entry.getKey(),
                        entry.getValue().inserted(),
                        entry.getValue().updated(),
                        entry.getValue().unchanged(),
                        entry.getValue().skipped()))
            .toList();
    var skippedSources =
        summary.skippedSources().stream()
            .map(
                skipped ->
                    new SkippedSourceResult(
                        skipped.source(), skipped.seriesType(), skipped.reason()))
            .toList();

    return new MarketDataImportResultResponse(series, skippedSources, summary.timestamp());
  }

  @Schema(description = "Import counts for one series")
  public record SeriesResult(
      @Schema(
              description = "Series type",
              requiredMode = Schema.RequiredMode.REQUIRED,
              example = "cpi")
          String seriesType,
      @Schema(
              description = "Number of new readings stored",
              requiredMode = Schema.RequiredMode.REQUIRED,
              example = "1")
          int inserted,
      @Schema(
              description = "Number of stored readings revised by the source",
              requiredMode = Schema.RequiredMode.REQUIRED,
              example = "0")
          int updated,
      @Schema(
              description = "Number of readings that matched the stored value",
              requiredMode = Schema.RequiredMode.REQUIRED,
              example = "4")
          int unchanged,
      @Schema(
              description = "Number of readings that could not be parsed or written",
              requiredMode = Schema.RequiredMode.REQUIRED,
              example = "0")
          int skipped) {}

  @Schema(description = "A source skipped in this run")
  public record SkippedSourceResult(
      @Schema(
              description = "Source name",
              requiredMode = Schema.RequiredMode.REQUIRED,
              example = "metals:gold")
          String source,
      @Schema(
              description = "Series type the source feeds",
              requiredMode = Schema.RequiredMode.REQUIRED,
              example = "gold")
          String seriesType,
      @Schema(
              description = "Why the source was skipped",
              requiredMode = Schema.RequiredMode.REQUIRED,
              example = "No metals API key configured, skipping gold")
          String reason) {}
}
