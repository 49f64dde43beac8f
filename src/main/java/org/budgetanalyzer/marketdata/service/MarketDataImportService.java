package org.budgetanalyzer.marketdata.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import org.budgetanalyzer.marketdata.exception.ServiceException;
import org.budgetanalyzer.marketdata.exception.StoreUnavailableException;
import org.budgetanalyzer.marketdata.exception.StoreWriteException;
import org.budgetanalyzer.marketdata.service.dto.MarketDataImportSummary;
import org.budgetanalyzer.marketdata.service.dto.ObservationBatch;
import org.budgetanalyzer.marketdata.service.dto.SeriesImportCounts;
import org.budgetanalyzer.marketdata.service.dto.SkippedSource;
import org.budgetanalyzer.marketdata.service.reconcile.ReconciliationDecision;
import org.budgetanalyzer.marketdata.service.reconcile.Reconciler;
import org.budgetanalyzer.marketdata.service.source.MarketDataSource;
import org.budgetanalyzer.marketdata.service.source.MarketDataSourceFactory;
import org.budgetanalyzer.marketdata.service.store.MarketDataStore;

/**
 * Runs a market data import: fetches every configured source, reconciles each observation against
 * the store, and applies the resulting insert or update.
 *
 * <p><b>Best effort:</b> a source that fails to fetch or returns a malformed payload is recorded
 * as skipped and the run moves on to the next source. A write that fails is counted as skipped
 * for its series and the run moves on to the next observation. Only an unreachable store ({@link
 * StoreUnavailableException}) aborts the run.
 *
 * <p><b>No run-wide transaction:</b> each insert or update commits on its own, so an interrupted
 * run leaves the store consistent and the next run picks up whatever was not reconciled.
 *
 * <p><b>Ordering:</b> observations are processed one at a time on the calling thread, which keeps
 * the read-decide-write sequence for a key from racing with itself.
 */
@Service
public class MarketDataImportService {

  private static final Logger log = LoggerFactory.getLogger(MarketDataImportService.class);

  private final MarketDataSourceFactory marketDataSourceFactory;
  private final Reconciler reconciler;
  private final MarketDataStore marketDataStore;

  /**
   * Constructs a new MarketDataImportService.
   *
   * @param marketDataSourceFactory builds the configured sources for each run
   * @param reconciler decides the action per observation
   * @param marketDataStore the store decisions are applied to
   */
  public MarketDataImportService(
      MarketDataSourceFactory marketDataSourceFactory,
      Reconciler reconciler,
      MarketDataStore marketDataStore) {
    this.marketDataSourceFactory = marketDataSourceFactory;
    this.reconciler = reconciler;
    this.marketDataStore = marketDataStore;
  }

  /**
   * Imports the latest data from every enabled source. Called from the scheduled job, the admin
   * endpoint and optionally at startup.
   *
   * @return per series counts and the sources skipped in this run
   * @throws StoreUnavailableException if the store cannot be reached
   */
  public MarketDataImportSummary importLatestMarketData() {
    return importFrom(marketDataSourceFactory.createSources());
  }

  /**
   * Imports from the given sources in order.
   *
   * @param sources sources to run
   * @return per series counts and the sources skipped in this run
   * @throws StoreUnavailableException if the store cannot be reached
   */
  public MarketDataImportSummary importFrom(List<MarketDataSource> sources) {
    if (sources.isEmpty()) {
      log.warn("No market data sources enabled - skipping import");
      return new MarketDataImportSummary(new LinkedHashMap<>(), List.of());
    }

    var countsBySeriesType = new LinkedHashMap<String, SeriesImportCounts>();
    var skippedSources = new ArrayList<SkippedSource>();

    for (var source : sources) {
      if (Thread.currentThread().isInterrupted()) {
        log.warn("Market data import interrupted before source {}", source.name());
        break;
      }

      ObservationBatch batch;
      try {
        log.info("Fetching market data source {}", source.name());
        batch = source.fetchObservations();
      } catch (ServiceException e) {
        log.warn("Skipping source {} for this run: {}", source.name(), e.getMessage());
        skippedSources.add(new SkippedSource(source.name(), source.seriesType(), e.getMessage()));
        continue;
      } catch (RuntimeException e) {
        log.error("Unexpected failure in source {}, skipping for this run", source.name(), e);
        skippedSources.add(new SkippedSource(source.name(), source.seriesType(), e.toString()));
        continue;
      }

      var counts = reconcileBatch(source, batch);
      countsBySeriesType.merge(source.seriesType(), counts, SeriesImportCounts::plus);
    }

    var summary = new MarketDataImportSummary(countsBySeriesType, skippedSources);
    var totals = summary.totals();

    log.info(
        "Import complete: {} series processed, {} new, {} updated, {} unchanged, {} skipped,"
            + " {} sources skipped",
        countsBySeriesType.size(),
        totals.inserted(),
        totals.updated(),
        totals.unchanged(),
        totals.skipped(),
        skippedSources.size());

    return summary;
  }

  private SeriesImportCounts reconcileBatch(MarketDataSource source, ObservationBatch batch) {
    var tally = new Tally();
    tally.skipped = batch.rejected();

    if (batch.observations().isEmpty()) {
      log.info("No new data for {}", source.seriesType());
    }

    for (var observation : batch.observations()) {
      if (Thread.currentThread().isInterrupted()) {
        log.warn(
            "Market data import interrupted during {}, remaining observations left for next run",
            source.name());
        break;
      }

      try {
        var decision = reconciler.reconcile(observation, marketDataStore::findByKey);
        apply(decision, tally);
      } catch (StoreWriteException e) {
        tally.skipped++;
        log.warn(
            "Failed to store {} for {}: {}",
            observation.seriesType(),
            observation.date(),
            e.getMessage());
      }
    }

    if (tally.inserted == 0 && tally.updated == 0) {
      log.info("{}: nothing new, {} unchanged", source.seriesType(), tally.unchanged);
    } else {
      log.info(
          "{}: {} new, {} updated, {} unchanged",
          source.seriesType(),
          tally.inserted,
          tally.updated,
          tally.unchanged);
    }

    return new SeriesImportCounts(tally.inserted, tally.updated, tally.unchanged, tally.skipped);
  }

  private void apply(ReconciliationDecision decision, Tally tally) {
    var observation = decision.observation();

    if (decision instanceof ReconciliationDecision.Insert) {
      marketDataStore.insert(observation);
      tally.inserted++;
      log.info(
          "Inserted {} for {}: {}",
          observation.seriesType(),
          observation.date(),
          observation.value());
    } else if (decision instanceof ReconciliationDecision.UpdateValue update) {
      marketDataStore.updateValue(update.id(), observation);
      tally.updated++;
      log.warn(
          "Value revised, updated {} for {}: {}",
          observation.seriesType(),
          observation.date(),
          observation.value());
    } else {
      tally.unchanged++;
      log.debug("Unchanged {} for {}", observation.seriesType(), observation.date());
    }
  }

  private static final class Tally {
    private int inserted;
    private int updated;
    private int unchanged;
    private int skipped;
  }
}
