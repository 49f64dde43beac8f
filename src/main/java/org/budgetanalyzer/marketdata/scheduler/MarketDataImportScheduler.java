package org.budgetanalyzer.marketdata.scheduler;

import java.time.Duration;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;

import org.budgetanalyzer.marketdata.config.MarketDataServiceProperties;
import org.budgetanalyzer.marketdata.logging.SafeLogger;
import org.budgetanalyzer.marketdata.service.MarketDataImportService;
import org.budgetanalyzer.marketdata.service.dto.MarketDataImportSummary;

/**
 * Runs the market data import on a cron schedule.
 *
 * <p>A run that completes with skipped sources counts as a success; those sources are simply
 * picked up by the next scheduled run. Only a run that throws (store unreachable) is retried,
 * each retry scheduled as a separate task so it shows up as its own execution in the metrics.
 */
@Component
public class MarketDataImportScheduler {

  private static final Logger log = LoggerFactory.getLogger(MarketDataImportScheduler.class);

  private final TaskScheduler taskScheduler;
  private final MeterRegistry meterRegistry;
  private final MarketDataServiceProperties properties;
  private final MarketDataImportService marketDataImportService;

  public MarketDataImportScheduler(
      TaskScheduler taskScheduler,
      MeterRegistry meterRegistry,
      MarketDataServiceProperties properties,
      MarketDataImportService marketDataImportService) {
    this.taskScheduler = taskScheduler;
    this.meterRegistry = meterRegistry;
    this.properties = properties;
    this.marketDataImportService = marketDataImportService;
  }

  @Scheduled(cron = "${market-data-service.market-data-import.cron:0 0 6 * * ?}", zone = "UTC")
  @SchedulerLock(name = "marketDataImport", lockAtMostFor = "15m", lockAtLeastFor = "1m")
  public void importMarketData() {
    var retryConfig = properties.getMarketDataImport().getRetry();

    log.info(
        "Starting scheduled market data import (max attempts: {}, delay: {} minutes)",
        retryConfig.getMaxAttempts(),
        retryConfig.getDelayMinutes());

    executeImport(1);
  }

  private void executeImport(int attemptNumber) {
    var sample = Timer.start(meterRegistry);

    try {
      var summary = marketDataImportService.importLatestMarketData();
      log.info(
          "Completed market data import on attempt {} for {} series: {}",
          attemptNumber,
          summary.countsBySeriesType().size(),
          SafeLogger.toJson(summary));

      recordSuccess(sample, attemptNumber, summary);
    } catch (Exception e) {
      var maxAttempts = properties.getMarketDataImport().getRetry().getMaxAttempts();

      log.error(
          "Failed to import market data on attempt {}/{}: {}",
          attemptNumber,
          maxAttempts,
          e.getMessage(),
          e);

      recordFailure(sample, attemptNumber, e);

      if (attemptNumber < maxAttempts) {
        scheduleRetry(attemptNumber + 1);
      } else {
        log.error("All retry attempts exhausted for market data import");
        meterRegistry.counter("market.data.import.exhausted").increment();
      }
    }
  }

  private void scheduleRetry(int attemptNumber) {
    var delayMinutes = properties.getMarketDataImport().getRetry().getDelayMinutes();
    var retryTime = Instant.now().plus(Duration.ofMinutes(delayMinutes));

    log.info(
        "Scheduling retry attempt {} in {} minutes at {}", attemptNumber, delayMinutes, retryTime);

    meterRegistry
        .counter("market.data.import.retry.scheduled", "attempt", String.valueOf(attemptNumber))
        .increment();

    taskScheduler.schedule(
        () -> {
          log.info("Executing retry attempt {} (scheduled retry)", attemptNumber);
          executeImport(attemptNumber);
        },
        retryTime);
  }

  private void recordSuccess(
      Timer.Sample sample, int attemptNumber, MarketDataImportSummary summary) {
    sample.stop(
        Timer.builder("market.data.import.duration")
            .tag("status", "success")
            .tag("attempt", String.valueOf(attemptNumber))
            .register(meterRegistry));

    meterRegistry
        .counter(
            "market.data.import.executions",
            "status",
            "success",
            "attempt",
            String.valueOf(attemptNumber))
        .increment();

    summary
        .skippedSources()
        .forEach(
            skipped ->
                meterRegistry
                    .counter("market.data.import.sources.skipped", "source", skipped.source())
                    .increment());
  }

  private void recordFailure(Timer.Sample sample, int attemptNumber, Exception e) {
    sample.stop(
        Timer.builder("market.data.import.duration")
            .tag("status", "failure")
            .tag("attempt", String.valueOf(attemptNumber))
            .tag("error", e.getClass().getSimpleName())
            .register(meterRegistry));

    meterRegistry
        .counter(
            "market.data.import.executions",
            "status",
            "failure",
            "attempt",
            String.valueOf(attemptNumber),
            "error",
            e.getClass().getSimpleName())
        .increment();
  }
}
