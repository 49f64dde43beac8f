package org.budgetanalyzer.marketdata.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import org.budgetanalyzer.marketdata.config.MarketDataServiceProperties;
import org.budgetanalyzer.marketdata.exception.StoreUnavailableException;
import org.budgetanalyzer.marketdata.service.MarketDataImportService;
import org.budgetanalyzer.marketdata.service.dto.MarketDataImportSummary;
import org.budgetanalyzer.marketdata.service.dto.SeriesImportCounts;
import org.budgetanalyzer.marketdata.service.dto.SkippedSource;

/**
 * Unit tests for {@link MarketDataImportScheduler}.
 *
 * <p><b>Test Coverage:</b>
 *
 * <ul>
 *   <li>Successful import execution and metrics recording
 *   <li>Skipped sources counted without triggering a retry
 *   <li>Failed import with retry scheduling
 *   <li>Retry exhaustion after max attempts
 * </ul>
 *
 * <p><b>Note:</b> ShedLock coordination is not covered here; these tests focus on the retry
 * mechanism and metrics.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("MarketDataImportScheduler Unit Tests")
class MarketDataImportSchedulerTest {

  // ===========================================================================================
  // Test Dependencies
  // ===========================================================================================

  @Mock private TaskScheduler taskScheduler;

  @Mock private MarketDataImportService importService;

  private MeterRegistry meterRegistry;

  private MarketDataServiceProperties properties;

  private MarketDataImportScheduler scheduler;

  // ===========================================================================================
  // Setup
  // ===========================================================================================

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();

    properties = new MarketDataServiceProperties();
    var retry = new MarketDataServiceProperties.MarketDataImport.Retry();
    retry.setMaxAttempts(3);
    retry.setDelayMinutes(1);
    properties.getMarketDataImport().setRetry(retry);

    scheduler =
        new MarketDataImportScheduler(taskScheduler, meterRegistry, properties, importService);
  }

  // ===========================================================================================
  // Test Cases - Successful Import
  // ===========================================================================================

  @Test
  @DisplayName("importMarketData - when successful - records metrics and does not retry")
  void importMarketData_WhenSuccessful_RecordsMetricsAndDoesNotRetry() {
    // Arrange
    when(importService.importLatestMarketData())
        .thenReturn(
            new MarketDataImportSummary(
                Map.of("cpi", new SeriesImportCounts(1, 0, 11, 0)), List.of()));

    // Act
    scheduler.importMarketData();

    // Assert
    verify(importService, times(1)).importLatestMarketData();
    verify(taskScheduler, never()).schedule(any(Runnable.class), any(Instant.class));

    Timer timer =
        meterRegistry
            .find("market.data.import.duration")
            .tag("status", "success")
            .tag("attempt", "1")
            .timer();
    assertThat(timer).isNotNull();
    assertThat(timer.count()).isEqualTo(1);

    Counter counter =
        meterRegistry
            .find("market.data.import.executions")
            .tag("status", "success")
            .tag("attempt", "1")
            .counter();
    assertThat(counter).isNotNull();
    assertThat(counter.count()).isEqualTo(1);

    assertThat(meterRegistry.find("market.data.import.retry.scheduled").counter()).isNull();
    assertThat(meterRegistry.find("market.data.import.exhausted").counter()).isNull();
  }

  @Test
  @DisplayName("importMarketData - with skipped sources - counts them and does not retry")
  void importMarketData_WithSkippedSources_CountsThemAndDoesNotRetry() {
    // Arrange
    var skipped =
        List.of(
            new SkippedSource("metals:gold", "gold", "No metals API key configured"),
            new SkippedSource("metals:silver", "silver", "No metals API key configured"));
    when(importService.importLatestMarketData())
        .thenReturn(new MarketDataImportSummary(Map.of(), skipped));

    // Act
    scheduler.importMarketData();

    // Assert
    verify(taskScheduler, never()).schedule(any(Runnable.class), any(Instant.class));

    Counter goldSkipped =
        meterRegistry
            .find("market.data.import.sources.skipped")
            .tag("source", "metals:gold")
            .counter();
    assertThat(goldSkipped).isNotNull();
    assertThat(goldSkipped.count()).isEqualTo(1);
    assertThat(meterRegistry.find("market.data.import.sources.skipped").counters()).hasSize(2);

    Counter success =
        meterRegistry.find("market.data.import.executions").tag("status", "success").counter();
    assertThat(success).isNotNull();
    assertThat(success.count()).isEqualTo(1);
  }

  // ===========================================================================================
  // Test Cases - Failed Import with Retry
  // ===========================================================================================

  @Test
  @DisplayName("importMarketData - when store unavailable - schedules retry")
  void importMarketData_WhenStoreUnavailable_SchedulesRetry() {
    // Arrange
    when(importService.importLatestMarketData())
        .thenThrow(
            new StoreUnavailableException(
                "Market data store unavailable", new RuntimeException("Connection refused")));

    // Act
    scheduler.importMarketData();

    // Assert
    ArgumentCaptor<Instant> instantCaptor = ArgumentCaptor.forClass(Instant.class);
    verify(taskScheduler, times(1)).schedule(any(Runnable.class), instantCaptor.capture());

    long delaySeconds = instantCaptor.getValue().getEpochSecond() - Instant.now().getEpochSecond();
    assertThat(delaySeconds).isBetween(55L, 65L);

    Counter counter =
        meterRegistry
            .find("market.data.import.executions")
            .tag("status", "failure")
            .tag("attempt", "1")
            .tag("error", "StoreUnavailableException")
            .counter();
    assertThat(counter).isNotNull();
    assertThat(counter.count()).isEqualTo(1);

    Counter retryCounter =
        meterRegistry.find("market.data.import.retry.scheduled").tag("attempt", "2").counter();
    assertThat(retryCounter).isNotNull();
    assertThat(retryCounter.count()).isEqualTo(1);
  }

  @Test
  @DisplayName("retry - when successful on second attempt - records metrics with attempt 2")
  void retry_WhenSuccessfulOnSecondAttempt_RecordsMetricsWithAttempt2() {
    // Arrange - first attempt fails, second succeeds
    when(importService.importLatestMarketData())
        .thenThrow(new RuntimeException("Temporary failure"))
        .thenReturn(new MarketDataImportSummary(Map.of(), List.of()));

    // Act
    scheduler.importMarketData();

    ArgumentCaptor<Runnable> runnableCaptor = ArgumentCaptor.forClass(Runnable.class);
    verify(taskScheduler).schedule(runnableCaptor.capture(), any(Instant.class));
    runnableCaptor.getValue().run();

    // Assert
    verify(importService, times(2)).importLatestMarketData();

    Timer timer =
        meterRegistry
            .find("market.data.import.duration")
            .tag("status", "success")
            .tag("attempt", "2")
            .timer();
    assertThat(timer).isNotNull();
    assertThat(timer.count()).isEqualTo(1);

    verify(taskScheduler, times(1)).schedule(any(Runnable.class), any(Instant.class));
  }

  // ===========================================================================================
  // Test Cases - Retry Exhaustion
  // ===========================================================================================

  @Test
  @DisplayName("importMarketData - when all attempts fail - records exhaustion and stops retrying")
  void importMarketData_WhenAllAttemptsFail_RecordsExhaustionAndStopsRetrying() {
    // Arrange
    when(importService.importLatestMarketData())
        .thenThrow(new RuntimeException("Persistent failure"));

    // Act - initial attempt, then both retries
    scheduler.importMarketData();

    ArgumentCaptor<Runnable> captor1 = ArgumentCaptor.forClass(Runnable.class);
    verify(taskScheduler, times(1)).schedule(captor1.capture(), any(Instant.class));
    captor1.getValue().run();

    ArgumentCaptor<Runnable> captor2 = ArgumentCaptor.forClass(Runnable.class);
    verify(taskScheduler, times(2)).schedule(captor2.capture(), any(Instant.class));
    captor2.getValue().run();

    // Assert
    verify(importService, times(3)).importLatestMarketData();
    verify(taskScheduler, times(2)).schedule(any(Runnable.class), any(Instant.class));

    Counter exhaustedCounter = meterRegistry.find("market.data.import.exhausted").counter();
    assertThat(exhaustedCounter).isNotNull();
    assertThat(exhaustedCounter.count()).isEqualTo(1);

    for (var attempt : List.of("1", "2", "3")) {
      Counter failure =
          meterRegistry
              .find("market.data.import.executions")
              .tag("status", "failure")
              .tag("attempt", attempt)
              .counter();
      assertThat(failure).isNotNull();
      assertThat(failure.count()).isEqualTo(1);
    }
  }

  @Test
  @DisplayName("importMarketData - with max attempts 1 - never retries")
  void importMarketData_WithMaxAttemptsOne_NeverRetries() {
    // Arrange
    properties.getMarketDataImport().getRetry().setMaxAttempts(1);
    when(importService.importLatestMarketData()).thenThrow(new IllegalStateException("boom"));

    // Act
    scheduler.importMarketData();

    // Assert
    verify(taskScheduler, never()).schedule(any(Runnable.class), any(Instant.class));
    assertThat(meterRegistry.find("market.data.import.exhausted").counter()).isNotNull();
  }
}
