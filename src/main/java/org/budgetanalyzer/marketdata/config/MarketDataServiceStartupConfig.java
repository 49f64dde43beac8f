package org.budgetanalyzer.marketdata.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import org.budgetanalyzer.marketdata.logging.SafeLogger;
import org.budgetanalyzer.marketdata.service.MarketDataImportService;

@Component
public class MarketDataServiceStartupConfig {

  private static final Logger log = LoggerFactory.getLogger(MarketDataServiceStartupConfig.class);

  private final MarketDataServiceProperties properties;
  private final MarketDataImportService marketDataImportService;

  public MarketDataServiceStartupConfig(
      MarketDataServiceProperties properties, MarketDataImportService marketDataImportService) {
    this.properties = properties;
    this.marketDataImportService = marketDataImportService;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onStartup() {
    log.info("Market Data Service Configuration:\n{}", SafeLogger.toJson(properties));
    importIfEnabled();
  }

  // unlike the scheduled job there is no retry here; the next scheduled run catches up
  private void importIfEnabled() {
    if (!properties.getMarketDataImport().isImportOnStartup()) {
      log.info("Startup import is disabled");
      return;
    }

    try {
      var summary = marketDataImportService.importLatestMarketData();
      log.info("Completed startup market data import: {}", SafeLogger.toJson(summary));
    } catch (Exception e) {
      log.error("Startup market data import failed, waiting for next scheduled run", e);
    }
  }
}
