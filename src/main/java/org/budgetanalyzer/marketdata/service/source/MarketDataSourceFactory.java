package org.budgetanalyzer.marketdata.service.source;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import org.budgetanalyzer.marketdata.client.bls.BlsClient;
import org.budgetanalyzer.marketdata.client.fred.FredClient;
import org.budgetanalyzer.marketdata.client.metals.MetalsClient;
import org.budgetanalyzer.marketdata.config.MarketDataServiceProperties;
import org.budgetanalyzer.marketdata.service.adapter.BlsObservationAdapter;
import org.budgetanalyzer.marketdata.service.adapter.FredObservationAdapter;
import org.budgetanalyzer.marketdata.service.adapter.MetalSpotObservationAdapter;

/**
 * Builds the sources for an import run from configuration.
 *
 * <p>Order is BLS series, then metals, then FRED series, each in configuration order. Disabled
 * sources are left out.
 */
@Component
public class MarketDataSourceFactory {

  private static final Logger log = LoggerFactory.getLogger(MarketDataSourceFactory.class);

  private final MarketDataServiceProperties properties;
  private final Clock clock;
  private final BlsClient blsClient;
  private final MetalsClient metalsClient;
  private final FredClient fredClient;
  private final BlsObservationAdapter blsAdapter;
  private final MetalSpotObservationAdapter metalSpotAdapter;
  private final FredObservationAdapter fredAdapter;

  public MarketDataSourceFactory(
      MarketDataServiceProperties properties,
      Clock clock,
      BlsClient blsClient,
      MetalsClient metalsClient,
      FredClient fredClient,
      BlsObservationAdapter blsAdapter,
      MetalSpotObservationAdapter metalSpotAdapter,
      FredObservationAdapter fredAdapter) {
    this.properties = properties;
    this.clock = clock;
    this.blsClient = blsClient;
    this.metalsClient = metalsClient;
    this.fredClient = fredClient;
    this.blsAdapter = blsAdapter;
    this.metalSpotAdapter = metalSpotAdapter;
    this.fredAdapter = fredAdapter;
  }

  public List<MarketDataSource> createSources() {
    var sources = new ArrayList<MarketDataSource>();

    var bls = properties.getBls();
    if (bls.isEnabled()) {
      bls.getSeries()
          .forEach(
              (seriesType, seriesId) ->
                  sources.add(
                      new BlsMarketDataSource(seriesType, seriesId, blsClient, blsAdapter)));
    }

    var metals = properties.getMetals();
    if (metals.isEnabled()) {
      metals
          .getMetals()
          .forEach(
              metal ->
                  sources.add(
                      new MetalSpotMarketDataSource(metal, metalsClient, metalSpotAdapter)));
    }

    var fred = properties.getFred();
    if (fred.isEnabled()) {
      var startDate =
          fred.getLookbackDays() > 0
              ? LocalDate.now(clock).minusDays(fred.getLookbackDays())
              : null;
      fred.getSeries()
          .forEach(
              (seriesType, seriesId) ->
                  sources.add(
                      new FredMarketDataSource(
                          seriesType, seriesId, startDate, fredClient, fredAdapter)));
    }

    log.debug(
        "Configured market data sources: {}",
        sources.stream().map(MarketDataSource::name).toList());

    return sources;
  }
}
