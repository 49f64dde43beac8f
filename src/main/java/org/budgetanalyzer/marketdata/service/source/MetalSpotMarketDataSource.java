package org.budgetanalyzer.marketdata.service.source;

import org.budgetanalyzer.marketdata.client.metals.MetalsClient;
import org.budgetanalyzer.marketdata.service.adapter.MetalSpotObservationAdapter;
import org.budgetanalyzer.marketdata.service.dto.ObservationBatch;

/** Spot price of one metal; the metal name doubles as the series type. */
public class MetalSpotMarketDataSource implements MarketDataSource {

  private final String metal;
  private final MetalsClient metalsClient;
  private final MetalSpotObservationAdapter adapter;

  public MetalSpotMarketDataSource(
      String metal, MetalsClient metalsClient, MetalSpotObservationAdapter adapter) {
    this.metal = metal;
    this.metalsClient = metalsClient;
    this.adapter = adapter;
  }

  @Override
  public String name() {
    return "metals:" + metal;
  }

  @Override
  public String seriesType() {
    return metal;
  }

  @Override
  public ObservationBatch fetchObservations() {
    return adapter.produce(metal, metalsClient.getSpotPrice(metal));
  }
}
