package org.budgetanalyzer.marketdata.service.source;

import org.budgetanalyzer.marketdata.client.bls.BlsClient;
import org.budgetanalyzer.marketdata.service.adapter.BlsObservationAdapter;
import org.budgetanalyzer.marketdata.service.dto.ObservationBatch;

public class BlsMarketDataSource implements MarketDataSource {

  private final String seriesType;
  private final String blsSeriesId;
  private final BlsClient blsClient;
  private final BlsObservationAdapter adapter;

  public BlsMarketDataSource(
      String seriesType, String blsSeriesId, BlsClient blsClient, BlsObservationAdapter adapter) {
    this.seriesType = seriesType;
    this.blsSeriesId = blsSeriesId;
    this.blsClient = blsClient;
    this.adapter = adapter;
  }

  @Override
  public String name() {
    return "bls:" + seriesType;
  }

  @Override
  public String seriesType() {
    return seriesType;
  }

  @Override
  public ObservationBatch fetchObservations() {
    return adapter.produce(seriesType, blsClient.getSeriesData(blsSeriesId));
  }
}
