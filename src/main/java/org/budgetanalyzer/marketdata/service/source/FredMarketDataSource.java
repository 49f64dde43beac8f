package org.budgetanalyzer.marketdata.service.source;

import java.time.LocalDate;

import org.budgetanalyzer.marketdata.client.fred.FredClient;
import org.budgetanalyzer.marketdata.service.adapter.FredObservationAdapter;
import org.budgetanalyzer.marketdata.service.dto.ObservationBatch;

public class FredMarketDataSource implements MarketDataSource {

  private final String seriesType;
  private final String fredSeriesId;
  private final LocalDate startDate;
  private final FredClient fredClient;
  private final FredObservationAdapter adapter;

  /**
   * Constructs a new FredMarketDataSource.
   *
   * @param seriesType series type to store observations under
   * @param fredSeriesId FRED series id
   * @param startDate first date to request, null for the full series
   * @param fredClient the FRED API client
   * @param adapter the FRED adapter
   */
  public FredMarketDataSource(
      String seriesType,
      String fredSeriesId,
      LocalDate startDate,
      FredClient fredClient,
      FredObservationAdapter adapter) {
    this.seriesType = seriesType;
    this.fredSeriesId = fredSeriesId;
    this.startDate = startDate;
    this.fredClient = fredClient;
    this.adapter = adapter;
  }

  @Override
  public String name() {
    return "fred:" + seriesType;
  }

  @Override
  public String seriesType() {
    return seriesType;
  }

  @Override
  public ObservationBatch fetchObservations() {
    return adapter.produce(
        seriesType, fredClient.getSeriesObservationsData(fredSeriesId, startDate));
  }
}
