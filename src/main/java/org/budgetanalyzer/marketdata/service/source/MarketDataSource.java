package org.budgetanalyzer.marketdata.service.source;

import org.budgetanalyzer.marketdata.service.dto.ObservationBatch;

/** One configured series of one external source: a client call followed by its adapter. */
public interface MarketDataSource {

  /** Name used in logs and the run summary, e.g. {@code bls:cpi}. */
  String name();

  /** Series type stamped on every observation this source produces. */
  String seriesType();

  /**
   * Fetches the source and translates the response.
   *
   * @return observations for this run
   * @throws org.budgetanalyzer.marketdata.exception.ClientException if the source cannot be read
   * @throws org.budgetanalyzer.marketdata.exception.PayloadShapeException if the response lacks
   *     the expected structure
   */
  ObservationBatch fetchObservations();
}
