package org.budgetanalyzer.marketdata.service.adapter;

import org.budgetanalyzer.marketdata.exception.PayloadShapeException;
import org.budgetanalyzer.marketdata.service.dto.ObservationBatch;

/**
 * Translates one source's decoded response into canonical observations.
 *
 * <p>Implementations do no I/O and hold no state. An unparsable entry is dropped and counted in
 * {@link ObservationBatch#rejected()}; the rest of the payload is still translated.
 *
 * @param <P> decoded response type of the source
 */
public interface SourceAdapter<P> {

  /**
   * Translates a decoded response.
   *
   * @param seriesType series type stamped on every produced observation
   * @param payload decoded response body
   * @return observations, at most one per date
   * @throws PayloadShapeException if the payload lacks the structure the source guarantees
   */
  ObservationBatch produce(String seriesType, P payload);
}
