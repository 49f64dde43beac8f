package org.budgetanalyzer.marketdata.service.dto;

import java.util.List;

/**
 * Output of one adapter call.
 *
 * @param observations one observation per (seriesType, date), in source order
 * @param rejected entries dropped because their value could not be parsed
 */
public record ObservationBatch(List<Observation> observations, int rejected) {

  public ObservationBatch {
    observations = List.copyOf(observations);
  }

  public static ObservationBatch of(List<Observation> observations) {
    return new ObservationBatch(observations, 0);
  }
}
