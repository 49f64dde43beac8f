package org.budgetanalyzer.marketdata.service.adapter;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.budgetanalyzer.marketdata.client.metals.response.MetalSpotResponse;
import org.budgetanalyzer.marketdata.exception.PayloadShapeException;
import org.budgetanalyzer.marketdata.service.dto.Observation;
import org.budgetanalyzer.marketdata.service.dto.ObservationBatch;

/**
 * Adapter for metals.dev spot responses.
 *
 * <p>Always produces exactly one observation, dated by the calendar-date part of the response
 * timestamp. The time of day is discarded, so every poll on the same day targets the same row.
 * The whole response is kept as the raw payload.
 */
@Component
public class MetalSpotObservationAdapter implements SourceAdapter<MetalSpotResponse> {

  private final ObjectMapper objectMapper;

  public MetalSpotObservationAdapter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public ObservationBatch produce(String seriesType, MetalSpotResponse payload) {
    if (payload == null || payload.rate() == null) {
      throw new PayloadShapeException("Metals response for " + seriesType + " has no rate");
    }

    var rate = payload.rate();
    if (rate.price() == null || rate.high() == null || rate.low() == null) {
      throw new PayloadShapeException(
          "Metals rate for " + seriesType + " is missing price, high or low");
    }

    var observation =
        new Observation(
            seriesType,
            toDate(seriesType, payload.timestamp()),
            rate.price(),
            rate.high(),
            rate.low(),
            objectMapper.valueToTree(payload));

    return ObservationBatch.of(List.of(observation));
  }

  private LocalDate toDate(String seriesType, String timestamp) {
    if (timestamp == null || timestamp.isBlank()) {
      throw new PayloadShapeException("Metals response for " + seriesType + " has no timestamp");
    }

    var separator = timestamp.indexOf('T');
    var datePart = separator >= 0 ? timestamp.substring(0, separator) : timestamp.trim();

    try {
      return LocalDate.parse(datePart);
    } catch (DateTimeParseException e) {
      throw new PayloadShapeException(
          "Metals response for " + seriesType + " has an invalid timestamp: " + timestamp, e);
    }
  }
}
