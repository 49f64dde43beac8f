package org.budgetanalyzer.marketdata.service.adapter;

import java.time.LocalDate;
import java.util.LinkedHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.budgetanalyzer.marketdata.client.fred.response.FredSeriesObservationsResponse;
import org.budgetanalyzer.marketdata.exception.ObservationParseException;
import org.budgetanalyzer.marketdata.exception.PayloadShapeException;
import org.budgetanalyzer.marketdata.service.dto.Observation;
import org.budgetanalyzer.marketdata.service.dto.ObservationBatch;
import org.budgetanalyzer.marketdata.service.normalizer.ObservationNormalizer;

/**
 * Adapter for FRED series observations.
 *
 * <p>Dates arrive in calendar form and are used as-is. Entries carrying FRED's "." marker are
 * dropped. Entries with a non-numeric value or a missing or invalid date are dropped and counted
 * as rejected. A repeated date keeps its first entry.
 */
@Component
public class FredObservationAdapter implements SourceAdapter<FredSeriesObservationsResponse> {

  private static final Logger log = LoggerFactory.getLogger(FredObservationAdapter.class);

  private final ObjectMapper objectMapper;

  public FredObservationAdapter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public ObservationBatch produce(String seriesType, FredSeriesObservationsResponse payload) {
    if (payload == null || payload.observations() == null) {
      throw new PayloadShapeException(
          "FRED response for " + seriesType + " has no observations array");
    }

    var byDate = new LinkedHashMap<LocalDate, Observation>();
    var rejected = 0;

    for (var entry : payload.observations()) {
      if (entry == null) {
        continue;
      }

      if (ObservationNormalizer.isBlankOrSentinel(entry.value())) {
        log.debug(
            "No {} data for {} (value '{}'), skipping", seriesType, entry.date(), entry.value());
        continue;
      }

      try {
        var date = ObservationNormalizer.parseDate(entry.date());
        var value = ObservationNormalizer.parseDecimal(entry.value());
        var observation =
            Observation.singlePoint(seriesType, date, value, objectMapper.valueToTree(entry));

        if (byDate.putIfAbsent(date, observation) != null) {
          log.debug("Ignoring repeated {} observation for {}", seriesType, date);
        }
      } catch (ObservationParseException e) {
        rejected++;
        log.warn(
            "Dropping unparsable {} observation date: {} value: '{}': {}",
            seriesType,
            entry.date(),
            entry.value(),
            e.getMessage());
      }
    }

    return new ObservationBatch(byDate.values().stream().toList(), rejected);
  }
}
