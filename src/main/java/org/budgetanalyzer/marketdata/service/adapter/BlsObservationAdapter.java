package org.budgetanalyzer.marketdata.service.adapter;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.LinkedHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.budgetanalyzer.marketdata.client.bls.response.BlsTimeseriesResponse;
import org.budgetanalyzer.marketdata.exception.ObservationParseException;
import org.budgetanalyzer.marketdata.exception.PayloadShapeException;
import org.budgetanalyzer.marketdata.service.dto.Observation;
import org.budgetanalyzer.marketdata.service.dto.ObservationBatch;
import org.budgetanalyzer.marketdata.service.normalizer.ObservationNormalizer;

/**
 * Adapter for BLS timeseries responses.
 *
 * <p>Each data point becomes a single-point observation dated the first of its month. Points with a
 * blank or "-" value are periods BLS has not published or marks unavailable, and are dropped
 * without counting as rejected. A point whose year cannot form a date is rejected.
 *
 * <p>Period codes outside {@code M01..M12} fall back to January, so an annual average ({@code
 * M13}) can land on the same date as January. When that happens the real monthly point wins;
 * between two points of the same kind the first one in the response wins.
 */
@Component
public class BlsObservationAdapter implements SourceAdapter<BlsTimeseriesResponse> {

  private static final Logger log = LoggerFactory.getLogger(BlsObservationAdapter.class);

  private final ObjectMapper objectMapper;

  public BlsObservationAdapter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public ObservationBatch produce(String seriesType, BlsTimeseriesResponse payload) {
    var series = requireSeries(seriesType, payload);

    var byDate = new LinkedHashMap<LocalDate, Candidate>();
    var rejected = 0;

    for (var point : series.data()) {
      if (point == null || ObservationNormalizer.isBlankOrSentinel(point.value())) {
        log.debug(
            "Skipping unpublished {} period {} {}",
            seriesType,
            point != null ? point.year() : null,
            point != null ? point.period() : null);
        continue;
      }

      try {
        var candidate = toCandidate(seriesType, point);
        var existing = byDate.get(candidate.observation().date());

        if (existing == null) {
          byDate.put(candidate.observation().date(), candidate);
        } else if (candidate.monthly() && !existing.monthly()) {
          log.debug(
              "Period {} replaces fallback period for {} {}",
              point.period(),
              seriesType,
              candidate.observation().date());
          byDate.put(candidate.observation().date(), candidate);
        } else {
          log.debug(
              "Ignoring repeated {} period {} for {}",
              seriesType,
              point.period(),
              candidate.observation().date());
        }
      } catch (ObservationParseException e) {
        rejected++;
        log.warn(
            "Dropping unparsable {} data point year: {} period: {} value: '{}': {}",
            seriesType,
            point.year(),
            point.period(),
            point.value(),
            e.getMessage());
      }
    }

    var observations = byDate.values().stream().map(Candidate::observation).toList();
    return new ObservationBatch(observations, rejected);
  }

  private BlsTimeseriesResponse.Series requireSeries(
      String seriesType, BlsTimeseriesResponse payload) {
    if (payload == null
        || payload.results() == null
        || payload.results().series() == null
        || payload.results().series().isEmpty()) {
      throw new PayloadShapeException("BLS response for " + seriesType + " has no series entries");
    }

    var series = payload.results().series().get(0);
    if (series == null || series.data() == null) {
      throw new PayloadShapeException("BLS response for " + seriesType + " has no data array");
    }

    return series;
  }

  private Candidate toCandidate(String seriesType, BlsTimeseriesResponse.DataPoint point) {
    var year = parseYear(point.year());
    var month = ObservationNormalizer.periodCodeToMonth(point.period());
    var value = ObservationNormalizer.parseDecimal(point.value());

    var observation =
        Observation.singlePoint(
            seriesType, firstOfMonth(year, month), value, objectMapper.valueToTree(point));
    return new Candidate(observation, ObservationNormalizer.isMonthlyPeriodCode(point.period()));
  }

  private LocalDate firstOfMonth(int year, int month) {
    try {
      return LocalDate.of(year, month, 1);
    } catch (DateTimeException e) {
      throw new ObservationParseException("Year is out of range: " + year, e);
    }
  }

  private int parseYear(String year) {
    if (year == null) {
      throw new ObservationParseException("Year is missing");
    }

    try {
      return Integer.parseInt(year.trim());
    } catch (NumberFormatException e) {
      throw new ObservationParseException("Year is not numeric: '" + year + "'", e);
    }
  }

  private record Candidate(Observation observation, boolean monthly) {}
}
