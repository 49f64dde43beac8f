package org.budgetanalyzer.marketdata.client.fred.response;

import java.time.LocalDate;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of a FRED {@code series/observations} response. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FredSeriesObservationsResponse(
    @JsonProperty("realtime_start") LocalDate realtimeStart,
    @JsonProperty("realtime_end") LocalDate realtimeEnd,
    @JsonProperty("observation_start") LocalDate observationStart,
    @JsonProperty("observation_end") LocalDate observationEnd,
    String units,
    @JsonProperty("output_type") Integer outputType,
    @JsonProperty("file_type") String fileType,
    @JsonProperty("order_by") String orderBy,
    @JsonProperty("sort_order") String sortOrder,
    Integer count,
    Integer offset,
    Integer limit,
    List<Observation> observations) {

  /**
   * A date/value pair; {@code value} is "." when FRED has no data for the date. Fields stay raw
   * strings so one malformed entry does not fail decoding of the whole response.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Observation(
      @JsonProperty("realtime_start") String realtimeStart,
      @JsonProperty("realtime_end") String realtimeEnd,
      String date,
      String value) {}
}
