package org.budgetanalyzer.marketdata.client.bls.response;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of a BLS {@code timeseries/data} response. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BlsTimeseriesResponse(
    String status,
    Integer responseTime,
    List<String> message,
    @JsonProperty("Results") Results results) {

  public static final String STATUS_SUCCEEDED = "REQUEST_SUCCEEDED";

  public boolean isSucceeded() {
    return STATUS_SUCCEEDED.equals(status);
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Results(List<Series> series) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Series(@JsonProperty("seriesID") String seriesId, List<DataPoint> data) {}

  /**
   * One published period. {@code period} is {@code M01}..{@code M12} for monthly data; {@code
   * value} is blank for periods not yet published.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record DataPoint(
      String year,
      String period,
      String periodName,
      String latest,
      String value,
      List<Footnote> footnotes) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Footnote(String code, String text) {}
}
