package org.budgetanalyzer.marketdata.client.metals.response;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of a metals.dev {@code metal/spot} response. Failed requests carry {@code status=failure}
 * with an error code and message instead of a rate.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MetalSpotResponse(
    String status,
    String timestamp,
    String currency,
    String unit,
    String metal,
    Rate rate,
    @JsonProperty("error_code") Integer errorCode,
    @JsonProperty("error_message") String errorMessage) {

  public static final String STATUS_SUCCESS = "success";

  public boolean isSuccess() {
    return STATUS_SUCCESS.equals(status);
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Rate(
      BigDecimal price,
      BigDecimal ask,
      BigDecimal bid,
      BigDecimal high,
      BigDecimal low,
      BigDecimal change,
      @JsonProperty("change_percent") BigDecimal changePercent) {}
}
