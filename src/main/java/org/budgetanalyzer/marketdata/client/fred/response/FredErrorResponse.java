package org.budgetanalyzer.marketdata.client.fred.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FredErrorResponse(
    @JsonProperty("error_code") Integer errorCode,
    @JsonProperty("error_message") String errorMessage) {}
