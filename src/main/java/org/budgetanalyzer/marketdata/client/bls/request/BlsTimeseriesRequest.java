package org.budgetanalyzer.marketdata.client.bls.request;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of a BLS {@code timeseries/data} POST. The registration key is only sent for v2. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BlsTimeseriesRequest(
    @JsonProperty("seriesid") List<String> seriesIds,
    @JsonProperty("startyear") String startYear,
    @JsonProperty("endyear") String endYear,
    @JsonProperty("registrationkey") String registrationKey) {}
