package org.budgetanalyzer.marketdata.client.bls;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;

import reactor.core.publisher.Mono;

import org.budgetanalyzer.marketdata.client.bls.request.BlsTimeseriesRequest;
import org.budgetanalyzer.marketdata.client.bls.response.BlsTimeseriesResponse;
import org.budgetanalyzer.marketdata.config.MarketDataServiceProperties;
import org.budgetanalyzer.marketdata.exception.ClientException;
import org.budgetanalyzer.marketdata.logging.SafeLogger;

/** Client for the Bureau of Labor Statistics timeseries API. */
@Component
public class BlsClient {

  private static final Logger log = LoggerFactory.getLogger(BlsClient.class);

  private static final String USER_AGENT = "MarketDataServiceClient/1.0";
  private static final int MAX_ERROR_BODY_LENGTH = 500;

  private final WebClient webClient;
  private final MarketDataServiceProperties.Bls blsConfig;
  private final Clock clock;

  public BlsClient(
      WebClient.Builder webClientBuilder, MarketDataServiceProperties properties, Clock clock) {
    this.blsConfig = properties.getBls();
    this.clock = clock;
    this.webClient =
        webClientBuilder
            .clone()
            .baseUrl(blsConfig.getBaseUrl())
            .defaultHeader("User-Agent", USER_AGENT)
            .build();

    log.info(
        "BlsClient initialized with base URL: {} api version: {}",
        blsConfig.getBaseUrl(),
        blsConfig.getApiVersion());
  }

  /**
   * Fetches the current calendar year of data for one series.
   *
   * @param seriesId BLS series id, e.g. CUUR0000SA0
   * @return the decoded response, always with status REQUEST_SUCCEEDED
   * @throws ClientException if BLS cannot be reached, answers with an error status, or reports the
   *     request as failed
   */
  public BlsTimeseriesResponse getSeriesData(String seriesId) {
    var year = String.valueOf(LocalDate.now(clock).getYear());
    var request = new BlsTimeseriesRequest(List.of(seriesId), year, year, registrationKey());

    log.info("Requesting BLS series: {} year: {}", seriesId, year);

    try {
      var response =
          webClient
              .post()
              .uri("/{version}/timeseries/data/", blsConfig.getApiVersion())
              .contentType(MediaType.APPLICATION_JSON)
              .accept(MediaType.APPLICATION_JSON)
              .bodyValue(request)
              .retrieve()
              .onStatus(HttpStatusCode::isError, this::handleErrorResponse)
              .bodyToMono(BlsTimeseriesResponse.class)
              .timeout(Duration.ofSeconds(blsConfig.getTimeoutSeconds()))
              .block();

      if (response == null) {
        throw new ClientException("Received null response from BLS API");
      }

      if (!response.isSucceeded()) {
        log.warn(
            "BLS API failed for series {}: status {} message {}",
            seriesId,
            response.status(),
            response.message());
        throw new ClientException(
            "BLS API failed for series " + seriesId + ": " + describeMessage(response));
      }

      log.debug(
          "Successfully fetched data from BLS API for series: {} data:\n{}",
          seriesId,
          SafeLogger.toJson(response));
      return response;
    } catch (ClientException ce) {
      throw ce;
    } catch (Exception e) {
      log.warn("Unexpected error fetching BLS data for series {}: {}", seriesId, e.getMessage(), e);
      throw new ClientException("Failed to fetch BLS data for series: " + seriesId, e);
    }
  }

  // registration keys only apply to v2
  private String registrationKey() {
    var key = blsConfig.getRegistrationKey();
    if ("v1".equalsIgnoreCase(blsConfig.getApiVersion()) || key == null || key.isBlank()) {
      return null;
    }

    return key;
  }

  private String describeMessage(BlsTimeseriesResponse response) {
    if (response.message() == null || response.message().isEmpty()) {
      return "Unknown error";
    }

    return String.join("; ", response.message());
  }

  private Mono<? extends Throwable> handleErrorResponse(ClientResponse response) {
    return response
        .bodyToMono(String.class)
        .defaultIfEmpty("No response body")
        .map(
            body -> {
              var message =
                  body.length() > MAX_ERROR_BODY_LENGTH
                      ? body.substring(0, MAX_ERROR_BODY_LENGTH) + "... (truncated)"
                      : body;
              log.warn("BLS API error: HTTP {} - Message: {}", response.statusCode(), message);
              return new ClientException(
                  "BLS API error: HTTP " + response.statusCode().value() + " " + message);
            });
  }
}
