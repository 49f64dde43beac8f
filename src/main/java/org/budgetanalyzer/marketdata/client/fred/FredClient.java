package org.budgetanalyzer.marketdata.client.fred;

import java.time.Duration;
import java.time.LocalDate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import reactor.core.publisher.Mono;

import org.budgetanalyzer.marketdata.client.fred.response.FredErrorResponse;
import org.budgetanalyzer.marketdata.client.fred.response.FredSeriesObservationsResponse;
import org.budgetanalyzer.marketdata.config.MarketDataServiceProperties;
import org.budgetanalyzer.marketdata.exception.ClientException;
import org.budgetanalyzer.marketdata.logging.SafeLogger;

/** Client for the St. Louis Fed FRED API. */
@Component
public class FredClient {

  private static final Logger log = LoggerFactory.getLogger(FredClient.class);

  private static final String USER_AGENT = "MarketDataServiceClient/1.0";

  private final WebClient webClient;
  private final MarketDataServiceProperties.Fred fredConfig;
  private final ObjectMapper objectMapper;

  public FredClient(
      WebClient.Builder webClientBuilder,
      MarketDataServiceProperties properties,
      ObjectMapper objectMapper) {
    this.fredConfig = properties.getFred();
    this.objectMapper = objectMapper;
    this.webClient =
        webClientBuilder
            .clone()
            .baseUrl(fredConfig.getBaseUrl())
            .defaultHeader("User-Agent", USER_AGENT)
            .build();

    log.info("FredClient initialized with base URL: {}", fredConfig.getBaseUrl());
  }

  /**
   * Fetches observations for one series.
   *
   * @param seriesId FRED series id, e.g. FEDFUNDS
   * @param startDate first observation date to request, null for the full series
   * @return the decoded response
   * @throws ClientException if no API key is configured or FRED cannot be reached or answers with
   *     an error
   */
  public FredSeriesObservationsResponse getSeriesObservationsData(
      String seriesId, LocalDate startDate) {
    if (fredConfig.getApiKey() == null || fredConfig.getApiKey().isBlank()) {
      throw new ClientException("FRED API key must be configured, skipping " + seriesId);
    }

    log.info("Requesting FRED series: {} startDate: {}", seriesId, startDate);

    try {
      var response =
          webClient
              .get()
              .uri(
                  uriBuilder -> {
                    uriBuilder
                        .path("/series/observations")
                        .queryParam("series_id", seriesId)
                        .queryParam("api_key", fredConfig.getApiKey())
                        .queryParam("file_type", "json");
                    if (startDate != null) {
                      uriBuilder.queryParam("observation_start", startDate.toString());
                    }
                    return uriBuilder.build();
                  })
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .onStatus(HttpStatusCode::isError, this::handleErrorResponse)
              .bodyToMono(FredSeriesObservationsResponse.class)
              .timeout(Duration.ofSeconds(fredConfig.getTimeoutSeconds()))
              .block();

      if (response == null) {
        throw new ClientException("Received null response from FRED API");
      }

      log.debug(
          "Successfully fetched data from FRED API for series: {} data:\n{}",
          seriesId,
          SafeLogger.toJson(response));
      return response;
    } catch (ClientException ce) {
      throw ce;
    } catch (Exception e) {
      log.warn(
          "Unexpected error fetching FRED data for series {}: {}", seriesId, e.getMessage(), e);
      throw new ClientException("Failed to fetch FRED data for series: " + seriesId, e);
    }
  }

  private Mono<? extends Throwable> handleErrorResponse(ClientResponse response) {
    return response
        .bodyToMono(String.class)
        .defaultIfEmpty("No response body")
        .map(body -> parseErrorAndCreateException(response, body));
  }

  private Throwable parseErrorAndCreateException(ClientResponse response, String body) {
    Integer errorCode = null;
    String errorMessage = body;

    try {
      var errorResponse = objectMapper.readValue(body, FredErrorResponse.class);
      if (errorResponse.errorMessage() != null) {
        errorMessage = errorResponse.errorMessage();
      }
      errorCode = errorResponse.errorCode();
    } catch (JsonProcessingException e) {
      // Not JSON, keep the raw body as the message
      log.debug("Could not parse FRED error response as JSON: {}", e.getMessage());

      if (body.length() > 500) {
        errorMessage = body.substring(0, 500) + "... (truncated)";
      }
    }

    log.warn(
        "FRED API error: HTTP {} - Error Code: {} - Message: {}",
        response.statusCode(),
        errorCode,
        errorMessage);

    return new ClientException("FRED API error message: " + errorMessage + " code: " + errorCode);
  }
}
