package org.budgetanalyzer.marketdata.client.metals;

import java.time.Duration;

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

import org.budgetanalyzer.marketdata.client.metals.response.MetalSpotResponse;
import org.budgetanalyzer.marketdata.config.MarketDataServiceProperties;
import org.budgetanalyzer.marketdata.exception.ClientException;
import org.budgetanalyzer.marketdata.logging.SafeLogger;

/** Client for the metals.dev spot price API. */
@Component
public class MetalsClient {

  private static final Logger log = LoggerFactory.getLogger(MetalsClient.class);

  private static final String USER_AGENT = "MarketDataServiceClient/1.0";

  private final WebClient webClient;
  private final MarketDataServiceProperties.Metals metalsConfig;
  private final ObjectMapper objectMapper;

  public MetalsClient(
      WebClient.Builder webClientBuilder,
      MarketDataServiceProperties properties,
      ObjectMapper objectMapper) {
    this.metalsConfig = properties.getMetals();
    this.objectMapper = objectMapper;
    this.webClient =
        webClientBuilder
            .clone()
            .baseUrl(metalsConfig.getBaseUrl())
            .defaultHeader("User-Agent", USER_AGENT)
            .build();

    if (!hasApiKey()) {
      log.warn("No metals API key configured, metal spot prices will be skipped");
    }

    log.info("MetalsClient initialized with base URL: {}", metalsConfig.getBaseUrl());
  }

  /**
   * Fetches the current spot price for one metal.
   *
   * @param metal metal name as understood by the API, e.g. gold
   * @return the decoded response, always with status success
   * @throws ClientException if no API key is configured, the API cannot be reached, or it reports
   *     the request as failed
   */
  public MetalSpotResponse getSpotPrice(String metal) {
    if (!hasApiKey()) {
      throw new ClientException("No metals API key configured, skipping " + metal);
    }

    log.info("Requesting metal spot price: {} currency: {}", metal, metalsConfig.getCurrency());

    try {
      var response =
          webClient
              .get()
              .uri(
                  uriBuilder ->
                      uriBuilder
                          .path("/metal/spot")
                          .queryParam("api_key", metalsConfig.getApiKey())
                          .queryParam("metal", metal)
                          .queryParam("currency", metalsConfig.getCurrency())
                          .build())
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .onStatus(HttpStatusCode::isError, this::handleErrorResponse)
              .bodyToMono(MetalSpotResponse.class)
              .timeout(Duration.ofSeconds(metalsConfig.getTimeoutSeconds()))
              .block();

      if (response == null) {
        throw new ClientException("Received null response from metals API");
      }

      if (!response.isSuccess()) {
        log.warn(
            "Metals API failed for {}: status {} code {} message {}",
            metal,
            response.status(),
            response.errorCode(),
            response.errorMessage());
        throw new ClientException(
            "Metals API failed for "
                + metal
                + ": "
                + (response.errorMessage() != null ? response.errorMessage() : "Unknown error"));
      }

      log.debug(
          "Successfully fetched spot price for {} data:\n{}", metal, SafeLogger.toJson(response));
      return response;
    } catch (ClientException ce) {
      throw ce;
    } catch (Exception e) {
      log.warn("Unexpected error fetching {} spot price: {}", metal, e.getMessage(), e);
      throw new ClientException("Failed to fetch spot price for metal: " + metal, e);
    }
  }

  private boolean hasApiKey() {
    return metalsConfig.getApiKey() != null && !metalsConfig.getApiKey().isBlank();
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
      var errorResponse = objectMapper.readValue(body, MetalSpotResponse.class);
      if (errorResponse.errorMessage() != null) {
        errorMessage = errorResponse.errorMessage();
      }
      errorCode = errorResponse.errorCode();
    } catch (JsonProcessingException e) {
      log.debug("Could not parse metals error response as JSON: {}", e.getMessage());

      if (body.length() > 500) {
        errorMessage = body.substring(0, 500) + "... (truncated)";
      }
    }

    log.warn(
        "Metals API error: HTTP {} - Error Code: {} - Message: {}",
        response.statusCode(),
        errorCode,
        errorMessage);

    return new ClientException("Metals API error message: " + errorMessage + " code: " + errorCode);
  }
}
