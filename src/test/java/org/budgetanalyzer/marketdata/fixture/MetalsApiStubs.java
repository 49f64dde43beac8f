package org.budgetanalyzer.marketdata.fixture;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;

/** WireMock stub templates for metals.dev spot price responses. */
public final class MetalsApiStubs {

  private static final ObjectMapper objectMapper = new ObjectMapper();

  private MetalsApiStubs() {
    throw new UnsupportedOperationException("Utility class - do not instantiate");
  }

  /**
   * Stubs a successful spot response.
   *
   * @param server WireMock server to register the stub on
   * @param metal metal name, e.g. "gold"
   * @param timestamp response timestamp, e.g. "2024-03-15T14:32:10.000Z"
   * @param price spot price
   * @param high day high
   * @param low day low
   */
  public static void stubSpotPrice(
      WireMockServer server,
      String metal,
      String timestamp,
      BigDecimal price,
      BigDecimal high,
      BigDecimal low) {
    var rate = new HashMap<String, Object>();
    rate.put("price", price);
    rate.put("ask", price.add(BigDecimal.ONE));
    rate.put("bid", price.subtract(BigDecimal.ONE));
    rate.put("high", high);
    rate.put("low", low);
    rate.put("change", new BigDecimal("3.12"));
    rate.put("change_percent", new BigDecimal("0.14"));

    var body = new HashMap<String, Object>();
    body.put("status", "success");
    body.put("timestamp", timestamp);
    body.put("currency", "USD");
    body.put("unit", "toz");
    body.put("metal", metal);
    body.put("rate", rate);

    stub(server, metal, 200, toJson(body));
  }

  /** Stubs a gold spot response for 2024-03-15. */
  public static void stubGoldSample(WireMockServer server) {
    stubSpotPrice(
        server,
        TestConstants.SERIES_GOLD,
        "2024-03-15T14:32:10.000Z",
        TestConstants.GOLD_PRICE,
        TestConstants.GOLD_HIGH,
        TestConstants.GOLD_LOW);
  }

  /**
   * Stubs a failure body as metals.dev sends it for an invalid key.
   *
   * @param server WireMock server to register the stub on
   * @param metal metal name
   * @param httpStatus status code to answer with
   */
  public static void stubInvalidKey(WireMockServer server, String metal, int httpStatus) {
    var body =
        Map.of(
            "status", "failure", "error_code", 1101, "error_message", "Invalid API key provided.");
    stub(server, metal, httpStatus, toJson(body));
  }

  private static void stub(WireMockServer server, String metal, int status, String body) {
    server.stubFor(
        get(urlPathEqualTo(TestConstants.METALS_API_PATH_SPOT))
            .withQueryParam(TestConstants.METALS_PARAM_METAL, equalTo(metal))
            .willReturn(
                aResponse()
                    .withStatus(status)
                    .withHeader("Content-Type", "application/json")
                    .withBody(body)));
  }

  private static String toJson(Object body) {
    try {
      return objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new RuntimeException("Failed to serialize metals response", e);
    }
  }
}
