package org.budgetanalyzer.marketdata.client.bls;

import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;

import org.budgetanalyzer.marketdata.config.MarketDataServiceProperties;
import org.budgetanalyzer.marketdata.exception.ClientException;
import org.budgetanalyzer.marketdata.fixture.BlsApiStubs;
import org.budgetanalyzer.marketdata.fixture.TestConstants;

/**
 * Tests for {@link BlsClient} against a WireMock server.
 *
 * <p>Covers request shape, response decoding and the mapping of BLS failures to {@link
 * ClientException}.
 */
@DisplayName("BlsClient Tests")
class BlsClientTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-04-10T06:00:00Z"), ZoneOffset.UTC);

  private static WireMockServer wireMockServer;

  private MarketDataServiceProperties properties;

  @BeforeAll
  static void startWireMock() {
    wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
    wireMockServer.start();
  }

  @AfterAll
  static void stopWireMock() {
    wireMockServer.stop();
  }

  @BeforeEach
  void setUp() {
    wireMockServer.resetAll();

    properties = new MarketDataServiceProperties();
    properties.getBls().setBaseUrl("http://localhost:" + wireMockServer.port());
    properties.getBls().setTimeoutSeconds(2);
  }

  @Test
  @DisplayName("getSeriesData - posts the series for the current year")
  void getSeriesData_PostsSeriesForCurrentYear() {
    // Arrange
    BlsApiStubs.stubSuccessWithSampleData(wireMockServer, TestConstants.BLS_SERIES_CPI);

    // Act
    var response = client().getSeriesData(TestConstants.BLS_SERIES_CPI);

    // Assert
    assertThat(response.isSucceeded()).isTrue();
    assertThat(response.results().series())
        .singleElement()
        .satisfies(
            series -> {
              assertThat(series.seriesId()).isEqualTo(TestConstants.BLS_SERIES_CPI);
              assertThat(series.data()).hasSize(3);
              assertThat(series.data().get(0).period()).isEqualTo("M03");
              assertThat(series.data().get(0).value()).isEqualTo("312.332");
            });

    wireMockServer.verify(
        postRequestedFor(urlPathEqualTo(TestConstants.BLS_API_PATH_TIMESERIES))
            .withRequestBody(
                equalToJson(
                    "{\"seriesid\":[\"CUUR0000SA0\"],"
                        + "\"startyear\":\"2024\",\"endyear\":\"2024\"}")));
  }

  @Test
  @DisplayName("getSeriesData - does not send a registration key to v1")
  void getSeriesData_V1_OmitsRegistrationKey() {
    properties.getBls().setRegistrationKey("my-bls-key");
    BlsApiStubs.stubSuccessWithSampleData(wireMockServer, TestConstants.BLS_SERIES_CPI);

    client().getSeriesData(TestConstants.BLS_SERIES_CPI);

    var body = wireMockServer.getAllServeEvents().get(0).getRequest().getBodyAsString();
    assertThat(body).doesNotContain("registrationkey");
  }

  @Test
  @DisplayName("getSeriesData - request not processed throws ClientException with BLS message")
  void getSeriesData_RequestNotProcessed_Throws() {
    BlsApiStubs.stubRequestNotProcessed(
        wireMockServer,
        TestConstants.BLS_SERIES_CPI,
        "Daily threshold for total number of requests allocated has been reached.");

    assertThatThrownBy(() -> client().getSeriesData(TestConstants.BLS_SERIES_CPI))
        .isInstanceOf(ClientException.class)
        .hasMessageContaining(TestConstants.BLS_SERIES_CPI)
        .hasMessageContaining("Daily threshold");
  }

  @Test
  @DisplayName("getSeriesData - server error throws ClientException")
  void getSeriesData_ServerError_Throws() {
    BlsApiStubs.stubServerError(wireMockServer, TestConstants.BLS_SERIES_CPI);

    assertThatThrownBy(() -> client().getSeriesData(TestConstants.BLS_SERIES_CPI))
        .isInstanceOf(ClientException.class)
        .hasMessageContaining("500");
  }

  @Test
  @DisplayName("getSeriesData - empty data array is returned as-is")
  void getSeriesData_EmptyData_ReturnedAsIs() {
    BlsApiStubs.stubSuccessWithData(wireMockServer, TestConstants.BLS_SERIES_CPI, List.of());

    var response = client().getSeriesData(TestConstants.BLS_SERIES_CPI);

    assertThat(response.results().series().get(0).data()).isEmpty();
  }

  private BlsClient client() {
    return new BlsClient(WebClient.builder(), properties, CLOCK);
  }
}
