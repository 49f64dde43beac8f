package org.budgetanalyzer.marketdata.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.budgetanalyzer.marketdata.api.response.MarketDataImportResultResponse;
import org.budgetanalyzer.marketdata.service.MarketDataImportService;

/** Admin endpoints for market data management. */
@Tag(
    name = "Admin - Market Data Handler",
    description = "Admin endpoints for importing market data")
@RestController
@RequestMapping(path = "/v1/admin/market-data")
public class AdminMarketDataController {

  private static final Logger log = LoggerFactory.getLogger(AdminMarketDataController.class);

  private final MarketDataImportService marketDataImportService;

  public AdminMarketDataController(MarketDataImportService marketDataImportService) {
    this.marketDataImportService = marketDataImportService;
  }

  @Operation(
      summary = "Import latest market data from all enabled sources",
      description =
          "Fetches BLS, metals spot and FRED data and reconciles it into the store -"
              + " manually triggers the scheduled job")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = MarketDataImportResultResponse.class))),
      })
  @PostMapping(path = "/import", produces = "application/json")
  public MarketDataImportResultResponse importLatestMarketData() {
    log.info("Received importLatestMarketData request");

    var summary = marketDataImportService.importLatestMarketData();
    return MarketDataImportResultResponse.from(summary);
  }
}
