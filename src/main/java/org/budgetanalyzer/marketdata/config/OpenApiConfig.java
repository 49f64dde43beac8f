package org.budgetanalyzer.marketdata.config;

import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.info.License;
import io.swagger.v3.oas.annotations.servers.Server;

@Configuration
@OpenAPIDefinition(
    info =
        @Info(
            title = "Market Data Service",
            version = "1.0",
            description = "Admin API for importing BLS, metals spot and FRED market data",
            contact = @Contact(name = "Bleu Rubin", email = "support@bleurubin.com"),
            license = @License(name = "MIT", url = "https://opensource.org/licenses/MIT")),
    servers = {
      @Server(url = "http://localhost:8080/api", description = "Local environment (via gateway)"),
      @Server(
          url = "http://localhost:8086/market-data-service",
          description = "Local environment (direct)")
    })
public class OpenApiConfig {}
