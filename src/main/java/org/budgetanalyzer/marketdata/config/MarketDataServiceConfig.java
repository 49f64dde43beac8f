package org.budgetanalyzer.marketdata.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Main configuration class for the Market Data Service.
 *
 * <p>Note: ObjectMapper is auto-configured by Spring Boot using spring.jackson.* properties in
 * application.yml, with JavaTimeModule registered from the classpath.
 */
@Configuration
@EnableConfigurationProperties(MarketDataServiceProperties.class)
public class MarketDataServiceConfig {

  /** UTC clock, used to pick the BLS request year and the FRED lookback start. */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
