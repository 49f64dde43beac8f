package org.budgetanalyzer.marketdata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MarketDataServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(MarketDataServiceApplication.class, args);
  }
}
