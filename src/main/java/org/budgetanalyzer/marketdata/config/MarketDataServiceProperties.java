package org.budgetanalyzer.marketdata.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import org.budgetanalyzer.marketdata.logging.Sensitive;

@ConfigurationProperties(prefix = "market-data-service")
@Validated
public class MarketDataServiceProperties {

  @Valid private MarketDataImport marketDataImport = new MarketDataImport();
  @Valid private Bls bls = new Bls();
  @Valid private Metals metals = new Metals();
  @Valid private Fred fred = new Fred();

  public MarketDataImport getMarketDataImport() {
    return marketDataImport;
  }

  public void setMarketDataImport(MarketDataImport marketDataImport) {
    this.marketDataImport = marketDataImport;
  }

  public Bls getBls() {
    return bls;
  }

  public void setBls(Bls bls) {
    this.bls = bls;
  }

  public Metals getMetals() {
    return metals;
  }

  public void setMetals(Metals metals) {
    this.metals = metals;
  }

  public Fred getFred() {
    return fred;
  }

  public void setFred(Fred fred) {
    this.fred = fred;
  }

  public static class MarketDataImport {

    /** Cron expression for scheduled import job. */
    private String cron = "0 0 6 * * ?";

    /** Whether to run one import when the application is ready. */
    private boolean importOnStartup = false;

    @Valid private Retry retry = new Retry();

    public String getCron() {
      return cron;
    }

    public void setCron(String cron) {
      this.cron = cron;
    }

    public boolean isImportOnStartup() {
      return importOnStartup;
    }

    public void setImportOnStartup(boolean importOnStartup) {
      this.importOnStartup = importOnStartup;
    }

    public Retry getRetry() {
      return retry;
    }

    public void setRetry(Retry retry) {
      this.retry = retry;
    }

    public static class Retry {
      /**
       * Maximum number of attempts (including initial attempt). Example: max-attempts=3 means 1
       * initial + 2 retries.
       */
      @Min(1)
      @Max(10)
      private int maxAttempts = 3;

      /** Delay between retries in minutes. */
      @Min(1)
      @Max(60)
      private long delayMinutes = 5;

      public int getMaxAttempts() {
        return maxAttempts;
      }

      public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
      }

      public long getDelayMinutes() {
        return delayMinutes;
      }

      public void setDelayMinutes(long delayMinutes) {
        this.delayMinutes = delayMinutes;
      }
    }
  }

  /** Bureau of Labor Statistics public API. */
  public static class Bls {

    private boolean enabled = true;

    @NotBlank private String baseUrl = "https://api.bls.gov/publicAPI";

    /** v1 needs no key, v2 requires a registration key. */
    @NotBlank private String apiVersion = "v1";

    @Sensitive(showLast = 4)
    private String registrationKey;

    @Min(1)
    @Max(120)
    private int timeoutSeconds = 30;

    /** Series type to BLS series id, e.g. cpi -> CUUR0000SA0. */
    @NotNull private Map<String, String> series = new LinkedHashMap<>(Map.of("cpi", "CUUR0000SA0"));

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getApiVersion() {
      return apiVersion;
    }

    public void setApiVersion(String apiVersion) {
      this.apiVersion = apiVersion;
    }

    public String getRegistrationKey() {
      return registrationKey;
    }

    public void setRegistrationKey(String registrationKey) {
      this.registrationKey = registrationKey;
    }

    public int getTimeoutSeconds() {
      return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
      this.timeoutSeconds = timeoutSeconds;
    }

    public Map<String, String> getSeries() {
      return series;
    }

    public void setSeries(Map<String, String> series) {
      this.series = series;
    }
  }

  /** metals.dev spot price API. */
  public static class Metals {

    private boolean enabled = true;

    @NotBlank private String baseUrl = "https://api.metals.dev/v1";

    /** Metals API key - should be set via environment variable. Metals are skipped without it. */
    @Sensitive(showLast = 4)
    private String apiKey;

    @NotBlank private String currency = "USD";

    @Min(1)
    @Max(120)
    private int timeoutSeconds = 30;

    /** Metal names as understood by the API; each one is stored as its own series type. */
    @NotNull private List<String> metals = new ArrayList<>(List.of("gold", "silver"));

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getApiKey() {
      return apiKey;
    }

    public void setApiKey(String apiKey) {
      this.apiKey = apiKey;
    }

    public String getCurrency() {
      return currency;
    }

    public void setCurrency(String currency) {
      this.currency = currency;
    }

    public int getTimeoutSeconds() {
      return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
      this.timeoutSeconds = timeoutSeconds;
    }

    public List<String> getMetals() {
      return metals;
    }

    public void setMetals(List<String> metals) {
      this.metals = metals;
    }
  }

  /** Federal Reserve Economic Data API. */
  public static class Fred {

    private boolean enabled = false;

    @NotBlank private String baseUrl = "https://api.stlouisfed.org/fred";

    @Sensitive(showLast = 4)
    private String apiKey;

    @Min(1)
    @Max(120)
    private int timeoutSeconds = 30;

    /** Days of history requested per call, 0 requests the full series. */
    @Min(0)
    private int lookbackDays = 0;

    /** Series type to FRED series id, e.g. fed-funds -> FEDFUNDS. */
    @NotNull private Map<String, String> series = new LinkedHashMap<>();

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getApiKey() {
      return apiKey;
    }

    public void setApiKey(String apiKey) {
      this.apiKey = apiKey;
    }

    public int getTimeoutSeconds() {
      return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
      this.timeoutSeconds = timeoutSeconds;
    }

    public int getLookbackDays() {
      return lookbackDays;
    }

    public void setLookbackDays(int lookbackDays) {
      this.lookbackDays = lookbackDays;
    }

    public Map<String, String> getSeries() {
      return series;
    }

    public void setSeries(Map<String, String> series) {
      this.series = series;
    }
  }
}
