package org.budgetanalyzer.marketdata.service.store;

import java.time.LocalDate;
import java.util.Optional;
import java.util.function.Supplier;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionException;

import org.budgetanalyzer.marketdata.domain.MarketData;
import org.budgetanalyzer.marketdata.exception.StoreUnavailableException;
import org.budgetanalyzer.marketdata.exception.StoreWriteException;
import org.budgetanalyzer.marketdata.repository.MarketDataRepository;
import org.budgetanalyzer.marketdata.service.dto.ExistingRecord;
import org.budgetanalyzer.marketdata.service.dto.Observation;

/** {@link MarketDataStore} backed by the {@code market_data} table. */
@Service
public class JpaMarketDataStore implements MarketDataStore {

  private final MarketDataRepository marketDataRepository;

  public JpaMarketDataStore(MarketDataRepository marketDataRepository) {
    this.marketDataRepository = marketDataRepository;
  }

  @Override
  public Optional<ExistingRecord> findByKey(String seriesType, LocalDate date) {
    return execute(
        "read " + seriesType + " " + date,
        () ->
            marketDataRepository
                .findBySeriesTypeAndDate(seriesType, date)
                .map(JpaMarketDataStore::toExistingRecord));
  }

  @Override
  public Long insert(Observation observation) {
    var marketData = new MarketData();
    marketData.setSeriesType(observation.seriesType());
    marketData.setDate(observation.date());
    copyValues(observation, marketData);

    return execute(
        "insert " + observation.seriesType() + " " + observation.date(),
        () -> marketDataRepository.save(marketData).getId());
  }

  @Override
  public void updateValue(Long id, Observation observation) {
    execute(
        "update " + observation.seriesType() + " " + observation.date(),
        () -> {
          var marketData =
              marketDataRepository
                  .findById(id)
                  .orElseThrow(
                      () -> new StoreWriteException("Market data not found with id: " + id));

          copyValues(observation, marketData);
          return marketDataRepository.save(marketData);
        });
  }

  private static void copyValues(Observation observation, MarketData marketData) {
    marketData.setValue(observation.value());
    marketData.setHigh(observation.high());
    marketData.setLow(observation.low());
    marketData.setRawData(observation.rawPayload());
  }

  private static ExistingRecord toExistingRecord(MarketData marketData) {
    return new ExistingRecord(
        marketData.getId(),
        marketData.getSeriesType(),
        marketData.getDate(),
        marketData.getValue(),
        marketData.getHigh(),
        marketData.getLow(),
        marketData.getRawData());
  }

  private static <T> T execute(String operation, Supplier<T> action) {
    try {
      return action.get();
    } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
      throw new StoreUnavailableException(
          "Market data store unavailable during " + operation + ": " + e.getMessage(), e);
    } catch (DataAccessException | TransactionException e) {
      throw new StoreWriteException("Failed to " + operation + ": " + e.getMessage(), e);
    }
  }
}
