package org.budgetanalyzer.marketdata.service.store;

import java.time.LocalDate;
import java.util.Optional;

import org.budgetanalyzer.marketdata.exception.StoreUnavailableException;
import org.budgetanalyzer.marketdata.exception.StoreWriteException;
import org.budgetanalyzer.marketdata.service.dto.ExistingRecord;
import org.budgetanalyzer.marketdata.service.dto.Observation;

/**
 * Persistent store of market data readings keyed by (seriesType, date).
 *
 * <p>Every call commits on its own. Implementations throw {@link StoreWriteException} when a
 * single call fails and {@link StoreUnavailableException} when the store cannot be reached.
 */
public interface MarketDataStore {

  Optional<ExistingRecord> findByKey(String seriesType, LocalDate date);

  /**
   * Stores a new reading.
   *
   * @param observation reading to store
   * @return id of the new row
   */
  Long insert(Observation observation);

  /**
   * Replaces value, high, low and raw payload of an existing row.
   *
   * @param id id from {@link ExistingRecord#id()}
   * @param observation the revised reading
   */
  void updateValue(Long id, Observation observation);
}
