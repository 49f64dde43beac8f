package org.budgetanalyzer.marketdata.service.reconcile;

import java.time.LocalDate;
import java.util.Optional;

import org.budgetanalyzer.marketdata.service.dto.ExistingRecord;

/** Read-by-key access to stored readings. */
@FunctionalInterface
public interface ObservationLookup {

  Optional<ExistingRecord> find(String seriesType, LocalDate date);
}
