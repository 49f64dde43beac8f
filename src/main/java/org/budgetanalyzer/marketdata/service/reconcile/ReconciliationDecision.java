package org.budgetanalyzer.marketdata.service.reconcile;

import org.budgetanalyzer.marketdata.service.dto.Observation;

/** What the import must do with one observation. Consumed immediately, never persisted. */
public sealed interface ReconciliationDecision
    permits ReconciliationDecision.Insert,
        ReconciliationDecision.UpdateValue,
        ReconciliationDecision.NoOp {

  Observation observation();

  /** No row exists for the key. */
  record Insert(Observation observation) implements ReconciliationDecision {}

  /** The stored row identified by {@code id} holds a different value and is replaced. */
  record UpdateValue(Long id, Observation observation) implements ReconciliationDecision {}

  /** The stored row already holds this value. */
  record NoOp(Observation observation, String reason) implements ReconciliationDecision {}
}
