package org.budgetanalyzer.marketdata.service.reconcile;

import org.springframework.stereotype.Component;

import org.budgetanalyzer.marketdata.service.dto.Observation;

/**
 * Decides whether an observation is new, a revision, or already stored.
 *
 * <p>Values are compared with {@link java.math.BigDecimal#compareTo}: exact, scale-insensitive,
 * no tolerance. Sources publish fixed-precision figures, so any difference is a deliberate
 * revision. Only the value is compared; a revision replaces value, high, low and raw payload
 * together.
 *
 * <p>Stateless. Each observation is decided on its own, so the order of a batch does not change
 * the outcome.
 */
@Component
public class Reconciler {

  public static final String UNCHANGED = "unchanged";

  /**
   * Decides the action for one observation.
   *
   * @param observation the incoming reading
   * @param lookup read access to the store, queried once with the observation's key
   * @return Insert, UpdateValue or NoOp
   */
  public ReconciliationDecision reconcile(Observation observation, ObservationLookup lookup) {
    var existing = lookup.find(observation.seriesType(), observation.date());

    if (existing.isEmpty()) {
      return new ReconciliationDecision.Insert(observation);
    }

    var stored = existing.get();
    if (stored.value() == null || stored.value().compareTo(observation.value()) != 0) {
      return new ReconciliationDecision.UpdateValue(stored.id(), observation);
    }

    return new ReconciliationDecision.NoOp(observation, UNCHANGED);
  }
}
