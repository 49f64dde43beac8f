package org.budgetanalyzer.marketdata.exception;

/**
 * A read, insert or update against the market data store failed for one observation. Recorded
 * against the observation's series type; the run continues with the next observation.
 */
public class StoreWriteException extends ServiceException {

  public StoreWriteException(String message) {
    super(message);
  }

  public StoreWriteException(String message, Throwable cause) {
    super(message, cause);
  }
}
