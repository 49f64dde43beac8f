package org.budgetanalyzer.marketdata.exception;

/** The market data store cannot be reached at all. Aborts the current import run. */
public class StoreUnavailableException extends ServiceException {

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
