package org.budgetanalyzer.marketdata.exception;

/** Base class for unchecked exceptions raised by the market data service. */
public class ServiceException extends RuntimeException {

  public ServiceException(String message) {
    super(message);
  }

  public ServiceException(String message, Throwable cause) {
    super(message, cause);
  }
}
