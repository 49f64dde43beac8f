package org.budgetanalyzer.marketdata.exception;

/** A single data point could not be parsed. Adapters drop the entry and keep going. */
public class ObservationParseException extends ServiceException {

  public ObservationParseException(String message) {
    super(message);
  }

  public ObservationParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
