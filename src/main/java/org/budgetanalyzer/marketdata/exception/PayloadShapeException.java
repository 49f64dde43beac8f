package org.budgetanalyzer.marketdata.exception;

/**
 * Raised by a source adapter when a decoded response is missing the structure it needs, such as
 * the series array or the rate object. Fails the whole adapter call for that source.
 */
public class PayloadShapeException extends ServiceException {

  public PayloadShapeException(String message) {
    super(message);
  }

  public PayloadShapeException(String message, Throwable cause) {
    super(message, cause);
  }
}
