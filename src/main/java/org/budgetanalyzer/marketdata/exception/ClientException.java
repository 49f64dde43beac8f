package org.budgetanalyzer.marketdata.exception;

/**
 * Raised by an external API client when a source could not be reached, answered with an error
 * status, or returned a body that could not be decoded.
 *
 * <p>The import run treats this as "source skipped for this run".
 */
public class ClientException extends ServiceException {

  public ClientException(String message) {
    super(message);
  }

  public ClientException(String message, Throwable cause) {
    super(message, cause);
  }
}
