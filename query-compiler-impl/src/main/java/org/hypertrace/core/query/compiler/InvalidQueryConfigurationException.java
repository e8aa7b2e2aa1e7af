package org.hypertrace.core.query.compiler;

/** Raised when a query carries a setting that cannot be lowered, e.g. an unknown weight. */
public class InvalidQueryConfigurationException extends RuntimeException {

  public InvalidQueryConfigurationException(String message) {
    super(message);
  }

  public InvalidQueryConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
