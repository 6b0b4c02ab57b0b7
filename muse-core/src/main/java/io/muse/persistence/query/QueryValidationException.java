package io.muse.persistence.query;

/**
 * Raised when a Query references invalid/unknown fields or otherwise fails validation.
 * <p>
 * Thrown by backend-agnostic validation before any statement is rendered. These are caller
 * programming errors and are never recovered inside the engines.
 */
public class QueryValidationException extends RuntimeException {
  public QueryValidationException(String message) {
    super(message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
