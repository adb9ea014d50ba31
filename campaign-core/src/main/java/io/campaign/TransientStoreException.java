package io.campaign;

/**
 * Unchecked wrapper for storage failures that may succeed on a later attempt
 * (lost connection, lock timeout, pool exhaustion).
 *
 * <p>Jobs failing with this exception are rescheduled with backoff.
 */
public class TransientStoreException extends RuntimeException {

  public TransientStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
