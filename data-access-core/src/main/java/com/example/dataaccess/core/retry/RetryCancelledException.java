package com.example.dataaccess.core.retry;

/**
 * Thrown when a retry loop is interrupted while waiting between attempts.
 *
 * <p>The cause is the {@link InterruptedException}; the failure of the last attempt is attached
 * as a suppressed exception. The interrupt flag of the calling thread is restored before this is
 * thrown.
 */
public class RetryCancelledException extends RuntimeException {

  public RetryCancelledException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
