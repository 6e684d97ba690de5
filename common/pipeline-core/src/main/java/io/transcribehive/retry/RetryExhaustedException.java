package io.transcribehive.retry;

import io.transcribehive.failure.TranscribeHiveException;

/**
 * Raised once every attempt allowed by a {@link RetryPolicy} failed with a retryable error, or when
 * the retrying thread was interrupted. The last failure is the cause.
 */
public class RetryExhaustedException extends TranscribeHiveException {

  private final String operation;
  private final int attempts;
  private final boolean interrupted;

  public RetryExhaustedException(String operation, int attempts, Throwable lastFailure) {
    this(operation, attempts, lastFailure, false);
  }

  public RetryExhaustedException(String operation, int attempts, Throwable lastFailure, boolean interrupted) {
    super(operation + (interrupted ? " interrupted after " : " failed after ") + attempts + " attempt(s): "
        + lastFailure, lastFailure);
    this.operation = operation;
    this.attempts = attempts;
    this.interrupted = interrupted;
  }

  public String operation() {
    return operation;
  }

  public int attempts() {
    return attempts;
  }

  /**
   * {@code true} when retrying stopped because the thread was interrupted, not because the policy
   * ran out of attempts.
   */
  public boolean interrupted() {
    return interrupted;
  }
}
