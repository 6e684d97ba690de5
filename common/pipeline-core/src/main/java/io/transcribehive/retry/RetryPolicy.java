package io.transcribehive.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded exponential backoff.
 * <p>
 * Attempt {@code n} (1-based) that fails is followed by a pause of
 * {@code initialBackoff * multiplier^(n-1)}, capped at {@code maxBackoff}. No pause follows the last
 * attempt.
 *
 * @param maxAttempts total number of attempts, including the first one
 * @param initialBackoff pause after the first failed attempt
 * @param multiplier growth factor applied to every further pause
 * @param maxBackoff upper bound for a single pause
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {

  public static final int UNBOUNDED = Integer.MAX_VALUE;

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
    }
    initialBackoff = nonNegative(initialBackoff, "initialBackoff");
    multiplier = multiplier < 1.0 || Double.isNaN(multiplier) ? 1.0 : multiplier;
    maxBackoff = maxBackoff == null || maxBackoff.isZero() ? initialBackoff : nonNegative(maxBackoff, "maxBackoff");
    if (maxBackoff.compareTo(initialBackoff) < 0) {
      maxBackoff = initialBackoff;
    }
  }

  public static RetryPolicy noRetry() {
    return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO);
  }

  public static RetryPolicy exponential(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
    return new RetryPolicy(maxAttempts, initialBackoff, 2.0, maxBackoff);
  }

  /**
   * Keeps trying until the caller gives up (for example when a worker is stopped).
   */
  public static RetryPolicy unbounded(Duration initialBackoff, Duration maxBackoff) {
    return new RetryPolicy(UNBOUNDED, initialBackoff, 2.0, maxBackoff);
  }

  public boolean bounded() {
    return maxAttempts != UNBOUNDED;
  }

  /**
   * Pause to apply after the given failed attempt.
   *
   * @param attempt 1-based number of the attempt that just failed
   */
  public Duration backoffAfter(int attempt) {
    if (attempt < 1) {
      return Duration.ZERO;
    }
    long initial = initialBackoff.toMillis();
    if (initial == 0L) {
      return Duration.ZERO;
    }
    long max = maxBackoff.toMillis();
    double computed = initial * Math.pow(multiplier, attempt - 1);
    if (Double.isInfinite(computed) || computed >= max) {
      return maxBackoff;
    }
    return Duration.ofMillis((long) computed);
  }

  public boolean hasAttemptAfter(int attempt) {
    return attempt < maxAttempts;
  }

  private static Duration nonNegative(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isNegative()) {
      throw new IllegalArgumentException(name + " must not be negative, got: " + value);
    }
    return value;
  }
}
