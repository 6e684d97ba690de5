package io.transcribehive.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an operation under a {@link RetryPolicy}. Failures the predicate considers retryable are
 * retried after the policy's backoff; anything else is rethrown straight away.
 * <p>
 * The executor is stateless and can be shared; the attempt counter lives on the stack of each
 * {@link #execute} call.
 */
public final class RetryExecutor {

  private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

  private final RetryPolicy policy;
  private final Predicate<Throwable> retryable;
  private final Sleeper sleeper;

  public RetryExecutor(RetryPolicy policy, Predicate<Throwable> retryable) {
    this(policy, retryable, Sleeper.THREAD);
  }

  public RetryExecutor(RetryPolicy policy, Predicate<Throwable> retryable, Sleeper sleeper) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.retryable = Objects.requireNonNull(retryable, "retryable");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  public RetryPolicy policy() {
    return policy;
  }

  /**
   * Runs {@code operation} until it succeeds, fails with a non-retryable error, or the policy runs
   * out of attempts.
   *
   * @param name operation name used in logs and in {@link RetryExhaustedException}
   * @throws RetryExhaustedException when the last allowed attempt failed with a retryable error, or
   *     the thread was interrupted while backing off
   */
  public <T> Attempted<T> execute(String name, Supplier<T> operation) {
    Objects.requireNonNull(operation, "operation");
    int attempt = 0;
    while (true) {
      attempt++;
      try {
        return new Attempted<>(operation.get(), attempt);
      } catch (RuntimeException ex) {
        if (!retryable.test(ex)) {
          throw ex;
        }
        if (Thread.currentThread().isInterrupted()) {
          throw new RetryExhaustedException(name, attempt, ex, true);
        }
        if (!policy.hasAttemptAfter(attempt)) {
          throw new RetryExhaustedException(name, attempt, ex);
        }
        Duration pause = policy.backoffAfter(attempt);
        if (policy.bounded()) {
          log.warn("{} attempt {}/{} failed: {}; retrying in {} ms",
              name, attempt, policy.maxAttempts(), ex.getMessage(), pause.toMillis());
        } else {
          log.warn("{} attempt {} failed: {}; retrying in {} ms", name, attempt, ex.getMessage(), pause.toMillis());
        }
        try {
          sleeper.sleep(pause);
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          throw new RetryExhaustedException(name, attempt, ex, true);
        }
      }
    }
  }

  /**
   * Convenience for operations without a result.
   */
  public int run(String name, Runnable operation) {
    Objects.requireNonNull(operation, "operation");
    return execute(name, () -> {
      operation.run();
      return Boolean.TRUE;
    }).attempts();
  }

  /**
   * Result of a successful {@link #execute} call together with the number of attempts it took.
   */
  public record Attempted<T>(T value, int attempts) {

    public boolean retried() {
      return attempts > 1;
    }
  }
}
