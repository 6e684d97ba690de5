package io.transcribehive.failure;

import java.util.Objects;

/**
 * A failure that has already been mapped onto {@link FailureKind}. Retry decisions are made on the
 * kind alone.
 */
public abstract class ClassifiedException extends TranscribeHiveException {

  private final FailureKind kind;

  protected ClassifiedException(FailureKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  protected ClassifiedException(FailureKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public FailureKind kind() {
    return kind;
  }

  public boolean retryable() {
    return kind.retryable();
  }

  /**
   * Predicate usable as the retryable-classification of a {@code RetryExecutor}.
   */
  public static boolean isRetryable(Throwable error) {
    return error instanceof ClassifiedException classified && classified.retryable();
  }
}
