package io.transcribehive.failure;

/**
 * Classification applied to failures coming back from the ASR engine and the result sink.
 */
public enum FailureKind {

  /** Network trouble, rate limiting or an overloaded peer. Worth another attempt. */
  TRANSIENT(true),

  /** Malformed input or a request the peer will never accept. */
  PERMANENT(false),

  /** The presigned reference can no longer be fetched. */
  REFERENCE_EXPIRED(false);

  private final boolean retryable;

  FailureKind(boolean retryable) {
    this.retryable = retryable;
  }

  public boolean retryable() {
    return retryable;
  }
}
