package io.transcribehive.transcriber.asr;

import io.transcribehive.failure.ClassifiedException;
import io.transcribehive.failure.FailureKind;
import io.transcribehive.queue.WorkItem;
import io.transcribehive.retry.RetryExecutor;
import io.transcribehive.retry.RetryExhaustedException;
import io.transcribehive.retry.RetryPolicy;
import io.transcribehive.retry.Sleeper;
import io.transcribehive.transcriber.model.TranscriptResult;
import java.util.Objects;

/**
 * Retries transient ASR failures in place before the worker falls back to requeueing. With a
 * single-attempt policy this is a pass-through.
 */
public class RetryingTranscriptionInvoker implements TranscriptionInvoker {

  private final TranscriptionInvoker delegate;
  private final RetryExecutor retry;

  public RetryingTranscriptionInvoker(TranscriptionInvoker delegate, RetryPolicy policy) {
    this(delegate, policy, Sleeper.THREAD);
  }

  RetryingTranscriptionInvoker(TranscriptionInvoker delegate, RetryPolicy policy, Sleeper sleeper) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.retry = new RetryExecutor(policy, ClassifiedException::isRetryable, sleeper);
  }

  @Override
  public String engine() {
    return delegate.engine();
  }

  @Override
  public TranscriptResult transcribe(WorkItem item) {
    try {
      return retry.execute("Transcribe " + item.jobId(), () -> delegate.transcribe(item)).value();
    } catch (RetryExhaustedException ex) {
      if (ex.getCause() instanceof TranscriptionException last) {
        throw last;
      }
      throw new TranscriptionException(FailureKind.TRANSIENT, ex.getMessage(), ex);
    }
  }
}
