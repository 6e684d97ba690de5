package io.transcribehive.transcriber.delivery;

import io.transcribehive.failure.ClassifiedException;
import io.transcribehive.retry.RetryExecutor;
import io.transcribehive.retry.RetryExhaustedException;
import io.transcribehive.retry.RetryPolicy;
import io.transcribehive.retry.Sleeper;
import io.transcribehive.transcriber.model.TranscriptResult;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries transient sink failures with bounded backoff and reports the end state as a
 * {@link DeliveryOutcome} instead of throwing.
 */
public class RetryingResultDelivery implements ResultDelivery {

  private static final Logger log = LoggerFactory.getLogger(RetryingResultDelivery.class);

  private final ResultDelivery delegate;
  private final RetryExecutor retry;

  public RetryingResultDelivery(ResultDelivery delegate, RetryPolicy policy) {
    this(delegate, policy, Sleeper.THREAD);
  }

  RetryingResultDelivery(ResultDelivery delegate, RetryPolicy policy, Sleeper sleeper) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.retry = new RetryExecutor(policy, ClassifiedException::isRetryable, sleeper);
  }

  @Override
  public DeliveryOutcome deliver(TranscriptResult result) {
    AtomicInteger attempts = new AtomicInteger();
    try {
      retry.execute("Deliver " + result.jobId(), () -> {
        attempts.incrementAndGet();
        return delegate.deliver(result);
      });
      return DeliveryOutcome.delivered(attempts.get());
    } catch (RetryExhaustedException ex) {
      String detail = ex.getCause() == null ? ex.getMessage() : ex.getCause().getMessage();
      if (ex.interrupted()) {
        log.warn("Interrupted delivering job {} after {} attempt(s): {}", result.jobId(), ex.attempts(), detail);
        return DeliveryOutcome.interrupted(ex.attempts(), detail);
      }
      log.error("Giving up delivering job {} after {} attempt(s): {}", result.jobId(), ex.attempts(), detail);
      return DeliveryOutcome.exhausted(ex.attempts(), detail);
    } catch (DeliveryException ex) {
      log.error("Sink rejected job {}: {}", result.jobId(), ex.getMessage());
      return DeliveryOutcome.rejected(attempts.get(), ex.getMessage());
    }
  }
}
