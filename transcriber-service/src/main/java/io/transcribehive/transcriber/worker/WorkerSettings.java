package io.transcribehive.transcriber.worker;

import io.transcribehive.retry.RetryPolicy;
import java.time.Duration;
import java.util.Objects;

/**
 * Per-loop tuning, resolved once from configuration.
 *
 * @param pollTimeout how long one fetch blocks before the loop re-checks for a stop request
 * @param transientRequeueDelay pause before a transiently failed message is requeued
 * @param maxDeliveries broker delivery count after which a message is failed instead of processed
 *     again; {@code 0} disables the ceiling
 * @param deliverFailures whether permanent failures are reported to the sink
 * @param reconnectPolicy backoff between broker reconnect attempts
 */
public record WorkerSettings(
    Duration pollTimeout,
    Duration transientRequeueDelay,
    int maxDeliveries,
    boolean deliverFailures,
    RetryPolicy reconnectPolicy
) {

  public WorkerSettings {
    Objects.requireNonNull(pollTimeout, "pollTimeout");
    Objects.requireNonNull(transientRequeueDelay, "transientRequeueDelay");
    Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
    if (maxDeliveries < 0) {
      throw new IllegalArgumentException("maxDeliveries must be >= 0, got: " + maxDeliveries);
    }
  }
}
