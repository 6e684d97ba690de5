package io.transcribehive.transcriber.worker;

import io.transcribehive.failure.FailureKind;
import io.transcribehive.queue.BrokerUnavailableException;
import io.transcribehive.queue.MalformedWorkItemException;
import io.transcribehive.queue.QueueClient;
import io.transcribehive.queue.QueueMessage;
import io.transcribehive.queue.WorkItem;
import io.transcribehive.queue.WorkItemCodec;
import io.transcribehive.retry.RetryExecutor;
import io.transcribehive.retry.RetryExhaustedException;
import io.transcribehive.retry.Sleeper;
import io.transcribehive.transcriber.asr.TranscriptionException;
import io.transcribehive.transcriber.asr.TranscriptionInvoker;
import io.transcribehive.transcriber.delivery.DeliveryOutcome;
import io.transcribehive.transcriber.delivery.ResultDelivery;
import io.transcribehive.transcriber.model.TranscriptResult;
import io.transcribehive.util.References;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * One sequential consumer: fetch a message, transcribe it, deliver the result, settle the
 * message, repeat.
 * <p>
 * Each message is settled exactly once and only after delivery finished or was given up on:
 * acknowledged for every terminal outcome, requeued for transient ASR failures. Nothing that goes
 * wrong with a single message escapes the loop; broker trouble makes the loop reconnect with
 * backoff until the broker is back or the loop is stopped.
 * <p>
 * A loop interrupted before the result reached the sink leaves its message unsettled and drops the
 * channel, so the broker redelivers the message.
 * <p>
 * A loop owns its {@link QueueClient} and closes it when it ends.
 */
public class WorkerLoop implements Runnable {

  private static final Logger log = LoggerFactory.getLogger(WorkerLoop.class);

  static final String MDC_WORKER = "worker";
  static final String MDC_JOB = "jobId";

  private final String name;
  private final QueueClient queue;
  private final TranscriptionInvoker invoker;
  private final ResultDelivery delivery;
  private final WorkerSettings settings;
  private final WorkerMetrics metrics;
  private final Clock clock;
  private final Sleeper sleeper;
  private final WorkItemCodec codec = new WorkItemCodec();
  private final RetryExecutor reconnect;

  private volatile WorkerState state = WorkerState.IDLE;
  private volatile boolean stopRequested;

  public WorkerLoop(String name,
                    QueueClient queue,
                    TranscriptionInvoker invoker,
                    ResultDelivery delivery,
                    WorkerSettings settings,
                    WorkerMetrics metrics,
                    Clock clock) {
    this(name, queue, invoker, delivery, settings, metrics, clock, Sleeper.THREAD);
  }

  WorkerLoop(String name,
             QueueClient queue,
             TranscriptionInvoker invoker,
             ResultDelivery delivery,
             WorkerSettings settings,
             WorkerMetrics metrics,
             Clock clock,
             Sleeper sleeper) {
    this.name = Objects.requireNonNull(name, "name");
    this.queue = Objects.requireNonNull(queue, "queue");
    this.invoker = Objects.requireNonNull(invoker, "invoker");
    this.delivery = Objects.requireNonNull(delivery, "delivery");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.reconnect = new RetryExecutor(settings.reconnectPolicy(),
        ex -> ex instanceof BrokerUnavailableException && !stopRequested, sleeper);
  }

  public String name() {
    return name;
  }

  public WorkerState state() {
    return state;
  }

  /**
   * Asks the loop to finish after the current message. A message in flight is still settled.
   */
  public void stop() {
    stopRequested = true;
  }

  public boolean stopRequested() {
    return stopRequested;
  }

  @Override
  public void run() {
    MDC.put(MDC_WORKER, name);
    log.info("Worker {} consuming {} ({})", name, queue.queueName(), invoker.engine());
    try {
      connect(false);
      while (!stopRequested && !Thread.currentThread().isInterrupted()) {
        runOnce();
      }
    } finally {
      state = WorkerState.STOPPED;
      queue.close();
      log.info("Worker {} stopped", name);
      MDC.remove(MDC_WORKER);
    }
  }

  /**
   * One iteration: waits up to the poll timeout for a message and handles it.
   *
   * @return the outcome of the handled message, empty when none arrived or the broker was lost
   *     while waiting
   */
  public Optional<ProcessingOutcome> runOnce() {
    state = WorkerState.FETCHING;
    Optional<QueueMessage> next;
    try {
      next = queue.fetch(settings.pollTimeout());
    } catch (BrokerUnavailableException ex) {
      log.warn("Lost broker while waiting for work: {}", ex.getMessage());
      connect(true);
      state = WorkerState.IDLE;
      return Optional.empty();
    }
    if (next.isEmpty()) {
      state = WorkerState.IDLE;
      return Optional.empty();
    }
    return Optional.of(handle(next.get()));
  }

  private ProcessingOutcome handle(QueueMessage message) {
    long started = System.nanoTime();
    state = WorkerState.PROCESSING;
    ProcessingOutcome outcome;
    WorkItem item = null;
    try {
      item = codec.decode(message.body());
      MDC.put(MDC_JOB, item.jobId());
      outcome = process(item, message);
    } catch (MalformedWorkItemException ex) {
      log.error("Dropping malformed message {}: {}", message.messageId(), ex.getMessage());
      outcome = ProcessingOutcome.MALFORMED;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure handling {}; dropping it", item == null ? message : item.objectKey(), ex);
      outcome = ProcessingOutcome.FAILED;
    }
    try {
      settle(message, outcome);
      metrics.record(outcome, Duration.ofNanos(System.nanoTime() - started));
      return outcome;
    } finally {
      MDC.remove(MDC_JOB);
      state = WorkerState.IDLE;
    }
  }

  private ProcessingOutcome process(WorkItem item, QueueMessage message) {
    if (item.isExpiredAt(clock.instant())) {
      return fail(item, FailureKind.REFERENCE_EXPIRED, "reference expired at " + item.expiresAt());
    }
    if (settings.maxDeliveries() > 0 && message.hasDeliveryCount()
        && message.deliveryCount() >= settings.maxDeliveries()) {
      return fail(item, FailureKind.PERMANENT, "delivered " + message.deliveryCount() + " times without success");
    }

    log.info("Transcribing {} ({})", item.objectKey(), References.redact(item.reference()));
    TranscriptResult result;
    try {
      result = invoker.transcribe(item);
    } catch (TranscriptionException ex) {
      if (ex.retryable()) {
        log.warn("Transient ASR failure for {}: {}; requeueing", item.objectKey(), ex.getMessage());
        pauseBeforeRequeue();
        return ProcessingOutcome.REQUEUED;
      }
      return fail(item, ex.kind(), ex.getMessage());
    }

    DeliveryOutcome delivered = deliver(result);
    if (delivered.status() == DeliveryOutcome.Status.INTERRUPTED) {
      return ProcessingOutcome.INTERRUPTED;
    }
    if (delivered.delivered()) {
      log.info("Completed {} ({} delivery attempt(s))", item.objectKey(), delivered.attempts());
      return ProcessingOutcome.COMPLETED;
    }
    log.error("Abandoning transcript of {}: {} after {} attempt(s): {}",
        item.objectKey(), delivered.status(), delivered.attempts(), delivered.detail());
    return ProcessingOutcome.DELIVERY_ABANDONED;
  }

  private ProcessingOutcome fail(WorkItem item, FailureKind kind, String detail) {
    log.error("Dropping {}: {} ({})", item.objectKey(), kind, detail);
    if (settings.deliverFailures()) {
      DeliveryOutcome delivered = deliver(TranscriptResult.failure(item, kind, detail));
      if (delivered.status() == DeliveryOutcome.Status.INTERRUPTED) {
        return ProcessingOutcome.INTERRUPTED;
      }
      if (!delivered.delivered()) {
        log.warn("Failure report for {} not delivered: {}", item.objectKey(), delivered.detail());
      }
    }
    return ProcessingOutcome.FAILED;
  }

  private DeliveryOutcome deliver(TranscriptResult result) {
    state = WorkerState.DELIVERING;
    try {
      return delivery.deliver(result);
    } catch (RuntimeException ex) {
      log.error("Result delivery for {} failed unexpectedly", result.jobId(), ex);
      return DeliveryOutcome.rejected(1, ex.toString());
    }
  }

  private void settle(QueueMessage message, ProcessingOutcome outcome) {
    state = WorkerState.ACKNOWLEDGING;
    if (outcome.settlement() == ProcessingOutcome.Settlement.NONE) {
      release(message);
      return;
    }
    try {
      if (outcome.settlement() == ProcessingOutcome.Settlement.ACK) {
        queue.ack(message);
      } else {
        queue.nack(message, true);
      }
    } catch (BrokerUnavailableException ex) {
      log.warn("Could not settle delivery {} ({}): {}; the broker will redeliver it",
          message.deliveryTag(), outcome, ex.getMessage());
      connect(true);
    }
  }

  // dropping the channel hands the unsettled delivery back to the broker
  private void release(QueueMessage message) {
    log.warn("Leaving delivery {} unsettled; the broker will redeliver it", message.deliveryTag());
    try {
      queue.reconnect();
    } catch (RuntimeException ex) {
      log.warn("Could not reopen the channel after releasing delivery {}: {}", message.deliveryTag(), ex.toString());
    }
  }

  private void pauseBeforeRequeue() {
    try {
      sleeper.sleep(settings.transientRequeueDelay());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  private void connect(boolean fresh) {
    try {
      int attempts = reconnect.run(fresh ? "Reconnect" : "Connect", fresh ? queue::reconnect : queue::connect);
      if (attempts > 1 || fresh) {
        log.info("Worker {} connected to {} after {} attempt(s)", name, queue.queueName(), attempts);
      }
    } catch (BrokerUnavailableException | RetryExhaustedException ex) {
      log.warn("Worker {} gave up connecting: {}", name, ex.getMessage());
    }
  }
}
