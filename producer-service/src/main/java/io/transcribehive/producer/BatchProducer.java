package io.transcribehive.producer;

import io.transcribehive.failure.ClassifiedException;
import io.transcribehive.producer.reference.ObjectSelector;
import io.transcribehive.producer.reference.ObjectStoreAccessException;
import io.transcribehive.producer.reference.ObjectStoreException;
import io.transcribehive.producer.reference.ObjectStoreNotFoundException;
import io.transcribehive.producer.reference.ReferenceGenerator;
import io.transcribehive.producer.reference.SignedReference;
import io.transcribehive.queue.BrokerUnavailableException;
import io.transcribehive.queue.QueueClient;
import io.transcribehive.queue.WorkItem;
import io.transcribehive.retry.RetryExecutor;
import io.transcribehive.retry.RetryExhaustedException;
import io.transcribehive.retry.RetryPolicy;
import io.transcribehive.retry.Sleeper;
import io.transcribehive.util.InstanceNameGenerator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns every object under the configured prefix into one work item on the queue.
 * <p>
 * Items are published one at a time and each publish waits for the broker's confirm, so the
 * {@link BatchSummary#enqueued()} count only includes items the broker has taken responsibility
 * for. A key is enqueued at most once per run.
 */
public class BatchProducer {

  private static final Logger log = LoggerFactory.getLogger(BatchProducer.class);

  private final ReferenceGenerator references;
  private final Function<String, QueueClient> queueClients;
  private final ProducerProperties properties;
  private final RetryPolicy connectPolicy;
  private final Clock clock;
  private final Sleeper sleeper;

  public BatchProducer(ReferenceGenerator references,
                       Function<String, QueueClient> queueClients,
                       ProducerProperties properties,
                       RetryPolicy connectPolicy,
                       Clock clock) {
    this(references, queueClients, properties, connectPolicy, clock, Sleeper.THREAD);
  }

  BatchProducer(ReferenceGenerator references,
                Function<String, QueueClient> queueClients,
                ProducerProperties properties,
                RetryPolicy connectPolicy,
                Clock clock,
                Sleeper sleeper) {
    this.references = Objects.requireNonNull(references, "references");
    this.queueClients = Objects.requireNonNull(queueClients, "queueClients");
    this.properties = Objects.requireNonNull(properties, "properties");
    this.connectPolicy = Objects.requireNonNull(connectPolicy, "connectPolicy");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  public BatchSummary run() {
    ObjectSelector selector = new ObjectSelector(properties.getBucket(), properties.getPrefix());
    Duration validity = properties.getValidityWindow();
    String name = InstanceNameGenerator.generate("producer");
    Instant started = clock.instant();
    log.info("Producer {} starting: bucket={} prefix='{}' validity={}", name, selector.bucket(), selector.prefix(),
        validity);

    RetryExecutor connectRetry = new RetryExecutor(connectPolicy,
        ex -> ex instanceof BrokerUnavailableException, sleeper);
    RetryExecutor publishRetry = new RetryExecutor(properties.getPublishRetry().toPolicy(),
        BatchProducer::isRetryablePublishFailure, sleeper);

    int enqueued = 0;
    int failed = 0;
    int duplicates = 0;
    Set<String> seen = new HashSet<>();
    try (QueueClient queue = queueClients.apply(name)) {
      try {
        connectRetry.run("Connect to " + queue.queueName(), queue::connect);
      } catch (RetryExhaustedException ex) {
        return finish(started, BatchSummary.aborted(0, 0, 0, "broker unavailable: " + rootMessage(ex)));
      }

      for (String key : references.objectKeys(selector)) {
        if (!seen.add(key)) {
          duplicates++;
          log.debug("Skipping duplicate key {}", key);
          continue;
        }
        SignedReference reference;
        try {
          reference = references.sign(selector.bucket(), key, validity);
        } catch (ObjectStoreAccessException ex) {
          throw ex;
        } catch (ObjectStoreException ex) {
          failed++;
          log.warn("Skipping {}: {}", key, ex.getMessage());
          continue;
        }
        // the item must not outlive its signature
        Instant enqueuedAt = reference.expiresAt().minus(validity);
        WorkItem item = WorkItem.forObject(selector.bucket(), key, reference.url(), enqueuedAt, validity);
        try {
          int attempts = publishRetry.run("Publish " + key, () -> queue.publish(item));
          enqueued++;
          log.info("Enqueued {} as job {} ({} attempt(s))", key, item.jobId(), attempts);
        } catch (RetryExhaustedException ex) {
          return finish(started, BatchSummary.aborted(enqueued, failed, duplicates,
              "publishing " + key + " failed after " + ex.attempts() + " attempt(s): " + rootMessage(ex)));
        }
      }
    } catch (ObjectStoreNotFoundException ex) {
      return finish(started, BatchSummary.aborted(enqueued, failed, duplicates, "bucket not found: " + ex.getMessage()));
    } catch (ObjectStoreAccessException ex) {
      return finish(started, BatchSummary.aborted(enqueued, failed, duplicates, "access denied: " + ex.getMessage()));
    } catch (ObjectStoreException ex) {
      return finish(started, BatchSummary.aborted(enqueued, failed, duplicates, "listing failed: " + ex.getMessage()));
    } catch (BrokerUnavailableException ex) {
      return finish(started, BatchSummary.aborted(enqueued, failed, duplicates, "broker unavailable: " + ex.getMessage()));
    }
    return finish(started, BatchSummary.completed(enqueued, failed, duplicates));
  }

  private static boolean isRetryablePublishFailure(Throwable error) {
    return error instanceof BrokerUnavailableException || ClassifiedException.isRetryable(error);
  }

  private static String rootMessage(RetryExhaustedException ex) {
    return ex.getCause() == null ? ex.getMessage() : ex.getCause().getMessage();
  }

  private BatchSummary finish(Instant started, BatchSummary summary) {
    Duration elapsed = Duration.between(started, clock.instant());
    if (summary.aborted()) {
      log.error("Batch aborted after {} having enqueued {} item(s), {} failed, {} duplicate(s): {}",
          elapsed, summary.enqueued(), summary.failed(), summary.skippedDuplicates(), summary.abortReason());
    } else {
      log.info("Batch complete in {}: {} enqueued, {} failed, {} duplicate(s)",
          elapsed, summary.enqueued(), summary.failed(), summary.skippedDuplicates());
    }
    return summary;
  }
}
