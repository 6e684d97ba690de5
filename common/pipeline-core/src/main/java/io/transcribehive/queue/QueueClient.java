package io.transcribehive.queue;

import java.time.Duration;
import java.util.Optional;

/**
 * Publish and consume primitives over one durable work queue.
 * <p>
 * A client owns its broker connection and is used by a single thread: the producer, or one worker
 * loop. Consumption runs in manual-acknowledgement mode with a prefetch of one, and the client
 * refuses to hand out a new message while the previous one is unsettled.
 */
public interface QueueClient extends AutoCloseable {

  String queueName();

  /**
   * Opens the connection and declares the queue. Called implicitly by the other operations.
   *
   * @throws BrokerUnavailableException when the broker cannot be reached
   */
  void connect();

  /**
   * Drops the current connection and opens a fresh one. A message that was still unsettled is
   * abandoned; the broker redelivers it.
   *
   * @throws BrokerUnavailableException when the broker cannot be reached
   */
  void reconnect();

  /**
   * Publishes one work item as a persistent message and waits for the broker's confirm.
   *
   * @throws QueuePublishException when the broker nacks or does not confirm in time
   * @throws BrokerUnavailableException when the connection is down
   */
  void publish(WorkItem item);

  /**
   * Waits up to {@code timeout} for the next message.
   *
   * @return the message, or empty when none arrived in time
   * @throws BrokerUnavailableException when the connection is lost while waiting
   * @throws IllegalStateException when the previous message has not been settled
   */
  Optional<QueueMessage> fetch(Duration timeout);

  /**
   * Acknowledges the outstanding message; the broker forgets it.
   *
   * @throws BrokerUnavailableException when the channel the message arrived on is gone; the broker
   *     redelivers the message in that case
   */
  void ack(QueueMessage message);

  /**
   * Negatively acknowledges the outstanding message.
   *
   * @param requeue {@code true} to make it available for redelivery
   * @throws BrokerUnavailableException when the channel the message arrived on is gone
   */
  void nack(QueueMessage message, boolean requeue);

  /**
   * Number of messages handed out and not yet settled: zero or one.
   */
  int unsettled();

  @Override
  void close();
}
