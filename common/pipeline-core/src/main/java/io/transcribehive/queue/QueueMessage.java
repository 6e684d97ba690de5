package io.transcribehive.queue;

import java.nio.charset.StandardCharsets;

/**
 * A message handed out by a {@link QueueClient} and not yet settled.
 *
 * @param deliveryTag broker-assigned tag the ack/nack is keyed by
 * @param redelivered whether the broker delivered this message before
 * @param messageId AMQP message id, the job id for messages written by the producer
 * @param deliveryCount delivery attempts reported by the broker ({@code x-delivery-count}); {@code -1}
 *     when the queue type does not track it
 * @param body raw message body
 * @param generation channel generation the message arrived on; a tag is meaningless on any other
 *     channel
 */
public record QueueMessage(
    long deliveryTag,
    boolean redelivered,
    String messageId,
    int deliveryCount,
    byte[] body,
    long generation
) {

  public QueueMessage {
    body = body == null ? new byte[0] : body;
  }

  public boolean hasDeliveryCount() {
    return deliveryCount >= 0;
  }

  public String bodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }

  boolean sameDelivery(QueueMessage other) {
    return other != null && other.deliveryTag == deliveryTag && other.generation == generation;
  }

  @Override
  public String toString() {
    return "QueueMessage[tag=" + deliveryTag + ", redelivered=" + redelivered + ", messageId=" + messageId
        + ", deliveryCount=" + deliveryCount + ", generation=" + generation + ", bytes=" + body.length + "]";
  }
}
