package io.transcribehive.queue;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.CancelCallback;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DeliverCallback;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.ShutdownSignalException;
import java.io.IOException;
import java.time.Duration;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.AmqpTimeoutException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

/**
 * {@link QueueClient} on top of a RabbitMQ channel.
 * <p>
 * The client opens one channel on a connection it owns, declares the durable work queue, sets a
 * prefetch of one and consumes with manual acknowledgements. Deliveries are pushed by the AMQP
 * client's dispatch thread into a hand-off queue that {@link #fetch(Duration)} drains, so the
 * owning thread blocks there without spinning.
 * <p>
 * Every (re)opened channel bumps a generation counter. Delivery tags are only valid on the
 * channel that produced them, so a message from an older generation is never acked or nacked on
 * the new channel; the broker redelivers it instead.
 * <p>
 * Publishing goes through a {@link RabbitTemplate} on the same connection factory, each publish on
 * its own channel with publisher confirms.
 * <p>
 * Not thread-safe: one owner thread per instance.
 */
public final class RabbitQueueClient implements QueueClient {

  private static final Logger log = LoggerFactory.getLogger(RabbitQueueClient.class);
  private static final long POLL_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(250);

  private final ConnectionFactory connectionFactory;
  private final boolean ownsConnectionFactory;
  private final String queueName;
  private final Map<String, Object> queueArguments;
  private final Duration confirmTimeout;
  private final String name;
  private final WorkItemCodec codec = new WorkItemCodec();
  private final BlockingQueue<PendingDelivery> deliveries = new LinkedBlockingQueue<>();

  private Connection connection;
  private Channel channel;
  private long generation;
  private RabbitTemplate publisher;
  private String consumerTag;
  private volatile boolean consumerCancelled;
  private QueueMessage outstanding;

  public RabbitQueueClient(ConnectionFactory connectionFactory,
                           boolean ownsConnectionFactory,
                           String name,
                           String queueName,
                           String queueType,
                           Duration confirmTimeout) {
    this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
    this.ownsConnectionFactory = ownsConnectionFactory;
    this.name = Objects.requireNonNull(name, "name");
    this.queueName = Objects.requireNonNull(queueName, "queueName");
    if (queueName.isBlank()) {
      throw new IllegalArgumentException("queueName must not be blank");
    }
    this.queueArguments = queueArguments(queueType);
    this.confirmTimeout = Objects.requireNonNull(confirmTimeout, "confirmTimeout");
  }

  @Override
  public String queueName() {
    return queueName;
  }

  public String name() {
    return name;
  }

  @Override
  public void connect() {
    channel();
  }

  @Override
  public void reconnect() {
    // any unsettled delivery belongs to the old channel; the broker requeues it
    outstanding = null;
    invalidate();
    open();
  }

  /**
   * Publishes on a channel scoped to this call and waits for the broker's confirm, so the item is
   * the broker's responsibility once this returns. The connection factory must have simple
   * publisher confirms enabled.
   */
  @Override
  public void publish(WorkItem item) {
    Objects.requireNonNull(item, "item");
    channel();
    MessageProperties properties = new MessageProperties();
    properties.setContentType(QueueDefaults.CONTENT_TYPE);
    properties.setContentEncoding("utf-8");
    properties.setDeliveryMode(MessageDeliveryMode.PERSISTENT);
    properties.setMessageId(item.jobId());
    properties.setTimestamp(Date.from(item.enqueuedAt()));
    Message message = new Message(codec.encode(item), properties);
    try {
      publisher().invoke(ops -> {
        ops.send("", queueName, message);
        ops.waitForConfirmsOrDie(confirmTimeout.toMillis());
        return null;
      });
    } catch (AmqpTimeoutException ex) {
      throw new QueuePublishException(item.jobId(),
          "No publisher confirm for job " + item.jobId() + " within " + confirmTimeout.toMillis() + " ms", ex);
    } catch (AmqpConnectException | ShutdownSignalException ex) {
      invalidate();
      throw new BrokerUnavailableException("Connection lost while publishing job " + item.jobId(), ex);
    } catch (AmqpException ex) {
      if (Thread.currentThread().isInterrupted()) {
        throw new QueuePublishException(item.jobId(), "Interrupted waiting for confirm of job " + item.jobId(), ex);
      }
      throw new QueuePublishException(item.jobId(), "Broker rejected job " + item.jobId() + ": " + ex.getMessage(), ex);
    }
  }

  private RabbitTemplate publisher() {
    if (publisher == null) {
      publisher = new RabbitTemplate(connectionFactory);
    }
    return publisher;
  }

  @Override
  public Optional<QueueMessage> fetch(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    if (outstanding != null) {
      throw new IllegalStateException("Delivery " + outstanding.deliveryTag() + " on " + queueName
          + " has not been settled");
    }
    Channel ch = consumingChannel();
    long deadline = System.nanoTime() + Math.max(0L, timeout.toNanos());
    try {
      while (true) {
        long remaining = deadline - System.nanoTime();
        PendingDelivery pending = deliveries.poll(Math.max(0L, Math.min(remaining, POLL_SLICE_NANOS)),
            TimeUnit.NANOSECONDS);
        if (pending != null) {
          if (pending.generation() != generation) {
            continue;
          }
          QueueMessage message = toMessage(pending);
          outstanding = message;
          return Optional.of(message);
        }
        if (consumerCancelled || !ch.isOpen()) {
          String reason = consumerCancelled ? "consumer cancelled by broker" : "channel closed";
          invalidate();
          throw new BrokerUnavailableException("Lost consumer on " + queueName + ": " + reason);
        }
        if (remaining <= 0L) {
          return Optional.empty();
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return Optional.empty();
    }
  }

  @Override
  public void ack(QueueMessage message) {
    settle(message, "ack", ch -> ch.basicAck(message.deliveryTag(), false));
  }

  @Override
  public void nack(QueueMessage message, boolean requeue) {
    settle(message, requeue ? "nack-requeue" : "nack-drop",
        ch -> ch.basicNack(message.deliveryTag(), false, requeue));
  }

  @Override
  public int unsettled() {
    return outstanding == null ? 0 : 1;
  }

  @Override
  public void close() {
    outstanding = null;
    invalidate();
    if (ownsConnectionFactory && connectionFactory instanceof CachingConnectionFactory caching) {
      caching.destroy();
    }
  }

  private void settle(QueueMessage message, String action, ChannelOperation operation) {
    Objects.requireNonNull(message, "message");
    if (outstanding == null || !outstanding.sameDelivery(message)) {
      throw new IllegalStateException("Delivery " + message.deliveryTag() + " is not the outstanding message on "
          + queueName);
    }
    outstanding = null;
    Channel ch = channel;
    if (message.generation() != generation || ch == null || !ch.isOpen()) {
      invalidate();
      throw new BrokerUnavailableException("Cannot " + action + " delivery " + message.deliveryTag()
          + ": the channel it arrived on is gone, the broker will redeliver it");
    }
    try {
      operation.apply(ch);
    } catch (IOException | ShutdownSignalException ex) {
      invalidate();
      throw new BrokerUnavailableException("Failed to " + action + " delivery " + message.deliveryTag()
          + " on " + queueName, ex);
    }
  }

  private Channel channel() {
    if (channel != null && channel.isOpen()) {
      return channel;
    }
    if (channel != null) {
      invalidate();
    }
    open();
    return channel;
  }

  private Channel consumingChannel() {
    Channel ch = channel();
    if (consumerTag != null) {
      return ch;
    }
    long consumerGeneration = generation;
    DeliverCallback onDelivery = (tag, delivery) ->
        deliveries.offer(new PendingDelivery(consumerGeneration, delivery));
    CancelCallback onCancel = tag -> {
      log.warn("Broker cancelled consumer {} on {}", tag, queueName);
      consumerCancelled = true;
    };
    try {
      consumerTag = ch.basicConsume(queueName, false, onDelivery, onCancel);
      consumerCancelled = false;
      log.debug("{} consuming {} with tag {}", name, queueName, consumerTag);
      return ch;
    } catch (IOException | ShutdownSignalException ex) {
      invalidate();
      throw new BrokerUnavailableException("Failed to start consumer on " + queueName, ex);
    }
  }

  private void open() {
    Connection newConnection = null;
    Channel newChannel = null;
    try {
      newConnection = connectionFactory.createConnection();
      newChannel = newConnection.createChannel(false);
      newChannel.basicQos(QueueDefaults.PREFETCH);
      newChannel.queueDeclare(queueName, true, false, false, queueArguments);
      connection = newConnection;
      channel = newChannel;
      generation++;
      log.info("{} connected to queue {} (channel generation {})", name, queueName, generation);
    } catch (AmqpException | IOException | ShutdownSignalException ex) {
      closeQuietly(newChannel);
      throw new BrokerUnavailableException("Broker unavailable for queue " + queueName + ": " + ex.getMessage(), ex);
    }
  }

  private void invalidate() {
    Channel oldChannel = channel;
    channel = null;
    consumerTag = null;
    deliveries.clear();
    closeQuietly(oldChannel);
    if (connection != null) {
      try {
        connection.close();
      } catch (AmqpException ex) {
        log.debug("Ignoring failure closing connection of {}: {}", name, ex.toString());
      }
      connection = null;
    }
    if (ownsConnectionFactory && connectionFactory instanceof CachingConnectionFactory caching) {
      caching.resetConnection();
    }
  }

  private QueueMessage toMessage(PendingDelivery pending) {
    Delivery delivery = pending.delivery();
    AMQP.BasicProperties properties = delivery.getProperties();
    String messageId = properties == null ? null : properties.getMessageId();
    int deliveryCount = deliveryCount(properties);
    return new QueueMessage(
        delivery.getEnvelope().getDeliveryTag(),
        delivery.getEnvelope().isRedeliver(),
        messageId,
        deliveryCount,
        delivery.getBody(),
        pending.generation());
  }

  private static int deliveryCount(AMQP.BasicProperties properties) {
    if (properties == null || properties.getHeaders() == null) {
      return -1;
    }
    Object value = properties.getHeaders().get(QueueDefaults.DELIVERY_COUNT_HEADER);
    if (value instanceof Number number) {
      return number.intValue();
    }
    return -1;
  }

  private static Map<String, Object> queueArguments(String queueType) {
    if (queueType == null || queueType.isBlank()) {
      return null;
    }
    Map<String, Object> arguments = new LinkedHashMap<>();
    arguments.put("x-queue-type", queueType.trim());
    return arguments;
  }

  private void closeQuietly(Channel ch) {
    if (ch == null) {
      return;
    }
    try {
      if (ch.isOpen()) {
        ch.close();
      }
    } catch (IOException | TimeoutException | ShutdownSignalException ex) {
      log.debug("Ignoring failure closing channel of {}: {}", name, ex.toString());
    }
  }

  @FunctionalInterface
  private interface ChannelOperation {
    void apply(Channel channel) throws IOException;
  }

  private record PendingDelivery(long generation, Delivery delivery) {
  }
}
