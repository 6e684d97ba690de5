package io.transcribehive.queue;

import io.transcribehive.retry.RetryProperties;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Broker connection and queue settings shared by the producer and the transcriber, bound from
 * {@code transcribehive.broker.*} (typically fed by {@code RABBIT_URI} and
 * {@code RABBIT_QUEUE_NAME}).
 */
@ConfigurationProperties(prefix = "transcribehive.broker")
public class BrokerProperties {

  private String uri = QueueDefaults.BROKER_URI;
  private String queueName = QueueDefaults.QUEUE_NAME;
  private String queueType = "";
  private Duration confirmTimeout = Duration.ofSeconds(10);
  private Duration connectionTimeout = Duration.ofSeconds(10);
  private Duration heartbeat = Duration.ofSeconds(30);
  private RetryProperties reconnect = new RetryProperties(5, Duration.ofSeconds(1), Duration.ofSeconds(30));

  public String getUri() {
    return uri;
  }

  public void setUri(String uri) {
    this.uri = uri == null || uri.isBlank() ? QueueDefaults.BROKER_URI : uri.trim();
  }

  public String getQueueName() {
    return queueName;
  }

  public void setQueueName(String queueName) {
    this.queueName = queueName == null || queueName.isBlank() ? QueueDefaults.QUEUE_NAME : queueName.trim();
  }

  /**
   * Optional {@code x-queue-type} used when declaring the queue ({@code classic} or
   * {@code quorum}). Quorum queues report {@code x-delivery-count} on redeliveries.
   */
  public String getQueueType() {
    return queueType;
  }

  public void setQueueType(String queueType) {
    this.queueType = queueType == null ? "" : queueType.trim();
  }

  public Duration getConfirmTimeout() {
    return confirmTimeout;
  }

  public void setConfirmTimeout(Duration confirmTimeout) {
    this.confirmTimeout = confirmTimeout;
  }

  public Duration getConnectionTimeout() {
    return connectionTimeout;
  }

  public void setConnectionTimeout(Duration connectionTimeout) {
    this.connectionTimeout = connectionTimeout;
  }

  public Duration getHeartbeat() {
    return heartbeat;
  }

  public void setHeartbeat(Duration heartbeat) {
    this.heartbeat = heartbeat;
  }

  /**
   * Backoff used while (re)connecting. The producer honours {@code max-attempts}; workers keep
   * reconnecting until stopped.
   */
  public RetryProperties getReconnect() {
    return reconnect;
  }

  public void setReconnect(RetryProperties reconnect) {
    this.reconnect = reconnect;
  }
}
