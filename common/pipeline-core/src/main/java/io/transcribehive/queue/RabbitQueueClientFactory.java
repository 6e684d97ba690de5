package io.transcribehive.queue;

import java.net.URI;
import java.util.Objects;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;

/**
 * Creates {@link RabbitQueueClient}s that each own a dedicated broker connection. Nothing is
 * shared between the clients, so one worker losing its connection does not affect another.
 */
public class RabbitQueueClientFactory {

  private final BrokerProperties properties;

  public RabbitQueueClientFactory(BrokerProperties properties) {
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  public BrokerProperties properties() {
    return properties;
  }

  /**
   * @param clientName used as AMQP connection name, visible in the broker's management UI
   */
  public QueueClient create(String clientName) {
    CachingConnectionFactory connectionFactory = new CachingConnectionFactory(URI.create(properties.getUri()));
    connectionFactory.setConnectionNameStrategy(cf -> clientName);
    connectionFactory.setConnectionTimeout((int) properties.getConnectionTimeout().toMillis());
    connectionFactory.setRequestedHeartBeat((int) properties.getHeartbeat().toSeconds());
    connectionFactory.setChannelCacheSize(1);
    connectionFactory.setPublisherConfirmType(CachingConnectionFactory.ConfirmType.SIMPLE);
    return new RabbitQueueClient(
        connectionFactory,
        true,
        clientName,
        properties.getQueueName(),
        properties.getQueueType(),
        properties.getConfirmTimeout());
  }
}
