package io.transcribehive.queue;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.RabbitMQContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
class RabbitQueueClientContainerTest {

  @Container
  private static final RabbitMQContainer RABBIT = new RabbitMQContainer("rabbitmq:3.13.1-management");

  @Test
  void unackedMessageIsRedeliveredToAnotherConsumer() {
    RabbitQueueClientFactory factory = new RabbitQueueClientFactory(properties("redelivery"));
    WorkItem item = WorkItem.forObject("media", "audio/a.wav", URI.create("https://media.example/a.wav?sig=1"),
        Instant.now(), Duration.ofHours(1));

    try (QueueClient producer = factory.create("producer");
         QueueClient first = factory.create("worker-1")) {
      producer.publish(item);

      QueueMessage taken = first.fetch(Duration.ofSeconds(5)).orElseThrow();
      assertThat(new WorkItemCodec().decode(taken.body()).jobId()).isEqualTo(item.jobId());
      first.nack(taken, true);

      QueueMessage again = first.fetch(Duration.ofSeconds(5)).orElseThrow();
      assertThat(again.redelivered()).isTrue();
      first.close();

      try (QueueClient second = factory.create("worker-2")) {
        QueueMessage recovered = second.fetch(Duration.ofSeconds(5)).orElseThrow();
        assertThat(recovered.messageId()).isEqualTo(item.jobId());
        second.ack(recovered);
        assertThat(second.fetch(Duration.ofMillis(300))).isEmpty();
      }
    }
  }

  @Test
  void reconnectStartsAFreshChannelGeneration() {
    RabbitQueueClientFactory factory = new RabbitQueueClientFactory(properties("reconnect"));
    WorkItem item = WorkItem.forObject("media", "audio/b.wav", URI.create("https://media.example/b.wav?sig=1"),
        Instant.now(), Duration.ofHours(1));

    try (QueueClient client = factory.create("worker")) {
      client.publish(item);
      QueueMessage before = client.fetch(Duration.ofSeconds(5)).orElseThrow();

      client.reconnect();

      QueueMessage after = client.fetch(Duration.ofSeconds(5)).orElseThrow();
      assertThat(after.generation()).isGreaterThan(before.generation());
      assertThat(after.messageId()).isEqualTo(item.jobId());
      client.ack(after);
    }
  }

  private static BrokerProperties properties(String suffix) {
    BrokerProperties properties = new BrokerProperties();
    properties.setUri(RABBIT.getAmqpUrl());
    properties.setQueueName("transcribehive.test." + suffix);
    return properties;
  }
}
