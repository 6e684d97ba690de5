package io.transcribehive.producer;

import io.transcribehive.producer.reference.ReferenceGenerator;
import io.transcribehive.producer.reference.S3ReferenceGenerator;
import io.transcribehive.queue.BrokerProperties;
import io.transcribehive.queue.RabbitQueueClientFactory;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

@Configuration
@EnableConfigurationProperties(BrokerProperties.class)
public class ProducerConfiguration {

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  RabbitQueueClientFactory queueClientFactory(BrokerProperties brokerProperties) {
    return new RabbitQueueClientFactory(brokerProperties);
  }

  @Bean
  ReferenceGenerator referenceGenerator(S3Client s3Client, S3Presigner s3Presigner) {
    return new S3ReferenceGenerator(s3Client, s3Presigner);
  }

  @Bean
  BatchProducer batchProducer(ReferenceGenerator referenceGenerator,
                              RabbitQueueClientFactory queueClientFactory,
                              ProducerProperties producerProperties,
                              BrokerProperties brokerProperties,
                              Clock clock) {
    return new BatchProducer(referenceGenerator, queueClientFactory::create, producerProperties,
        brokerProperties.getReconnect().toPolicy(), clock);
  }
}
