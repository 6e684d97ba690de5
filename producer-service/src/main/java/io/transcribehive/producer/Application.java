package io.transcribehive.producer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;

/**
 * One-shot batch: lists the bucket, enqueues one work item per object and exits with the batch
 * result as process exit code.
 */
@SpringBootApplication(exclude = RabbitAutoConfiguration.class)
public class Application {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(Application.class, args)));
  }
}
