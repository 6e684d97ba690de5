package io.transcribehive.producer;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Runs the batch once on startup and reports its result as the application exit code.
 */
@Component
class ProducerRunner implements ApplicationRunner, ExitCodeGenerator {

  private final BatchProducer producer;
  private volatile BatchSummary summary;

  ProducerRunner(BatchProducer producer) {
    this.producer = producer;
  }

  @Override
  public void run(ApplicationArguments args) {
    summary = producer.run();
  }

  @Override
  public int getExitCode() {
    return summary == null ? 1 : summary.exitCode();
  }

  BatchSummary summary() {
    return summary;
  }
}
