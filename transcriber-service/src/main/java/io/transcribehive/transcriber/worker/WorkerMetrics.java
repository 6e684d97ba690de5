package io.transcribehive.transcriber.worker;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Message outcome counters and processing time, shared by every loop in the process.
 */
public class WorkerMetrics {

  static final String MESSAGES = "transcribehive.worker.messages";
  static final String PROCESSING = "transcribehive.worker.processing";

  private final Map<ProcessingOutcome, Counter> counters = new EnumMap<>(ProcessingOutcome.class);
  private final Timer processing;

  public WorkerMetrics(MeterRegistry registry) {
    Objects.requireNonNull(registry, "registry");
    for (ProcessingOutcome outcome : ProcessingOutcome.values()) {
      counters.put(outcome, Counter.builder(MESSAGES)
          .description("Work items handled, by outcome")
          .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
          .register(registry));
    }
    processing = Timer.builder(PROCESSING)
        .description("Time from fetch to settlement of one work item")
        .register(registry);
  }

  public void record(ProcessingOutcome outcome, Duration elapsed) {
    counters.get(outcome).increment();
    processing.record(elapsed);
  }
}
