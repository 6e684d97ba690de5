package io.transcribehive.transcriber.asr;

import io.transcribehive.queue.WorkItem;
import io.transcribehive.transcriber.model.TranscriptResult;
import io.transcribehive.transcriber.usage.UsageEvent;
import io.transcribehive.transcriber.usage.UsageReporter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Reports every engine invocation to the usage collector, whatever its outcome.
 */
public class MeteredTranscriptionInvoker implements TranscriptionInvoker {

  private static final Logger log = LoggerFactory.getLogger(MeteredTranscriptionInvoker.class);

  private final TranscriptionInvoker delegate;
  private final UsageReporter reporter;
  private final Clock clock;

  public MeteredTranscriptionInvoker(TranscriptionInvoker delegate, UsageReporter reporter, Clock clock) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.reporter = Objects.requireNonNull(reporter, "reporter");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public String engine() {
    return delegate.engine();
  }

  @Override
  public TranscriptResult transcribe(WorkItem item) {
    Instant started = clock.instant();
    String outcome = "error";
    try {
      TranscriptResult result = delegate.transcribe(item);
      outcome = "success";
      return result;
    } catch (TranscriptionException ex) {
      outcome = ex.kind().name().toLowerCase(Locale.ROOT);
      throw ex;
    } finally {
      report(new UsageEvent(item.jobId(), item.objectKey(), delegate.engine(), MDC.get("worker"), started,
          Duration.between(started, clock.instant()), outcome));
    }
  }

  private void report(UsageEvent event) {
    try {
      reporter.report(event);
    } catch (RuntimeException ex) {
      log.warn("Usage reporting failed for job {}: {}", event.jobId(), ex.toString());
    }
  }
}
