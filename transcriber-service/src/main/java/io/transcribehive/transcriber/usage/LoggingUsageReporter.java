package io.transcribehive.transcriber.usage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Used when no collector URL is configured.
 */
public class LoggingUsageReporter implements UsageReporter {

  private static final Logger log = LoggerFactory.getLogger(LoggingUsageReporter.class);

  @Override
  public void report(UsageEvent event) {
    log.info("usage job={} engine={} outcome={} durationMs={}",
        event.jobId(), event.engine(), event.outcome(), event.duration().toMillis());
  }
}
