package io.transcribehive.transcriber.usage;

/**
 * Side channel for usage metering. Implementations must not throw: metering never affects the
 * outcome of a work item.
 */
public interface UsageReporter {

  void report(UsageEvent event);
}
