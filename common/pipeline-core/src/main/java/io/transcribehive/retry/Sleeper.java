package io.transcribehive.retry;

import java.time.Duration;

/**
 * Blocking pause between attempts. Tests replace it to run without real delays.
 */
@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD = duration -> {
    if (!duration.isZero() && !duration.isNegative()) {
      Thread.sleep(duration.toMillis());
    }
  };

  void sleep(Duration duration) throws InterruptedException;
}
