package io.transcribehive.retry;

import java.time.Duration;

/**
 * Bindable form of {@link RetryPolicy} for {@code @ConfigurationProperties} trees, for example
 * {@code transcribehive.producer.publish-retry.max-attempts=5}.
 */
public class RetryProperties {

  private int maxAttempts;
  private Duration initialBackoff;
  private double multiplier = 2.0;
  private Duration maxBackoff;

  public RetryProperties() {
    this(3, Duration.ofMillis(500), Duration.ofSeconds(5));
  }

  public RetryProperties(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
    this.maxAttempts = maxAttempts;
    this.initialBackoff = initialBackoff;
    this.maxBackoff = maxBackoff;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public void setMaxAttempts(int maxAttempts) {
    this.maxAttempts = maxAttempts;
  }

  public Duration getInitialBackoff() {
    return initialBackoff;
  }

  public void setInitialBackoff(Duration initialBackoff) {
    this.initialBackoff = initialBackoff;
  }

  public double getMultiplier() {
    return multiplier;
  }

  public void setMultiplier(double multiplier) {
    this.multiplier = multiplier;
  }

  public Duration getMaxBackoff() {
    return maxBackoff;
  }

  public void setMaxBackoff(Duration maxBackoff) {
    this.maxBackoff = maxBackoff;
  }

  public RetryPolicy toPolicy() {
    return new RetryPolicy(maxAttempts, initialBackoff, multiplier, maxBackoff);
  }

  /**
   * Same backoff shape without an attempt ceiling, used for broker reconnects.
   */
  public RetryPolicy toUnboundedPolicy() {
    return new RetryPolicy(RetryPolicy.UNBOUNDED, initialBackoff, multiplier, maxBackoff);
  }
}
