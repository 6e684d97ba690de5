package io.transcribehive.retry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

  @Test
  void backoffGrowsExponentiallyUpToTheCap() {
    RetryPolicy policy = RetryPolicy.exponential(6, Duration.ofMillis(500), Duration.ofSeconds(3));

    assertThat(policy.backoffAfter(1)).isEqualTo(Duration.ofMillis(500));
    assertThat(policy.backoffAfter(2)).isEqualTo(Duration.ofMillis(1000));
    assertThat(policy.backoffAfter(3)).isEqualTo(Duration.ofMillis(2000));
    assertThat(policy.backoffAfter(4)).isEqualTo(Duration.ofSeconds(3));
    assertThat(policy.backoffAfter(5)).isEqualTo(Duration.ofSeconds(3));
  }

  @Test
  void lastAttemptHasNoSuccessor() {
    RetryPolicy policy = RetryPolicy.exponential(3, Duration.ofMillis(10), Duration.ofMillis(40));

    assertThat(policy.hasAttemptAfter(1)).isTrue();
    assertThat(policy.hasAttemptAfter(2)).isTrue();
    assertThat(policy.hasAttemptAfter(3)).isFalse();
  }

  @Test
  void noRetryAllowsExactlyOneAttempt() {
    RetryPolicy policy = RetryPolicy.noRetry();

    assertThat(policy.hasAttemptAfter(1)).isFalse();
    assertThat(policy.backoffAfter(1)).isZero();
  }

  @Test
  void unboundedPolicyNeverRunsOutButStaysCapped() {
    RetryPolicy policy = RetryPolicy.unbounded(Duration.ofSeconds(1), Duration.ofSeconds(30));

    assertThat(policy.bounded()).isFalse();
    assertThat(policy.hasAttemptAfter(10_000)).isTrue();
    assertThat(policy.backoffAfter(10_000)).isEqualTo(Duration.ofSeconds(30));
  }

  @Test
  void normalisesMultiplierAndMissingCap() {
    RetryPolicy policy = new RetryPolicy(4, Duration.ofMillis(200), 0.5, null);

    assertThat(policy.multiplier()).isEqualTo(1.0);
    assertThat(policy.maxBackoff()).isEqualTo(Duration.ofMillis(200));
    assertThat(policy.backoffAfter(3)).isEqualTo(Duration.ofMillis(200));
  }

  @Test
  void rejectsNonPositiveAttempts() {
    assertThatThrownBy(() -> RetryPolicy.exponential(0, Duration.ZERO, Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("maxAttempts");
  }

  @Test
  void propertiesBuildTheSamePolicy() {
    RetryProperties properties = new RetryProperties(5, Duration.ofSeconds(1), Duration.ofSeconds(30));
    properties.setMultiplier(3.0);

    RetryPolicy policy = properties.toPolicy();
    assertThat(policy.maxAttempts()).isEqualTo(5);
    assertThat(policy.backoffAfter(2)).isEqualTo(Duration.ofSeconds(3));
    assertThat(properties.toUnboundedPolicy().bounded()).isFalse();
  }
}
