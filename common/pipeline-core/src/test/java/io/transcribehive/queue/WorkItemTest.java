package io.transcribehive.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class WorkItemTest {

  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
  private static final URI REF = URI.create("https://media.example/audio/a.wav?sig=1");

  @Test
  void jobIdIsStablePerObject() {
    WorkItem first = WorkItem.forObject("media", "audio/a.wav", REF, T0, Duration.ofHours(1));
    WorkItem rerun = WorkItem.forObject("media", "audio/a.wav", REF, T0.plusSeconds(600), Duration.ofHours(1));
    WorkItem other = WorkItem.forObject("media", "audio/b.wav", REF, T0, Duration.ofHours(1));

    assertThat(rerun.jobId()).isEqualTo(first.jobId());
    assertThat(other.jobId()).isNotEqualTo(first.jobId());
  }

  @Test
  void expiresAtTheEndOfTheValidityWindow() {
    WorkItem item = WorkItem.forObject("media", "audio/a.wav", REF, T0, Duration.ofMinutes(10));

    assertThat(item.expiresAt()).isEqualTo(T0.plusSeconds(600));
    assertThat(item.isExpiredAt(T0.plusSeconds(599))).isFalse();
    assertThat(item.isExpiredAt(T0.plusSeconds(600))).isTrue();
    assertThat(item.remainingAt(T0.plusSeconds(540))).isEqualTo(Duration.ofMinutes(1));
    assertThat(item.remainingAt(T0.plusSeconds(3600))).isZero();
  }

  @Test
  void rejectsEmptyValidityWindow() {
    assertThatThrownBy(() -> new WorkItem("id", "k", REF, T0, Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
