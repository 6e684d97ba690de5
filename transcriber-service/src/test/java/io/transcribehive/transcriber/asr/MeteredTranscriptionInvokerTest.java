package io.transcribehive.transcriber.asr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.transcribehive.failure.FailureKind;
import io.transcribehive.queue.WorkItem;
import io.transcribehive.transcriber.model.TranscriptResult;
import io.transcribehive.transcriber.usage.UsageEvent;
import io.transcribehive.transcriber.usage.UsageReporter;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.MDC;

class MeteredTranscriptionInvokerTest {

  private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
  private static final WorkItem ITEM = WorkItem.forObject("media", "audio/a.wav",
      URI.create("https://media.example/audio/a.wav"), NOW, Duration.ofHours(1));

  private final TranscriptionInvoker engine = mock(TranscriptionInvoker.class);
  private final UsageReporter reporter = mock(UsageReporter.class);
  private final MeteredTranscriptionInvoker metered =
      new MeteredTranscriptionInvoker(engine, reporter, Clock.fixed(NOW, ZoneOffset.UTC));

  @AfterEach
  void clearMdc() {
    MDC.clear();
  }

  @Test
  void reportsSuccessfulInvocation() {
    MDC.put("worker", "jobs-scribe-1");
    when(engine.engine()).thenReturn("http");
    when(engine.transcribe(ITEM)).thenReturn(TranscriptResult.success(ITEM, "hi"));

    assertThat(metered.transcribe(ITEM).text()).isEqualTo("hi");

    UsageEvent event = reported();
    assertThat(event.jobId()).isEqualTo(ITEM.jobId());
    assertThat(event.objectKey()).isEqualTo("audio/a.wav");
    assertThat(event.engine()).isEqualTo("http");
    assertThat(event.worker()).isEqualTo("jobs-scribe-1");
    assertThat(event.startedAt()).isEqualTo(NOW);
    assertThat(event.outcome()).isEqualTo("success");
  }

  @Test
  void reportsFailedInvocationWithItsKind() {
    when(engine.transcribe(ITEM)).thenThrow(new TranscriptionException(FailureKind.REFERENCE_EXPIRED, "expired"));

    assertThatThrownBy(() -> metered.transcribe(ITEM)).isInstanceOf(TranscriptionException.class);

    assertThat(reported().outcome()).isEqualTo("reference_expired");
  }

  @Test
  void reporterFailureDoesNotAffectTheResult() {
    when(engine.transcribe(ITEM)).thenReturn(TranscriptResult.success(ITEM, "hi"));
    doThrow(new IllegalStateException("collector down")).when(reporter).report(any());

    assertThat(metered.transcribe(ITEM).successful()).isTrue();
  }

  private UsageEvent reported() {
    ArgumentCaptor<UsageEvent> captor = ArgumentCaptor.forClass(UsageEvent.class);
    verify(reporter).report(captor.capture());
    return captor.getValue();
  }
}
