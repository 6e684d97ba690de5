package io.transcribehive.transcriber.asr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.transcribehive.failure.FailureKind;
import io.transcribehive.queue.WorkItem;
import io.transcribehive.transcriber.model.TranscriptResult;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class ProcessTranscriptionInvokerTest {

  @TempDir
  Path workDir;

  @Test
  void classifiesExitCodes() {
    assertThat(ProcessTranscriptionInvoker.classifyExit(75, "")).isEqualTo(FailureKind.TRANSIENT);
    assertThat(ProcessTranscriptionInvoker.classifyExit(1, "fetch failed: URL expired"))
        .isEqualTo(FailureKind.REFERENCE_EXPIRED);
    assertThat(ProcessTranscriptionInvoker.classifyExit(2, "unsupported codec")).isEqualTo(FailureKind.PERMANENT);
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void readsTranscriptFromStdoutAndCleansUp() throws Exception {
    // $0 is "sh", $1 is --job-config and $2 the config file
    ProcessTranscriptionInvoker invoker = invoker("grep -q fetch_data \"$2\" && echo 'the quick brown fox'");

    TranscriptResult result = invoker.transcribe(item(Instant.now()));

    assertThat(result.successful()).isTrue();
    assertThat(result.text()).isEqualTo("the quick brown fox");
    try (Stream<Path> leftovers = Files.list(workDir)) {
      assertThat(leftovers).isEmpty();
    }
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void tempfailExitIsTransient() {
    ProcessTranscriptionInvoker invoker = invoker("echo 'engine busy' >&2; exit 75");

    assertThatThrownBy(() -> invoker.transcribe(item(Instant.now())))
        .isInstanceOfSatisfying(TranscriptionException.class, ex -> {
          assertThat(ex.kind()).isEqualTo(FailureKind.TRANSIENT);
          assertThat(ex.getMessage()).contains("engine busy");
        });
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void hangingPipelineTimesOutAsTransient() {
    ProcessTranscriptionInvoker invoker = new ProcessTranscriptionInvoker(List.of("sh", "-c", "sleep 5"), workDir,
        "en", Duration.ofMillis(200), Clock.systemUTC());

    assertThatThrownBy(() -> invoker.transcribe(item(Instant.now())))
        .isInstanceOfSatisfying(TranscriptionException.class,
            ex -> assertThat(ex.kind()).isEqualTo(FailureKind.TRANSIENT));
  }

  @Test
  void expiredItemIsNotRun() {
    ProcessTranscriptionInvoker invoker = invoker("exit 0");

    assertThatThrownBy(() -> invoker.transcribe(item(Instant.now().minus(Duration.ofHours(3)))))
        .isInstanceOfSatisfying(TranscriptionException.class,
            ex -> assertThat(ex.kind()).isEqualTo(FailureKind.REFERENCE_EXPIRED));
  }

  private ProcessTranscriptionInvoker invoker(String script) {
    return new ProcessTranscriptionInvoker(List.of("sh", "-c", script, "sh"), workDir, "en",
        Duration.ofSeconds(20), Clock.systemUTC());
  }

  private static WorkItem item(Instant enqueuedAt) {
    return WorkItem.forObject("media", "audio/fox.wav", URI.create("https://media.example/audio/fox.wav?sig=abc"),
        enqueuedAt, Duration.ofHours(1));
  }
}
