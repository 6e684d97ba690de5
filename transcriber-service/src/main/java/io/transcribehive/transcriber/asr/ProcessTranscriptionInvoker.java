package io.transcribehive.transcriber.asr;

import io.transcribehive.failure.FailureKind;
import io.transcribehive.failure.HttpFailures;
import io.transcribehive.queue.WorkItem;
import io.transcribehive.transcriber.model.TranscriptResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a local batch pipeline as {@code <command> --job-config <file>} and reads the transcript
 * from its standard output.
 * <p>
 * Exit codes: {@code 0} is success, {@code 75} ({@code EX_TEMPFAIL}) is transient; any other
 * non-zero exit is permanent unless stderr reports an expired reference.
 */
public class ProcessTranscriptionInvoker implements TranscriptionInvoker {

  static final int EXIT_TEMPFAIL = 75;

  private static final Logger log = LoggerFactory.getLogger(ProcessTranscriptionInvoker.class);

  private final List<String> command;
  private final Path workDir;
  private final String language;
  private final Duration timeout;
  private final Clock clock;

  public ProcessTranscriptionInvoker(List<String> command, Path workDir, String language, Duration timeout,
                                     Clock clock) {
    this.command = List.copyOf(Objects.requireNonNull(command, "command"));
    if (this.command.isEmpty()) {
      throw new IllegalArgumentException("command must not be empty");
    }
    this.workDir = Objects.requireNonNull(workDir, "workDir");
    this.language = Objects.requireNonNull(language, "language");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public String engine() {
    return "process";
  }

  @Override
  public TranscriptResult transcribe(WorkItem item) {
    Instant now = clock.instant();
    if (item.isExpiredAt(now)) {
      throw new TranscriptionException(FailureKind.REFERENCE_EXPIRED,
          "Reference for " + item.objectKey() + " expired at " + item.expiresAt());
    }
    Duration remaining = item.remainingAt(now);
    Duration budget = remaining.compareTo(timeout) < 0 ? remaining : timeout;

    Path config = null;
    Path stdout = null;
    Path stderr = null;
    try {
      Files.createDirectories(workDir);
      config = Files.createTempFile(workDir, "job-" + item.jobId() + "-", ".json");
      stdout = Files.createTempFile(workDir, "job-" + item.jobId() + "-", ".out");
      stderr = Files.createTempFile(workDir, "job-" + item.jobId() + "-", ".err");
      Files.writeString(config, TranscriptionJobConfig.toJson(item, language), StandardCharsets.UTF_8);

      List<String> argv = new ArrayList<>(command);
      argv.add("--job-config");
      argv.add(config.toString());
      Process process = new ProcessBuilder(argv)
          .redirectOutput(stdout.toFile())
          .redirectError(stderr.toFile())
          .start();
      boolean finished;
      try {
        finished = process.waitFor(Math.max(1L, budget.toMillis()), TimeUnit.MILLISECONDS);
      } catch (InterruptedException ex) {
        process.destroyForcibly();
        Thread.currentThread().interrupt();
        throw new TranscriptionException(FailureKind.TRANSIENT, "Interrupted while transcribing " + item.jobId(), ex);
      }
      if (!finished) {
        process.destroyForcibly();
        FailureKind kind = item.isExpiredAt(clock.instant()) ? FailureKind.REFERENCE_EXPIRED : FailureKind.TRANSIENT;
        throw new TranscriptionException(kind, "Pipeline did not finish within " + budget.toMillis() + " ms");
      }
      int exit = process.exitValue();
      String errors = Files.readString(stderr, StandardCharsets.UTF_8);
      if (exit == 0) {
        if (!errors.isBlank()) {
          log.debug("pipeline stderr: {}", errors.trim());
        }
        return TranscriptResult.success(item, Files.readString(stdout, StandardCharsets.UTF_8).trim());
      }
      throw new TranscriptionException(classifyExit(exit, errors), "Pipeline exited with " + exit + ": " + errors.trim());
    } catch (IOException ex) {
      throw new TranscriptionException(FailureKind.TRANSIENT, "Failed to run pipeline: " + ex.getMessage(), ex);
    } finally {
      deleteQuietly(config);
      deleteQuietly(stdout);
      deleteQuietly(stderr);
    }
  }

  static FailureKind classifyExit(int exit, String stderr) {
    if (exit == EXIT_TEMPFAIL) {
      return FailureKind.TRANSIENT;
    }
    if (HttpFailures.mentionsExpiry(stderr)) {
      return FailureKind.REFERENCE_EXPIRED;
    }
    return FailureKind.PERMANENT;
  }

  private static void deleteQuietly(Path file) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException ex) {
      log.debug("Could not delete {}: {}", file, ex.toString());
    }
  }
}
