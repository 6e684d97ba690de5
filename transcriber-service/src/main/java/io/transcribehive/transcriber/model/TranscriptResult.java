package io.transcribehive.transcriber.model;

import io.transcribehive.failure.FailureKind;
import io.transcribehive.queue.WorkItem;
import java.net.URI;
import java.util.Objects;

/**
 * What the worker hands to the result sink for one work item.
 *
 * @param text transcript, {@code null} for failures
 * @param failureKind why the item failed, {@code null} on success
 * @param errorDetail human readable failure description, {@code null} on success
 */
public record TranscriptResult(
    String jobId,
    String objectKey,
    URI reference,
    String text,
    Status status,
    FailureKind failureKind,
    String errorDetail
) {

  public enum Status {
    SUCCESS,
    FAILURE;

    public String wireValue() {
      return this == SUCCESS ? "success" : "failure";
    }
  }

  public TranscriptResult {
    Objects.requireNonNull(jobId, "jobId");
    Objects.requireNonNull(status, "status");
    objectKey = objectKey == null ? "" : objectKey;
  }

  public static TranscriptResult success(WorkItem item, String text) {
    return new TranscriptResult(item.jobId(), item.objectKey(), item.reference(), text == null ? "" : text,
        Status.SUCCESS, null, null);
  }

  public static TranscriptResult failure(WorkItem item, FailureKind kind, String detail) {
    return new TranscriptResult(item.jobId(), item.objectKey(), item.reference(), null, Status.FAILURE,
        Objects.requireNonNull(kind, "kind"), detail);
  }

  public boolean successful() {
    return status == Status.SUCCESS;
  }
}
