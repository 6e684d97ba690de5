package io.transcribehive.queue;

import io.transcribehive.failure.ClassifiedException;
import io.transcribehive.failure.FailureKind;

/**
 * The broker did not confirm a published work item in time, or rejected it.
 */
public class QueuePublishException extends ClassifiedException {

  private final String jobId;

  public QueuePublishException(String jobId, String message, Throwable cause) {
    super(FailureKind.TRANSIENT, message, cause);
    this.jobId = jobId;
  }

  public String jobId() {
    return jobId;
  }
}
