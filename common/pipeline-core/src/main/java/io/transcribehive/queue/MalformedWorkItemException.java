package io.transcribehive.queue;

import io.transcribehive.failure.ClassifiedException;
import io.transcribehive.failure.FailureKind;

/**
 * A message body that cannot be turned into a {@link WorkItem}. Never retried.
 */
public class MalformedWorkItemException extends ClassifiedException {

  public MalformedWorkItemException(String message) {
    super(FailureKind.PERMANENT, message);
  }

  public MalformedWorkItemException(String message, Throwable cause) {
    super(FailureKind.PERMANENT, message, cause);
  }
}
