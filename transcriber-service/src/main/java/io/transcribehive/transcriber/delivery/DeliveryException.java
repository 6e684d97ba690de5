package io.transcribehive.transcriber.delivery;

import io.transcribehive.failure.ClassifiedException;
import io.transcribehive.failure.FailureKind;

public class DeliveryException extends ClassifiedException {

  public DeliveryException(FailureKind kind, String message) {
    super(kind, message);
  }

  public DeliveryException(FailureKind kind, String message, Throwable cause) {
    super(kind, message, cause);
  }
}
