package io.transcribehive.transcriber.asr;

import io.transcribehive.failure.ClassifiedException;
import io.transcribehive.failure.FailureKind;

public class TranscriptionException extends ClassifiedException {

  public TranscriptionException(FailureKind kind, String message) {
    super(kind, message);
  }

  public TranscriptionException(FailureKind kind, String message, Throwable cause) {
    super(kind, message, cause);
  }
}
