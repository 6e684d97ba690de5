package io.transcribehive.failure;

/**
 * Base type for every failure raised by the transcription pipeline. Library exceptions are
 * translated into a subclass at the adapter that talks to the library, so callers further in
 * never see {@code IOException}, {@code AmqpException} or SDK exceptions.
 */
public class TranscribeHiveException extends RuntimeException {

  public TranscribeHiveException(String message) {
    super(message);
  }

  public TranscribeHiveException(String message, Throwable cause) {
    super(message, cause);
  }
}
