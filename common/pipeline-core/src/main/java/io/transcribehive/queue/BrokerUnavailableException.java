package io.transcribehive.queue;

import io.transcribehive.failure.TranscribeHiveException;

/**
 * The broker connection could not be opened or was lost. Unsettled messages stay with the
 * broker and are redelivered once a consumer is back.
 */
public class BrokerUnavailableException extends TranscribeHiveException {

  public BrokerUnavailableException(String message) {
    super(message);
  }

  public BrokerUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
