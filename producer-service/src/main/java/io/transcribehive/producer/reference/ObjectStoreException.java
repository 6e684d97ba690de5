package io.transcribehive.producer.reference;

import io.transcribehive.failure.TranscribeHiveException;

/**
 * Listing or signing against the object store failed.
 */
public class ObjectStoreException extends TranscribeHiveException {

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
