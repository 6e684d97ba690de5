package io.transcribehive.producer.reference;

/**
 * Credentials are missing or invalid, or they do not grant access to the bucket.
 */
public class ObjectStoreAccessException extends ObjectStoreException {

  public ObjectStoreAccessException(String message, Throwable cause) {
    super(message, cause);
  }
}
