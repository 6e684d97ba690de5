package io.transcribehive.producer.reference;

public class ObjectStoreNotFoundException extends ObjectStoreException {

  public ObjectStoreNotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
