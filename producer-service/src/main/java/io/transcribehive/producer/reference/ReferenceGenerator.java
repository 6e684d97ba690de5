package io.transcribehive.producer.reference;

import java.time.Duration;

/**
 * Read-only view of the object store: enumerates keys and mints time-bounded references to them.
 */
public interface ReferenceGenerator {

  /**
   * Lazily lists the keys selected by {@code selector}. Every call to {@code iterator()} starts a
   * fresh listing from the first page.
   *
   * @throws ObjectStoreException (during iteration) when the listing fails
   */
  Iterable<String> objectKeys(ObjectSelector selector);

  /**
   * Creates a reference that resolves to the object for {@code validity}.
   *
   * @throws ObjectStoreException when the reference cannot be created
   */
  SignedReference sign(String bucket, String key, Duration validity);
}
