package io.transcribehive.producer.reference;

import java.util.Objects;
import java.util.Optional;

/**
 * Bucket and key prefix of a producer run.
 * <p>
 * A leading {@code /} on the prefix is ignored, so the default {@code /} selects the whole bucket.
 * A prefix ending in {@code /} names a "directory": listing starts after the prefix itself so the
 * directory marker object is not returned.
 */
public record ObjectSelector(String bucket, String prefix) {

  private static final String DELIMITER = "/";

  public ObjectSelector {
    Objects.requireNonNull(bucket, "bucket");
    if (bucket.isBlank()) {
      throw new IllegalArgumentException("bucket must not be blank");
    }
    prefix = normalise(prefix);
  }

  public Optional<String> startAfter() {
    return prefix.endsWith(DELIMITER) ? Optional.of(prefix) : Optional.empty();
  }

  private static String normalise(String prefix) {
    if (prefix == null) {
      return "";
    }
    return prefix.startsWith(DELIMITER) ? prefix.substring(1) : prefix;
  }
}
