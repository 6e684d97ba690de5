package io.transcribehive.queue;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One unit of transcription work: a time-bounded reference to a single stored audio object.
 * <p>
 * The reference resolves until {@link #expiresAt()}. Work items are created once by the producer
 * and never change afterwards; the broker may still deliver the same item more than once.
 *
 * @param jobId stable identifier, identical across producer runs for the same object
 * @param objectKey key of the source object, safe to log
 * @param reference presigned URL of the object
 * @param enqueuedAt when the producer minted the reference
 * @param validityWindow how long the reference stays valid after {@code enqueuedAt}
 */
public record WorkItem(String jobId, String objectKey, URI reference, Instant enqueuedAt, Duration validityWindow) {

  public WorkItem {
    Objects.requireNonNull(jobId, "jobId");
    Objects.requireNonNull(reference, "reference");
    Objects.requireNonNull(enqueuedAt, "enqueuedAt");
    Objects.requireNonNull(validityWindow, "validityWindow");
    if (validityWindow.isNegative() || validityWindow.isZero()) {
      throw new IllegalArgumentException("validityWindow must be positive, got: " + validityWindow);
    }
    objectKey = objectKey == null ? "" : objectKey;
  }

  /**
   * Builds the work item for {@code bucket/key}. The job id is a name-based UUID of the object
   * location so a re-run of the producer yields the same id.
   */
  public static WorkItem forObject(String bucket, String key, URI reference, Instant enqueuedAt, Duration validityWindow) {
    return new WorkItem(jobIdFor(bucket, key), key, reference, enqueuedAt, validityWindow);
  }

  public static String jobIdFor(String bucket, String key) {
    return UUID.nameUUIDFromBytes((bucket + "/" + key).getBytes(StandardCharsets.UTF_8)).toString();
  }

  public Instant expiresAt() {
    return enqueuedAt.plus(validityWindow);
  }

  public boolean isExpiredAt(Instant now) {
    return !now.isBefore(expiresAt());
  }

  /**
   * Time left before the reference stops resolving, never negative.
   */
  public Duration remainingAt(Instant now) {
    Duration remaining = Duration.between(now, expiresAt());
    return remaining.isNegative() ? Duration.ZERO : remaining;
  }
}
