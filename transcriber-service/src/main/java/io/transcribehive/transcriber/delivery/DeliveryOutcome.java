package io.transcribehive.transcriber.delivery;

/**
 * @param attempts delivery attempts made, more than one means the delivery was retried
 * @param detail reason the result was not delivered, {@code null} when it was
 */
public record DeliveryOutcome(Status status, int attempts, String detail) {

  public enum Status {
    /** The sink acknowledged the result. */
    DELIVERED,
    /** The sink refused the result for good. */
    REJECTED,
    /** The sink kept failing transiently until the retry budget ran out. */
    EXHAUSTED,
    /** The worker was interrupted before the sink accepted the result. */
    INTERRUPTED
  }

  public static DeliveryOutcome delivered(int attempts) {
    return new DeliveryOutcome(Status.DELIVERED, attempts, null);
  }

  public static DeliveryOutcome rejected(int attempts, String detail) {
    return new DeliveryOutcome(Status.REJECTED, attempts, detail);
  }

  public static DeliveryOutcome exhausted(int attempts, String detail) {
    return new DeliveryOutcome(Status.EXHAUSTED, attempts, detail);
  }

  public static DeliveryOutcome interrupted(int attempts, String detail) {
    return new DeliveryOutcome(Status.INTERRUPTED, attempts, detail);
  }

  public boolean delivered() {
    return status == Status.DELIVERED;
  }

  public boolean retried() {
    return attempts > 1;
  }
}
