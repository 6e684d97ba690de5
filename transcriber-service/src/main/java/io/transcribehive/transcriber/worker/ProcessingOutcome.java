package io.transcribehive.transcriber.worker;

/**
 * Terminal state of one message in a worker, and the single settlement it leads to.
 */
public enum ProcessingOutcome {

  /** Transcript delivered to the sink. */
  COMPLETED(Settlement.ACK),

  /** Transient ASR failure; the message goes back to the queue for another worker. */
  REQUEUED(Settlement.NACK_REQUEUE),

  /** Permanent failure or expired reference; recorded and dropped. */
  FAILED(Settlement.ACK),

  /** Transcript produced but the sink never accepted it. */
  DELIVERY_ABANDONED(Settlement.ACK),

  /** Body is not a work item. */
  MALFORMED(Settlement.ACK),

  /** Worker interrupted before the result was delivered; the message is left for redelivery. */
  INTERRUPTED(Settlement.NONE);

  public enum Settlement {
    ACK,
    NACK_REQUEUE,
    /** Not settled; the broker redelivers once the channel is gone. */
    NONE
  }

  private final Settlement settlement;

  ProcessingOutcome(Settlement settlement) {
    this.settlement = settlement;
  }

  public Settlement settlement() {
    return settlement;
  }
}
