package io.transcribehive.transcriber.delivery;

import io.transcribehive.transcriber.model.TranscriptResult;

/**
 * Hands a transcript result to the downstream sink. Delivering the same result twice is safe: the
 * sink de-duplicates on the job id.
 */
public interface ResultDelivery {

  DeliveryOutcome deliver(TranscriptResult result);
}
