package io.transcribehive.transcriber.usage;

import java.time.Duration;
import java.time.Instant;

/**
 * One ASR invocation as seen by the metering collector.
 *
 * @param outcome {@code success} or the lower-case failure kind
 */
public record UsageEvent(
    String jobId,
    String objectKey,
    String engine,
    String worker,
    Instant startedAt,
    Duration duration,
    String outcome
) {
}
