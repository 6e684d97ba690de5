package io.transcribehive.transcriber.asr;

import io.transcribehive.failure.FailureKind;
import io.transcribehive.failure.HttpFailures;
import io.transcribehive.queue.WorkItem;
import io.transcribehive.transcriber.model.TranscriptResult;
import io.transcribehive.util.References;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Submits the job config to an ASR engine over HTTP and waits for the transcript in the response.
 * <p>
 * The response timeout never exceeds the time left in the item's validity window: once the
 * reference has expired the engine cannot fetch the audio anyway.
 */
public class HttpTranscriptionInvoker implements TranscriptionInvoker {

  private static final Logger log = LoggerFactory.getLogger(HttpTranscriptionInvoker.class);

  private final HttpClient httpClient;
  private final URI endpoint;
  private final String language;
  private final Duration timeout;
  private final Clock clock;

  public HttpTranscriptionInvoker(HttpClient httpClient, URI endpoint, String language, Duration timeout, Clock clock) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.language = Objects.requireNonNull(language, "language");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public String engine() {
    return "http";
  }

  @Override
  public TranscriptResult transcribe(WorkItem item) {
    Instant now = clock.instant();
    if (item.isExpiredAt(now)) {
      throw new TranscriptionException(FailureKind.REFERENCE_EXPIRED,
          "Reference for " + item.objectKey() + " expired at " + item.expiresAt());
    }
    Duration budget = effectiveTimeout(item, now);

    HttpPost post = new HttpPost(endpoint);
    post.setEntity(new StringEntity(TranscriptionJobConfig.toJson(item, language), ContentType.APPLICATION_JSON));
    post.setConfig(RequestConfig.custom()
        .setResponseTimeout(Timeout.ofMilliseconds(Math.max(1L, budget.toMillis())))
        .build());
    log.debug("POST {} for {} (timeout {} ms)", endpoint, References.redact(item.reference()), budget.toMillis());

    EngineResponse response;
    try {
      response = httpClient.execute(post, httpResponse -> new EngineResponse(
          httpResponse.getCode(),
          httpResponse.getEntity() == null ? "" : EntityUtils.toString(httpResponse.getEntity(), StandardCharsets.UTF_8)));
    } catch (IOException ex) {
      if (HttpFailures.isTimeout(ex) && item.isExpiredAt(clock.instant())) {
        throw new TranscriptionException(FailureKind.REFERENCE_EXPIRED,
            "ASR did not answer before the reference expired", ex);
      }
      throw new TranscriptionException(HttpFailures.classify(ex), "ASR request failed: " + ex, ex);
    }

    if (!HttpFailures.isSuccess(response.status())) {
      FailureKind kind = HttpFailures.classify(response.status(), response.body());
      throw new TranscriptionException(kind, "ASR returned " + response.status() + ": " + abbreviate(response.body()));
    }
    return TranscriptResult.success(item, TranscriptionJobConfig.transcriptFrom(response.body()));
  }

  Duration effectiveTimeout(WorkItem item, Instant now) {
    Duration remaining = item.remainingAt(now);
    return remaining.compareTo(timeout) < 0 ? remaining : timeout;
  }

  private static String abbreviate(String body) {
    if (body == null) {
      return "";
    }
    return body.length() <= 200 ? body : body.substring(0, 200) + "...";
  }

  private record EngineResponse(int status, String body) {
  }
}
