package io.transcribehive.transcriber.delivery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.transcribehive.failure.FailureKind;
import io.transcribehive.failure.HttpFailures;
import io.transcribehive.transcriber.model.TranscriptResult;
import io.transcribehive.util.References;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.net.URIBuilder;
import org.apache.hc.core5.util.Timeout;

/**
 * Single delivery attempt: {@code POST <sink>?id=<jobId>&status=success|failure} with the result
 * as JSON and the job id as {@code Idempotency-Key}.
 * <p>
 * Non-2xx answers and I/O errors are thrown as {@link DeliveryException}; retrying is left to
 * {@link RetryingResultDelivery}.
 */
public class HttpResultDelivery implements ResultDelivery {

  public static final String IDEMPOTENCY_KEY = "Idempotency-Key";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final HttpClient httpClient;
  private final URI sink;
  private final Duration timeout;

  public HttpResultDelivery(HttpClient httpClient, URI sink, Duration timeout) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  @Override
  public DeliveryOutcome deliver(TranscriptResult result) {
    HttpPost post = new HttpPost(target(result));
    post.setHeader(IDEMPOTENCY_KEY, result.jobId());
    post.setEntity(new StringEntity(body(result), ContentType.APPLICATION_JSON));
    post.setConfig(RequestConfig.custom().setResponseTimeout(Timeout.ofMilliseconds(timeout.toMillis())).build());

    SinkResponse response;
    try {
      response = httpClient.execute(post, httpResponse -> new SinkResponse(
          httpResponse.getCode(),
          httpResponse.getEntity() == null ? "" : EntityUtils.toString(httpResponse.getEntity(), StandardCharsets.UTF_8)));
    } catch (IOException ex) {
      throw new DeliveryException(HttpFailures.classify(ex), "Sink unreachable: " + ex, ex);
    }
    if (!HttpFailures.isSuccess(response.status())) {
      throw new DeliveryException(sinkFailureKind(response), "Sink returned " + response.status());
    }
    return DeliveryOutcome.delivered(1);
  }

  private URI target(TranscriptResult result) {
    try {
      return new URIBuilder(sink)
          .addParameter("id", result.jobId())
          .addParameter("status", result.status().wireValue())
          .build();
    } catch (URISyntaxException ex) {
      throw new DeliveryException(FailureKind.PERMANENT, "Invalid sink URL " + sink, ex);
    }
  }

  // expiry only matters for references; a sink 410 just means the endpoint is gone
  private static FailureKind sinkFailureKind(SinkResponse response) {
    FailureKind kind = HttpFailures.classify(response.status(), response.body());
    return kind == FailureKind.REFERENCE_EXPIRED ? FailureKind.PERMANENT : kind;
  }

  static String body(TranscriptResult result) {
    ObjectNode node = MAPPER.createObjectNode();
    node.put("jobId", result.jobId());
    node.put("objectKey", result.objectKey());
    node.put("reference", References.redact(result.reference()));
    node.put("status", result.status().wireValue());
    if (result.successful()) {
      node.put("transcript", result.text());
    } else {
      node.put("failureKind", result.failureKind().name());
      node.put("error", result.errorDetail());
    }
    try {
      return MAPPER.writeValueAsString(node);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to render result for " + result.jobId(), ex);
    }
  }

  private record SinkResponse(int status, String body) {
  }
}
