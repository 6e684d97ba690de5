package io.transcribehive.transcriber.usage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.transcribehive.failure.HttpFailures;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
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
 * Posts one JSON event per ASR invocation to the usage collector ({@code SM_EATS_URL}). Failures
 * are logged and dropped.
 */
public class HttpUsageReporter implements UsageReporter {

  private static final Logger log = LoggerFactory.getLogger(HttpUsageReporter.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final HttpClient httpClient;
  private final URI endpoint;
  private final Duration timeout;

  public HttpUsageReporter(HttpClient httpClient, URI endpoint, Duration timeout) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  /**
   * Accepts collector addresses given as bare {@code host:port}, the way container setups usually
   * pass them. An address without a path posts to the root path.
   */
  public static URI endpointOf(String address) {
    String trimmed = address.trim();
    URI uri = URI.create(trimmed.contains("://") ? trimmed : "http://" + trimmed);
    return uri.getRawPath() == null || uri.getRawPath().isEmpty() ? uri.resolve("/") : uri;
  }

  @Override
  public void report(UsageEvent event) {
    HttpPost post = new HttpPost(endpoint);
    post.setConfig(RequestConfig.custom().setResponseTimeout(Timeout.ofMilliseconds(timeout.toMillis())).build());
    try {
      post.setEntity(new StringEntity(MAPPER.writeValueAsString(toJson(event)), ContentType.APPLICATION_JSON));
      Integer status = httpClient.execute(post, response -> {
        if (response.getEntity() != null) {
          EntityUtils.consume(response.getEntity());
        }
        return response.getCode();
      });
      if (!HttpFailures.isSuccess(status)) {
        log.warn("Usage collector rejected event for job {} with status {}", event.jobId(), status);
      }
    } catch (JsonProcessingException ex) {
      log.warn("Could not render usage event for job {}: {}", event.jobId(), ex.getMessage());
    } catch (IOException ex) {
      log.warn("Usage collector unreachable for job {}: {}", event.jobId(), ex.toString());
    }
  }

  static ObjectNode toJson(UsageEvent event) {
    ObjectNode node = MAPPER.createObjectNode();
    node.put("jobId", event.jobId());
    node.put("objectKey", event.objectKey());
    node.put("engine", event.engine());
    node.put("worker", event.worker());
    node.put("startedAt", event.startedAt().toString());
    node.put("durationMs", event.duration().toMillis());
    node.put("outcome", event.outcome());
    return node;
  }
}
