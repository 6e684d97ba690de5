package io.transcribehive.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * JSON wire format of a {@link WorkItem}:
 * <pre>{@code
 * {
 *   "jobId": "5f0c…",
 *   "objectKey": "audio/a.wav",
 *   "url": "https://bucket.s3.eu-west-2.amazonaws.com/audio/a.wav?X-Amz-…",
 *   "enqueuedAt": "2024-01-01T00:00:00Z",
 *   "validitySeconds": 3600
 * }
 * }</pre>
 * Unknown fields are ignored so older workers keep accepting newer producers.
 */
public final class WorkItemCodec {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  public byte[] encode(WorkItem item) {
    ObjectNode node = MAPPER.createObjectNode();
    node.put("jobId", item.jobId());
    node.put("objectKey", item.objectKey());
    node.put("url", item.reference().toString());
    node.put("enqueuedAt", item.enqueuedAt().toString());
    node.put("validitySeconds", item.validityWindow().getSeconds());
    try {
      return MAPPER.writeValueAsBytes(node);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to encode work item " + item.jobId(), ex);
    }
  }

  public WorkItem decode(byte[] body) {
    if (body == null || body.length == 0) {
      throw new MalformedWorkItemException("Empty message body");
    }
    JsonNode node;
    try {
      node = MAPPER.readTree(body);
    } catch (IOException ex) {
      throw new MalformedWorkItemException("Message body is not JSON", ex);
    }
    if (node == null || !node.isObject()) {
      throw new MalformedWorkItemException("Message body is not a JSON object");
    }
    URI reference = reference(node);
    Instant enqueuedAt = enqueuedAt(node);
    Duration validity = validity(node);
    String objectKey = node.path("objectKey").asText("");
    String jobId = node.path("jobId").asText("");
    if (jobId.isBlank()) {
      jobId = WorkItem.jobIdFor(reference.getHost() == null ? "" : reference.getHost(), reference.getPath());
    }
    try {
      return new WorkItem(jobId, objectKey, reference, enqueuedAt, validity);
    } catch (IllegalArgumentException ex) {
      throw new MalformedWorkItemException(ex.getMessage(), ex);
    }
  }

  private static URI reference(JsonNode node) {
    String url = node.path("url").asText("");
    if (url.isBlank()) {
      throw new MalformedWorkItemException("Missing 'url'");
    }
    try {
      URI uri = new URI(url);
      if (!uri.isAbsolute()) {
        throw new MalformedWorkItemException("'url' is not absolute: " + uri.getPath());
      }
      return uri;
    } catch (URISyntaxException ex) {
      throw new MalformedWorkItemException("'url' is not a valid URI", ex);
    }
  }

  private static Instant enqueuedAt(JsonNode node) {
    String raw = node.path("enqueuedAt").asText("");
    if (raw.isBlank()) {
      throw new MalformedWorkItemException("Missing 'enqueuedAt'");
    }
    try {
      return Instant.parse(raw);
    } catch (DateTimeParseException ex) {
      throw new MalformedWorkItemException("'enqueuedAt' is not an ISO-8601 instant: " + raw, ex);
    }
  }

  private static Duration validity(JsonNode node) {
    JsonNode seconds = node.path("validitySeconds");
    if (!seconds.canConvertToLong()) {
      throw new MalformedWorkItemException("Missing or non-numeric 'validitySeconds'");
    }
    return Duration.ofSeconds(seconds.asLong());
  }
}
