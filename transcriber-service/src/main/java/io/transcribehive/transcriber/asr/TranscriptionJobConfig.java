package io.transcribehive.transcriber.asr;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.transcribehive.queue.WorkItem;

/**
 * Batch job config understood by the ASR engine:
 * <pre>{@code
 * {"type": "transcription",
 *  "transcription_config": {"language": "en"},
 *  "fetch_data": {"url": "https://…"}}
 * }</pre>
 */
final class TranscriptionJobConfig {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private TranscriptionJobConfig() {
  }

  static ObjectNode forItem(WorkItem item, String language) {
    ObjectNode config = MAPPER.createObjectNode();
    config.put("type", "transcription");
    config.putObject("transcription_config").put("language", language);
    config.putObject("fetch_data").put("url", item.reference().toString());
    return config;
  }

  static String toJson(WorkItem item, String language) {
    try {
      return MAPPER.writeValueAsString(forItem(item, language));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to render job config for " + item.jobId(), ex);
    }
  }

  /**
   * Pulls the transcript out of an engine response. JSON responses carry it in {@code transcript}
   * or {@code text}; anything else is taken as the plain transcript.
   */
  static String transcriptFrom(String body) {
    if (body == null) {
      return "";
    }
    String trimmed = body.trim();
    if (!trimmed.startsWith("{")) {
      return body;
    }
    try {
      JsonNode node = MAPPER.readTree(trimmed);
      if (node.hasNonNull("transcript")) {
        return node.get("transcript").asText();
      }
      if (node.hasNonNull("text")) {
        return node.get("text").asText();
      }
      return body;
    } catch (JsonProcessingException ex) {
      return body;
    }
  }
}
