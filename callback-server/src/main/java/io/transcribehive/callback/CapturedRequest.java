package io.transcribehive.callback;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * One request as received by the bucket.
 *
 * @param files multipart parts, decoded as UTF-8 text where possible
 * @param time epoch seconds
 * @param postNotifyAction outcome of the post-notify action, {@code null} when none was requested
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CapturedRequest(
    Map<String, String> files,
    String text,
    Map<String, String> args,
    Map<String, String> headers,
    String method,
    long time,
    @JsonProperty("remote_addr") String remoteAddr,
    @JsonProperty("post_notify_action") Map<String, Object> postNotifyAction
) {

  public CapturedRequest {
    files = files == null ? Map.of() : Map.copyOf(files);
    args = args == null ? Map.of() : Map.copyOf(args);
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }
}
