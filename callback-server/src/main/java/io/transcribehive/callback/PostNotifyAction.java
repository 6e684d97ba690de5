package io.transcribehive.callback;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Follow-up call made after a notification, for example to fetch the transcript a callback
 * announced. The target comes from the {@code X-Action-Url} header with {@code $jobid} replaced by
 * the job id; {@code X-Action-Authorization} is passed on as {@code Authorization}.
 */
@Component
public class PostNotifyAction {

  public static final String ACTION_URL = "X-Action-Url";
  public static final String ACTION_AUTH = "X-Action-Authorization";
  static final String JOB_ID_PLACEHOLDER = "$jobid";

  private static final Logger log = LoggerFactory.getLogger(PostNotifyAction.class);

  private final HttpClient httpClient;
  private final Duration timeout;

  @Autowired
  public PostNotifyAction(HttpClient httpClient, CallbackProperties properties) {
    this(httpClient, properties.getActionTimeout());
  }

  PostNotifyAction(HttpClient httpClient, Duration timeout) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  /**
   * Runs the action and describes its outcome: {@code status_code} and {@code content} of the
   * response, or {@code error} when the action could not be made.
   */
  public Map<String, Object> run(String actionUrl, String authorization, String jobId) {
    Map<String, Object> outcome = new LinkedHashMap<>();
    if (actionUrl == null || actionUrl.isBlank()) {
      outcome.put("error", ACTION_URL + " is required for a post action");
      return outcome;
    }
    String target = actionUrl.replace(JOB_ID_PLACEHOLDER, jobId == null ? "" : jobId);
    HttpGet get;
    try {
      get = new HttpGet(target);
    } catch (IllegalArgumentException ex) {
      outcome.put("error", "Invalid action URL " + target);
      return outcome;
    }
    if (authorization != null) {
      get.setHeader(HttpHeaders.AUTHORIZATION, authorization);
    }
    get.setConfig(RequestConfig.custom().setResponseTimeout(Timeout.ofMilliseconds(timeout.toMillis())).build());
    try {
      return httpClient.execute(get, response -> {
        outcome.put("status_code", response.getCode());
        outcome.put("content", response.getEntity() == null
            ? "" : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8));
        return outcome;
      });
    } catch (IOException ex) {
      log.warn("Post-notify action to {} failed: {}", target, ex.toString());
      outcome.put("error", ex.toString());
      return outcome;
    }
  }
}
