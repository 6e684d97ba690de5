package io.transcribehive.producer;

import io.transcribehive.retry.RetryProperties;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@Validated
@ConfigurationProperties(prefix = "transcribehive.producer")
public class ProducerProperties {

  /** Source bucket ({@code S3_BUCKET_NAME}). */
  @NotBlank
  private String bucket;

  /** Key prefix ({@code S3_FILE_PREFIX}); {@code /} selects the whole bucket. */
  private String prefix = "/";

  /** How long each presigned reference stays valid. */
  @NotNull
  private Duration validityWindow = Duration.ofHours(1);

  /** Shortest window accepted; anything below is unlikely to survive the queue wait. */
  @NotNull
  private Duration minValidityWindow = Duration.ofMinutes(5);

  private RetryProperties publishRetry = new RetryProperties();

  public String getBucket() {
    return bucket;
  }

  public void setBucket(String bucket) {
    this.bucket = bucket == null ? null : bucket.trim();
  }

  public String getPrefix() {
    return prefix;
  }

  public void setPrefix(String prefix) {
    this.prefix = prefix == null || prefix.isBlank() ? "/" : prefix.trim();
  }

  public Duration getValidityWindow() {
    return validityWindow;
  }

  public void setValidityWindow(Duration validityWindow) {
    this.validityWindow = validityWindow;
  }

  public Duration getMinValidityWindow() {
    return minValidityWindow;
  }

  public void setMinValidityWindow(Duration minValidityWindow) {
    this.minValidityWindow = minValidityWindow;
  }

  public RetryProperties getPublishRetry() {
    return publishRetry;
  }

  public void setPublishRetry(RetryProperties publishRetry) {
    this.publishRetry = publishRetry;
  }

  @AssertTrue(message = "validity-window must be at least min-validity-window")
  public boolean isValidityWindowSufficient() {
    if (validityWindow == null || minValidityWindow == null) {
      return true;
    }
    return validityWindow.compareTo(minValidityWindow) >= 0;
  }
}
