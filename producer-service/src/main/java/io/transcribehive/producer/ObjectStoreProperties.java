package io.transcribehive.producer;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Object store client settings. Credentials are not configured here; the AWS default credentials
 * chain picks up {@code AWS_ACCESS_KEY_ID}/{@code AWS_SECRET_ACCESS_KEY}, profiles or instance roles.
 */
@Component
@ConfigurationProperties(prefix = "transcribehive.object-store")
public class ObjectStoreProperties {

  private String region = "eu-west-2";
  private String endpoint = "";
  private boolean pathStyle;

  public String getRegion() {
    return region;
  }

  public void setRegion(String region) {
    this.region = region == null || region.isBlank() ? "eu-west-2" : region.trim();
  }

  /**
   * Optional endpoint override for S3-compatible stores (MinIO, LocalStack).
   */
  public String getEndpoint() {
    return endpoint;
  }

  public void setEndpoint(String endpoint) {
    this.endpoint = endpoint == null ? "" : endpoint.trim();
  }

  public boolean isPathStyle() {
    return pathStyle;
  }

  public void setPathStyle(boolean pathStyle) {
    this.pathStyle = pathStyle;
  }
}
