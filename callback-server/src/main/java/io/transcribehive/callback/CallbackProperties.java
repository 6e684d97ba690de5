package io.transcribehive.callback;

import jakarta.validation.constraints.Min;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@Validated
@ConfigurationProperties(prefix = "callback")
public class CallbackProperties {

  /**
   * When set, every request must carry {@code Authorization: Bearer <token>}.
   */
  private String authToken;

  /**
   * Number of captured requests kept, newest first.
   */
  @Min(1)
  private int capacity = 100;

  /**
   * Response timeout for post-notify actions.
   */
  private Duration actionTimeout = Duration.ofSeconds(10);

  public String getAuthToken() {
    return authToken;
  }

  public void setAuthToken(String authToken) {
    this.authToken = authToken;
  }

  public boolean authRequired() {
    return authToken != null && !authToken.isBlank();
  }

  public int getCapacity() {
    return capacity;
  }

  public void setCapacity(int capacity) {
    this.capacity = capacity;
  }

  public Duration getActionTimeout() {
    return actionTimeout;
  }

  public void setActionTimeout(Duration actionTimeout) {
    this.actionTimeout = actionTimeout;
  }
}
