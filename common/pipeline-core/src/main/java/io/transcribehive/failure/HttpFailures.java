package io.transcribehive.failure;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Locale;

/**
 * Maps HTTP status codes and I/O errors onto {@link FailureKind}. Shared by every outbound HTTP
 * adapter so the ASR engine and the sink are classified the same way.
 */
public final class HttpFailures {

  private HttpFailures() {
  }

  public static boolean isSuccess(int status) {
    return status >= 200 && status < 300;
  }

  /**
   * Classifies a non-2xx response.
   *
   * @param status HTTP status code
   * @param body response body, may be {@code null}
   */
  public static FailureKind classify(int status, String body) {
    if (status == 410) {
      return FailureKind.REFERENCE_EXPIRED;
    }
    if (status == 403 && mentionsExpiry(body)) {
      return FailureKind.REFERENCE_EXPIRED;
    }
    if (status == 408 || status == 425 || status == 429) {
      return FailureKind.TRANSIENT;
    }
    if (status >= 500) {
      return FailureKind.TRANSIENT;
    }
    return FailureKind.PERMANENT;
  }

  /**
   * Every {@link IOException} raised while talking to a peer (refused connection, reset, timeout)
   * is treated as transient.
   */
  public static FailureKind classify(IOException error) {
    return FailureKind.TRANSIENT;
  }

  public static boolean isTimeout(IOException error) {
    return error instanceof InterruptedIOException;
  }

  public static boolean mentionsExpiry(String text) {
    return text != null && text.toLowerCase(Locale.ROOT).contains("expired");
  }
}
