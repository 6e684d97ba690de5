package io.transcribehive.util;

import java.net.URI;

/**
 * Helpers for presigned object references.
 */
public final class References {

  private References() {
  }

  /**
   * Strips the query string and fragment so a presigned URL can be logged without its signature
   * and credentials.
   */
  public static String redact(URI reference) {
    if (reference == null) {
      return "null";
    }
    if (reference.getRawQuery() == null && reference.getRawFragment() == null) {
      return reference.toString();
    }
    if (reference.isOpaque()) {
      return reference.getScheme() + ":<redacted>";
    }
    StringBuilder out = new StringBuilder();
    if (reference.getScheme() != null) {
      out.append(reference.getScheme()).append(':');
    }
    if (reference.getRawAuthority() != null) {
      out.append("//").append(reference.getRawAuthority());
    }
    if (reference.getRawPath() != null) {
      out.append(reference.getRawPath());
    }
    return out.toString();
  }
}
