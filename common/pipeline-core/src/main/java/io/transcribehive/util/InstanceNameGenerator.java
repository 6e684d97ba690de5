package io.transcribehive.util;

import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Names producer runs and worker loops as {@code <queue>-<role>-<process>-<n>}.
 * <p>
 * The process token is drawn once per JVM, so every loop of one process shares it and the broker's
 * connection list groups them; {@code n} counts the names handed out by this process. The names end
 * up in thread names, AMQP connection names and consumer tags, so they are restricted to
 * {@code [a-z0-9_.-]}.
 */
public final class InstanceNameGenerator {

  private static final String PROCESS_TOKEN =
      Integer.toString(ThreadLocalRandom.current().nextInt(36 * 36 * 36, 36 * 36 * 36 * 36), 36);
  private static final AtomicInteger SEQUENCE = new AtomicInteger();

  private InstanceNameGenerator() {}

  public static String generate(String role) {
    return generate(role, null);
  }

  public static String generate(String role, String queueName) {
    String queue = sanitize(queueName, "jobs");
    return queue + "-" + sanitize(role, "worker") + "-" + PROCESS_TOKEN + "-" + SEQUENCE.incrementAndGet();
  }

  static String processToken() {
    return PROCESS_TOKEN;
  }

  private static String sanitize(String value, String fallback) {
    if (value == null) {
      return fallback;
    }
    String sanitized = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_.]", "");
    return sanitized.isEmpty() ? fallback : sanitized;
  }
}
