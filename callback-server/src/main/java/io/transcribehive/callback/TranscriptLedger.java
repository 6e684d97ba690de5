package io.transcribehive.callback;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * One entry per job, however often its result was delivered. A repeated delivery replaces the
 * stored result and bumps the delivery counter, except that a successful result is never replaced
 * by a later failure report for the same job.
 * <p>
 * Holds at most {@code capacity} jobs; the job recorded first is evicted first.
 */
@Component
public class TranscriptLedger {

  static final String SUCCESS = "success";

  private final int capacity;
  private final Map<String, Entry> entries;

  @Autowired
  public TranscriptLedger(CallbackProperties properties) {
    this(properties.getCapacity());
  }

  TranscriptLedger(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
    }
    this.capacity = capacity;
    this.entries = new LinkedHashMap<>() {
      @Override
      protected boolean removeEldestEntry(Map.Entry<String, Entry> eldest) {
        return size() > TranscriptLedger.this.capacity;
      }
    };
  }

  public synchronized Entry record(String key, String status, String body, Instant receivedAt) {
    Entry previous = entries.get(key);
    Entry entry;
    if (previous == null) {
      entry = new Entry(key, status, body, receivedAt, receivedAt, 1);
    } else if (previous.successful() && !SUCCESS.equals(status)) {
      entry = new Entry(key, previous.status(), previous.body(), previous.firstReceivedAt(), receivedAt,
          previous.deliveries() + 1);
    } else {
      entry = new Entry(key, status, body, previous.firstReceivedAt(), receivedAt, previous.deliveries() + 1);
    }
    entries.put(key, entry);
    return entry;
  }

  public synchronized List<Entry> entries() {
    return new ArrayList<>(entries.values());
  }

  public int capacity() {
    return capacity;
  }

  /**
   * @param key idempotency key of the delivery, the job id for transcriber results
   * @param deliveries how many times this result was received
   */
  public record Entry(
      String key,
      String status,
      String body,
      Instant firstReceivedAt,
      Instant lastReceivedAt,
      int deliveries
  ) {

    boolean successful() {
      return SUCCESS.equals(status);
    }
  }
}
