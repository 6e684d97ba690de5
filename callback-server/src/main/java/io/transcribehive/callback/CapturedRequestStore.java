package io.transcribehive.callback;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Bounded in-memory store, newest request first. The oldest request is dropped once the capacity
 * is reached.
 */
@Component
public class CapturedRequestStore {

  private final int capacity;
  private final Deque<CapturedRequest> requests = new ArrayDeque<>();

  @Autowired
  public CapturedRequestStore(CallbackProperties properties) {
    this(properties.getCapacity());
  }

  CapturedRequestStore(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
    }
    this.capacity = capacity;
  }

  public synchronized void add(CapturedRequest request) {
    requests.addFirst(request);
    while (requests.size() > capacity) {
      requests.removeLast();
    }
  }

  public synchronized List<CapturedRequest> list() {
    return List.copyOf(requests);
  }

  public int capacity() {
    return capacity;
  }

  public synchronized int size() {
    return requests.size();
  }
}
