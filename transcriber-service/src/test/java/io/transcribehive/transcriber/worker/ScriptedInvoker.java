package io.transcribehive.transcriber.worker;

import io.transcribehive.queue.WorkItem;
import io.transcribehive.transcriber.asr.TranscriptionInvoker;
import io.transcribehive.transcriber.model.TranscriptResult;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Returns "transcript of &lt;key&gt;" unless failures were queued for that key.
 */
final class ScriptedInvoker implements TranscriptionInvoker {

  private final Map<String, Deque<RuntimeException>> failures = new HashMap<>();
  private final Map<String, Integer> calls = new HashMap<>();

  synchronized ScriptedInvoker failNext(String objectKey, RuntimeException failure) {
    failures.computeIfAbsent(objectKey, k -> new ArrayDeque<>()).addLast(failure);
    return this;
  }

  synchronized int calls(String objectKey) {
    return calls.getOrDefault(objectKey, 0);
  }

  synchronized int totalCalls() {
    return calls.values().stream().mapToInt(Integer::intValue).sum();
  }

  @Override
  public TranscriptResult transcribe(WorkItem item) {
    RuntimeException failure;
    synchronized (this) {
      calls.merge(item.objectKey(), 1, Integer::sum);
      Deque<RuntimeException> queued = failures.get(item.objectKey());
      failure = queued == null ? null : queued.pollFirst();
    }
    if (failure != null) {
      throw failure;
    }
    return TranscriptResult.success(item, "transcript of " + item.objectKey());
  }

  @Override
  public String engine() {
    return "scripted";
  }
}
