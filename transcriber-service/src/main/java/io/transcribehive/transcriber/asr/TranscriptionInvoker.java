package io.transcribehive.transcriber.asr;

import io.transcribehive.queue.WorkItem;
import io.transcribehive.transcriber.model.TranscriptResult;

/**
 * Adapter around a speech recognition engine.
 */
public interface TranscriptionInvoker {

  /**
   * Transcribes the audio behind {@code item.reference()}.
   *
   * @return a successful result carrying the transcript
   * @throws TranscriptionException classified failure; no other exception type is expected
   */
  TranscriptResult transcribe(WorkItem item);

  /**
   * Short engine name used in logs and usage events.
   */
  String engine();
}
