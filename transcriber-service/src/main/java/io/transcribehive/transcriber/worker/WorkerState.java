package io.transcribehive.transcriber.worker;

public enum WorkerState {
  IDLE,
  FETCHING,
  PROCESSING,
  DELIVERING,
  ACKNOWLEDGING,
  STOPPED
}
