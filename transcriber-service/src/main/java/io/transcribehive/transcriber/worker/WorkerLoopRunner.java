package io.transcribehive.transcriber.worker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.IntFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the configured number of worker loops, each on its own thread with its own broker
 * connection, and stops them gracefully with the application context.
 * <p>
 * On stop every loop is asked to finish its current message; loops still busy after the grace
 * period are interrupted. An interrupted message is never settled, so the broker redelivers it.
 */
public class WorkerLoopRunner implements SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(WorkerLoopRunner.class);

  private final IntFunction<WorkerLoop> loopFactory;
  private final int consumers;
  private final Duration shutdownGrace;
  private final List<WorkerLoop> loops = new ArrayList<>();
  private final List<Thread> threads = new ArrayList<>();
  private volatile boolean running;

  /**
   * @param loopFactory creates the loop with the given 1-based index
   */
  public WorkerLoopRunner(IntFunction<WorkerLoop> loopFactory, int consumers, Duration shutdownGrace) {
    this.loopFactory = Objects.requireNonNull(loopFactory, "loopFactory");
    if (consumers < 1) {
      throw new IllegalArgumentException("consumers must be >= 1, got: " + consumers);
    }
    this.consumers = consumers;
    this.shutdownGrace = Objects.requireNonNull(shutdownGrace, "shutdownGrace");
  }

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    for (int i = 1; i <= consumers; i++) {
      WorkerLoop loop = loopFactory.apply(i);
      Thread thread = new Thread(loop, loop.name());
      thread.setUncaughtExceptionHandler((t, ex) -> log.error("Worker thread {} died", t.getName(), ex));
      loops.add(loop);
      threads.add(thread);
      thread.start();
    }
    running = true;
    log.info("Started {} worker loop(s)", consumers);
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    loops.forEach(WorkerLoop::stop);
    long deadline = System.nanoTime() + shutdownGrace.toNanos();
    try {
      for (Thread thread : threads) {
        long remaining = deadline - System.nanoTime();
        if (remaining > 0) {
          TimeUnit.NANOSECONDS.timedJoin(thread, remaining);
        }
        if (thread.isAlive()) {
          log.warn("Worker {} still busy after {}; interrupting", thread.getName(), shutdownGrace);
          thread.interrupt();
        }
      }
      for (Thread thread : threads) {
        thread.join(TimeUnit.SECONDS.toMillis(5));
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      threads.forEach(Thread::interrupt);
    } finally {
      loops.clear();
      threads.clear();
      running = false;
    }
    log.info("Worker loops stopped");
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  List<WorkerLoop> loops() {
    return List.copyOf(loops);
  }
}
