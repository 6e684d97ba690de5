package io.transcribehive.transcriber.worker;

import static io.transcribehive.transcriber.worker.WorkerLoopTest.item;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.transcribehive.failure.FailureKind;
import io.transcribehive.retry.RetryPolicy;
import io.transcribehive.transcriber.delivery.DeliveryException;
import io.transcribehive.transcriber.delivery.ResultDelivery;
import io.transcribehive.transcriber.delivery.RetryingResultDelivery;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class WorkerLoopRunnerTest {

  private final InMemoryBroker broker = new InMemoryBroker();
  private final RecordingSink sink = new RecordingSink();
  private final List<InMemoryBroker.Client> clients = new ArrayList<>();

  @Test
  void startsOneLoopPerConsumerAndStopsThemGracefully() {
    WorkerLoopRunner runner = new WorkerLoopRunner(this::newLoop, 3, Duration.ofSeconds(5));

    runner.start();
    for (int i = 0; i < 6; i++) {
      broker.publish(item("audio/" + i + ".wav", Instant.now()));
    }

    assertThat(runner.isRunning()).isTrue();
    assertThat(runner.loops()).hasSize(3).extracting(WorkerLoop::name)
        .containsExactly("jobs-scribe-1", "jobs-scribe-2", "jobs-scribe-3");
    await().atMost(Duration.ofSeconds(10)).until(() -> sink.distinctResults().size() == 6 && broker.idle());

    List<WorkerLoop> loops = runner.loops();
    runner.stop();

    assertThat(runner.isRunning()).isFalse();
    assertThat(loops).allSatisfy(loop -> assertThat(loop.state()).isEqualTo(WorkerState.STOPPED));
    assertThat(clients).allSatisfy(client -> assertThat(client.closed).isTrue());
  }

  @Test
  void workerInterruptedDuringSinkBackoffLeavesMessageForRedelivery() {
    ResultDelivery unreachableSink = new RetryingResultDelivery(result -> {
      throw new DeliveryException(FailureKind.TRANSIENT, "Sink unreachable");
    }, RetryPolicy.exponential(5, Duration.ofSeconds(30), Duration.ofSeconds(30)));
    WorkerLoopRunner runner = new WorkerLoopRunner(index -> newLoop(index, unreachableSink), 1,
        Duration.ofMillis(100));
    broker.publish(item("audio/slow.wav", Instant.now()));

    runner.start();
    List<WorkerLoop> loops = runner.loops();
    await().atMost(Duration.ofSeconds(5)).until(() -> loops.get(0).state() == WorkerState.DELIVERING);
    runner.stop();

    assertThat(loops.get(0).state()).isEqualTo(WorkerState.STOPPED);
    assertThat(broker.acks()).isZero();
    assertThat(broker.unacked()).isZero();
    assertThat(broker.ready()).isEqualTo(1);
  }

  @Test
  void rejectsZeroConsumers() {
    assertThatThrownBy(() -> new WorkerLoopRunner(this::newLoop, 0, Duration.ofSeconds(1)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private WorkerLoop newLoop(int index) {
    return newLoop(index, sink);
  }

  private WorkerLoop newLoop(int index, ResultDelivery delivery) {
    String name = "jobs-scribe-" + index;
    InMemoryBroker.Client client = broker.client(name);
    clients.add(client);
    WorkerSettings settings = new WorkerSettings(Duration.ofMillis(50), Duration.ZERO, 0, true,
        RetryPolicy.unbounded(Duration.ofMillis(10), Duration.ofMillis(50)));
    return new WorkerLoop(name, client, new ScriptedInvoker(), delivery, settings,
        new WorkerMetrics(new SimpleMeterRegistry()), Clock.systemUTC());
  }
}
