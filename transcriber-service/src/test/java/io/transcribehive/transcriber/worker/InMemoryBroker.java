package io.transcribehive.transcriber.worker;

import io.transcribehive.queue.BrokerUnavailableException;
import io.transcribehive.queue.QueueClient;
import io.transcribehive.queue.QueueMessage;
import io.transcribehive.queue.WorkItem;
import io.transcribehive.queue.WorkItemCodec;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Single-queue broker double with manual acknowledgements, requeue and connection loss.
 * <p>
 * Dropping the broker returns every unacknowledged message to the queue, marks it redelivered and
 * invalidates all connections; clients have to reconnect once the broker is restored. A client
 * that reconnects or closes hands its own unacknowledged messages back the same way.
 */
final class InMemoryBroker {

  private final WorkItemCodec codec = new WorkItemCodec();
  private final Deque<Stored> ready = new ArrayDeque<>();
  private final Map<Long, Unacked> unacked = new LinkedHashMap<>();
  private final Map<String, Integer> maxUnackedPerClient = new HashMap<>();
  private long nextTag;
  private long epoch;
  private boolean down;
  private int acks;
  private int requeues;

  synchronized void publish(WorkItem item) {
    publishRaw(item.jobId(), codec.encode(item));
  }

  synchronized void publishRaw(String messageId, byte[] body) {
    ready.addLast(new Stored(messageId, body, 0, false));
    notifyAll();
  }

  synchronized void drop() {
    down = true;
    epoch++;
    Iterator<Unacked> pending = unacked.values().iterator();
    while (pending.hasNext()) {
      Unacked entry = pending.next();
      ready.addFirst(entry.stored().asRedelivered());
      pending.remove();
    }
    notifyAll();
  }

  synchronized void restore() {
    down = false;
    notifyAll();
  }

  synchronized boolean idle() {
    return ready.isEmpty() && unacked.isEmpty();
  }

  synchronized int ready() {
    return ready.size();
  }

  synchronized int unacked() {
    return unacked.size();
  }

  synchronized int acks() {
    return acks;
  }

  synchronized int requeues() {
    return requeues;
  }

  synchronized int maxUnackedSeenBy(String client) {
    return maxUnackedPerClient.getOrDefault(client, 0);
  }

  Client client(String name) {
    return new Client(name);
  }

  private synchronized Optional<QueueMessage> take(Client client, Duration timeout) {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (true) {
      requireConnected(client);
      Stored next = ready.pollFirst();
      if (next != null) {
        long tag = ++nextTag;
        unacked.put(tag, new Unacked(client.name, next));
        long held = unacked.values().stream().filter(u -> u.client().equals(client.name)).count();
        maxUnackedPerClient.merge(client.name, (int) held, Math::max);
        return Optional.of(new QueueMessage(tag, next.redelivered(), next.messageId(), next.deliveries(),
            next.body(), client.epoch));
      }
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        return Optional.empty();
      }
      try {
        long millis = Math.max(1L, remaining / 1_000_000L);
        wait(millis);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return Optional.empty();
      }
    }
  }

  private synchronized void settle(Client client, QueueMessage message, boolean ack, boolean requeue) {
    requireConnected(client);
    if (message.generation() != client.epoch) {
      throw new BrokerUnavailableException("stale delivery tag " + message.deliveryTag());
    }
    Unacked entry = unacked.remove(message.deliveryTag());
    if (entry == null) {
      throw new IllegalStateException("unknown delivery tag " + message.deliveryTag());
    }
    if (ack) {
      acks++;
    } else if (requeue) {
      requeues++;
      ready.addLast(entry.stored().asRedelivered());
      notifyAll();
    }
  }

  private synchronized void connect(Client client) {
    if (down) {
      throw new BrokerUnavailableException("broker is down");
    }
    client.epoch = epoch;
    client.connected = true;
  }

  private synchronized void release(Client client) {
    Iterator<Unacked> pending = unacked.values().iterator();
    while (pending.hasNext()) {
      Unacked entry = pending.next();
      if (entry.client().equals(client.name)) {
        ready.addFirst(entry.stored().asRedelivered());
        pending.remove();
      }
    }
    notifyAll();
  }

  private void requireConnected(Client client) {
    if (down || !client.connected || client.epoch != epoch) {
      throw new BrokerUnavailableException("connection lost");
    }
  }

  private record Stored(String messageId, byte[] body, int deliveries, boolean redelivered) {

    Stored asRedelivered() {
      return new Stored(messageId, body, deliveries + 1, true);
    }
  }

  private record Unacked(String client, Stored stored) {
  }

  final class Client implements QueueClient {

    private final String name;
    private volatile long epoch = -1;
    private volatile boolean connected;
    private QueueMessage outstanding;
    int reconnects;
    boolean closed;

    private Client(String name) {
      this.name = name;
    }

    @Override
    public String queueName() {
      return "transcribehive.jobs";
    }

    @Override
    public void connect() {
      if (!connected || epoch != InMemoryBroker.this.epoch) {
        InMemoryBroker.this.connect(this);
      }
    }

    @Override
    public void reconnect() {
      reconnects++;
      outstanding = null;
      connected = false;
      // like a closed channel: whatever this client held goes back to the queue
      release(this);
      InMemoryBroker.this.connect(this);
    }

    @Override
    public void publish(WorkItem item) {
      InMemoryBroker.this.publish(item);
    }

    @Override
    public Optional<QueueMessage> fetch(Duration timeout) {
      if (outstanding != null) {
        throw new IllegalStateException("previous message not settled");
      }
      Optional<QueueMessage> message = take(this, timeout);
      message.ifPresent(m -> outstanding = m);
      return message;
    }

    @Override
    public void ack(QueueMessage message) {
      outstanding = null;
      settle(this, message, true, false);
    }

    @Override
    public void nack(QueueMessage message, boolean requeue) {
      outstanding = null;
      settle(this, message, false, requeue);
    }

    @Override
    public int unsettled() {
      return outstanding == null ? 0 : 1;
    }

    @Override
    public void close() {
      closed = true;
      connected = false;
      outstanding = null;
      release(this);
    }

    String name() {
      return name;
    }
  }
}
