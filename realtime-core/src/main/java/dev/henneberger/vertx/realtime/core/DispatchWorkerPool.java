package dev.henneberger.vertx.realtime.core;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans change events out to connections.
 *
 * <p>Worker {@code i} consumes shard {@code i} of the {@link IngestionQueue}. For each event it
 * drops duplicates, matches subscriptions, checks authorization once per connection and enqueues
 * one {@code change} message per matching subscription. Since one worker owns all events of a
 * table and outbound queues are FIFO, a connection sees the changes of a table in commit order.
 */
public final class DispatchWorkerPool implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(DispatchWorkerPool.class);
  private static final long POLL_TIMEOUT_MS = 250L;

  private final IngestionQueue queue;
  private final SequenceDeduplicator deduplicator;
  private final SubscriptionRegistry registry;
  private final ConnectionManager connections;
  private final AuthorizationGate authorizationGate;
  private final List<RealtimeMetricsListener> metricsListeners = new CopyOnWriteArrayList<>();
  private final AtomicBoolean shouldRun = new AtomicBoolean(false);
  private final AtomicLong processed = new AtomicLong();
  private final AtomicLong delivered = new AtomicLong();
  private final AtomicLong denied = new AtomicLong();
  private final AtomicLong undeliverable = new AtomicLong();
  private final List<Thread> workers = new ArrayList<>();

  public DispatchWorkerPool(IngestionQueue queue,
                            SequenceDeduplicator deduplicator,
                            SubscriptionRegistry registry,
                            ConnectionManager connections,
                            AuthorizationGate authorizationGate) {
    this.queue = Objects.requireNonNull(queue, "queue");
    this.deduplicator = Objects.requireNonNull(deduplicator, "deduplicator");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.connections = Objects.requireNonNull(connections, "connections");
    this.authorizationGate = Objects.requireNonNull(authorizationGate, "authorizationGate");
  }

  public synchronized void start() {
    if (!shouldRun.compareAndSet(false, true)) {
      return;
    }
    for (int shard = 0; shard < queue.shardCount(); shard++) {
      int assigned = shard;
      Thread worker = new Thread(() -> runLoop(assigned), "realtime-dispatch-" + shard);
      worker.setDaemon(true);
      workers.add(worker);
      worker.start();
    }
  }

  @Override
  public synchronized void close() {
    shouldRun.set(false);
    for (Thread worker : workers) {
      worker.interrupt();
    }
    workers.clear();
  }

  /**
   * Delivers one event to every authorized, matching subscription.
   *
   * @return number of messages accepted by connection queues
   */
  public int dispatch(ChangeEvent event, long nowMillis) {
    processed.incrementAndGet();
    if (!deduplicator.firstSeen(event, nowMillis)) {
      for (RealtimeMetricsListener listener : metricsListeners) {
        listener.onDuplicateSuppressed(event);
      }
      return 0;
    }

    List<Subscription> matches = registry.match(event);
    if (matches.isEmpty()) {
      return 0;
    }

    Map<String, Boolean> verdicts = new HashMap<>();
    int accepted = 0;
    for (Subscription subscription : matches) {
      RealtimeConnection connection = connections.get(subscription.connectionId());
      if (connection == null || !connection.isOpen()) {
        continue;
      }
      Boolean allowed = verdicts.get(connection.id());
      if (allowed == null) {
        allowed = authorizationGate.isAllowed(connection.identity(), event, nowMillis);
        verdicts.put(connection.id(), allowed);
        if (!allowed) {
          denied.incrementAndGet();
        }
      }
      if (!allowed) {
        continue;
      }

      String message = ServerMessages.change(subscription.id(), event).encode();
      EnqueueResult result = connections.enqueue(connection.id(), message);
      if (result == EnqueueResult.ACCEPTED) {
        accepted++;
        delivered.incrementAndGet();
        for (RealtimeMetricsListener listener : metricsListeners) {
          listener.onDelivered(connection.id(), event);
        }
      } else {
        undeliverable.incrementAndGet();
      }
    }
    return accepted;
  }

  public long processed() {
    return processed.get();
  }

  public long delivered() {
    return delivered.get();
  }

  public long denied() {
    return denied.get();
  }

  public long undeliverable() {
    return undeliverable.get();
  }

  public RealtimeSubscription addMetricsListener(RealtimeMetricsListener listener) {
    RealtimeMetricsListener resolved = Objects.requireNonNull(listener, "listener");
    metricsListeners.add(resolved);
    return () -> metricsListeners.remove(resolved);
  }

  private void runLoop(int shard) {
    while (shouldRun.get()) {
      ChangeEvent event;
      try {
        event = queue.poll(shard, POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
      if (event == null) {
        continue;
      }
      try {
        dispatch(event, System.currentTimeMillis());
      } catch (RuntimeException e) {
        LOG.warn("Dispatch of change on {} failed, dropping it", event.qualifiedTable(), e);
      }
    }
  }
}
