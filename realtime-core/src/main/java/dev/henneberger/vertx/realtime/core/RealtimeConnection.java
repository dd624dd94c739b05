package dev.henneberger.vertx.realtime.core;

import io.vertx.core.Context;
import io.vertx.core.json.JsonObject;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Server-side state of one client connection.
 *
 * <p>Dispatch workers append to the bounded outbound queue; the write loop drains it on the
 * connection's Vert.x context and stops while the socket's own write queue is full. Owned by the
 * {@link ConnectionManager}; everything else refers to it by id.
 */
public final class RealtimeConnection {

  private final String id;
  private final String remoteAddress;
  private final ClientSink sink;
  private final Context context;
  private final ArrayBlockingQueue<String> outbound;
  private final long createdAt;
  private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
  private final AtomicBoolean drainScheduled = new AtomicBoolean(false);
  private final AtomicLong delivered = new AtomicLong();
  private final AtomicLong dropped = new AtomicLong();

  private volatile CallerIdentity identity;
  private volatile CloseReason closeReason;
  private volatile long slowSince = -1L;
  private volatile long lastPingAt;
  private volatile long pingOutstandingSince = -1L;
  private volatile long lastSeenAt;

  RealtimeConnection(String id,
                     CallerIdentity identity,
                     String remoteAddress,
                     ClientSink sink,
                     Context context,
                     int queueCapacity,
                     long createdAt) {
    this.id = Objects.requireNonNull(id, "id");
    this.identity = Objects.requireNonNull(identity, "identity");
    this.remoteAddress = remoteAddress == null ? "unknown" : remoteAddress;
    this.sink = Objects.requireNonNull(sink, "sink");
    this.context = context;
    this.outbound = new ArrayBlockingQueue<>(queueCapacity);
    this.createdAt = createdAt;
    this.lastPingAt = createdAt;
    this.lastSeenAt = createdAt;
  }

  public String id() {
    return id;
  }

  public CallerIdentity identity() {
    return identity;
  }

  public String remoteAddress() {
    return remoteAddress;
  }

  public ConnectionState state() {
    return state.get();
  }

  public CloseReason closeReason() {
    return closeReason;
  }

  public int queueDepth() {
    return outbound.size();
  }

  public long delivered() {
    return delivered.get();
  }

  public long dropped() {
    return dropped.get();
  }

  public long createdAt() {
    return createdAt;
  }

  public boolean isOpen() {
    ConnectionState current = state.get();
    return current == ConnectionState.ACTIVE || current == ConnectionState.SLOW;
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("id", id)
      .put("state", state.get().name().toLowerCase(Locale.ROOT))
      .put("caller_id", identity.callerId())
      .put("remote_address", remoteAddress)
      .put("queue_depth", outbound.size())
      .put("delivered", delivered.get())
      .put("dropped", dropped.get());
  }

  @Override
  public String toString() {
    return "RealtimeConnection{id=" + id + ", state=" + state.get() + ", remote=" + remoteAddress + '}';
  }

  void identity(CallerIdentity identity) {
    this.identity = Objects.requireNonNull(identity, "identity");
  }

  boolean activate() {
    return state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.ACTIVE);
  }

  EnqueueResult offer(String message) {
    if (!isOpen()) {
      return EnqueueResult.CLOSED;
    }
    if (!outbound.offer(message)) {
      dropped.incrementAndGet();
      return EnqueueResult.QUEUE_FULL;
    }
    scheduleDrain();
    return EnqueueResult.ACCEPTED;
  }

  /**
   * Updates the slow-consumer tracking for one sweep.
   *
   * @return {@code true} when the connection has been over the threshold for at least
   *   {@code timeoutMillis} and must be evicted
   */
  boolean evaluateBackpressure(int threshold, long timeoutMillis, long now) {
    if (outbound.size() > threshold) {
      if (slowSince < 0L) {
        slowSince = now;
        state.compareAndSet(ConnectionState.ACTIVE, ConnectionState.SLOW);
      }
      return now - slowSince >= timeoutMillis;
    }
    if (slowSince >= 0L) {
      slowSince = -1L;
      state.compareAndSet(ConnectionState.SLOW, ConnectionState.ACTIVE);
    }
    return false;
  }

  long slowSince() {
    return slowSince;
  }

  void recordLiveness(long now) {
    lastSeenAt = now;
    pingOutstandingSince = -1L;
  }

  long lastSeenAt() {
    return lastSeenAt;
  }

  /**
   * @return {@code true} when a ping has gone unanswered for {@code pongTimeoutMillis}
   */
  boolean heartbeatExpired(long pongTimeoutMillis, long now) {
    long outstanding = pingOutstandingSince;
    return outstanding >= 0L && now - outstanding >= pongTimeoutMillis;
  }

  boolean pingDue(long pingIntervalMillis, long now) {
    return now - lastPingAt >= pingIntervalMillis;
  }

  void sendPing(long now) {
    lastPingAt = now;
    if (pingOutstandingSince < 0L) {
      pingOutstandingSince = now;
    }
    runOnContext(() -> {
      if (isOpen()) {
        sink.ping();
      }
    });
  }

  /**
   * Moves to {@link ConnectionState#DRAINING} and closes the socket, after flushing what is queued
   * for graceful reasons. Forced closes release the queue at once.
   *
   * @return {@code false} if the connection was already closing
   */
  boolean close(CloseReason reason) {
    ConnectionState current;
    do {
      current = state.get();
      if (current == ConnectionState.DRAINING || current == ConnectionState.CLOSED) {
        return false;
      }
    } while (!state.compareAndSet(current, ConnectionState.DRAINING));

    closeReason = reason;
    if (!reason.graceful()) {
      outbound.clear();
    }
    runOnContext(() -> {
      if (reason.graceful()) {
        flush();
      }
      outbound.clear();
      state.set(ConnectionState.CLOSED);
      if (reason != CloseReason.CLIENT_CLOSED) {
        sink.close(reason.statusCode(), reason.wireName());
      }
    });
    return true;
  }

  private void scheduleDrain() {
    if (drainScheduled.compareAndSet(false, true)) {
      runOnContext(this::drain);
    }
  }

  private void drain() {
    drainScheduled.set(false);
    if (!isOpen()) {
      return;
    }
    if (!flush()) {
      sink.drainHandler(v -> scheduleDrain());
    }
  }

  /**
   * Writes queued messages until the queue is empty or the socket pushes back.
   *
   * @return {@code true} when the queue was emptied
   */
  private boolean flush() {
    while (true) {
      if (sink.writeQueueFull()) {
        return false;
      }
      String message = outbound.poll();
      if (message == null) {
        return true;
      }
      sink.write(message);
      delivered.incrementAndGet();
    }
  }

  private void runOnContext(Runnable action) {
    if (context == null) {
      action.run();
    } else {
      context.runOnContext(v -> action.run());
    }
  }
}
