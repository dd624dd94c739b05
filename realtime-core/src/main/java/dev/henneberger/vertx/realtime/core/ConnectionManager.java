package dev.henneberger.vertx.realtime.core;

import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns every client connection: admission limits, outbound queues, slow-consumer eviction and
 * heartbeats.
 *
 * <p>{@link #enqueue} is the only path messages take to a client and never blocks. Closing a
 * connection removes its subscriptions and runs the close listeners (presence among them) before
 * {@link #unregister} returns, so a dispatch racing with the close finds no connection and the
 * message is discarded.
 */
public final class ConnectionManager implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(ConnectionManager.class);
  private static final long HEARTBEAT_CHECK_INTERVAL_MS = 1_000L;

  private final Vertx vertx;
  private final RealtimeOptions options;
  private final SubscriptionRegistry registry;
  private final Map<String, RealtimeConnection> connections = new ConcurrentHashMap<>();
  private final Map<String, Integer> perCaller = new HashMap<>();
  private final Map<String, Integer> perAddress = new HashMap<>();
  private final List<Handler<RealtimeConnection>> closeListeners = new CopyOnWriteArrayList<>();
  private final List<RealtimeMetricsListener> metricsListeners = new CopyOnWriteArrayList<>();
  private final AtomicLong rejected = new AtomicLong();
  private final AtomicLong slowClientsDisconnected = new AtomicLong();
  private final AtomicLong heartbeatTimeouts = new AtomicLong();
  private final AtomicLong messagesDropped = new AtomicLong();

  private long slowTimerId = -1L;
  private long heartbeatTimerId = -1L;

  public ConnectionManager(Vertx vertx, RealtimeOptions options, SubscriptionRegistry registry) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.options = new RealtimeOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /**
   * Starts the periodic slow-consumer and heartbeat sweeps.
   */
  public synchronized void start() {
    if (slowTimerId >= 0L) {
      return;
    }
    slowTimerId = vertx.setPeriodic(options.getSlowClientCheckIntervalMs(),
      id -> checkSlowClients(System.currentTimeMillis()));
    heartbeatTimerId = vertx.setPeriodic(Math.min(HEARTBEAT_CHECK_INTERVAL_MS, options.getPingIntervalMs()),
      id -> checkHeartbeats(System.currentTimeMillis()));
  }

  /**
   * Admits a connection after checking the global, per-caller and per-address limits. Anonymous
   * callers are limited per address, authenticated callers per caller id.
   *
   * @throws ConnectionRejectedException when a limit is reached
   */
  public RealtimeConnection register(CallerIdentity identity, String remoteAddress, ClientSink sink) {
    Objects.requireNonNull(identity, "identity");
    RealtimeConnection connection = new RealtimeConnection(
      UUID.randomUUID().toString(),
      identity,
      remoteAddress,
      sink,
      Vertx.currentContext(),
      options.getClientMessageQueueSize(),
      System.currentTimeMillis());

    synchronized (this) {
      if (connections.size() >= options.getMaxConnections()) {
        throw reject(ConnectionRejectedException.Reason.MAX_CONNECTIONS,
          "server connection limit " + options.getMaxConnections() + " reached");
      }
      if (identity.isAnonymous()) {
        if (perAddress.getOrDefault(connection.remoteAddress(), 0) >= options.getMaxConnectionsPerIp()) {
          throw reject(ConnectionRejectedException.Reason.MAX_IP_CONNECTIONS,
            "connection limit " + options.getMaxConnectionsPerIp() + " per address reached");
        }
        perAddress.merge(connection.remoteAddress(), 1, Integer::sum);
      } else {
        if (perCaller.getOrDefault(identity.callerId(), 0) >= options.getMaxConnectionsPerUser()) {
          throw reject(ConnectionRejectedException.Reason.MAX_USER_CONNECTIONS,
            "connection limit " + options.getMaxConnectionsPerUser() + " per user reached");
        }
        perCaller.merge(identity.callerId(), 1, Integer::sum);
      }
      connections.put(connection.id(), connection);
    }

    connection.activate();
    LOG.debug("Registered connection {} from {}", connection.id(), connection.remoteAddress());
    return connection;
  }

  public void unregister(String connectionId) {
    close(connectionId, CloseReason.CLIENT_CLOSED);
  }

  /**
   * Closes a connection with the given reason and forgets it.
   *
   * @return {@code false} when the connection was not registered
   */
  public boolean close(String connectionId, CloseReason reason) {
    RealtimeConnection connection;
    synchronized (this) {
      connection = connections.remove(connectionId);
      if (connection == null) {
        return false;
      }
      release(connection.identity(), connection.remoteAddress());
    }

    connection.close(reason);
    registry.removeConnection(connectionId);
    for (Handler<RealtimeConnection> listener : closeListeners) {
      try {
        listener.handle(connection);
      } catch (RuntimeException e) {
        LOG.warn("Close listener failed for connection {}", connectionId, e);
      }
    }
    for (RealtimeMetricsListener listener : metricsListeners) {
      listener.onConnectionClosed(connectionId, reason);
    }

    if (reason == CloseReason.CLIENT_CLOSED || reason == CloseReason.NORMAL) {
      LOG.debug("Unregistered connection {} ({})", connectionId, reason.wireName());
    } else {
      LOG.info("Closed connection {} from {}: {}", connectionId, connection.remoteAddress(), reason.wireName());
    }
    return true;
  }

  public EnqueueResult enqueue(String connectionId, String message) {
    RealtimeConnection connection = connections.get(connectionId);
    if (connection == null) {
      return EnqueueResult.UNKNOWN_CONNECTION;
    }
    EnqueueResult result = connection.offer(message);
    if (result == EnqueueResult.QUEUE_FULL) {
      messagesDropped.incrementAndGet();
      for (RealtimeMetricsListener listener : metricsListeners) {
        listener.onClientMessageDropped(connectionId);
      }
    }
    return result;
  }

  public RealtimeConnection get(String connectionId) {
    return connections.get(connectionId);
  }

  public Collection<RealtimeConnection> connections() {
    return List.copyOf(connections.values());
  }

  public int size() {
    return connections.size();
  }

  /**
   * Evicts connections whose outbound queue has stayed above the slow-client threshold for the
   * slow-client timeout. Reaching the timeout exactly counts as expired.
   *
   * @return ids of the evicted connections
   */
  public List<String> checkSlowClients(long now) {
    List<String> evicted = new ArrayList<>();
    int threshold = options.getSlowClientThreshold();
    long timeout = options.getSlowClientTimeoutMs();
    for (RealtimeConnection connection : connections.values()) {
      if (!connection.isOpen()) {
        continue;
      }
      if (connection.evaluateBackpressure(threshold, timeout, now)) {
        LOG.info("Connection {} queued {} messages for {} ms, evicting slow consumer",
          connection.id(), connection.queueDepth(), now - connection.slowSince());
        if (close(connection.id(), CloseReason.SLOW_CONSUMER)) {
          slowClientsDisconnected.incrementAndGet();
          evicted.add(connection.id());
        }
      }
    }
    return evicted;
  }

  /**
   * Closes connections that left a ping unanswered for the pong timeout, then pings the ones whose
   * ping interval elapsed.
   *
   * @return ids of the closed connections
   */
  public List<String> checkHeartbeats(long now) {
    List<String> expired = new ArrayList<>();
    for (RealtimeConnection connection : connections.values()) {
      if (!connection.isOpen()) {
        continue;
      }
      if (connection.heartbeatExpired(options.getPongTimeoutMs(), now)) {
        if (close(connection.id(), CloseReason.HEARTBEAT_TIMEOUT)) {
          heartbeatTimeouts.incrementAndGet();
          expired.add(connection.id());
        }
        continue;
      }
      if (connection.pingDue(options.getPingIntervalMs(), now)) {
        connection.sendPing(now);
      }
    }
    return expired;
  }

  public void recordPong(String connectionId) {
    recordActivity(connectionId, System.currentTimeMillis());
  }

  public void recordActivity(String connectionId, long now) {
    RealtimeConnection connection = connections.get(connectionId);
    if (connection != null) {
      connection.recordLiveness(now);
    }
  }

  /**
   * Replaces the identity of a connection after a token refresh and moves its slot in the
   * per-caller and per-address counts. The new identity is not checked against the limits.
   *
   * @return the previous identity, or {@code null} when the connection is unknown
   */
  public CallerIdentity updateIdentity(String connectionId, CallerIdentity identity) {
    Objects.requireNonNull(identity, "identity");
    synchronized (this) {
      RealtimeConnection connection = connections.get(connectionId);
      if (connection == null) {
        return null;
      }
      CallerIdentity previous = connection.identity();
      release(previous, connection.remoteAddress());
      if (identity.isAnonymous()) {
        perAddress.merge(connection.remoteAddress(), 1, Integer::sum);
      } else {
        perCaller.merge(identity.callerId(), 1, Integer::sum);
      }
      connection.identity(identity);
      return previous;
    }
  }

  public RealtimeSubscription onConnectionClosed(Handler<RealtimeConnection> listener) {
    Handler<RealtimeConnection> resolved = Objects.requireNonNull(listener, "listener");
    closeListeners.add(resolved);
    return () -> closeListeners.remove(resolved);
  }

  public RealtimeSubscription addMetricsListener(RealtimeMetricsListener listener) {
    RealtimeMetricsListener resolved = Objects.requireNonNull(listener, "listener");
    metricsListeners.add(resolved);
    return () -> metricsListeners.remove(resolved);
  }

  public long slowClientsDisconnected() {
    return slowClientsDisconnected.get();
  }

  public long heartbeatTimeouts() {
    return heartbeatTimeouts.get();
  }

  public long rejected() {
    return rejected.get();
  }

  public JsonObject stats() {
    Map<ConnectionState, Integer> byState = new EnumMap<>(ConnectionState.class);
    JsonArray details = new JsonArray();
    long queued = 0L;
    for (RealtimeConnection connection : connections.values()) {
      byState.merge(connection.state(), 1, Integer::sum);
      queued += connection.queueDepth();
      details.add(connection.toJson());
    }
    JsonObject states = new JsonObject();
    for (ConnectionState state : ConnectionState.values()) {
      states.put(state.name().toLowerCase(Locale.ROOT), byState.getOrDefault(state, 0));
    }
    return new JsonObject()
      .put("connections", connections.size())
      .put("by_state", states)
      .put("queued_messages", queued)
      .put("messages_dropped", messagesDropped.get())
      .put("slow_clients_disconnected", slowClientsDisconnected.get())
      .put("heartbeat_timeouts", heartbeatTimeouts.get())
      .put("rejected", rejected.get())
      .put("connection_details", details);
  }

  /**
   * Stops the sweeps and closes every connection with {@link CloseReason#SHUTDOWN}.
   */
  @Override
  public void close() {
    synchronized (this) {
      if (slowTimerId >= 0L) {
        vertx.cancelTimer(slowTimerId);
        vertx.cancelTimer(heartbeatTimerId);
        slowTimerId = -1L;
        heartbeatTimerId = -1L;
      }
    }
    for (String id : List.copyOf(connections.keySet())) {
      close(id, CloseReason.SHUTDOWN);
    }
  }

  private ConnectionRejectedException reject(ConnectionRejectedException.Reason reason, String message) {
    rejected.incrementAndGet();
    LOG.debug("Rejected connection: {}", message);
    return new ConnectionRejectedException(reason, message);
  }

  private void release(CallerIdentity identity, String remoteAddress) {
    if (identity.isAnonymous()) {
      decrement(perAddress, remoteAddress);
    } else {
      decrement(perCaller, identity.callerId());
    }
  }

  private static void decrement(Map<String, Integer> counts, String key) {
    counts.computeIfPresent(key, (k, count) -> count <= 1 ? null : count - 1);
  }
}
