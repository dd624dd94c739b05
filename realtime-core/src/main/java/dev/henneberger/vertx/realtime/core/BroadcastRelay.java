package dev.henneberger.vertx.realtime.core;

import io.vertx.core.Future;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans client broadcasts out to the channel's subscribers on this instance and, through a
 * {@link BroadcastBus}, on every other instance.
 *
 * <p>Envelopes are JSON objects {@code {"instance", "channel", "payload"}}. An instance ignores
 * its own envelopes when they come back from the bus, since it delivered them locally already.
 */
public final class BroadcastRelay implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(BroadcastRelay.class);

  private final BroadcastBus bus;
  private final SubscriptionRegistry registry;
  private final ConnectionManager connections;
  private final String instanceId = UUID.randomUUID().toString();
  private final AtomicLong published = new AtomicLong();
  private final AtomicLong received = new AtomicLong();
  private final AtomicLong publishFailures = new AtomicLong();
  private RealtimeSubscription busSubscription;

  public BroadcastRelay(BroadcastBus bus, SubscriptionRegistry registry, ConnectionManager connections) {
    this.bus = Objects.requireNonNull(bus, "bus");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.connections = Objects.requireNonNull(connections, "connections");
  }

  public synchronized void start() {
    if (busSubscription == null) {
      busSubscription = bus.subscribe(this::receive);
    }
  }

  @Override
  public synchronized void close() {
    if (busSubscription != null) {
      busSubscription.cancel();
      busSubscription = null;
    }
  }

  /**
   * Delivers {@code payload} to the local subscribers of {@code channel}, except the sender, and
   * publishes it to the other instances.
   *
   * @return the number of local connections the message was queued for
   */
  public int broadcast(String channel, Object payload, String originConnectionId) {
    int delivered = deliver(channel, ServerMessages.broadcast(channel, payload).encode(), originConnectionId);
    String envelope = new JsonObject()
      .put("instance", instanceId)
      .put("channel", channel)
      .put("payload", payload)
      .encode();
    Future<Void> sent;
    try {
      sent = bus.publish(envelope);
    } catch (RuntimeException e) {
      sent = Future.failedFuture(e);
    }
    sent.onComplete(ar -> {
      if (ar.succeeded()) {
        published.incrementAndGet();
      } else {
        publishFailures.incrementAndGet();
        LOG.warn("Publishing broadcast on channel {} failed: {}", channel, ar.cause().toString());
      }
    });
    return delivered;
  }

  void receive(String envelope) {
    String channel;
    Object payload;
    String origin;
    try {
      JsonObject json = new JsonObject(envelope);
      origin = json.getString("instance");
      channel = json.getString("channel");
      payload = json.getValue("payload");
    } catch (DecodeException | ClassCastException e) {
      LOG.warn("Ignoring malformed broadcast envelope: {}", e.getMessage());
      return;
    }
    if (instanceId.equals(origin)) {
      return;
    }
    if (channel == null || channel.isBlank()) {
      LOG.warn("Ignoring broadcast envelope without a channel");
      return;
    }
    received.incrementAndGet();
    deliver(channel, ServerMessages.broadcast(channel, payload).encode(), null);
  }

  private int deliver(String channel, String message, String excludedConnectionId) {
    Set<String> notified = new HashSet<>();
    if (excludedConnectionId != null) {
      notified.add(excludedConnectionId);
    }
    int delivered = 0;
    for (Subscription subscriber : registry.channelSubscribers(channel)) {
      if (notified.add(subscriber.connectionId())) {
        connections.enqueue(subscriber.connectionId(), message);
        delivered++;
      }
    }
    return delivered;
  }

  public String instanceId() {
    return instanceId;
  }

  public long published() {
    return published.get();
  }

  public long received() {
    return received.get();
  }

  public long publishFailures() {
    return publishFailures.get();
  }
}
