package dev.henneberger.vertx.realtime.core;

import io.vertx.core.json.JsonObject;
import java.util.Locale;

/**
 * Point-in-time health and counters of a {@link RealtimeEngine}.
 */
public final class RealtimeHealth {
  private final HealthStatus status;
  private final int connectedListeners;
  private final int listenerPoolSize;
  private final int ingestionQueueDepth;
  private final long ingestionDropped;
  private final long parseFailures;
  private final long duplicatesSuppressed;
  private final long eventsDelivered;
  private final int rlsCacheSize;
  private final long rlsCacheHits;
  private final long rlsCacheMisses;
  private final long authorizationFailures;
  private final int subscriptions;
  private final JsonObject connections;

  RealtimeHealth(HealthStatus status,
                 int connectedListeners,
                 int listenerPoolSize,
                 int ingestionQueueDepth,
                 long ingestionDropped,
                 long parseFailures,
                 long duplicatesSuppressed,
                 long eventsDelivered,
                 int rlsCacheSize,
                 long rlsCacheHits,
                 long rlsCacheMisses,
                 long authorizationFailures,
                 int subscriptions,
                 JsonObject connections) {
    this.status = status;
    this.connectedListeners = connectedListeners;
    this.listenerPoolSize = listenerPoolSize;
    this.ingestionQueueDepth = ingestionQueueDepth;
    this.ingestionDropped = ingestionDropped;
    this.parseFailures = parseFailures;
    this.duplicatesSuppressed = duplicatesSuppressed;
    this.eventsDelivered = eventsDelivered;
    this.rlsCacheSize = rlsCacheSize;
    this.rlsCacheHits = rlsCacheHits;
    this.rlsCacheMisses = rlsCacheMisses;
    this.authorizationFailures = authorizationFailures;
    this.subscriptions = subscriptions;
    this.connections = connections;
  }

  public HealthStatus status() {
    return status;
  }

  public int connectedListeners() {
    return connectedListeners;
  }

  public int listenerPoolSize() {
    return listenerPoolSize;
  }

  public int ingestionQueueDepth() {
    return ingestionQueueDepth;
  }

  public long ingestionDropped() {
    return ingestionDropped;
  }

  public long parseFailures() {
    return parseFailures;
  }

  public long duplicatesSuppressed() {
    return duplicatesSuppressed;
  }

  public long eventsDelivered() {
    return eventsDelivered;
  }

  public int rlsCacheSize() {
    return rlsCacheSize;
  }

  public long authorizationFailures() {
    return authorizationFailures;
  }

  public int subscriptions() {
    return subscriptions;
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("status", status.name().toLowerCase(Locale.ROOT))
      .put("listeners", new JsonObject()
        .put("connected", connectedListeners)
        .put("size", listenerPoolSize))
      .put("ingestion", new JsonObject()
        .put("queue_depth", ingestionQueueDepth)
        .put("dropped", ingestionDropped)
        .put("parse_failures", parseFailures)
        .put("duplicates_suppressed", duplicatesSuppressed))
      .put("dispatch", new JsonObject()
        .put("delivered", eventsDelivered)
        .put("subscriptions", subscriptions))
      .put("rls_cache", new JsonObject()
        .put("size", rlsCacheSize)
        .put("hits", rlsCacheHits)
        .put("misses", rlsCacheMisses)
        .put("authorization_failures", authorizationFailures))
      .put("connections", connections.copy());
  }
}
