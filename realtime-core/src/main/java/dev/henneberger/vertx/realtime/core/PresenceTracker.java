package dev.henneberger.vertx.realtime.core;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Membership of named presence channels. Joins and leaves are announced to the other subscribers
 * of the channel through {@link ConnectionManager#enqueue}. Records owned by a connection are
 * removed while the connection manager closes it.
 */
public final class PresenceTracker {

  private static final Logger LOG = LoggerFactory.getLogger(PresenceTracker.class);

  private final ConnectionManager connections;
  private final SubscriptionRegistry registry;
  // member maps are replaced on every change, never mutated in place
  private final Map<String, Map<String, PresenceRecord>> channels = new ConcurrentHashMap<>();

  public PresenceTracker(ConnectionManager connections, SubscriptionRegistry registry) {
    this.connections = Objects.requireNonNull(connections, "connections");
    this.registry = Objects.requireNonNull(registry, "registry");
    connections.onConnectionClosed(connection -> leaveAll(connection.id()));
  }

  /**
   * Adds (or replaces) the caller's record in {@code channel} and announces it to the other
   * subscribers.
   *
   * @return the members of the channel after the join
   */
  public List<PresenceRecord> join(String channel, String connectionId, JsonObject meta) {
    RealtimeConnection connection = connections.get(connectionId);
    if (connection == null) {
      throw new IllegalStateException("unknown connection " + connectionId);
    }
    CallerIdentity identity = connection.identity();
    String memberKey = identity.isAnonymous() ? connectionId : identity.callerId();
    PresenceRecord record = new PresenceRecord(channel, memberKey, identity.callerId(), connectionId, meta, Instant.now());

    Map<String, PresenceRecord> after = channels.compute(channel, (key, records) -> {
      Map<String, PresenceRecord> next = records == null ? new LinkedHashMap<>() : new LinkedHashMap<>(records);
      next.put(memberKey, record);
      return next;
    });
    List<PresenceRecord> members = new ArrayList<>(after.values());
    LOG.debug("Connection {} joined presence channel {}", connectionId, channel);

    broadcast(channel, connectionId, ServerMessages.presenceJoin(channel, record.toJson()).encode());
    return members;
  }

  /**
   * Removes the record {@code connectionId} holds in {@code channel} and announces the leave.
   *
   * @return {@code false} when the connection had no record there
   */
  public boolean leave(String channel, String connectionId) {
    PresenceRecord[] removed = new PresenceRecord[1];
    channels.computeIfPresent(channel, (key, records) -> {
      for (PresenceRecord record : records.values()) {
        if (record.connectionId().equals(connectionId)) {
          removed[0] = record;
          break;
        }
      }
      if (removed[0] == null) {
        return records;
      }
      Map<String, PresenceRecord> next = new LinkedHashMap<>(records);
      next.remove(removed[0].memberKey());
      return next.isEmpty() ? null : next;
    });
    if (removed[0] == null) {
      return false;
    }
    LOG.debug("Connection {} left presence channel {}", connectionId, channel);
    broadcast(channel, connectionId, ServerMessages.presenceLeave(channel, removed[0].toJson()).encode());
    return true;
  }

  public void leaveAll(String connectionId) {
    for (String channel : List.copyOf(channels.keySet())) {
      leave(channel, connectionId);
    }
  }

  public List<PresenceRecord> members(String channel) {
    Map<String, PresenceRecord> records = channels.get(channel);
    if (records == null) {
      return List.of();
    }
    return new ArrayList<>(records.values());
  }

  public static JsonArray toJson(List<PresenceRecord> members) {
    JsonArray array = new JsonArray();
    for (PresenceRecord member : members) {
      array.add(member.toJson());
    }
    return array;
  }

  private void broadcast(String channel, String originConnectionId, String message) {
    Set<String> notified = new HashSet<>();
    notified.add(originConnectionId);
    for (Subscription subscriber : registry.channelSubscribers(channel)) {
      if (notified.add(subscriber.connectionId())) {
        connections.enqueue(subscriber.connectionId(), message);
      }
    }
  }
}
