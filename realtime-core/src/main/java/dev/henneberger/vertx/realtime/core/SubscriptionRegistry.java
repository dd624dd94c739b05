package dev.henneberger.vertx.realtime.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Index of active subscriptions keyed by target.
 *
 * <p>Targets are spread over a fixed number of shards, each guarded by its own read/write lock, so
 * matching changes of one table never waits on subscribe or unsubscribe calls for another table.
 * A subscription stays in the shard of its target for its whole lifetime.
 */
public final class SubscriptionRegistry {

  public static final int DEFAULT_SHARDS = 64;

  private final Shard[] shards;
  private final Map<String, Subscription> byId = new ConcurrentHashMap<>();
  private final Map<String, Set<String>> byConnection = new ConcurrentHashMap<>();

  public SubscriptionRegistry() {
    this(DEFAULT_SHARDS);
  }

  public SubscriptionRegistry(int shardCount) {
    OptionValidation.requireMin("shardCount", shardCount, 1);
    this.shards = new Shard[shardCount];
    for (int i = 0; i < shardCount; i++) {
      shards[i] = new Shard();
    }
  }

  public void add(Subscription subscription) {
    Objects.requireNonNull(subscription, "subscription");
    if (byId.putIfAbsent(subscription.id(), subscription) != null) {
      throw new IllegalStateException("duplicate subscription id " + subscription.id());
    }
    byConnection.computeIfAbsent(subscription.connectionId(), id -> ConcurrentHashMap.newKeySet())
      .add(subscription.id());
    shardFor(subscription.targetKey()).add(subscription);
  }

  /**
   * @return the removed subscription, or {@code null} when the id is unknown
   */
  public Subscription remove(String subscriptionId) {
    Subscription removed = byId.remove(subscriptionId);
    if (removed == null) {
      return null;
    }
    shardFor(removed.targetKey()).remove(removed);
    Set<String> owned = byConnection.get(removed.connectionId());
    if (owned != null) {
      owned.remove(subscriptionId);
      if (owned.isEmpty()) {
        byConnection.remove(removed.connectionId(), owned);
      }
    }
    return removed;
  }

  public List<Subscription> removeConnection(String connectionId) {
    Set<String> owned = byConnection.remove(connectionId);
    if (owned == null) {
      return List.of();
    }
    List<Subscription> removed = new ArrayList<>(owned.size());
    for (String id : owned) {
      Subscription subscription = byId.remove(id);
      if (subscription != null) {
        shardFor(subscription.targetKey()).remove(subscription);
        removed.add(subscription);
      }
    }
    return removed;
  }

  /**
   * Table subscriptions whose operation set and row filter accept the event, in subscription
   * order.
   */
  public List<Subscription> match(ChangeEvent event) {
    List<Subscription> candidates = shardFor(event.qualifiedTable()).snapshot(event.qualifiedTable());
    if (candidates.isEmpty()) {
      return candidates;
    }
    List<Subscription> matched = new ArrayList<>(candidates.size());
    for (Subscription candidate : candidates) {
      if (candidate.matches(event)) {
        matched.add(candidate);
      }
    }
    return matched;
  }

  public List<Subscription> channelSubscribers(String channel) {
    String key = Subscription.channelKey(channel);
    return shardFor(key).snapshot(key);
  }

  public Subscription get(String subscriptionId) {
    return byId.get(subscriptionId);
  }

  public List<Subscription> subscriptionsOf(String connectionId) {
    Set<String> owned = byConnection.get(connectionId);
    if (owned == null) {
      return List.of();
    }
    List<Subscription> result = new ArrayList<>(owned.size());
    for (String id : owned) {
      Subscription subscription = byId.get(id);
      if (subscription != null) {
        result.add(subscription);
      }
    }
    return result;
  }

  public int size() {
    return byId.size();
  }

  public int shardCount() {
    return shards.length;
  }

  public int shardIndex(String targetKey) {
    return Math.floorMod(targetKey.hashCode(), shards.length);
  }

  private Shard shardFor(String targetKey) {
    return shards[shardIndex(targetKey)];
  }

  private static final class Shard {
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Map<String, Subscription>> byTarget = new HashMap<>();

    private void add(Subscription subscription) {
      lock.writeLock().lock();
      try {
        byTarget.computeIfAbsent(subscription.targetKey(), key -> new LinkedHashMap<>())
          .put(subscription.id(), subscription);
      } finally {
        lock.writeLock().unlock();
      }
    }

    private void remove(Subscription subscription) {
      lock.writeLock().lock();
      try {
        Map<String, Subscription> target = byTarget.get(subscription.targetKey());
        if (target != null) {
          target.remove(subscription.id());
          if (target.isEmpty()) {
            byTarget.remove(subscription.targetKey());
          }
        }
      } finally {
        lock.writeLock().unlock();
      }
    }

    private List<Subscription> snapshot(String targetKey) {
      lock.readLock().lock();
      try {
        Map<String, Subscription> target = byTarget.get(targetKey);
        return target == null ? Collections.emptyList() : new ArrayList<>(target.values());
      } finally {
        lock.readLock().unlock();
      }
    }
  }
}
