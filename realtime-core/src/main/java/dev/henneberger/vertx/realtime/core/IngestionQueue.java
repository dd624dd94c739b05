package dev.henneberger.vertx.realtime.core;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded hand-off between the listener pool and the dispatch workers.
 *
 * <p>The queue is split into one shard per dispatch worker and every event goes to the shard of
 * its source table, so a single worker sees all events of a table in arrival order. The capacity
 * is shared by all shards. Offering never waits for a consumer: when the queue is full the oldest
 * event of the offering shard is discarded and counted, or the oldest event of the fullest shard
 * when the offering shard holds nothing but the new event.
 */
public final class IngestionQueue {

  private final Shard[] shards;
  private final int capacity;
  private final AtomicInteger depth = new AtomicInteger();
  private final AtomicLong dropped = new AtomicLong();

  public IngestionQueue(int shardCount, int capacity) {
    OptionValidation.requireMin("shardCount", shardCount, 1);
    OptionValidation.requireMin("capacity", capacity, 1);
    this.capacity = capacity;
    this.shards = new Shard[shardCount];
    for (int i = 0; i < shardCount; i++) {
      shards[i] = new Shard(Math.min(capacity, 1024));
    }
  }

  /**
   * @return the event that had to be discarded to make room, or {@code null}
   */
  public ChangeEvent offer(ChangeEvent event) {
    Objects.requireNonNull(event, "event");
    Shard target = shards[shardFor(event.qualifiedTable())];
    target.offer(event);
    ChangeEvent evicted = null;
    int total = depth.incrementAndGet();
    while (total > capacity) {
      ChangeEvent oldest = target.pollOldest(1);
      if (oldest == null) {
        oldest = fullestShard().pollOldest(0);
      }
      if (oldest == null) {
        // consumers drained the surplus
        break;
      }
      dropped.incrementAndGet();
      evicted = oldest;
      total = depth.decrementAndGet();
    }
    return evicted;
  }

  public ChangeEvent poll(int shard, long timeout, TimeUnit unit) throws InterruptedException {
    ChangeEvent event = shards[shard].poll(unit.toNanos(timeout));
    if (event != null) {
      depth.decrementAndGet();
    }
    return event;
  }

  private Shard fullestShard() {
    Shard fullest = shards[0];
    for (Shard shard : shards) {
      if (shard.size() > fullest.size()) {
        fullest = shard;
      }
    }
    return fullest;
  }

  public int shardFor(String qualifiedTable) {
    return Math.floorMod(qualifiedTable.hashCode(), shards.length);
  }

  public int shardCount() {
    return shards.length;
  }

  public int capacity() {
    return capacity;
  }

  public int depth() {
    return Math.max(0, depth.get());
  }

  public long dropped() {
    return dropped.get();
  }

  private static final class Shard {
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final ArrayDeque<ChangeEvent> events;

    private Shard(int initialCapacity) {
      this.events = new ArrayDeque<>(initialCapacity);
    }

    private void offer(ChangeEvent event) {
      lock.lock();
      try {
        events.addLast(event);
        notEmpty.signal();
      } finally {
        lock.unlock();
      }
    }

    /**
     * Removes the oldest event unless at most {@code keep} events are queued.
     */
    private ChangeEvent pollOldest(int keep) {
      lock.lock();
      try {
        return events.size() > keep ? events.pollFirst() : null;
      } finally {
        lock.unlock();
      }
    }

    private ChangeEvent poll(long timeoutNanos) throws InterruptedException {
      lock.lockInterruptibly();
      try {
        long remaining = timeoutNanos;
        while (events.isEmpty()) {
          if (remaining <= 0L) {
            return null;
          }
          remaining = notEmpty.awaitNanos(remaining);
        }
        return events.pollFirst();
      } finally {
        lock.unlock();
      }
    }

    private int size() {
      lock.lock();
      try {
        return events.size();
      } finally {
        lock.unlock();
      }
    }
  }
}
