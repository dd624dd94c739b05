package dev.henneberger.vertx.realtime.core;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Bounded memo of row authorization verdicts.
 *
 * <p>Keys are spread over independently locked segments. Each segment keeps its entries in access
 * order and evicts the least recently used one when full. Expired entries are never returned.
 */
public final class RlsDecisionCache {

  static final int DEFAULT_SEGMENTS = 16;

  private final Segment[] segments;
  private final int capacity;
  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();

  public RlsDecisionCache(int capacity) {
    this(capacity, DEFAULT_SEGMENTS);
  }

  public RlsDecisionCache(int capacity, int segmentCount) {
    OptionValidation.requireMin("capacity", capacity, 1);
    OptionValidation.requireMin("segmentCount", segmentCount, 1);
    int resolvedSegments = Math.min(segmentCount, capacity);
    this.capacity = capacity;
    this.segments = new Segment[resolvedSegments];
    int base = capacity / resolvedSegments;
    int remainder = capacity % resolvedSegments;
    for (int i = 0; i < resolvedSegments; i++) {
      segments[i] = new Segment(base + (i < remainder ? 1 : 0));
    }
  }

  public Optional<Boolean> get(String key) {
    return get(key, System.currentTimeMillis());
  }

  public Optional<Boolean> get(String key, long nowMillis) {
    Boolean decision = segmentFor(key).get(key, nowMillis);
    if (decision == null) {
      misses.incrementAndGet();
      return Optional.empty();
    }
    hits.incrementAndGet();
    return Optional.of(decision);
  }

  public void put(String key, boolean allow, long ttlMillis) {
    put(key, allow, ttlMillis, System.currentTimeMillis());
  }

  public void put(String key, boolean allow, long ttlMillis, long nowMillis) {
    if (ttlMillis <= 0L) {
      return;
    }
    segmentFor(key).put(key, new Entry(allow, nowMillis + ttlMillis));
  }

  /**
   * Drops every entry whose key starts with {@code prefix}.
   *
   * @return number of entries removed
   */
  public int invalidate(String prefix) {
    int removed = 0;
    for (Segment segment : segments) {
      removed += segment.removeIf(key -> key.startsWith(prefix), Long.MIN_VALUE);
    }
    return removed;
  }

  public int evictExpired(long nowMillis) {
    int removed = 0;
    for (Segment segment : segments) {
      removed += segment.removeIf(key -> false, nowMillis);
    }
    return removed;
  }

  public int size() {
    int size = 0;
    for (Segment segment : segments) {
      size += segment.size();
    }
    return size;
  }

  public int capacity() {
    return capacity;
  }

  public long hits() {
    return hits.get();
  }

  public long misses() {
    return misses.get();
  }

  private Segment segmentFor(String key) {
    int h = key.hashCode();
    h ^= (h >>> 16);
    return segments[Math.floorMod(h, segments.length)];
  }

  private static final class Entry {
    private final boolean allow;
    private final long expiresAt;

    private Entry(boolean allow, long expiresAt) {
      this.allow = allow;
      this.expiresAt = expiresAt;
    }
  }

  private static final class Segment {
    private final LinkedHashMap<String, Entry> entries;

    private Segment(int maxEntries) {
      this.entries = new LinkedHashMap<>(16, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Entry> eldest) {
          return size() > maxEntries;
        }
      };
    }

    private synchronized Boolean get(String key, long now) {
      Entry entry = entries.get(key);
      if (entry == null) {
        return null;
      }
      if (now >= entry.expiresAt) {
        entries.remove(key);
        return null;
      }
      return entry.allow;
    }

    private synchronized void put(String key, Entry entry) {
      entries.put(key, entry);
    }

    private synchronized int removeIf(Predicate<String> keyMatch, long now) {
      int removed = 0;
      Iterator<Map.Entry<String, Entry>> it = entries.entrySet().iterator();
      while (it.hasNext()) {
        Map.Entry<String, Entry> next = it.next();
        if (keyMatch.test(next.getKey()) || now >= next.getValue().expiresAt) {
          it.remove();
          removed++;
        }
      }
      return removed;
    }

    private synchronized int size() {
      return entries.size();
    }
  }
}
