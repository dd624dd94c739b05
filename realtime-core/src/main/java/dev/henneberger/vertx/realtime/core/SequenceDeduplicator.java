package dev.henneberger.vertx.realtime.core;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Suppresses the copies of a change that every redundant listener delivers. Changes are keyed by
 * table and commit sequence (or payload digest) and remembered for a sliding window.
 */
public final class SequenceDeduplicator {

  static final int DEFAULT_MAX_KEYS_PER_TABLE = 65_536;

  private final long windowMillis;
  private final int maxKeysPerTable;
  private final Map<String, Window> windows = new ConcurrentHashMap<>();
  private final AtomicLong suppressed = new AtomicLong();

  public SequenceDeduplicator(long windowMillis) {
    this(windowMillis, DEFAULT_MAX_KEYS_PER_TABLE);
  }

  public SequenceDeduplicator(long windowMillis, int maxKeysPerTable) {
    OptionValidation.requireMin("windowMillis", windowMillis, 1L);
    OptionValidation.requireMin("maxKeysPerTable", maxKeysPerTable, 1);
    this.windowMillis = windowMillis;
    this.maxKeysPerTable = maxKeysPerTable;
  }

  /**
   * @return {@code true} the first time a change is seen within the window
   */
  public boolean firstSeen(ChangeEvent event, long nowMillis) {
    Window window = windows.computeIfAbsent(event.qualifiedTable(), key -> new Window());
    boolean first = window.record(event.getDedupKey(), nowMillis, windowMillis, maxKeysPerTable);
    if (!first) {
      suppressed.incrementAndGet();
    }
    return first;
  }

  public long suppressed() {
    return suppressed.get();
  }

  private static final class Window {
    private final LinkedHashMap<String, Long> seenAt = new LinkedHashMap<>();

    private synchronized boolean record(String key, long now, long windowMillis, int maxKeys) {
      Iterator<Map.Entry<String, Long>> it = seenAt.entrySet().iterator();
      while (it.hasNext()) {
        Map.Entry<String, Long> oldest = it.next();
        if (now - oldest.getValue() < windowMillis && seenAt.size() < maxKeys) {
          break;
        }
        it.remove();
      }
      Long previous = seenAt.get(key);
      if (previous != null && now - previous < windowMillis) {
        return false;
      }
      seenAt.remove(key);
      seenAt.put(key, now);
      return true;
    }
  }
}
