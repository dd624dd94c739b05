package dev.henneberger.vertx.realtime.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class RlsDecisionCacheTest {

  @Test
  void returnsVerdictUntilTtlExpires() {
    RlsDecisionCache cache = new RlsDecisionCache(10);
    cache.put("k", true, 1_000L, 0L);

    assertEquals(Optional.of(true), cache.get("k", 999L));
    assertEquals(Optional.empty(), cache.get("k", 1_000L));
    assertEquals(0, cache.size());
    assertEquals(1, cache.hits());
    assertEquals(1, cache.misses());
  }

  @Test
  void ignoresNonPositiveTtl() {
    RlsDecisionCache cache = new RlsDecisionCache(10);
    cache.put("k", false, 0L, 0L);
    assertFalse(cache.get("k", 0L).isPresent());
  }

  @Test
  void evictsLeastRecentlyUsedWhenFull() {
    RlsDecisionCache cache = new RlsDecisionCache(2, 1);
    cache.put("a", true, 10_000L, 0L);
    cache.put("b", true, 10_000L, 0L);
    assertTrue(cache.get("a", 1L).isPresent());
    cache.put("c", false, 10_000L, 2L);

    assertEquals(2, cache.size());
    assertTrue(cache.get("a", 3L).isPresent());
    assertFalse(cache.get("b", 3L).isPresent());
    assertEquals(Optional.of(false), cache.get("c", 3L));
  }

  @Test
  void sizeNeverExceedsCapacity() {
    RlsDecisionCache cache = new RlsDecisionCache(100);
    for (int i = 0; i < 1_000; i++) {
      cache.put("key-" + i, true, 10_000L, 0L);
    }
    assertTrue(cache.size() <= cache.capacity());
  }

  @Test
  void invalidatesByPrefix() {
    RlsDecisionCache cache = new RlsDecisionCache(10);
    cache.put("u1|a", true, 10_000L, 0L);
    cache.put("u1|b", true, 10_000L, 0L);
    cache.put("u2|a", true, 10_000L, 0L);

    assertEquals(2, cache.invalidate("u1|"));
    assertEquals(1, cache.size());
    assertTrue(cache.get("u2|a", 1L).isPresent());
  }

  @Test
  void evictExpiredRemovesOnlyStaleEntries() {
    RlsDecisionCache cache = new RlsDecisionCache(10);
    cache.put("short", true, 100L, 0L);
    cache.put("long", true, 10_000L, 0L);

    assertEquals(1, cache.evictExpired(500L));
    assertEquals(1, cache.size());
  }
}
