package dev.henneberger.vertx.realtime.core;

import io.vertx.core.Future;

/**
 * Tells which tables have realtime change delivery enabled.
 */
@FunctionalInterface
public interface TableCatalog {

  Future<Boolean> isRealtimeEnabled(String schema, String table);

  static TableCatalog allowAll() {
    return (schema, table) -> Future.succeededFuture(true);
  }
}
