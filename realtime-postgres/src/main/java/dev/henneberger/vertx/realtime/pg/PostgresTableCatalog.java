/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.henneberger.vertx.realtime.pg;

import dev.henneberger.vertx.realtime.core.Identifiers;
import dev.henneberger.vertx.realtime.core.TableCatalog;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads {@code <realtimeSchema>.schema_registry(schema_name, table_name, realtime_enabled)}.
 * Answers are cached for {@code catalogCacheTtlMs}; unknown tables count as disabled.
 */
public final class PostgresTableCatalog implements TableCatalog {

  private final Vertx vertx;
  private final PostgresConnections connections;
  private final String query;
  private final long cacheTtlMillis;
  private final Map<String, CachedAnswer> cache = new ConcurrentHashMap<>();

  public PostgresTableCatalog(Vertx vertx, PostgresNotifyOptions options) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.connections = new PostgresConnections(options);
    this.cacheTtlMillis = connections.options().getCatalogCacheTtlMs();
    this.query = "SELECT realtime_enabled FROM "
      + Identifiers.quote(connections.options().getRealtimeSchema())
      + ".schema_registry WHERE schema_name = ? AND table_name = ?";
  }

  @Override
  public Future<Boolean> isRealtimeEnabled(String schema, String table) {
    String key = schema + '.' + table;
    long now = System.currentTimeMillis();
    CachedAnswer cached = cache.get(key);
    if (cached != null && cached.expiresAt > now) {
      return Future.succeededFuture(cached.enabled);
    }
    return vertx.executeBlocking(() -> lookup(schema, table), false)
      .onSuccess(enabled -> {
        if (cacheTtlMillis > 0L) {
          cache.put(key, new CachedAnswer(enabled, System.currentTimeMillis() + cacheTtlMillis));
        }
      });
  }

  /**
   * Drops cached answers, e.g. after {@code schema_registry} was changed.
   */
  public void invalidate() {
    cache.clear();
  }

  private boolean lookup(String schema, String table) throws SQLException {
    try (Connection connection = connections.open();
         PreparedStatement statement = connection.prepareStatement(query)) {
      statement.setString(1, schema);
      statement.setString(2, table);
      try (ResultSet rs = statement.executeQuery()) {
        return rs.next() && rs.getBoolean(1);
      }
    }
  }

  private static final class CachedAnswer {
    private final boolean enabled;
    private final long expiresAt;

    private CachedAnswer(boolean enabled, long expiresAt) {
      this.enabled = enabled;
      this.expiresAt = expiresAt;
    }
  }
}
