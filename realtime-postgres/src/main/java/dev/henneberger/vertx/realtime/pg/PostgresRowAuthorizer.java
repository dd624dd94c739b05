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

import dev.henneberger.vertx.realtime.core.CallerIdentity;
import dev.henneberger.vertx.realtime.core.Identifiers;
import dev.henneberger.vertx.realtime.core.RowAuthorizer;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates row level security policies by re-reading the changed row as the caller.
 *
 * <p>Each check runs in its own transaction that switches to the caller's role with
 * {@code SET LOCAL ROLE} and exposes the claims through transaction-local settings
 * ({@code request.jwt.claims}, {@code request.jwt.claim.sub}, {@code request.jwt.claim.role} by
 * default). The row is visible when a {@code SELECT} by the table's primary key finds it.
 *
 * <p>A deleted row is first put back from its old image, as the connecting user and inside the
 * same transaction, so the policies see the row as it was. The old image must carry every
 * column the policies read ({@code REPLICA IDENTITY FULL} style); an image that cannot be
 * re-inserted is denied.
 *
 * <p>Tables without a primary key, and rows missing a key value, are denied. The transaction is
 * always rolled back.
 */
public final class PostgresRowAuthorizer implements RowAuthorizer, AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresRowAuthorizer.class);
  private static final String INSUFFICIENT_PRIVILEGE = "42501";
  private static final String PRIMARY_KEY_QUERY =
    "SELECT a.attname FROM pg_index i"
      + " JOIN pg_attribute a ON a.attrelid = i.indrelid AND a.attnum = ANY(i.indkey)"
      + " WHERE i.indrelid = ?::regclass AND i.indisprimary"
      + " ORDER BY array_position(i.indkey::int2[], a.attnum)";

  private final Vertx vertx;
  private final PostgresConnections connections;
  private final String claimsSetting;
  private final String claimPrefix;
  private final BlockingQueue<Connection> idle;
  private final long keyCacheTtlMillis;
  private final Map<String, CachedKey> primaryKeys = new ConcurrentHashMap<>();
  private volatile boolean closed;

  public PostgresRowAuthorizer(Vertx vertx, PostgresNotifyOptions options) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.connections = new PostgresConnections(options);
    this.claimsSetting = connections.options().getClaimsSetting();
    this.claimPrefix = claimsSetting.replaceFirst("claims$", "claim");
    this.idle = new ArrayBlockingQueue<>(connections.options().getAuthorizerPoolSize());
    this.keyCacheTtlMillis = connections.options().getCatalogCacheTtlMs();
  }

  @Override
  public Future<Boolean> authorize(CallerIdentity caller, String table, Map<String, Object> row) {
    return vertx.executeBlocking(() -> check(caller, table, row, false), false);
  }

  @Override
  public Future<Boolean> authorizeDeleted(CallerIdentity caller, String table, Map<String, Object> oldRow) {
    return vertx.executeBlocking(() -> check(caller, table, oldRow, true), false);
  }

  @Override
  public void close() {
    closed = true;
    Connection connection;
    while ((connection = idle.poll()) != null) {
      closeQuietly(connection);
    }
  }

  private boolean check(CallerIdentity caller,
                        String table,
                        Map<String, Object> row,
                        boolean deleted) throws SQLException {
    if (!Identifiers.isValid(caller.role())) {
      LOG.debug("Denying rows of {} to a caller with unusable role", table);
      return false;
    }
    String relation = quoteRelation(table);
    if (row == null) {
      return false;
    }

    Connection connection = acquire();
    boolean reusable = false;
    try {
      List<String> keyColumns = primaryKey(connection, relation);
      List<String> keyValues = keyValues(keyColumns, row);
      if (keyValues == null) {
        LOG.debug("Denying row of {} without a complete primary key", table);
        reusable = true;
        return false;
      }
      connection.setAutoCommit(false);
      try {
        if (deleted && !restoreOldImage(connection, relation, row)) {
          reusable = true;
          return false;
        }
        try (Statement statement = connection.createStatement()) {
          statement.execute("SET LOCAL ROLE " + Identifiers.quote(caller.role()));
        }
        applyClaims(connection, caller);
        boolean visible = rowVisible(connection, relation, keyColumns, keyValues);
        reusable = true;
        return visible;
      } finally {
        connection.rollback();
      }
    } finally {
      release(connection, reusable);
    }
  }

  private List<String> primaryKey(Connection connection, String relation) throws SQLException {
    long now = System.currentTimeMillis();
    CachedKey cached = primaryKeys.get(relation);
    if (cached != null && cached.expiresAt > now) {
      return cached.columns;
    }
    List<String> columns = new ArrayList<>();
    try (PreparedStatement statement = connection.prepareStatement(PRIMARY_KEY_QUERY)) {
      statement.setString(1, relation);
      try (ResultSet rs = statement.executeQuery()) {
        while (rs.next()) {
          columns.add(rs.getString(1));
        }
      }
    }
    List<String> result = List.copyOf(columns);
    if (keyCacheTtlMillis > 0L) {
      primaryKeys.put(relation, new CachedKey(result, now + keyCacheTtlMillis));
    }
    return result;
  }

  private static boolean restoreOldImage(Connection connection, String relation, Map<String, Object> oldRow)
    throws SQLException {
    String sql = "INSERT INTO " + relation + " OVERRIDING SYSTEM VALUE"
      + " SELECT * FROM json_populate_record(NULL::" + relation + ", ?::json)";
    try (PreparedStatement statement = connection.prepareStatement(sql)) {
      statement.setString(1, new JsonObject(new LinkedHashMap<>(oldRow)).encode());
      statement.executeUpdate();
      return true;
    } catch (SQLException e) {
      if (e.getSQLState() != null && e.getSQLState().startsWith("08")) {
        throw e;
      }
      LOG.debug("Denying deleted row of {}: old image cannot be restored ({})", relation, e.getSQLState());
      return false;
    }
  }

  private void applyClaims(Connection connection, CallerIdentity caller) throws SQLException {
    JsonObject claims = new JsonObject(new LinkedHashMap<>(caller.claims()));
    if (caller.callerId() != null && !claims.containsKey("sub")) {
      claims.put("sub", caller.callerId());
    }
    if (!claims.containsKey("role")) {
      claims.put("role", caller.role());
    }
    try (PreparedStatement statement = connection.prepareStatement(
      "SELECT set_config(?, ?, true), set_config(?, ?, true), set_config(?, ?, true)")) {
      statement.setString(1, claimsSetting);
      statement.setString(2, claims.encode());
      statement.setString(3, claimPrefix + ".sub");
      statement.setString(4, caller.callerId() == null ? "" : caller.callerId());
      statement.setString(5, claimPrefix + ".role");
      statement.setString(6, caller.role());
      statement.executeQuery().close();
    }
  }

  private static boolean rowVisible(Connection connection,
                                    String relation,
                                    List<String> keyColumns,
                                    List<String> keyValues) throws SQLException {
    String sql = "SELECT EXISTS (SELECT 1 FROM " + relation + " WHERE " + keyPredicate(keyColumns) + ")";
    try (PreparedStatement statement = connection.prepareStatement(sql)) {
      for (int i = 0; i < keyValues.size(); i++) {
        statement.setString(i + 1, keyValues.get(i));
      }
      try (ResultSet rs = statement.executeQuery()) {
        return rs.next() && rs.getBoolean(1);
      }
    } catch (SQLException e) {
      if (INSUFFICIENT_PRIVILEGE.equals(e.getSQLState())) {
        return false;
      }
      throw e;
    }
  }

  static String keyPredicate(List<String> keyColumns) {
    if (keyColumns.isEmpty()) {
      throw new IllegalArgumentException("primary key has no columns");
    }
    StringBuilder sql = new StringBuilder();
    for (String column : keyColumns) {
      if (sql.length() > 0) {
        sql.append(" AND ");
      }
      sql.append(Identifiers.quote(column)).append("::text = ?");
    }
    return sql.toString();
  }

  /**
   * @return the text form of each key column's value, or {@code null} when there is no key or a
   *     value is missing
   */
  static List<String> keyValues(List<String> keyColumns, Map<String, Object> row) {
    if (keyColumns.isEmpty()) {
      return null;
    }
    List<String> values = new ArrayList<>(keyColumns.size());
    for (String column : keyColumns) {
      Object value = row.get(column);
      if (value == null) {
        return null;
      }
      values.add(String.valueOf(value));
    }
    return values;
  }

  static String quoteRelation(String table) {
    int dot = table == null ? -1 : table.indexOf('.');
    if (dot <= 0) {
      throw new IllegalArgumentException("table must be schema-qualified: " + table);
    }
    String schema = table.substring(0, dot);
    String name = table.substring(dot + 1);
    if (!Identifiers.isValid(schema) || !Identifiers.isValid(name)) {
      throw new IllegalArgumentException("invalid table name: " + table);
    }
    return Identifiers.quote(schema) + '.' + Identifiers.quote(name);
  }

  private Connection acquire() throws SQLException {
    if (closed) {
      throw new SQLException("row authorizer is closed");
    }
    Connection connection = idle.poll();
    return connection != null ? connection : connections.open();
  }

  private void release(Connection connection, boolean reusable) {
    if (reusable && !closed) {
      try {
        connection.setAutoCommit(true);
        if (idle.offer(connection)) {
          return;
        }
      } catch (SQLException e) {
        LOG.debug("Discarding authorizer connection", e);
      }
    }
    closeQuietly(connection);
  }

  private static void closeQuietly(Connection connection) {
    try {
      connection.close();
    } catch (SQLException e) {
      LOG.debug("Closing authorizer connection failed", e);
    }
  }

  private static final class CachedKey {
    private final List<String> columns;
    private final long expiresAt;

    private CachedKey(List<String> columns, long expiresAt) {
      this.columns = columns;
      this.expiresAt = expiresAt;
    }
  }
}
