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
import dev.henneberger.vertx.realtime.core.NotificationSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * LISTEN/NOTIFY transport over pgjdbc. Every session owns a dedicated connection; notifications
 * are read with {@link PGConnection#getNotifications(int)}, which blocks on the socket instead of
 * polling with a query.
 */
public final class PostgresNotificationSource implements NotificationSource {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresNotificationSource.class);
  private static final int VALIDATION_TIMEOUT_SECONDS = 2;

  private final PostgresConnections connections;

  public PostgresNotificationSource(PostgresNotifyOptions options) {
    this.connections = new PostgresConnections(options);
  }

  @Override
  public NotificationSession open(String channelName) throws SQLException {
    if (channelName == null || channelName.isBlank()) {
      throw new IllegalArgumentException("channelName is required");
    }
    Connection connection = connections.open();
    try {
      connection.setAutoCommit(true);
      try (Statement statement = connection.createStatement()) {
        statement.execute("LISTEN " + Identifiers.quote(channelName));
      }
      PGConnection pgConnection = connection.unwrap(PGConnection.class);
      LOG.debug("Listening on channel {} as backend pid {}", channelName, pgConnection.getBackendPID());
      return new Session(connection, pgConnection, channelName,
        connections.options().getValidationIntervalMs());
    } catch (SQLException | RuntimeException e) {
      closeQuietly(connection, e);
      throw e;
    }
  }

  private static void closeQuietly(Connection connection, Exception primary) {
    try {
      connection.close();
    } catch (SQLException closeError) {
      primary.addSuppressed(closeError);
    }
  }

  private static final class Session implements NotificationSession {
    private final Connection connection;
    private final PGConnection pgConnection;
    private final String channelName;
    private final long validationIntervalMillis;
    private final Deque<String> pending = new ArrayDeque<>();
    private long lastValidatedAt = System.nanoTime();

    private Session(Connection connection,
                    PGConnection pgConnection,
                    String channelName,
                    long validationIntervalMillis) {
      this.connection = connection;
      this.pgConnection = pgConnection;
      this.channelName = channelName;
      this.validationIntervalMillis = validationIntervalMillis;
    }

    @Override
    public List<String> poll(long timeoutMillis, int maxPayloads) throws SQLException {
      if (pending.isEmpty()) {
        validateIfDue();
        // 0 would block until the next notification arrives
        PGNotification[] notifications = pgConnection.getNotifications((int) Math.max(1L, timeoutMillis));
        if (notifications != null) {
          for (PGNotification notification : notifications) {
            if (channelName.equals(notification.getName())) {
              pending.add(notification.getParameter());
            }
          }
        }
      }
      List<String> batch = new ArrayList<>(Math.min(pending.size(), Math.max(1, maxPayloads)));
      while (!pending.isEmpty() && batch.size() < maxPayloads) {
        batch.add(pending.poll());
      }
      return batch;
    }

    private void validateIfDue() throws SQLException {
      long now = System.nanoTime();
      if (now - lastValidatedAt < validationIntervalMillis * 1_000_000L) {
        return;
      }
      if (!connection.isValid(VALIDATION_TIMEOUT_SECONDS)) {
        throw new SQLException("listener connection for channel " + channelName + " is no longer valid");
      }
      lastValidatedAt = now;
    }

    @Override
    public void close() {
      pending.clear();
      try {
        connection.close();
      } catch (SQLException e) {
        LOG.debug("Closing listener connection for channel {} failed", channelName, e);
      }
    }
  }
}
