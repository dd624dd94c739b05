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

import dev.henneberger.vertx.realtime.core.BackoffPolicy;
import dev.henneberger.vertx.realtime.core.BroadcastBus;
import dev.henneberger.vertx.realtime.core.NotificationSource;
import dev.henneberger.vertx.realtime.core.RealtimeSubscription;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BroadcastBus} over PostgreSQL {@code NOTIFY} on {@code broadcastChannel}, so every
 * engine instance connected to the same database sees the broadcasts of the others.
 *
 * <p>Envelopes are published with {@code pg_notify} on one shared connection. A single daemon
 * thread listens on the channel while at least one handler is subscribed and reconnects with
 * {@code reconnectPolicy} when the connection drops; envelopes sent while it is disconnected are
 * lost.
 */
public final class PostgresBroadcastBus implements BroadcastBus, AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresBroadcastBus.class);
  static final int MAX_PAYLOAD_BYTES = 7999;
  private static final long POLL_TIMEOUT_MS = 500L;
  private static final int MAX_PAYLOADS_PER_POLL = 100;

  private final Vertx vertx;
  private final Context context;
  private final PostgresConnections connections;
  private final NotificationSource source;
  private final String channel;
  private final BackoffPolicy reconnectPolicy;
  private final List<Handler<String>> handlers = new CopyOnWriteArrayList<>();
  private Connection publisher;
  private volatile Thread receiver;
  private volatile NotificationSource.NotificationSession session;
  private volatile boolean closed;

  public PostgresBroadcastBus(Vertx vertx, PostgresNotifyOptions options, BackoffPolicy reconnectPolicy) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.context = vertx.getOrCreateContext();
    this.connections = new PostgresConnections(options);
    this.source = new PostgresNotificationSource(connections.options());
    this.channel = connections.options().getBroadcastChannel();
    this.reconnectPolicy = Objects.requireNonNull(reconnectPolicy, "reconnectPolicy").copy();
    this.reconnectPolicy.validate();
  }

  @Override
  public Future<Void> publish(String envelope) {
    if (envelope.getBytes(StandardCharsets.UTF_8).length > MAX_PAYLOAD_BYTES) {
      return Future.failedFuture(new IllegalArgumentException(
        "broadcast envelope exceeds " + MAX_PAYLOAD_BYTES + " bytes"));
    }
    return vertx.executeBlocking(() -> {
      notify(envelope);
      return null;
    }, false);
  }

  @Override
  public synchronized RealtimeSubscription subscribe(Handler<String> envelopeHandler) {
    Objects.requireNonNull(envelopeHandler, "envelopeHandler");
    if (closed) {
      throw new IllegalStateException("broadcast bus is closed");
    }
    handlers.add(envelopeHandler);
    if (receiver == null) {
      receiver = new Thread(this::receiveLoop, "realtime-broadcast-listener");
      receiver.setDaemon(true);
      receiver.start();
    }
    return () -> unsubscribe(envelopeHandler);
  }

  /**
   * @return whether the receiving thread currently holds a listening session
   */
  public boolean listening() {
    return session != null;
  }

  @Override
  public void close() {
    Thread thread;
    synchronized (this) {
      closed = true;
      handlers.clear();
      thread = receiver;
      receiver = null;
      closePublisher();
    }
    stopReceiver(thread);
  }

  private void unsubscribe(Handler<String> envelopeHandler) {
    Thread thread = null;
    synchronized (this) {
      handlers.remove(envelopeHandler);
      if (handlers.isEmpty()) {
        thread = receiver;
        receiver = null;
      }
    }
    stopReceiver(thread);
  }

  private void stopReceiver(Thread thread) {
    if (thread == null) {
      return;
    }
    closeSession();
    thread.interrupt();
  }

  private synchronized void notify(String envelope) throws SQLException {
    if (closed) {
      throw new SQLException("broadcast bus is closed");
    }
    if (publisher == null) {
      publisher = connections.open();
    }
    try (PreparedStatement statement = publisher.prepareStatement("SELECT pg_notify(?, ?)")) {
      statement.setString(1, channel);
      statement.setString(2, envelope);
      statement.executeQuery().close();
    } catch (SQLException e) {
      closePublisher();
      throw e;
    }
  }

  private void closePublisher() {
    Connection current = publisher;
    publisher = null;
    if (current != null) {
      try {
        current.close();
      } catch (SQLException e) {
        LOG.debug("Closing broadcast publisher connection failed", e);
      }
    }
  }

  private boolean shouldRun() {
    return !closed && receiver == Thread.currentThread();
  }

  private void receiveLoop() {
    long attempt = 0;
    while (shouldRun()) {
      attempt++;
      try {
        NotificationSource.NotificationSession opened = source.open(channel);
        session = opened;
        LOG.info("Listening for broadcasts on channel {}", channel);
        attempt = 0;
        while (shouldRun()) {
          for (String envelope : opened.poll(POLL_TIMEOUT_MS, MAX_PAYLOADS_PER_POLL)) {
            dispatch(envelope);
          }
        }
      } catch (Exception e) {
        if (!shouldRun()) {
          return;
        }
        long failures = Math.max(1L, attempt);
        LOG.warn("Broadcast listener on channel {} failed (attempt {}): {}", channel, failures, e.toString());
        if (!reconnectPolicy.shouldReconnect(failures)) {
          LOG.error("Broadcast listener on channel {} gave up after {} attempts", channel, failures);
          return;
        }
        try {
          Thread.sleep(reconnectPolicy.delayMillis(failures));
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          return;
        }
      } finally {
        closeSession();
      }
    }
  }

  private void dispatch(String envelope) {
    for (Handler<String> handler : handlers) {
      context.runOnContext(v -> handler.handle(envelope));
    }
  }

  private void closeSession() {
    NotificationSource.NotificationSession current = session;
    session = null;
    if (current != null) {
      try {
        current.close();
      } catch (RuntimeException e) {
        LOG.debug("Ignoring error while closing broadcast session", e);
      }
    }
  }
}
