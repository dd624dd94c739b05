package dev.henneberger.vertx.realtime.core;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Notify channel stand-in: every open session receives every published payload, the way
 * redundant LISTEN connections do.
 */
final class FakeNotificationSource implements NotificationSource {

  private final List<FakeSession> sessions = new CopyOnWriteArrayList<>();
  private final AtomicInteger opened = new AtomicInteger();
  private volatile boolean refuseConnections;

  @Override
  public NotificationSession open(String channelName) throws Exception {
    if (refuseConnections) {
      throw new IOException("connection refused");
    }
    FakeSession session = new FakeSession();
    sessions.add(session);
    opened.incrementAndGet();
    return session;
  }

  void publish(String payload) {
    for (FakeSession session : sessions) {
      if (session.alive.get()) {
        session.pending.add(payload);
      }
    }
  }

  int liveSessions() {
    int live = 0;
    for (FakeSession session : sessions) {
      if (session.alive.get()) {
        live++;
      }
    }
    return live;
  }

  int opened() {
    return opened.get();
  }

  /**
   * Drops the oldest live session as if its database connection broke.
   */
  void killOneSession() {
    for (FakeSession session : sessions) {
      if (session.alive.compareAndSet(true, false)) {
        return;
      }
    }
  }

  void killAllSessions() {
    for (FakeSession session : sessions) {
      session.alive.set(false);
    }
  }

  void refuseConnections(boolean refuse) {
    this.refuseConnections = refuse;
  }

  private static final class FakeSession implements NotificationSession {
    private final LinkedBlockingQueue<String> pending = new LinkedBlockingQueue<>();
    private final AtomicBoolean alive = new AtomicBoolean(true);

    @Override
    public List<String> poll(long timeoutMillis, int maxPayloads) throws Exception {
      if (!alive.get()) {
        throw new IOException("connection lost");
      }
      List<String> payloads = new ArrayList<>();
      String first = pending.poll(Math.min(timeoutMillis, 20L), TimeUnit.MILLISECONDS);
      if (first == null) {
        return payloads;
      }
      payloads.add(first);
      pending.drainTo(payloads, maxPayloads - 1);
      return payloads;
    }

    @Override
    public void close() {
      alive.set(false);
    }
  }
}
