package dev.henneberger.vertx.realtime.core;

import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Redundant subscriptions to the database notify channel.
 *
 * <p>Every listener owns one worker thread and one {@link NotificationSource.NotificationSession}.
 * Each listener receives every notification, parses it and offers it to the shared
 * {@link IngestionQueue}; duplicates are removed downstream. A failed session is reopened with
 * the configured {@link BackoffPolicy} while the other listeners keep delivering.
 */
public class ListenerPool implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(ListenerPool.class);
  private static final long POLL_TIMEOUT_MS = 250L;
  private static final long DROP_LOG_EVERY = 1000L;

  private final Vertx vertx;
  private final NotificationSource source;
  private final IngestionQueue queue;
  private final RealtimeOptions options;
  private final List<Listener> listeners = new ArrayList<>();
  private final List<Handler<ListenerStateChange>> stateHandlers = new CopyOnWriteArrayList<>();
  private final List<RealtimeMetricsListener> metricsListeners = new CopyOnWriteArrayList<>();
  private final AtomicBoolean shouldRun = new AtomicBoolean(false);
  private final AtomicLong parseFailures = new AtomicLong();

  private volatile Promise<Void> startPromise;
  private volatile boolean closed;

  public ListenerPool(Vertx vertx, NotificationSource source, IngestionQueue queue, RealtimeOptions options) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.source = Objects.requireNonNull(source, "source");
    this.queue = Objects.requireNonNull(queue, "queue");
    this.options = new RealtimeOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();
    for (int i = 0; i < this.options.getListenerPoolSize(); i++) {
      listeners.add(new Listener(i));
    }
  }

  /**
   * Starts every listener. The returned future completes once the first listener is listening
   * and fails only if every listener gives up before that.
   */
  public Future<Void> start() {
    synchronized (this) {
      if (closed) {
        return Future.failedFuture("listener pool is closed");
      }
      if (startPromise != null) {
        return startPromise.future();
      }
      shouldRun.set(true);
      startPromise = Promise.promise();
      for (Listener listener : listeners) {
        listener.startWorker();
      }
      return startPromise.future();
    }
  }

  @Override
  public synchronized void close() {
    closed = true;
    shouldRun.set(false);
    for (Listener listener : listeners) {
      listener.stop();
    }
    Promise<Void> promise = startPromise;
    if (promise != null) {
      promise.tryFail("listener pool closed before any listener connected");
    }
  }

  public int size() {
    return listeners.size();
  }

  public int connectedListeners() {
    int connected = 0;
    for (Listener listener : listeners) {
      if (listener.state == ListenerState.LISTENING) {
        connected++;
      }
    }
    return connected;
  }

  public ListenerState state(int listenerIndex) {
    return listeners.get(listenerIndex).state;
  }

  public HealthStatus health() {
    int connected = connectedListeners();
    if (connected == listeners.size()) {
      return HealthStatus.HEALTHY;
    }
    return connected == 0 ? HealthStatus.STALE : HealthStatus.DEGRADED;
  }

  public long parseFailures() {
    return parseFailures.get();
  }

  public RealtimeSubscription onStateChange(Handler<ListenerStateChange> handler) {
    Handler<ListenerStateChange> resolved = Objects.requireNonNull(handler, "handler");
    stateHandlers.add(resolved);
    return () -> stateHandlers.remove(resolved);
  }

  public RealtimeSubscription addMetricsListener(RealtimeMetricsListener listener) {
    RealtimeMetricsListener resolved = Objects.requireNonNull(listener, "listener");
    metricsListeners.add(resolved);
    return () -> metricsListeners.remove(resolved);
  }

  /**
   * Parses one raw payload and hands it to the ingestion queue. Malformed payloads are counted,
   * logged and dropped.
   */
  void ingest(String payload) {
    ChangeEvent event;
    try {
      event = ChangeEventParser.parse(payload, Instant.now());
    } catch (MalformedChangeEventException e) {
      parseFailures.incrementAndGet();
      LOG.warn("Dropping malformed notification: {}", e.getMessage());
      for (RealtimeMetricsListener listener : metricsListeners) {
        listener.onParseFailure(payload, e);
      }
      return;
    }

    for (RealtimeMetricsListener listener : metricsListeners) {
      listener.onEventIngested(event);
    }
    ChangeEvent evicted = queue.offer(event);
    if (evicted != null) {
      long total = queue.dropped();
      if (total % DROP_LOG_EVERY == 1L) {
        LOG.warn("Ingestion queue full, dropped oldest change for {} (total dropped {})",
          evicted.qualifiedTable(), total);
      }
      for (RealtimeMetricsListener listener : metricsListeners) {
        listener.onIngestionDrop(evicted);
      }
    }
  }

  private void listenerConnected() {
    Promise<Void> promise = startPromise;
    if (promise != null) {
      promise.tryComplete();
    }
  }

  private void listenerGaveUp(Throwable cause) {
    for (Listener listener : listeners) {
      if (listener.state != ListenerState.FAILED) {
        return;
      }
    }
    Promise<Void> promise = startPromise;
    if (promise != null) {
      promise.tryFail(cause);
    }
  }

  private void emitStateChange(ListenerStateChange change) {
    for (RealtimeMetricsListener listener : metricsListeners) {
      listener.onListenerStateChange(change);
    }
    for (Handler<ListenerStateChange> handler : stateHandlers) {
      vertx.runOnContext(v -> handler.handle(change));
    }
  }

  private static void sleepInterruptibly(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ignore) {
      Thread.currentThread().interrupt();
    }
  }

  private final class Listener {
    private final int index;
    private volatile ListenerState state = ListenerState.CREATED;
    private volatile Thread worker;
    private volatile NotificationSource.NotificationSession session;

    private Listener(int index) {
      this.index = index;
    }

    private synchronized void startWorker() {
      if (worker != null && worker.isAlive()) {
        return;
      }
      worker = new Thread(this::runLoop, "realtime-listener-" + index);
      worker.setDaemon(true);
      worker.start();
    }

    private synchronized void stop() {
      transition(ListenerState.CLOSED, null, 0);
      closeSession();
      Thread thread = worker;
      worker = null;
      if (thread != null) {
        thread.interrupt();
      }
    }

    private void runLoop() {
      BackoffPolicy backoff = options.getReconnectPolicy();
      long attempt = 0;
      try {
        while (shouldRun.get()) {
          attempt++;
          transition(ListenerState.CONNECTING, null, attempt);
          try {
            runSession(attempt);
            if (!shouldRun.get()) {
              return;
            }
            throw new IllegalStateException("notification session ended unexpectedly");
          } catch (Exception e) {
            if (!shouldRun.get()) {
              return;
            }
            if (state == ListenerState.LISTENING) {
              attempt = 1;
            }
            LOG.warn("Listener {} on channel {} failed (attempt {}): {}",
              index, options.getNotifyChannel(), attempt, e.toString());
            closeSession();
            if (!backoff.shouldReconnect(attempt)) {
              transition(ListenerState.FAILED, e, attempt);
              listenerGaveUp(e);
              return;
            }
            transition(ListenerState.RETRYING, e, attempt);
            sleepInterruptibly(backoff.delayMillis(attempt));
          }
        }
      } finally {
        closeSession();
      }
    }

    private void runSession(long attempt) throws Exception {
      NotificationSource.NotificationSession opened = source.open(options.getNotifyChannel());
      this.session = opened;
      if (!shouldRun.get()) {
        return;
      }
      if (attempt > 1) {
        LOG.info("Listener {} reconnected to channel {} after {} attempts",
          index, options.getNotifyChannel(), attempt);
      } else {
        LOG.info("Listener {} listening on channel {}", index, options.getNotifyChannel());
      }
      transition(ListenerState.LISTENING, null, attempt);
      listenerConnected();

      int maxPayloads = options.getChannelBufferSize();
      while (shouldRun.get()) {
        List<String> payloads = opened.poll(POLL_TIMEOUT_MS, maxPayloads);
        for (String payload : payloads) {
          ingest(payload);
        }
      }
    }

    private void closeSession() {
      NotificationSource.NotificationSession current = session;
      session = null;
      if (current != null) {
        try {
          current.close();
        } catch (RuntimeException e) {
          LOG.debug("Ignoring error while closing listener {} session", index, e);
        }
      }
    }

    private void transition(ListenerState nextState, Throwable cause, long attempt) {
      ListenerState previous;
      synchronized (this) {
        previous = state;
        if (previous == ListenerState.CLOSED || (previous == nextState && cause == null)) {
          return;
        }
        state = nextState;
      }
      emitStateChange(new ListenerStateChange(index, previous, nextState, cause, attempt));
    }
  }
}
