package dev.henneberger.vertx.realtime.core;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The change fan-out engine: listener pool, ingestion queue, dispatch workers, subscription
 * registry, authorization cache, connection manager and presence, wired together.
 *
 * <pre>
 * RealtimeEngine engine = new RealtimeEngine(vertx, options, source, authenticator, authorizer, catalog);
 * engine.start();
 * vertx.createHttpServer(options.applyTo(new HttpServerOptions()))
 *   .webSocketHandler(engine.webSocketHandler())
 *   .listen(8080);
 * </pre>
 */
public class RealtimeEngine implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(RealtimeEngine.class);

  private final Vertx vertx;
  private final RealtimeOptions options;
  private final IngestionQueue ingestionQueue;
  private final SequenceDeduplicator deduplicator;
  private final SubscriptionRegistry registry;
  private final RlsDecisionCache rlsCache;
  private final AuthorizationGate authorizationGate;
  private final ConnectionManager connectionManager;
  private final PresenceTracker presenceTracker;
  private final DispatchWorkerPool dispatchWorkers;
  private final ListenerPool listenerPool;
  private final BroadcastRelay broadcastRelay;
  private final RealtimeProtocolHandler protocolHandler;
  private final RealtimeWebSocketHandler webSocketHandler;

  private long cacheSweepTimerId = -1L;
  private boolean started;

  public RealtimeEngine(Vertx vertx,
                        RealtimeOptions options,
                        NotificationSource notificationSource,
                        ConnectionAuthenticator authenticator,
                        RowAuthorizer rowAuthorizer,
                        TableCatalog tableCatalog) {
    this(vertx, options, notificationSource, authenticator, rowAuthorizer, tableCatalog, BroadcastBus.local());
  }

  /**
   * @param broadcastBus carries client broadcasts to the other instances serving the same
   *     clients; {@link BroadcastBus#local()} for a single instance
   */
  public RealtimeEngine(Vertx vertx,
                        RealtimeOptions options,
                        NotificationSource notificationSource,
                        ConnectionAuthenticator authenticator,
                        RowAuthorizer rowAuthorizer,
                        TableCatalog tableCatalog,
                        BroadcastBus broadcastBus) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.options = new RealtimeOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();
    Objects.requireNonNull(notificationSource, "notificationSource");
    Objects.requireNonNull(authenticator, "authenticator");
    Objects.requireNonNull(rowAuthorizer, "rowAuthorizer");
    Objects.requireNonNull(tableCatalog, "tableCatalog");
    Objects.requireNonNull(broadcastBus, "broadcastBus");

    this.ingestionQueue = new IngestionQueue(this.options.getNotificationWorkers(), this.options.getNotificationQueueSize());
    this.deduplicator = new SequenceDeduplicator(this.options.getDedupWindowMs());
    this.registry = new SubscriptionRegistry();
    this.rlsCache = new RlsDecisionCache(this.options.getRlsCacheSize());
    this.authorizationGate = new AuthorizationGate(rowAuthorizer, rlsCache, this.options);
    this.connectionManager = new ConnectionManager(vertx, this.options, registry);
    this.presenceTracker = new PresenceTracker(connectionManager, registry);
    this.dispatchWorkers = new DispatchWorkerPool(ingestionQueue, deduplicator, registry, connectionManager, authorizationGate);
    this.listenerPool = new ListenerPool(vertx, notificationSource, ingestionQueue, this.options);
    this.broadcastRelay = new BroadcastRelay(broadcastBus, registry, connectionManager);
    this.protocolHandler = new RealtimeProtocolHandler(connectionManager, registry, presenceTracker,
      tableCatalog, authenticator, authorizationGate, broadcastRelay, this.options);
    this.webSocketHandler = new RealtimeWebSocketHandler(vertx, connectionManager, protocolHandler,
      authenticator, this.options);
  }

  /**
   * Starts dispatching and listening. Completes when the first listener is connected; a pool
   * that never connects leaves the engine running in {@link HealthStatus#STALE} state.
   */
  public synchronized Future<Void> start() {
    if (!started) {
      started = true;
      connectionManager.start();
      dispatchWorkers.start();
      broadcastRelay.start();
      cacheSweepTimerId = vertx.setPeriodic(Math.max(1_000L, options.getRlsCacheTtlMs()),
        id -> rlsCache.evictExpired(System.currentTimeMillis()));
      LOG.info("Realtime engine starting: {} listeners on channel {}, {} dispatch workers",
        options.getListenerPoolSize(), options.getNotifyChannel(), options.getNotificationWorkers());
    }
    return listenerPool.start();
  }

  @Override
  public synchronized void close() {
    if (cacheSweepTimerId >= 0L) {
      vertx.cancelTimer(cacheSweepTimerId);
      cacheSweepTimerId = -1L;
    }
    listenerPool.close();
    broadcastRelay.close();
    dispatchWorkers.close();
    connectionManager.close();
    LOG.info("Realtime engine stopped");
  }

  public RealtimeHealth health() {
    return new RealtimeHealth(
      listenerPool.health(),
      listenerPool.connectedListeners(),
      listenerPool.size(),
      ingestionQueue.depth(),
      ingestionQueue.dropped(),
      listenerPool.parseFailures(),
      deduplicator.suppressed(),
      dispatchWorkers.delivered(),
      rlsCache.size(),
      rlsCache.hits(),
      rlsCache.misses(),
      authorizationGate.failures(),
      registry.size(),
      connectionManager.stats());
  }

  public RealtimeSubscription addMetricsListener(RealtimeMetricsListener listener) {
    RealtimeSubscription fromPool = listenerPool.addMetricsListener(listener);
    RealtimeSubscription fromWorkers = dispatchWorkers.addMetricsListener(listener);
    RealtimeSubscription fromGate = authorizationGate.addMetricsListener(listener);
    RealtimeSubscription fromConnections = connectionManager.addMetricsListener(listener);
    return () -> {
      fromPool.cancel();
      fromWorkers.cancel();
      fromGate.cancel();
      fromConnections.cancel();
    };
  }

  public RealtimeOptions options() {
    return new RealtimeOptions(options);
  }

  public ConnectionManager connectionManager() {
    return connectionManager;
  }

  public SubscriptionRegistry registry() {
    return registry;
  }

  public PresenceTracker presenceTracker() {
    return presenceTracker;
  }

  public ListenerPool listenerPool() {
    return listenerPool;
  }

  public IngestionQueue ingestionQueue() {
    return ingestionQueue;
  }

  public DispatchWorkerPool dispatchWorkers() {
    return dispatchWorkers;
  }

  public BroadcastRelay broadcastRelay() {
    return broadcastRelay;
  }

  public AuthorizationGate authorizationGate() {
    return authorizationGate;
  }

  public RealtimeProtocolHandler protocolHandler() {
    return protocolHandler;
  }

  public RealtimeWebSocketHandler webSocketHandler() {
    return webSocketHandler;
  }
}
