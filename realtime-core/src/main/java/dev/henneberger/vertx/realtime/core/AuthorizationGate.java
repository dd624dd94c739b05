package dev.henneberger.vertx.realtime.core;

import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a caller may receive a change, consulting the {@link RlsDecisionCache} first and
 * the {@link RowAuthorizer} on a miss.
 *
 * <p>Runs on dispatch worker threads and waits for the authorizer up to the configured timeout.
 * A failed or timed out call is retried once; if that fails too the verdict is deny and it is
 * cached for the short negative TTL only.
 */
public final class AuthorizationGate {

  private static final Logger LOG = LoggerFactory.getLogger(AuthorizationGate.class);
  private static final int MAX_ATTEMPTS = 2;

  private final RowAuthorizer authorizer;
  private final RlsDecisionCache cache;
  private final long ttlMillis;
  private final long negativeTtlMillis;
  private final long timeoutMillis;
  private final AtomicLong failures = new AtomicLong();
  private final AtomicLong authorizerCalls = new AtomicLong();
  private final List<RealtimeMetricsListener> metricsListeners = new CopyOnWriteArrayList<>();

  public AuthorizationGate(RowAuthorizer authorizer, RlsDecisionCache cache, RealtimeOptions options) {
    this.authorizer = Objects.requireNonNull(authorizer, "authorizer");
    this.cache = Objects.requireNonNull(cache, "cache");
    Objects.requireNonNull(options, "options");
    this.ttlMillis = options.getRlsCacheTtlMs();
    this.negativeTtlMillis = options.getRlsNegativeTtlMs();
    this.timeoutMillis = options.getAuthorizationTimeoutMs();
  }

  public boolean isAllowed(CallerIdentity caller, ChangeEvent event, long nowMillis) {
    String key = cacheKey(caller, event);
    Optional<Boolean> cached = cache.get(key, nowMillis);
    if (cached.isPresent()) {
      return cached.get();
    }

    Throwable lastError = null;
    for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
      try {
        boolean allowed = callAuthorizer(caller, event);
        cache.put(key, allowed, ttlMillis, nowMillis);
        return allowed;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return false;
      } catch (ExecutionException e) {
        lastError = e.getCause() == null ? e : e.getCause();
      } catch (TimeoutException | RuntimeException e) {
        lastError = e;
      }
    }

    failures.incrementAndGet();
    LOG.warn("Authorization failed for table {}, denying (fail-closed): {}",
      event.qualifiedTable(), String.valueOf(lastError));
    for (RealtimeMetricsListener listener : metricsListeners) {
      listener.onAuthorizationFailure(event.qualifiedTable(), lastError);
    }
    cache.put(key, false, negativeTtlMillis, nowMillis);
    return false;
  }

  /**
   * Forgets every verdict computed for {@code caller}.
   */
  public int invalidate(CallerIdentity caller) {
    return cache.invalidate(caller.cacheKeyPrefix());
  }

  public RlsDecisionCache cache() {
    return cache;
  }

  public long failures() {
    return failures.get();
  }

  public long authorizerCalls() {
    return authorizerCalls.get();
  }

  public RealtimeSubscription addMetricsListener(RealtimeMetricsListener listener) {
    RealtimeMetricsListener resolved = Objects.requireNonNull(listener, "listener");
    metricsListeners.add(resolved);
    return () -> metricsListeners.remove(resolved);
  }

  /**
   * Caller prefix, operation class, table and a digest of the row image the policy sees.
   */
  static String cacheKey(CallerIdentity caller, ChangeEvent event) {
    Map<String, Object> row = event.effectiveRow();
    String rowDigest = row.isEmpty()
      ? "-"
      : ChangeEventParser.digest(new JsonObject(new TreeMap<>(row)).encode());
    char kind = event.getOperation() == ChangeEvent.Operation.DELETE ? 'D' : 'R';
    return caller.cacheKeyPrefix() + kind + '|' + event.qualifiedTable() + '|' + rowDigest;
  }

  private boolean callAuthorizer(CallerIdentity caller, ChangeEvent event)
    throws InterruptedException, ExecutionException, TimeoutException {
    authorizerCalls.incrementAndGet();
    Future<Boolean> verdict = event.getOperation() == ChangeEvent.Operation.DELETE
      ? authorizer.authorizeDeleted(caller, event.qualifiedTable(), event.getOldRow())
      : authorizer.authorize(caller, event.qualifiedTable(), event.getNewRow());
    if (verdict == null) {
      throw new IllegalStateException("authorizer returned no result");
    }
    Boolean allowed = verdict.toCompletionStage().toCompletableFuture().get(timeoutMillis, TimeUnit.MILLISECONDS);
    return Boolean.TRUE.equals(allowed);
  }
}
