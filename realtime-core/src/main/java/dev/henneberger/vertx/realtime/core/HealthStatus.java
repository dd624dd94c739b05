package dev.henneberger.vertx.realtime.core;

/**
 * Connectivity of the listener pool as seen by the hosting server.
 */
public enum HealthStatus {
  /** Every listener is connected. */
  HEALTHY,
  /** At least one listener is connected, at least one is not. */
  DEGRADED,
  /** No listener is connected; open connections stay open but receive no new changes. */
  STALE
}
