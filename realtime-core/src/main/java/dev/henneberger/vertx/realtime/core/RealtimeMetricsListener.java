package dev.henneberger.vertx.realtime.core;

/**
 * Observability hooks. Callbacks run on the thread that produced the signal (listener, dispatch
 * worker or event loop) and must not block.
 */
public interface RealtimeMetricsListener {
  default void onEventIngested(ChangeEvent event) {
  }

  default void onParseFailure(String payload, Throwable error) {
  }

  default void onListenerStateChange(ListenerStateChange stateChange) {
  }

  default void onIngestionDrop(ChangeEvent dropped) {
  }

  default void onDuplicateSuppressed(ChangeEvent event) {
  }

  default void onAuthorizationFailure(String table, Throwable error) {
  }

  default void onDelivered(String connectionId, ChangeEvent event) {
  }

  default void onClientMessageDropped(String connectionId) {
  }

  default void onConnectionClosed(String connectionId, CloseReason reason) {
  }
}
