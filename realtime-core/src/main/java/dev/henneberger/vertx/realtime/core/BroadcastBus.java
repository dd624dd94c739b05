package dev.henneberger.vertx.realtime.core;

import io.vertx.core.Future;
import io.vertx.core.Handler;

/**
 * Carries client broadcasts between engine instances serving the same channels. Every envelope
 * published by any instance, the publishing one included, reaches the handlers subscribed on
 * every instance.
 */
public interface BroadcastBus {

  Future<Void> publish(String envelope);

  RealtimeSubscription subscribe(Handler<String> envelopeHandler);

  /**
   * A bus for a single instance: nothing is carried anywhere.
   */
  static BroadcastBus local() {
    return new BroadcastBus() {
      @Override
      public Future<Void> publish(String envelope) {
        return Future.succeededFuture();
      }

      @Override
      public RealtimeSubscription subscribe(Handler<String> envelopeHandler) {
        return () -> { };
      }
    };
  }
}
