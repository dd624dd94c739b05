package dev.henneberger.vertx.realtime.core;

import io.vertx.core.Future;
import io.vertx.core.Handler;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Bus shared by several relays in one JVM. Envelopes are handed to every subscriber, the
 * publisher's own included, before {@link #publish} returns.
 */
final class InMemoryBroadcastBus implements BroadcastBus {

  private final List<Handler<String>> handlers = new CopyOnWriteArrayList<>();
  private final List<String> envelopes = new CopyOnWriteArrayList<>();
  private volatile boolean failing;

  @Override
  public Future<Void> publish(String envelope) {
    if (failing) {
      return Future.failedFuture(new IllegalStateException("bus unavailable"));
    }
    envelopes.add(envelope);
    for (Handler<String> handler : handlers) {
      handler.handle(envelope);
    }
    return Future.succeededFuture();
  }

  @Override
  public RealtimeSubscription subscribe(Handler<String> envelopeHandler) {
    handlers.add(envelopeHandler);
    return () -> handlers.remove(envelopeHandler);
  }

  void inject(String envelope) {
    for (Handler<String> handler : handlers) {
      handler.handle(envelope);
    }
  }

  void failPublishes(boolean failing) {
    this.failing = failing;
  }

  List<String> envelopes() {
    return new ArrayList<>(envelopes);
  }

  int subscribers() {
    return handlers.size();
  }
}
