package dev.henneberger.vertx.realtime.core;

@FunctionalInterface
public interface RealtimeSubscription {
  void cancel();
}
