package dev.henneberger.vertx.realtime.core;

import io.vertx.core.Handler;

/**
 * The network side of a connection. Called only from the connection's context.
 */
public interface ClientSink {

  boolean writeQueueFull();

  void write(String message);

  /**
   * Registers a one-shot callback for when {@link #writeQueueFull()} turns false again.
   */
  void drainHandler(Handler<Void> handler);

  void ping();

  void close(short statusCode, String reason);
}
