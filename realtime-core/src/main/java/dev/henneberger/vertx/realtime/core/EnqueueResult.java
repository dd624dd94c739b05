package dev.henneberger.vertx.realtime.core;

public enum EnqueueResult {
  ACCEPTED,
  /** The outbound queue was full; the message was dropped. */
  QUEUE_FULL,
  /** No connection with that id is registered, usually because it just closed. */
  UNKNOWN_CONNECTION,
  /** The connection is draining or closed. */
  CLOSED
}
