package dev.henneberger.vertx.realtime.core;

public enum ConnectionState {
  CONNECTING,
  ACTIVE,
  SLOW,
  DRAINING,
  CLOSED
}
