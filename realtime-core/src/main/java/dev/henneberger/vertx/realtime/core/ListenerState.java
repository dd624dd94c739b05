package dev.henneberger.vertx.realtime.core;

public enum ListenerState {
  CREATED,
  CONNECTING,
  LISTENING,
  RETRYING,
  FAILED,
  CLOSED
}
