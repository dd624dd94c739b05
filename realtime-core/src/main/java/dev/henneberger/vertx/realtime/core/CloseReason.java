package dev.henneberger.vertx.realtime.core;

/**
 * Why the server closed a connection, with the WebSocket close status sent to the client.
 */
public enum CloseReason {
  NORMAL("normal", (short) 1000, true),
  SHUTDOWN("shutdown", (short) 1001, true),
  HEARTBEAT_TIMEOUT("heartbeat_timeout", (short) 1001, false),
  AUTH_TIMEOUT("auth_timeout", (short) 1001, false),
  SLOW_CONSUMER("slow_consumer", (short) 1008, false),
  CLIENT_CLOSED("client_closed", (short) 1000, false);

  private final String wireName;
  private final short statusCode;
  private final boolean graceful;

  CloseReason(String wireName, short statusCode, boolean graceful) {
    this.wireName = wireName;
    this.statusCode = statusCode;
    this.graceful = graceful;
  }

  public String wireName() {
    return wireName;
  }

  public short statusCode() {
    return statusCode;
  }

  /**
   * Graceful closes flush queued messages first; forced ones discard them.
   */
  public boolean graceful() {
    return graceful;
  }
}
