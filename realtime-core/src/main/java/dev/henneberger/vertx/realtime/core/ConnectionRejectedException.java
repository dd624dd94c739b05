package dev.henneberger.vertx.realtime.core;

/**
 * A connection refused before it became active.
 */
public class ConnectionRejectedException extends RuntimeException {

  public enum Reason {
    MAX_CONNECTIONS("max_connections"),
    MAX_USER_CONNECTIONS("max_user_connections"),
    MAX_IP_CONNECTIONS("max_ip_connections"),
    AUTHENTICATION_FAILED("authentication_failed");

    private final String wireName;

    Reason(String wireName) {
      this.wireName = wireName;
    }

    public String wireName() {
      return wireName;
    }
  }

  private final Reason reason;

  public ConnectionRejectedException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public ConnectionRejectedException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
