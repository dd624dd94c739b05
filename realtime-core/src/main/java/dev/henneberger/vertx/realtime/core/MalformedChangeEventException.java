package dev.henneberger.vertx.realtime.core;

/**
 * Raised when a notification payload cannot be decoded into a {@link ChangeEvent}.
 */
public final class MalformedChangeEventException extends RuntimeException {

  private final String payload;

  public MalformedChangeEventException(String message, String payload, Throwable cause) {
    super(message, cause);
    this.payload = payload;
  }

  public MalformedChangeEventException(String message, String payload) {
    this(message, payload, null);
  }

  public String payload() {
    return payload;
  }
}
