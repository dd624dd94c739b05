package dev.henneberger.vertx.realtime.core;

/**
 * A client request that was rejected. The connection stays open; the {@link #code()} is sent back
 * to the client in an {@code error} message.
 */
public class SubscriptionException extends RuntimeException {

  public static final String INVALID_FILTER = "invalid_filter";
  public static final String INVALID_CHANNEL = "invalid_channel";
  public static final String TABLE_NOT_ENABLED = "table_not_enabled";
  public static final String UNKNOWN_SUBSCRIPTION = "unknown_subscription";
  public static final String INVALID_MESSAGE = "invalid_message";
  public static final String MESSAGE_TOO_LARGE = "message_too_large";
  public static final String INVALID_TOKEN = "invalid_token";

  private final String code;

  public SubscriptionException(String code, String message) {
    super(message);
    this.code = code;
  }

  public SubscriptionException(String code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public String code() {
    return code;
  }
}
