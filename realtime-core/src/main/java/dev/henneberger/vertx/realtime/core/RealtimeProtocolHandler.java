package dev.henneberger.vertx.realtime.core;

import io.vertx.core.Future;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles the JSON messages a client sends over its connection.
 *
 * <p>Rejected requests are answered with an {@code error} message and leave the connection
 * open. All replies travel through {@link ConnectionManager#enqueue}, behind any change messages
 * already queued.
 */
public final class RealtimeProtocolHandler {

  private static final Logger LOG = LoggerFactory.getLogger(RealtimeProtocolHandler.class);
  private static final Pattern CHANNEL_NAME = Pattern.compile("[A-Za-z0-9_:\\-]{1,128}");
  static final String INTERNAL_ERROR = "internal_error";

  private final ConnectionManager connections;
  private final SubscriptionRegistry registry;
  private final PresenceTracker presence;
  private final TableCatalog tableCatalog;
  private final ConnectionAuthenticator authenticator;
  private final AuthorizationGate authorizationGate;
  private final BroadcastRelay broadcastRelay;
  private final int messageSizeLimit;

  public RealtimeProtocolHandler(ConnectionManager connections,
                                 SubscriptionRegistry registry,
                                 PresenceTracker presence,
                                 TableCatalog tableCatalog,
                                 ConnectionAuthenticator authenticator,
                                 AuthorizationGate authorizationGate,
                                 RealtimeOptions options) {
    this(connections, registry, presence, tableCatalog, authenticator, authorizationGate,
      new BroadcastRelay(BroadcastBus.local(), registry, connections), options);
  }

  public RealtimeProtocolHandler(ConnectionManager connections,
                                 SubscriptionRegistry registry,
                                 PresenceTracker presence,
                                 TableCatalog tableCatalog,
                                 ConnectionAuthenticator authenticator,
                                 AuthorizationGate authorizationGate,
                                 BroadcastRelay broadcastRelay,
                                 RealtimeOptions options) {
    this.connections = Objects.requireNonNull(connections, "connections");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.presence = Objects.requireNonNull(presence, "presence");
    this.tableCatalog = Objects.requireNonNull(tableCatalog, "tableCatalog");
    this.authenticator = Objects.requireNonNull(authenticator, "authenticator");
    this.authorizationGate = Objects.requireNonNull(authorizationGate, "authorizationGate");
    this.broadcastRelay = Objects.requireNonNull(broadcastRelay, "broadcastRelay");
    this.messageSizeLimit = Objects.requireNonNull(options, "options").getMessageSizeLimit();
  }

  /**
   * Processes one text frame. The returned future completes once the reply (or the error
   * message) has been enqueued and does not fail.
   */
  public Future<Void> handle(String connectionId, String frame) {
    RealtimeConnection connection = connections.get(connectionId);
    if (connection == null) {
      return Future.succeededFuture();
    }
    connections.recordActivity(connectionId, System.currentTimeMillis());

    Future<Void> result;
    try {
      JsonObject message = decode(frame);
      String type = message.getString("type", "");
      switch (type) {
        case "subscribe":
          result = subscribe(connection, message);
          break;
        case "unsubscribe":
          unsubscribe(connection, message);
          result = Future.succeededFuture();
          break;
        case "heartbeat":
          reply(connection, ServerMessages.heartbeat());
          result = Future.succeededFuture();
          break;
        case "presence":
          presence(connection, message);
          result = Future.succeededFuture();
          break;
        case "broadcast":
          broadcast(connection, message);
          result = Future.succeededFuture();
          break;
        case "access_token":
          result = refreshToken(connection, message);
          break;
        default:
          throw new SubscriptionException(SubscriptionException.INVALID_MESSAGE,
            "unsupported message type '" + type + "'");
      }
    } catch (SubscriptionException e) {
      result = Future.failedFuture(e);
    } catch (RuntimeException e) {
      LOG.warn("Failed to handle message from connection {}", connectionId, e);
      result = Future.failedFuture(new SubscriptionException(INTERNAL_ERROR, "internal error", e));
    }

    return result.recover(err -> {
      if (err instanceof SubscriptionException) {
        SubscriptionException rejected = (SubscriptionException) err;
        reply(connection, ServerMessages.error(rejected.code(), rejected.getMessage()));
        return Future.succeededFuture();
      }
      LOG.warn("Request from connection {} failed", connectionId, err);
      reply(connection, ServerMessages.error(INTERNAL_ERROR, "internal error"));
      return Future.succeededFuture();
    });
  }

  private JsonObject decode(String frame) {
    if (frame == null) {
      throw new SubscriptionException(SubscriptionException.INVALID_MESSAGE, "empty message");
    }
    if (frame.length() > messageSizeLimit
      || (frame.length() * 3L > messageSizeLimit && frame.getBytes(StandardCharsets.UTF_8).length > messageSizeLimit)) {
      throw new SubscriptionException(SubscriptionException.MESSAGE_TOO_LARGE,
        "message exceeds " + messageSizeLimit + " bytes");
    }
    try {
      return new JsonObject(frame);
    } catch (DecodeException | ClassCastException e) {
      throw new SubscriptionException(SubscriptionException.INVALID_MESSAGE, "message is not a JSON object");
    }
  }

  private Future<Void> subscribe(RealtimeConnection connection, JsonObject message) {
    String channel = requireChannel(message);
    int dot = channel.indexOf('.');
    if (dot < 0) {
      Subscription subscription = subscribeChannel(connection, channel);
      reply(connection, ServerMessages.subscribed(subscription.id(), channel));
      return Future.succeededFuture();
    }

    String schema = channel.substring(0, dot);
    String table = channel.substring(dot + 1);
    if (!Identifiers.isValid(schema) || !Identifiers.isValid(table)) {
      throw new SubscriptionException(SubscriptionException.INVALID_CHANNEL,
        "channel must be schema.table or a channel name");
    }
    RowFilter filter = FilterParser.parse(message.getValue("filter"));
    Set<ChangeEvent.Operation> operations = parseOperations(message.getValue("ops"));

    return tableCatalog.isRealtimeEnabled(schema, table)
      .recover(err -> Future.failedFuture(
        new SubscriptionException(INTERNAL_ERROR, "could not check realtime table " + channel, err)))
      .compose(enabled -> {
        if (!Boolean.TRUE.equals(enabled)) {
          return Future.failedFuture(new SubscriptionException(SubscriptionException.TABLE_NOT_ENABLED,
            "realtime is not enabled for " + channel));
        }
        if (!connection.isOpen()) {
          return Future.succeededFuture();
        }
        Subscription subscription = Subscription.forTable(
          UUID.randomUUID().toString(), connection.id(), schema, table, operations, filter);
        registry.add(subscription);
        if (connections.get(connection.id()) == null) {
          registry.remove(subscription.id());
          return Future.succeededFuture();
        }
        LOG.debug("Connection {} subscribed {} to {}", connection.id(), subscription.id(), channel);
        reply(connection, ServerMessages.subscribed(subscription.id(), channel));
        return Future.succeededFuture();
      });
  }

  private Subscription subscribeChannel(RealtimeConnection connection, String channel) {
    Subscription subscription = Subscription.forChannel(UUID.randomUUID().toString(), connection.id(), channel);
    registry.add(subscription);
    LOG.debug("Connection {} subscribed {} to channel {}", connection.id(), subscription.id(), channel);
    return subscription;
  }

  private void unsubscribe(RealtimeConnection connection, JsonObject message) {
    String id = message.getString("id");
    Subscription subscription = id == null ? null : registry.get(id);
    if (subscription == null || !subscription.connectionId().equals(connection.id())) {
      throw new SubscriptionException(SubscriptionException.UNKNOWN_SUBSCRIPTION, "unknown subscription " + id);
    }
    registry.remove(id);
    if (subscription.isChannel() && channelSubscription(connection, subscription.channel()) == null) {
      presence.leave(subscription.channel(), connection.id());
    }
    LOG.debug("Connection {} unsubscribed {}", connection.id(), id);
    reply(connection, ServerMessages.unsubscribed(id));
  }

  private void presence(RealtimeConnection connection, JsonObject message) {
    String channel = requireChannelName(message);
    String event = message.getString("event", "join");
    switch (event.toLowerCase(Locale.ROOT)) {
      case "join":
      case "track":
        if (channelSubscription(connection, channel) == null) {
          Subscription subscription = subscribeChannel(connection, channel);
          reply(connection, ServerMessages.subscribed(subscription.id(), channel));
        }
        JsonObject meta = message.getJsonObject("meta", new JsonObject());
        List<PresenceRecord> members = presence.join(channel, connection.id(), meta);
        reply(connection, ServerMessages.presenceState(channel, PresenceTracker.toJson(members)));
        break;
      case "leave":
      case "untrack":
        presence.leave(channel, connection.id());
        break;
      default:
        throw new SubscriptionException(SubscriptionException.INVALID_MESSAGE,
          "presence event must be join or leave");
    }
  }

  private void broadcast(RealtimeConnection connection, JsonObject message) {
    String channel = requireChannelName(message);
    if (channelSubscription(connection, channel) == null) {
      throw new SubscriptionException(SubscriptionException.INVALID_CHANNEL,
        "not subscribed to channel " + channel);
    }
    broadcastRelay.broadcast(channel, message.getValue("payload"), connection.id());
  }

  private Future<Void> refreshToken(RealtimeConnection connection, JsonObject message) {
    String token = message.getString("token");
    if (token == null || token.isBlank()) {
      throw new SubscriptionException(SubscriptionException.INVALID_TOKEN, "token is required");
    }
    Future<CallerIdentity> authenticated;
    try {
      authenticated = authenticator.authenticate(token);
    } catch (RuntimeException e) {
      authenticated = Future.failedFuture(e);
    }
    return authenticated
      .recover(err -> Future.failedFuture(
        new SubscriptionException(SubscriptionException.INVALID_TOKEN, "access token rejected")))
      .compose(identity -> {
        CallerIdentity previous = connections.updateIdentity(connection.id(), identity);
        if (previous != null && !previous.equals(identity)) {
          authorizationGate.invalidate(previous);
        }
        reply(connection, ServerMessages.accessTokenAccepted());
        return Future.succeededFuture();
      });
  }

  private Subscription channelSubscription(RealtimeConnection connection, String channel) {
    for (Subscription subscription : registry.subscriptionsOf(connection.id())) {
      if (subscription.isChannel() && subscription.channel().equals(channel)) {
        return subscription;
      }
    }
    return null;
  }

  private static Set<ChangeEvent.Operation> parseOperations(Object ops) {
    if (ops == null || "*".equals(ops)) {
      return EnumSet.allOf(ChangeEvent.Operation.class);
    }
    if (!(ops instanceof JsonArray)) {
      throw new SubscriptionException(SubscriptionException.INVALID_MESSAGE, "ops must be an array");
    }
    Set<ChangeEvent.Operation> operations = EnumSet.noneOf(ChangeEvent.Operation.class);
    for (Object op : (JsonArray) ops) {
      String name = String.valueOf(op).trim();
      if ("*".equals(name)) {
        return EnumSet.allOf(ChangeEvent.Operation.class);
      }
      try {
        operations.add(ChangeEvent.Operation.valueOf(name.toUpperCase(Locale.ROOT)));
      } catch (IllegalArgumentException e) {
        throw new SubscriptionException(SubscriptionException.INVALID_MESSAGE, "unsupported operation '" + name + "'");
      }
    }
    return operations.isEmpty() ? EnumSet.allOf(ChangeEvent.Operation.class) : operations;
  }

  private static String requireChannel(JsonObject message) {
    Object channel = message.getValue("channel");
    if (!(channel instanceof String) || ((String) channel).isBlank()) {
      throw new SubscriptionException(SubscriptionException.INVALID_CHANNEL, "channel is required");
    }
    String value = ((String) channel).trim();
    if (value.indexOf('.') < 0 && !CHANNEL_NAME.matcher(value).matches()) {
      throw new SubscriptionException(SubscriptionException.INVALID_CHANNEL, "invalid channel name");
    }
    return value;
  }

  private static String requireChannelName(JsonObject message) {
    String channel = requireChannel(message);
    if (channel.indexOf('.') >= 0) {
      throw new SubscriptionException(SubscriptionException.INVALID_CHANNEL,
        "presence and broadcast need a channel name, not a table");
    }
    return channel;
  }

  private void reply(RealtimeConnection connection, JsonObject message) {
    connections.enqueue(connection.id(), message.encode());
  }
}
