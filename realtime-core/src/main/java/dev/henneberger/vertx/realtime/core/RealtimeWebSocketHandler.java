package dev.henneberger.vertx.realtime.core;

import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.http.ServerWebSocket;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds accepted WebSockets to the engine: authenticates the handshake token, registers the
 * connection and routes frames to the {@link RealtimeProtocolHandler}.
 *
 * <p>The token is read from the {@code access_token}, {@code token} or {@code apikey} query
 * parameter, or from an {@code Authorization: Bearer} header. A missing token is passed to the
 * authenticator as {@code null}, which decides whether anonymous access is allowed. Frames are
 * paused until the connection is registered.
 */
public final class RealtimeWebSocketHandler implements Handler<ServerWebSocket> {

  private static final Logger LOG = LoggerFactory.getLogger(RealtimeWebSocketHandler.class);
  private static final short REJECTED_STATUS = 1008;

  private final Vertx vertx;
  private final ConnectionManager connections;
  private final RealtimeProtocolHandler protocol;
  private final ConnectionAuthenticator authenticator;
  private final long authTimeoutMillis;

  public RealtimeWebSocketHandler(Vertx vertx,
                                  ConnectionManager connections,
                                  RealtimeProtocolHandler protocol,
                                  ConnectionAuthenticator authenticator,
                                  RealtimeOptions options) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.connections = Objects.requireNonNull(connections, "connections");
    this.protocol = Objects.requireNonNull(protocol, "protocol");
    this.authenticator = Objects.requireNonNull(authenticator, "authenticator");
    this.authTimeoutMillis = Objects.requireNonNull(options, "options").getAuthTimeoutMs();
  }

  @Override
  public void handle(ServerWebSocket socket) {
    socket.pause();
    Context context = vertx.getOrCreateContext();
    String remoteAddress = socket.remoteAddress() == null ? null : socket.remoteAddress().host();
    String token = extractToken(socket.query(), socket.headers().get("Authorization"));
    AtomicBoolean settled = new AtomicBoolean(false);
    AtomicReference<String> connectionId = new AtomicReference<>();

    long timerId = vertx.setTimer(authTimeoutMillis, id -> {
      if (settled.compareAndSet(false, true)) {
        LOG.info("Closing connection from {}: {}", remoteAddress, CloseReason.AUTH_TIMEOUT.wireName());
        socket.close(CloseReason.AUTH_TIMEOUT.statusCode(), CloseReason.AUTH_TIMEOUT.wireName());
      }
    });

    socket.closeHandler(v -> {
      if (settled.compareAndSet(false, true)) {
        vertx.cancelTimer(timerId);
        return;
      }
      String id = connectionId.get();
      if (id != null) {
        connections.unregister(id);
      }
    });
    socket.exceptionHandler(err -> LOG.debug("WebSocket error from {}", remoteAddress, err));

    Future<CallerIdentity> authenticated;
    try {
      authenticated = authenticator.authenticate(token);
    } catch (RuntimeException e) {
      authenticated = Future.failedFuture(e);
    }

    authenticated.onComplete(ar -> context.runOnContext(v -> {
      if (!settled.compareAndSet(false, true)) {
        return;
      }
      vertx.cancelTimer(timerId);
      if (ar.failed()) {
        reject(socket, remoteAddress, new ConnectionRejectedException(
          ConnectionRejectedException.Reason.AUTHENTICATION_FAILED, "authentication failed", ar.cause()));
        return;
      }

      RealtimeConnection connection;
      try {
        connection = connections.register(ar.result(), remoteAddress, new WebSocketClientSink(socket));
      } catch (ConnectionRejectedException e) {
        reject(socket, remoteAddress, e);
        return;
      }

      String id = connection.id();
      connectionId.set(id);
      socket.textMessageHandler(text -> protocol.handle(id, text));
      socket.pongHandler(buffer -> connections.recordPong(id));
      socket.resume();
    }));
  }

  static String extractToken(String query, String authorization) {
    if (query != null && !query.isEmpty()) {
      for (String pair : query.split("&")) {
        int eq = pair.indexOf('=');
        if (eq <= 0) {
          continue;
        }
        String name = pair.substring(0, eq);
        if ("access_token".equals(name) || "token".equals(name) || "apikey".equals(name)) {
          String value = URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
          if (!value.isBlank()) {
            return value;
          }
        }
      }
    }
    if (authorization != null && authorization.regionMatches(true, 0, "Bearer ", 0, 7)) {
      String value = authorization.substring(7).trim();
      return value.isEmpty() ? null : value;
    }
    return null;
  }

  private void reject(ServerWebSocket socket, String remoteAddress, ConnectionRejectedException rejection) {
    LOG.info("Rejected connection from {}: {}", remoteAddress, rejection.reason().wireName());
    socket.writeTextMessage(ServerMessages.error(rejection.reason().wireName(), rejection.getMessage()).encode());
    socket.close(REJECTED_STATUS, rejection.reason().wireName());
  }
}
