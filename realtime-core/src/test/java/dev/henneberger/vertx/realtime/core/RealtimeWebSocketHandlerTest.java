package dev.henneberger.vertx.realtime.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.http.WebSocket;
import io.vertx.core.http.WebSocketClient;
import io.vertx.core.http.WebSocketClientOptions;
import io.vertx.core.json.JsonObject;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class RealtimeWebSocketHandlerTest {

  @Test
  void readsTokenFromQueryParameters() {
    assertEquals("abc", RealtimeWebSocketHandler.extractToken("access_token=abc", null));
    assertEquals("abc", RealtimeWebSocketHandler.extractToken("vsn=1.0.0&token=abc", null));
    assertEquals("key", RealtimeWebSocketHandler.extractToken("apikey=key&x=1", null));
    assertEquals("a b", RealtimeWebSocketHandler.extractToken("access_token=a%20b", null));
  }

  @Test
  void fallsBackToBearerHeader() {
    assertEquals("jwt", RealtimeWebSocketHandler.extractToken("vsn=1", "Bearer jwt"));
    assertEquals("jwt", RealtimeWebSocketHandler.extractToken(null, "bearer  jwt "));
    assertEquals("query", RealtimeWebSocketHandler.extractToken("token=query", "Bearer header"));
  }

  @Test
  void missingTokenIsNull() {
    assertNull(RealtimeWebSocketHandler.extractToken(null, null));
    assertNull(RealtimeWebSocketHandler.extractToken("token=", null));
    assertNull(RealtimeWebSocketHandler.extractToken("", "Basic dXNlcjpwYXNz"));
    assertNull(RealtimeWebSocketHandler.extractToken(null, "Bearer "));
  }

  @Test
  void largeMessagesReachTheProtocolHandlerOverARealSocket() throws Exception {
    Vertx vertx = Vertx.vertx();
    RealtimeOptions options = new RealtimeOptions().setMessageSizeLimit(270_000);
    ConnectionAuthenticator authenticator = token -> Future.succeededFuture(CallerIdentity.of(token, "authenticated"));
    RealtimeEngine engine = new RealtimeEngine(vertx, options, new FakeNotificationSource(), authenticator,
      (caller, table, row) -> Future.succeededFuture(true), TableCatalog.allowAll());
    try {
      engine.start().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
      HttpServer server = vertx.createHttpServer(options.applyTo(new HttpServerOptions()))
        .webSocketHandler(engine.webSocketHandler())
        .listen(0, "localhost")
        .toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);

      WebSocketClient client = vertx.createWebSocketClient(new WebSocketClientOptions()
        .setMaxFrameSize(1024 * 1024)
        .setMaxMessageSize(1024 * 1024));
      BlockingQueue<JsonObject> replies = new LinkedBlockingQueue<>();
      WebSocket socket = client.connect(server.actualPort(), "localhost", "/realtime?token=alice")
        .toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
      socket.textMessageHandler(text -> replies.add(new JsonObject(text)));

      socket.writeTextMessage(new JsonObject().put("type", "heartbeat").put("pad", "x".repeat(265_000)).encode());
      JsonObject heartbeat = replies.poll(10, TimeUnit.SECONDS);
      assertEquals("heartbeat", heartbeat.getString("type"));

      socket.writeTextMessage(new JsonObject().put("type", "heartbeat").put("pad", "x".repeat(280_000)).encode());
      JsonObject error = replies.poll(10, TimeUnit.SECONDS);
      assertEquals("error", error.getString("type"));
      assertEquals(SubscriptionException.MESSAGE_TOO_LARGE, error.getString("code"));
    } finally {
      engine.close();
      vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }
  }
}
