package dev.henneberger.vertx.realtime.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RealtimeProtocolHandlerTest {

  private static final Set<String> ENABLED_TABLES = Set.of("public.orders", "public.messages");

  private Vertx vertx;
  private SubscriptionRegistry registry;
  private ConnectionManager connections;
  private PresenceTracker presence;
  private AuthorizationGate gate;
  private RealtimeProtocolHandler handler;

  @BeforeEach
  void setUp() {
    vertx = Vertx.vertx();
    RealtimeOptions options = new RealtimeOptions().setMessageSizeLimit(1024);
    registry = new SubscriptionRegistry();
    connections = new ConnectionManager(vertx, options, registry);
    presence = new PresenceTracker(connections, registry);
    gate = new AuthorizationGate((caller, table, row) -> Future.succeededFuture(true), new RlsDecisionCache(100), options);
    TableCatalog catalog = (schema, table) -> {
      if ("broken".equals(schema)) {
        return Future.failedFuture(new IllegalStateException("catalog unavailable"));
      }
      return Future.succeededFuture(ENABLED_TABLES.contains(schema + "." + table));
    };
    ConnectionAuthenticator authenticator = token -> "good-token".equals(token)
      ? Future.succeededFuture(CallerIdentity.of("alice", "authenticated"))
      : Future.failedFuture(new IllegalArgumentException("bad token"));
    handler = new RealtimeProtocolHandler(connections, registry, presence, catalog, authenticator, gate, options);
  }

  @AfterEach
  void tearDown() {
    vertx.close();
  }

  @Test
  void subscribeRegistersTableSubscriptionWithFilterAndOps() {
    FakeClientSink sink = new FakeClientSink();
    RealtimeConnection connection = connect("alice", sink);

    send(connection, new JsonObject()
      .put("type", "subscribe")
      .put("channel", "public.orders")
      .put("filter", "user_id=eq.42")
      .put("ops", new JsonArray().add("insert").add("update")));

    JsonObject reply = lastMessage(sink);
    assertEquals("subscribed", reply.getString("type"));
    assertEquals("public.orders", reply.getString("channel"));
    Subscription subscription = registry.get(reply.getString("id"));
    assertNotNull(subscription);
    assertEquals(EnumSet.of(ChangeEvent.Operation.INSERT, ChangeEvent.Operation.UPDATE), subscription.operations());
    assertEquals(1, registry.match(ChangeEvents.insert("orders", 1, new JsonObject().put("user_id", 42))).size());
    assertTrue(registry.match(ChangeEvents.insert("orders", 2, new JsonObject().put("user_id", 7))).isEmpty());
  }

  @Test
  void subscribeErrorsKeepConnectionOpen() {
    FakeClientSink sink = new FakeClientSink();
    RealtimeConnection connection = connect("alice", sink);

    send(connection, subscribe("public.orders").put("filter", "user_id=between.1"));
    assertError(sink, SubscriptionException.INVALID_FILTER);

    send(connection, subscribe("public.audit_log"));
    assertError(sink, SubscriptionException.TABLE_NOT_ENABLED);

    send(connection, subscribe("broken.orders"));
    assertError(sink, RealtimeProtocolHandler.INTERNAL_ERROR);

    send(connection, subscribe("public.bad-name"));
    assertError(sink, SubscriptionException.INVALID_CHANNEL);

    send(connection, subscribe("public.orders").put("ops", new JsonArray().add("truncate")));
    assertError(sink, SubscriptionException.INVALID_MESSAGE);

    assertEquals(0, registry.size());
    assertTrue(connection.isOpen());
  }

  @Test
  void unsubscribeOnlyRemovesOwnSubscriptions() {
    FakeClientSink aliceSink = new FakeClientSink();
    FakeClientSink bobSink = new FakeClientSink();
    RealtimeConnection alice = connect("alice", aliceSink);
    RealtimeConnection bob = connect("bob", bobSink);
    send(alice, subscribe("public.orders"));
    String id = lastMessage(aliceSink).getString("id");

    send(bob, new JsonObject().put("type", "unsubscribe").put("id", id));
    assertError(bobSink, SubscriptionException.UNKNOWN_SUBSCRIPTION);
    assertNotNull(registry.get(id));

    send(alice, new JsonObject().put("type", "unsubscribe").put("id", id));
    assertEquals(new JsonObject().put("type", "unsubscribed").put("id", id), lastMessage(aliceSink));
    assertEquals(0, registry.size());

    send(alice, new JsonObject().put("type", "unsubscribe").put("id", id));
    assertError(aliceSink, SubscriptionException.UNKNOWN_SUBSCRIPTION);
  }

  @Test
  void heartbeatIsAnsweredAndCountsAsActivity() {
    FakeClientSink sink = new FakeClientSink();
    RealtimeConnection connection = connect("alice", sink);

    send(connection, new JsonObject().put("type", "heartbeat"));

    assertEquals("heartbeat", lastMessage(sink).getString("type"));
  }

  @Test
  void rejectsMalformedAndOversizedMessages() {
    FakeClientSink sink = new FakeClientSink();
    RealtimeConnection connection = connect("alice", sink);

    handler.handle(connection.id(), "not json");
    assertError(sink, SubscriptionException.INVALID_MESSAGE);

    handler.handle(connection.id(), new JsonObject().put("type", "dance").encode());
    assertError(sink, SubscriptionException.INVALID_MESSAGE);

    StringBuilder padding = new StringBuilder();
    for (int i = 0; i < 2_000; i++) {
      padding.append('x');
    }
    handler.handle(connection.id(), new JsonObject().put("type", "heartbeat").put("pad", padding.toString()).encode());
    assertError(sink, SubscriptionException.MESSAGE_TOO_LARGE);
    assertTrue(connection.isOpen());
  }

  @Test
  void presenceJoinSubscribesAndReturnsState() {
    FakeClientSink aliceSink = new FakeClientSink();
    FakeClientSink bobSink = new FakeClientSink();
    RealtimeConnection alice = connect("alice", aliceSink);
    RealtimeConnection bob = connect("bob", bobSink);

    send(alice, presenceJoin("lobby"));
    send(bob, presenceJoin("lobby"));

    assertEquals(1, bobSink.messagesOfType("subscribed").size());
    JsonObject state = lastMessage(bobSink);
    assertEquals("presence_state", state.getString("type"));
    assertEquals(2, state.getJsonArray("members").size());
    assertEquals("bob", aliceSink.messagesOfType("presence_join").get(0).getJsonObject("member").getString("caller_id"));

    String bobSubscription = bobSink.messagesOfType("subscribed").get(0).getString("id");
    send(bob, new JsonObject().put("type", "unsubscribe").put("id", bobSubscription));
    assertEquals(1, presence.members("lobby").size());
    assertEquals(1, aliceSink.messagesOfType("presence_leave").size());
  }

  @Test
  void broadcastReachesOtherSubscribersOnce() {
    FakeClientSink aliceSink = new FakeClientSink();
    FakeClientSink bobSink = new FakeClientSink();
    FakeClientSink carolSink = new FakeClientSink();
    RealtimeConnection alice = connect("alice", aliceSink);
    RealtimeConnection bob = connect("bob", bobSink);
    RealtimeConnection carol = connect("carol", carolSink);
    send(alice, subscribe("chat"));
    send(bob, subscribe("chat"));
    send(bob, subscribe("chat"));

    send(alice, new JsonObject().put("type", "broadcast").put("channel", "chat")
      .put("payload", new JsonObject().put("text", "hi")));
    send(carol, new JsonObject().put("type", "broadcast").put("channel", "chat").put("payload", "x"));

    List<JsonObject> received = bobSink.messagesOfType("broadcast");
    assertEquals(1, received.size());
    assertEquals("hi", received.get(0).getJsonObject("payload").getString("text"));
    assertTrue(aliceSink.messagesOfType("broadcast").isEmpty());
    assertError(carolSink, SubscriptionException.INVALID_CHANNEL);
  }

  @Test
  void accessTokenRefreshReplacesIdentity() {
    FakeClientSink sink = new FakeClientSink();
    RealtimeConnection connection = connections.register(CallerIdentity.anonymous(), "h", sink);
    gate.isAllowed(CallerIdentity.anonymous(), ChangeEvents.insert("orders", 1, new JsonObject()), 0L);
    assertEquals(1, gate.cache().size());

    send(connection, new JsonObject().put("type", "access_token").put("token", "good-token"));

    assertEquals(ServerMessages.accessTokenAccepted(), lastMessage(sink));
    assertEquals("alice", connection.identity().callerId());
    assertEquals(0, gate.cache().size());

    send(connection, new JsonObject().put("type", "access_token").put("token", "forged"));
    assertError(sink, SubscriptionException.INVALID_TOKEN);
    assertEquals("alice", connection.identity().callerId());
  }

  @Test
  void ignoresFramesForUnknownConnections() {
    assertTrue(handler.handle("missing", "{}").succeeded());
  }

  private RealtimeConnection connect(String callerId, FakeClientSink sink) {
    return connections.register(CallerIdentity.of(callerId, "authenticated"), "h", sink);
  }

  private void send(RealtimeConnection connection, JsonObject message) {
    Future<Void> handled = handler.handle(connection.id(), message.encode());
    assertTrue(handled.succeeded());
  }

  private static JsonObject subscribe(String channel) {
    return new JsonObject().put("type", "subscribe").put("channel", channel);
  }

  private static JsonObject presenceJoin(String channel) {
    return new JsonObject().put("type", "presence").put("event", "join").put("channel", channel);
  }

  private static JsonObject lastMessage(FakeClientSink sink) {
    List<JsonObject> messages = sink.messages();
    assertFalse(messages.isEmpty());
    return messages.get(messages.size() - 1);
  }

  private static void assertError(FakeClientSink sink, String code) {
    JsonObject reply = lastMessage(sink);
    assertEquals("error", reply.getString("type"));
    assertEquals(code, reply.getString("code"));
  }
}
