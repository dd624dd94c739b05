package dev.henneberger.vertx.realtime.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RealtimeEngineTest {

  private Vertx vertx;
  private FakeNotificationSource source;
  private RealtimeEngine engine;

  @BeforeEach
  void setUp() throws Exception {
    vertx = Vertx.vertx();
    source = new FakeNotificationSource();
    RealtimeOptions options = new RealtimeOptions()
      .setListenerPoolSize(3)
      .setNotificationWorkers(2)
      .setReconnectPolicy(BackoffPolicy.exponential()
        .setInitialDelay(Duration.ofMillis(10))
        .setMaxDelay(Duration.ofMillis(50))
        .setJitter(0.0d));
    ConnectionAuthenticator authenticator = token -> Future.succeededFuture(
      token == null ? CallerIdentity.anonymous() : CallerIdentity.of(token, "authenticated"));
    RowAuthorizer ownerOnly = (caller, table, row) ->
      Future.succeededFuture(!caller.isAnonymous() && caller.callerId().equals(row.get("owner")));
    engine = new RealtimeEngine(vertx, options, source, authenticator, ownerOnly, TableCatalog.allowAll());
    engine.start().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    waitUntil(() -> source.liveSessions() == 3);
  }

  @AfterEach
  void tearDown() throws Exception {
    engine.close();
    vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
  }

  @Test
  void deliversEachChangeOnceDespiteRedundantListeners() throws Exception {
    FakeClientSink sink = new FakeClientSink();
    RealtimeConnection alice = engine.connectionManager().register(CallerIdentity.of("alice", "authenticated"), "h", sink);
    subscribe(alice, "public.orders");

    for (int seq = 1; seq <= 20; seq++) {
      source.publish(ChangeEvents.insertPayload("orders", seq, new JsonObject().put("id", seq).put("owner", "alice")));
    }

    waitUntil(() -> sink.messagesOfType("change").size() >= 20);
    Thread.sleep(200);
    List<JsonObject> changes = sink.messagesOfType("change");
    assertEquals(20, changes.size());
    List<Long> order = new ArrayList<>();
    for (JsonObject change : changes) {
      order.add(change.getLong("seq"));
    }
    List<Long> expected = new ArrayList<>();
    for (long seq = 1; seq <= 20; seq++) {
      expected.add(seq);
    }
    assertEquals(expected, order);
    assertTrue(engine.health().duplicatesSuppressed() >= 20);
  }

  @Test
  void filtersAndAuthorizationDecideWhoReceivesAChange() throws Exception {
    FakeClientSink aliceSink = new FakeClientSink();
    FakeClientSink bobSink = new FakeClientSink();
    FakeClientSink anonSink = new FakeClientSink();
    RealtimeConnection alice = engine.connectionManager().register(CallerIdentity.of("alice", "authenticated"), "h", aliceSink);
    RealtimeConnection bob = engine.connectionManager().register(CallerIdentity.of("bob", "authenticated"), "h", bobSink);
    RealtimeConnection anon = engine.connectionManager().register(CallerIdentity.anonymous(), "h", anonSink);
    subscribe(alice, "public.orders");
    subscribe(bob, "public.orders");
    subscribe(anon, "public.orders");
    engine.protocolHandler().handle(bob.id(), new JsonObject()
      .put("type", "subscribe").put("channel", "public.invoices").put("filter", "owner=eq.bob").encode());

    source.publish(ChangeEvents.insertPayload("orders", 1, new JsonObject().put("id", 1).put("owner", "alice")));
    source.publish(ChangeEvents.insertPayload("invoices", 1, new JsonObject().put("id", 9).put("owner", "bob")));

    waitUntil(() -> aliceSink.messagesOfType("change").size() == 1 && bobSink.messagesOfType("change").size() == 1);
    Thread.sleep(200);
    assertEquals("orders", aliceSink.messagesOfType("change").get(0).getString("table"));
    assertEquals("invoices", bobSink.messagesOfType("change").get(0).getString("table"));
    assertTrue(anonSink.messagesOfType("change").isEmpty());
  }

  @Test
  void healthReflectsListenerPool() throws Exception {
    assertEquals(HealthStatus.HEALTHY, engine.health().status());
    JsonObject json = engine.health().toJson();
    assertEquals("healthy", json.getString("status"));
    assertEquals(3, json.getJsonObject("listeners").getInteger("connected"));

    source.refuseConnections(true);
    source.killAllSessions();
    waitUntil(() -> engine.health().status() == HealthStatus.STALE);
  }

  private void subscribe(RealtimeConnection connection, String channel) {
    engine.protocolHandler().handle(connection.id(),
      new JsonObject().put("type", "subscribe").put("channel", channel).encode());
  }

  private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("condition not met within 10 seconds");
      }
      Thread.sleep(10);
    }
  }
}
