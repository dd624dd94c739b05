package dev.henneberger.vertx.realtime.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConnectionManagerTest {

  private Vertx vertx;
  private SubscriptionRegistry registry;

  @BeforeEach
  void setUp() {
    vertx = Vertx.vertx();
    registry = new SubscriptionRegistry();
  }

  @AfterEach
  void tearDown() {
    vertx.close();
  }

  @Test
  void rejectsEleventhConnectionOfOneUser() {
    ConnectionManager manager = manager(new RealtimeOptions());
    CallerIdentity alice = CallerIdentity.of("alice", "authenticated");
    for (int i = 0; i < 10; i++) {
      manager.register(alice, "10.0.0." + i, new FakeClientSink());
    }

    ConnectionRejectedException error = assertThrows(ConnectionRejectedException.class,
      () -> manager.register(alice, "10.0.1.1", new FakeClientSink()));
    assertEquals(ConnectionRejectedException.Reason.MAX_USER_CONNECTIONS, error.reason());
    assertEquals(10, manager.size());
    assertEquals(1L, manager.rejected());

    manager.register(CallerIdentity.of("bob", "authenticated"), "10.0.1.1", new FakeClientSink());
    assertEquals(11, manager.size());
  }

  @Test
  void addressLimitAppliesToAnonymousCallersOnly() {
    ConnectionManager manager = manager(new RealtimeOptions().setMaxConnectionsPerIp(2));
    manager.register(CallerIdentity.anonymous(), "10.0.0.1", new FakeClientSink());
    manager.register(CallerIdentity.anonymous(), "10.0.0.1", new FakeClientSink());

    ConnectionRejectedException error = assertThrows(ConnectionRejectedException.class,
      () -> manager.register(CallerIdentity.anonymous(), "10.0.0.1", new FakeClientSink()));
    assertEquals(ConnectionRejectedException.Reason.MAX_IP_CONNECTIONS, error.reason());

    manager.register(CallerIdentity.of("alice", "authenticated"), "10.0.0.1", new FakeClientSink());
    manager.register(CallerIdentity.anonymous(), "10.0.0.2", new FakeClientSink());
    assertEquals(4, manager.size());
  }

  @Test
  void globalLimitAndReleasedSlots() {
    ConnectionManager manager = manager(new RealtimeOptions().setMaxConnections(2));
    RealtimeConnection first = manager.register(CallerIdentity.of("a", "authenticated"), "h", new FakeClientSink());
    manager.register(CallerIdentity.of("b", "authenticated"), "h", new FakeClientSink());

    ConnectionRejectedException error = assertThrows(ConnectionRejectedException.class,
      () -> manager.register(CallerIdentity.of("c", "authenticated"), "h", new FakeClientSink()));
    assertEquals(ConnectionRejectedException.Reason.MAX_CONNECTIONS, error.reason());

    manager.unregister(first.id());
    assertNotNull(manager.register(CallerIdentity.of("c", "authenticated"), "h", new FakeClientSink()));
  }

  @Test
  void deliversQueuedMessagesInOrder() {
    ConnectionManager manager = manager(new RealtimeOptions());
    FakeClientSink sink = new FakeClientSink();
    RealtimeConnection connection = manager.register(CallerIdentity.anonymous(), "h", sink);

    for (int i = 0; i < 5; i++) {
      assertEquals(EnqueueResult.ACCEPTED, manager.enqueue(connection.id(), "m" + i));
    }

    assertEquals(List.of("m0", "m1", "m2", "m3", "m4"), sink.written());
    assertEquals(5L, connection.delivered());
    assertEquals(ConnectionState.ACTIVE, connection.state());
  }

  @Test
  void fullQueueDropsNewMessagesWithoutBlocking() {
    ConnectionManager manager = manager(new RealtimeOptions()
      .setClientMessageQueueSize(3)
      .setSlowClientThreshold(2));
    FakeClientSink sink = new FakeClientSink();
    sink.pause();
    RealtimeConnection connection = manager.register(CallerIdentity.anonymous(), "h", sink);
    List<String> droppedFor = new ArrayList<>();
    manager.addMetricsListener(new RealtimeMetricsListener() {
      @Override
      public void onClientMessageDropped(String connectionId) {
        droppedFor.add(connectionId);
      }
    });

    for (int i = 0; i < 3; i++) {
      assertEquals(EnqueueResult.ACCEPTED, manager.enqueue(connection.id(), "m" + i));
    }
    assertEquals(EnqueueResult.QUEUE_FULL, manager.enqueue(connection.id(), "m3"));
    assertEquals(List.of(connection.id()), droppedFor);
    assertEquals(1L, manager.stats().getLong("messages_dropped"));

    sink.resume();
    assertEquals(List.of("m0", "m1", "m2"), sink.written());
    assertEquals(0, connection.queueDepth());
  }

  @Test
  void evictsSlowConsumerOnceTimeoutIsReached() {
    ConnectionManager manager = manager(slowClientOptions());
    FakeClientSink sink = new FakeClientSink();
    sink.pause();
    RealtimeConnection connection = manager.register(CallerIdentity.of("alice", "authenticated"), "h", sink);
    registry.add(Subscription.forTable("s1", connection.id(), "public", "orders", null, null));
    fill(manager, connection, 8);

    assertTrue(manager.checkSlowClients(1_000L).isEmpty());
    assertEquals(ConnectionState.SLOW, connection.state());
    assertTrue(manager.checkSlowClients(1_999L).isEmpty());

    assertEquals(List.of(connection.id()), manager.checkSlowClients(2_000L));
    assertEquals(ConnectionState.CLOSED, connection.state());
    assertEquals(CloseReason.SLOW_CONSUMER, connection.closeReason());
    assertEquals(Short.valueOf((short) 1008), sink.closeStatus());
    assertEquals("slow_consumer", sink.closeReason());
    assertEquals(0, connection.queueDepth());
    assertNull(manager.get(connection.id()));
    assertTrue(registry.subscriptionsOf(connection.id()).isEmpty());
    assertEquals(EnqueueResult.UNKNOWN_CONNECTION, manager.enqueue(connection.id(), "late"));
    assertEquals(1L, manager.slowClientsDisconnected());
  }

  @Test
  void slowConsumerThatCatchesUpIsKept() {
    ConnectionManager manager = manager(slowClientOptions());
    FakeClientSink sink = new FakeClientSink();
    sink.pause();
    RealtimeConnection connection = manager.register(CallerIdentity.of("alice", "authenticated"), "h", sink);
    fill(manager, connection, 8);

    manager.checkSlowClients(1_000L);
    assertEquals(ConnectionState.SLOW, connection.state());

    sink.resume();
    assertTrue(manager.checkSlowClients(1_500L).isEmpty());
    assertEquals(ConnectionState.ACTIVE, connection.state());

    sink.pause();
    fill(manager, connection, 8);
    assertTrue(manager.checkSlowClients(2_500L).isEmpty());
    assertTrue(manager.checkSlowClients(3_000L).isEmpty());
    assertEquals(ConnectionState.SLOW, connection.state());
  }

  @Test
  void closesConnectionThatStopsAnsweringPings() {
    ConnectionManager manager = manager(new RealtimeOptions().setPingIntervalMs(100L).setPongTimeoutMs(300L));
    FakeClientSink sink = new FakeClientSink();
    RealtimeConnection connection = manager.register(CallerIdentity.anonymous(), "h", sink);
    long t0 = connection.createdAt();

    assertTrue(manager.checkHeartbeats(t0 + 50L).isEmpty());
    assertEquals(0, sink.pings());
    assertTrue(manager.checkHeartbeats(t0 + 100L).isEmpty());
    assertEquals(1, sink.pings());
    assertTrue(manager.checkHeartbeats(t0 + 200L).isEmpty());
    assertEquals(2, sink.pings());

    assertEquals(List.of(connection.id()), manager.checkHeartbeats(t0 + 400L));
    assertEquals(CloseReason.HEARTBEAT_TIMEOUT, connection.closeReason());
    assertEquals("heartbeat_timeout", sink.closeReason());
    assertEquals(1L, manager.heartbeatTimeouts());
  }

  @Test
  void pongKeepsConnectionAlive() {
    ConnectionManager manager = manager(new RealtimeOptions().setPingIntervalMs(100L).setPongTimeoutMs(300L));
    RealtimeConnection connection = manager.register(CallerIdentity.anonymous(), "h", new FakeClientSink());
    long t0 = connection.createdAt();

    manager.checkHeartbeats(t0 + 100L);
    manager.recordActivity(connection.id(), t0 + 350L);
    assertTrue(manager.checkHeartbeats(t0 + 400L).isEmpty());
    assertTrue(connection.isOpen());
  }

  @Test
  void closeRunsListenersAndIsIdempotent() {
    ConnectionManager manager = manager(new RealtimeOptions());
    List<String> closed = new ArrayList<>();
    manager.onConnectionClosed(connection -> closed.add(connection.id()));
    FakeClientSink sink = new FakeClientSink();
    RealtimeConnection connection = manager.register(CallerIdentity.anonymous(), "h", sink);

    manager.unregister(connection.id());
    assertFalse(manager.close(connection.id(), CloseReason.NORMAL));

    assertEquals(List.of(connection.id()), closed);
    assertEquals(ConnectionState.CLOSED, connection.state());
    assertNull(sink.closeStatus());
    assertEquals(EnqueueResult.UNKNOWN_CONNECTION, manager.enqueue(connection.id(), "x"));
  }

  @Test
  void shutdownClosesEveryConnection() {
    ConnectionManager manager = manager(new RealtimeOptions());
    FakeClientSink sink = new FakeClientSink();
    sink.pause();
    RealtimeConnection connection = manager.register(CallerIdentity.anonymous(), "h", sink);
    manager.enqueue(connection.id(), "a");
    manager.enqueue(connection.id(), "b");
    sink.resume();
    sink.pause();
    manager.enqueue(connection.id(), "c");

    RealtimeConnection other = manager.register(CallerIdentity.anonymous(), "h", new FakeClientSink());
    sink.resume();
    manager.close();

    assertEquals(List.of("a", "b", "c"), sink.written());
    assertEquals(Short.valueOf((short) 1001), sink.closeStatus());
    assertEquals(0, manager.size());
    assertEquals(CloseReason.SHUTDOWN, other.closeReason());
  }

  @Test
  void updateIdentityMovesCallerSlot() {
    ConnectionManager manager = manager(new RealtimeOptions().setMaxConnectionsPerUser(1));
    RealtimeConnection connection = manager.register(CallerIdentity.of("alice", "authenticated"), "h", new FakeClientSink());

    CallerIdentity previous = manager.updateIdentity(connection.id(), CallerIdentity.of("bob", "authenticated"));

    assertEquals("alice", previous.callerId());
    assertEquals("bob", connection.identity().callerId());
    assertNotNull(manager.register(CallerIdentity.of("alice", "authenticated"), "h", new FakeClientSink()));
    assertThrows(ConnectionRejectedException.class,
      () -> manager.register(CallerIdentity.of("bob", "authenticated"), "h", new FakeClientSink()));
  }

  @Test
  void statsReportConnectionsByState() {
    ConnectionManager manager = manager(slowClientOptions());
    FakeClientSink slowSink = new FakeClientSink();
    slowSink.pause();
    RealtimeConnection slow = manager.register(CallerIdentity.of("a", "authenticated"), "h", slowSink);
    manager.register(CallerIdentity.of("b", "authenticated"), "h", new FakeClientSink());
    fill(manager, slow, 6);
    manager.checkSlowClients(0L);

    JsonObject stats = manager.stats();
    assertEquals(2, stats.getInteger("connections"));
    assertEquals(1, stats.getJsonObject("by_state").getInteger("slow"));
    assertEquals(1, stats.getJsonObject("by_state").getInteger("active"));
    assertEquals(6L, stats.getLong("queued_messages"));
    assertEquals(2, stats.getJsonArray("connection_details").size());
  }

  private ConnectionManager manager(RealtimeOptions options) {
    return new ConnectionManager(vertx, options, registry);
  }

  private static RealtimeOptions slowClientOptions() {
    return new RealtimeOptions()
      .setClientMessageQueueSize(10)
      .setSlowClientThreshold(5)
      .setSlowClientTimeoutMs(1_000L);
  }

  private static void fill(ConnectionManager manager, RealtimeConnection connection, int count) {
    for (int i = 0; i < count; i++) {
      manager.enqueue(connection.id(), "m" + i);
    }
  }
}
