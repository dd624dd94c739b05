package dev.henneberger.vertx.realtime.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PresenceTrackerTest {

  private Vertx vertx;
  private SubscriptionRegistry registry;
  private ConnectionManager connections;
  private PresenceTracker presence;

  @BeforeEach
  void setUp() {
    vertx = Vertx.vertx();
    registry = new SubscriptionRegistry();
    connections = new ConnectionManager(vertx, new RealtimeOptions(), registry);
    presence = new PresenceTracker(connections, registry);
  }

  @AfterEach
  void tearDown() {
    vertx.close();
  }

  @Test
  void joinIsAnnouncedToOtherSubscribers() {
    FakeClientSink aliceSink = new FakeClientSink();
    FakeClientSink bobSink = new FakeClientSink();
    RealtimeConnection alice = join("alice", aliceSink);
    RealtimeConnection bob = connect("bob", bobSink);
    registry.add(Subscription.forChannel("bob-room", bob.id(), "room-1"));

    List<PresenceRecord> members = presence.join("room-1", bob.id(), new JsonObject().put("status", "online"));

    assertEquals(2, members.size());
    List<JsonObject> joins = aliceSink.messagesOfType("presence_join");
    assertEquals(1, joins.size());
    assertEquals("bob", joins.get(0).getJsonObject("member").getString("caller_id"));
    assertEquals("online", joins.get(0).getJsonArray("joined").getJsonObject(0)
      .getJsonObject("meta").getString("status"));
    assertTrue(bobSink.messagesOfType("presence_join").isEmpty());
    assertEquals(alice.id(), presence.members("room-1").get(0).connectionId());
  }

  @Test
  void leaveIsAnnouncedAndRemovesRecord() {
    FakeClientSink aliceSink = new FakeClientSink();
    join("alice", aliceSink);
    RealtimeConnection bob = join("bob", new FakeClientSink());

    assertTrue(presence.leave("room-1", bob.id()));
    assertFalse(presence.leave("room-1", bob.id()));

    List<JsonObject> leaves = aliceSink.messagesOfType("presence_leave");
    assertEquals(1, leaves.size());
    assertEquals("bob", leaves.get(0).getJsonArray("left").getJsonObject(0).getString("key"));
    assertEquals(1, presence.members("room-1").size());
  }

  @Test
  void closingConnectionLeavesEveryChannel() {
    FakeClientSink aliceSink = new FakeClientSink();
    join("alice", aliceSink);
    RealtimeConnection bob = join("bob", new FakeClientSink());
    registry.add(Subscription.forChannel("bob-room-2", bob.id(), "room-2"));
    presence.join("room-2", bob.id(), new JsonObject());

    connections.unregister(bob.id());

    assertEquals(1, presence.members("room-1").size());
    assertTrue(presence.members("room-2").isEmpty());
    assertEquals(1, aliceSink.messagesOfType("presence_leave").size());
  }

  @Test
  void rejoinReplacesRecordOfSameCaller() {
    RealtimeConnection alice = join("alice", new FakeClientSink());

    presence.join("room-1", alice.id(), new JsonObject().put("status", "away"));

    List<PresenceRecord> members = presence.members("room-1");
    assertEquals(1, members.size());
    assertEquals("away", members.get(0).meta().getString("status"));
  }

  @Test
  void anonymousMembersAreKeyedByConnection() {
    RealtimeConnection first = connections.register(CallerIdentity.anonymous(), "h", new FakeClientSink());
    RealtimeConnection second = connections.register(CallerIdentity.anonymous(), "h", new FakeClientSink());

    presence.join("room-1", first.id(), new JsonObject());
    presence.join("room-1", second.id(), new JsonObject());

    assertEquals(2, presence.members("room-1").size());
  }

  @Test
  void concurrentJoinsAndLeavesKeepEveryFinalMember() throws Exception {
    int members = 8;
    List<RealtimeConnection> joined = new ArrayList<>();
    for (int i = 0; i < members; i++) {
      joined.add(connect("user-" + i, new FakeClientSink()));
    }

    CountDownLatch start = new CountDownLatch(1);
    List<Thread> threads = new ArrayList<>();
    for (RealtimeConnection connection : joined) {
      Thread thread = new Thread(() -> {
        try {
          start.await();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return;
        }
        for (int round = 0; round < 500; round++) {
          presence.join("room-1", connection.id(), new JsonObject());
          presence.leave("room-1", connection.id());
        }
        presence.join("room-1", connection.id(), new JsonObject());
      });
      thread.start();
      threads.add(thread);
    }
    start.countDown();
    for (Thread thread : threads) {
      thread.join(TimeUnit.SECONDS.toMillis(10));
    }

    assertEquals(members, presence.members("room-1").size());
  }

  @Test
  void joinRequiresKnownConnection() {
    assertThrows(IllegalStateException.class, () -> presence.join("room-1", "missing", new JsonObject()));
  }

  private RealtimeConnection connect(String callerId, FakeClientSink sink) {
    return connections.register(CallerIdentity.of(callerId, "authenticated"), "h", sink);
  }

  private RealtimeConnection join(String callerId, FakeClientSink sink) {
    RealtimeConnection connection = connect(callerId, sink);
    registry.add(Subscription.forChannel(callerId + "-room", connection.id(), "room-1"));
    presence.join("room-1", connection.id(), new JsonObject());
    return connection;
  }
}
