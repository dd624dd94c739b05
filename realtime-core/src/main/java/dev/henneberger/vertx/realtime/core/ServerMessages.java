package dev.henneberger.vertx.realtime.core;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * Builders for the JSON envelopes the server sends to clients.
 */
public final class ServerMessages {

  private ServerMessages() {
  }

  public static JsonObject change(String subscriptionId, ChangeEvent event) {
    return new JsonObject()
      .put("type", "change")
      .put("subscription_id", subscriptionId)
      .put("op", event.getOperation().wireName())
      .put("schema", event.getSchema())
      .put("table", event.getTable())
      .put("row", event.getOperation() == ChangeEvent.Operation.DELETE ? null : event.newRowJson())
      .put("old_row", event.oldRowJson())
      .put("seq", event.hasSequence() ? event.getSequence() : null)
      .put("commit_timestamp", event.getCommitTimestamp() == null ? null : event.getCommitTimestamp().toString());
  }

  public static JsonObject subscribed(String subscriptionId, String channel) {
    return new JsonObject()
      .put("type", "subscribed")
      .put("id", subscriptionId)
      .put("channel", channel);
  }

  public static JsonObject unsubscribed(String subscriptionId) {
    return new JsonObject()
      .put("type", "unsubscribed")
      .put("id", subscriptionId);
  }

  public static JsonObject error(String code, String message) {
    return new JsonObject()
      .put("type", "error")
      .put("code", code)
      .put("message", message);
  }

  public static JsonObject heartbeat() {
    return new JsonObject().put("type", "heartbeat");
  }

  public static JsonObject accessTokenAccepted() {
    return new JsonObject()
      .put("type", "access_token")
      .put("status", "ok");
  }

  public static JsonObject broadcast(String channel, Object payload) {
    return new JsonObject()
      .put("type", "broadcast")
      .put("channel", channel)
      .put("payload", payload);
  }

  public static JsonObject presenceState(String channel, JsonArray members) {
    return new JsonObject()
      .put("type", "presence_state")
      .put("channel", channel)
      .put("members", members);
  }

  public static JsonObject presenceJoin(String channel, JsonObject member) {
    return new JsonObject()
      .put("type", "presence_join")
      .put("channel", channel)
      .put("member", member)
      .put("joined", new JsonArray().add(member))
      .put("left", new JsonArray());
  }

  public static JsonObject presenceLeave(String channel, JsonObject member) {
    return new JsonObject()
      .put("type", "presence_leave")
      .put("channel", channel)
      .put("member", member)
      .put("joined", new JsonArray())
      .put("left", new JsonArray().add(member));
  }
}
