package dev.henneberger.vertx.realtime.core;

import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.Objects;

/**
 * One member of a presence channel. There is at most one record per channel and member key.
 */
public final class PresenceRecord {
  private final String channel;
  private final String memberKey;
  private final String callerId;
  private final String connectionId;
  private final JsonObject meta;
  private final Instant joinedAt;

  public PresenceRecord(String channel,
                        String memberKey,
                        String callerId,
                        String connectionId,
                        JsonObject meta,
                        Instant joinedAt) {
    this.channel = Objects.requireNonNull(channel, "channel");
    this.memberKey = Objects.requireNonNull(memberKey, "memberKey");
    this.callerId = callerId;
    this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
    this.meta = meta == null ? new JsonObject() : meta.copy();
    this.joinedAt = Objects.requireNonNull(joinedAt, "joinedAt");
  }

  public String channel() {
    return channel;
  }

  /**
   * Caller id for authenticated callers, connection id for anonymous ones.
   */
  public String memberKey() {
    return memberKey;
  }

  public String callerId() {
    return callerId;
  }

  public String connectionId() {
    return connectionId;
  }

  public JsonObject meta() {
    return meta.copy();
  }

  public Instant joinedAt() {
    return joinedAt;
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("key", memberKey)
      .put("caller_id", callerId)
      .put("meta", meta.copy())
      .put("joined_at", joinedAt.toString());
  }
}
