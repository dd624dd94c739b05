package dev.henneberger.vertx.realtime.core;

import io.vertx.core.json.JsonObject;
import java.time.Duration;

final class RealtimeOptionsConverter {

  private RealtimeOptionsConverter() {
  }

  static void fromJson(JsonObject json, RealtimeOptions options) {
    if (json == null) {
      return;
    }

    if (json.containsKey("maxConnections")) {
      options.setMaxConnections(json.getInteger("maxConnections"));
    }
    if (json.containsKey("maxConnectionsPerUser")) {
      options.setMaxConnectionsPerUser(json.getInteger("maxConnectionsPerUser"));
    }
    if (json.containsKey("maxConnectionsPerIp")) {
      options.setMaxConnectionsPerIp(json.getInteger("maxConnectionsPerIp"));
    }
    if (json.containsKey("pingIntervalMs")) {
      options.setPingIntervalMs(json.getLong("pingIntervalMs"));
    }
    if (json.containsKey("pongTimeoutMs")) {
      options.setPongTimeoutMs(json.getLong("pongTimeoutMs"));
    }
    if (json.containsKey("messageSizeLimit")) {
      options.setMessageSizeLimit(json.getInteger("messageSizeLimit"));
    }
    if (json.containsKey("channelBufferSize")) {
      options.setChannelBufferSize(json.getInteger("channelBufferSize"));
    }
    if (json.containsKey("rlsCacheSize")) {
      options.setRlsCacheSize(json.getInteger("rlsCacheSize"));
    }
    if (json.containsKey("rlsCacheTtlMs")) {
      options.setRlsCacheTtlMs(json.getLong("rlsCacheTtlMs"));
    }
    if (json.containsKey("rlsNegativeTtlMs")) {
      options.setRlsNegativeTtlMs(json.getLong("rlsNegativeTtlMs"));
    }
    if (json.containsKey("authorizationTimeoutMs")) {
      options.setAuthorizationTimeoutMs(json.getLong("authorizationTimeoutMs"));
    }
    if (json.containsKey("listenerPoolSize")) {
      options.setListenerPoolSize(json.getInteger("listenerPoolSize"));
    }
    if (json.containsKey("notificationWorkers")) {
      options.setNotificationWorkers(json.getInteger("notificationWorkers"));
    }
    if (json.containsKey("notificationQueueSize")) {
      options.setNotificationQueueSize(json.getInteger("notificationQueueSize"));
    }
    if (json.containsKey("clientMessageQueueSize")) {
      options.setClientMessageQueueSize(json.getInteger("clientMessageQueueSize"));
    }
    if (json.containsKey("slowClientThreshold")) {
      options.setSlowClientThreshold(json.getInteger("slowClientThreshold"));
    }
    if (json.containsKey("slowClientTimeoutMs")) {
      options.setSlowClientTimeoutMs(json.getLong("slowClientTimeoutMs"));
    }
    if (json.containsKey("slowClientCheckIntervalMs")) {
      options.setSlowClientCheckIntervalMs(json.getLong("slowClientCheckIntervalMs"));
    }
    if (json.containsKey("dedupWindowMs")) {
      options.setDedupWindowMs(json.getLong("dedupWindowMs"));
    }
    if (json.containsKey("authTimeoutMs")) {
      options.setAuthTimeoutMs(json.getLong("authTimeoutMs"));
    }
    if (json.containsKey("notifyChannel")) {
      options.setNotifyChannel(json.getString("notifyChannel"));
    }

    JsonObject reconnectJson = json.getJsonObject("reconnectPolicy");
    if (reconnectJson != null) {
      options.setReconnectPolicy(BackoffPolicy.exponential()
        .setInitialDelay(Duration.ofMillis(reconnectJson.getLong("initialDelayMs", 500L)))
        .setMaxDelay(Duration.ofMillis(reconnectJson.getLong("maxDelayMs", 30000L)))
        .setMultiplier(reconnectJson.getDouble("multiplier", 2.0d))
        .setJitter(reconnectJson.getDouble("jitter", 0.2d))
        .setMaxAttempts(reconnectJson.getLong("maxAttempts", 0L)));
    }
  }

  static void toJson(RealtimeOptions options, JsonObject json) {
    json.put("maxConnections", options.getMaxConnections());
    json.put("maxConnectionsPerUser", options.getMaxConnectionsPerUser());
    json.put("maxConnectionsPerIp", options.getMaxConnectionsPerIp());
    json.put("pingIntervalMs", options.getPingIntervalMs());
    json.put("pongTimeoutMs", options.getPongTimeoutMs());
    json.put("messageSizeLimit", options.getMessageSizeLimit());
    json.put("channelBufferSize", options.getChannelBufferSize());
    json.put("rlsCacheSize", options.getRlsCacheSize());
    json.put("rlsCacheTtlMs", options.getRlsCacheTtlMs());
    json.put("rlsNegativeTtlMs", options.getRlsNegativeTtlMs());
    json.put("authorizationTimeoutMs", options.getAuthorizationTimeoutMs());
    json.put("listenerPoolSize", options.getListenerPoolSize());
    json.put("notificationWorkers", options.getNotificationWorkers());
    json.put("notificationQueueSize", options.getNotificationQueueSize());
    json.put("clientMessageQueueSize", options.getClientMessageQueueSize());
    json.put("slowClientThreshold", options.getSlowClientThreshold());
    json.put("slowClientTimeoutMs", options.getSlowClientTimeoutMs());
    json.put("slowClientCheckIntervalMs", options.getSlowClientCheckIntervalMs());
    json.put("dedupWindowMs", options.getDedupWindowMs());
    json.put("authTimeoutMs", options.getAuthTimeoutMs());
    json.put("notifyChannel", options.getNotifyChannel());

    BackoffPolicy reconnect = options.getReconnectPolicy();
    if (reconnect != null) {
      json.put("reconnectPolicy", new JsonObject()
        .put("initialDelayMs", reconnect.getInitialDelay().toMillis())
        .put("maxDelayMs", reconnect.getMaxDelay().toMillis())
        .put("multiplier", reconnect.getMultiplier())
        .put("jitter", reconnect.getJitter())
        .put("maxAttempts", reconnect.getMaxAttempts()));
    }
  }
}
