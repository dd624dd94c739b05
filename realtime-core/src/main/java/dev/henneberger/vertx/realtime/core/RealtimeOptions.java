package dev.henneberger.vertx.realtime.core;

import io.vertx.codegen.annotations.DataObject;
import io.vertx.codegen.annotations.GenIgnore;
import io.vertx.codegen.json.annotations.JsonGen;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.json.JsonObject;
import java.util.Objects;

/**
 * Limits, queue sizes and timeouts of the realtime engine.
 */
@DataObject
@JsonGen(publicConverter = false)
public class RealtimeOptions {

  public static final int DEFAULT_MAX_CONNECTIONS = 1000;
  public static final int DEFAULT_MAX_CONNECTIONS_PER_USER = 10;
  public static final int DEFAULT_MAX_CONNECTIONS_PER_IP = 20;
  public static final long DEFAULT_PING_INTERVAL_MS = 30_000L;
  public static final long DEFAULT_PONG_TIMEOUT_MS = 60_000L;
  public static final int DEFAULT_MESSAGE_SIZE_LIMIT = 512 * 1024;
  public static final int DEFAULT_CHANNEL_BUFFER_SIZE = 100;
  public static final int DEFAULT_RLS_CACHE_SIZE = 100_000;
  public static final long DEFAULT_RLS_CACHE_TTL_MS = 30_000L;
  public static final long DEFAULT_RLS_NEGATIVE_TTL_MS = 1_000L;
  public static final long DEFAULT_AUTHORIZATION_TIMEOUT_MS = 2_000L;
  public static final int DEFAULT_LISTENER_POOL_SIZE = 2;
  public static final int DEFAULT_NOTIFICATION_WORKERS = 4;
  public static final int DEFAULT_NOTIFICATION_QUEUE_SIZE = 1000;
  public static final int DEFAULT_CLIENT_MESSAGE_QUEUE_SIZE = 256;
  public static final int DEFAULT_SLOW_CLIENT_THRESHOLD = 100;
  public static final long DEFAULT_SLOW_CLIENT_TIMEOUT_MS = 30_000L;
  public static final long DEFAULT_SLOW_CLIENT_CHECK_INTERVAL_MS = 1_000L;
  public static final long DEFAULT_DEDUP_WINDOW_MS = 10_000L;
  public static final long DEFAULT_AUTH_TIMEOUT_MS = 10_000L;
  public static final String DEFAULT_NOTIFY_CHANNEL = "realtime_changes";

  private int maxConnections;
  private int maxConnectionsPerUser;
  private int maxConnectionsPerIp;
  private long pingIntervalMs;
  private long pongTimeoutMs;
  private int messageSizeLimit;
  private int channelBufferSize;
  private int rlsCacheSize;
  private long rlsCacheTtlMs;
  private long rlsNegativeTtlMs;
  private long authorizationTimeoutMs;
  private int listenerPoolSize;
  private int notificationWorkers;
  private int notificationQueueSize;
  private int clientMessageQueueSize;
  private int slowClientThreshold;
  private long slowClientTimeoutMs;
  private long slowClientCheckIntervalMs;
  private long dedupWindowMs;
  private long authTimeoutMs;
  private String notifyChannel;
  private BackoffPolicy reconnectPolicy;

  public RealtimeOptions() {
    init();
  }

  public RealtimeOptions(JsonObject json) {
    init();
    RealtimeOptionsConverter.fromJson(json, this);
  }

  public RealtimeOptions(RealtimeOptions other) {
    this.maxConnections = other.maxConnections;
    this.maxConnectionsPerUser = other.maxConnectionsPerUser;
    this.maxConnectionsPerIp = other.maxConnectionsPerIp;
    this.pingIntervalMs = other.pingIntervalMs;
    this.pongTimeoutMs = other.pongTimeoutMs;
    this.messageSizeLimit = other.messageSizeLimit;
    this.channelBufferSize = other.channelBufferSize;
    this.rlsCacheSize = other.rlsCacheSize;
    this.rlsCacheTtlMs = other.rlsCacheTtlMs;
    this.rlsNegativeTtlMs = other.rlsNegativeTtlMs;
    this.authorizationTimeoutMs = other.authorizationTimeoutMs;
    this.listenerPoolSize = other.listenerPoolSize;
    this.notificationWorkers = other.notificationWorkers;
    this.notificationQueueSize = other.notificationQueueSize;
    this.clientMessageQueueSize = other.clientMessageQueueSize;
    this.slowClientThreshold = other.slowClientThreshold;
    this.slowClientTimeoutMs = other.slowClientTimeoutMs;
    this.slowClientCheckIntervalMs = other.slowClientCheckIntervalMs;
    this.dedupWindowMs = other.dedupWindowMs;
    this.authTimeoutMs = other.authTimeoutMs;
    this.notifyChannel = other.notifyChannel;
    this.reconnectPolicy = other.reconnectPolicy.copy();
  }

  public int getMaxConnections() {
    return maxConnections;
  }

  public RealtimeOptions setMaxConnections(int maxConnections) {
    this.maxConnections = maxConnections;
    return this;
  }

  public int getMaxConnectionsPerUser() {
    return maxConnectionsPerUser;
  }

  public RealtimeOptions setMaxConnectionsPerUser(int maxConnectionsPerUser) {
    this.maxConnectionsPerUser = maxConnectionsPerUser;
    return this;
  }

  public int getMaxConnectionsPerIp() {
    return maxConnectionsPerIp;
  }

  public RealtimeOptions setMaxConnectionsPerIp(int maxConnectionsPerIp) {
    this.maxConnectionsPerIp = maxConnectionsPerIp;
    return this;
  }

  public long getPingIntervalMs() {
    return pingIntervalMs;
  }

  public RealtimeOptions setPingIntervalMs(long pingIntervalMs) {
    this.pingIntervalMs = pingIntervalMs;
    return this;
  }

  public long getPongTimeoutMs() {
    return pongTimeoutMs;
  }

  public RealtimeOptions setPongTimeoutMs(long pongTimeoutMs) {
    this.pongTimeoutMs = pongTimeoutMs;
    return this;
  }

  public int getMessageSizeLimit() {
    return messageSizeLimit;
  }

  public RealtimeOptions setMessageSizeLimit(int messageSizeLimit) {
    this.messageSizeLimit = messageSizeLimit;
    return this;
  }

  public int getChannelBufferSize() {
    return channelBufferSize;
  }

  public RealtimeOptions setChannelBufferSize(int channelBufferSize) {
    this.channelBufferSize = channelBufferSize;
    return this;
  }

  public int getRlsCacheSize() {
    return rlsCacheSize;
  }

  public RealtimeOptions setRlsCacheSize(int rlsCacheSize) {
    this.rlsCacheSize = rlsCacheSize;
    return this;
  }

  public long getRlsCacheTtlMs() {
    return rlsCacheTtlMs;
  }

  public RealtimeOptions setRlsCacheTtlMs(long rlsCacheTtlMs) {
    this.rlsCacheTtlMs = rlsCacheTtlMs;
    return this;
  }

  public long getRlsNegativeTtlMs() {
    return rlsNegativeTtlMs;
  }

  public RealtimeOptions setRlsNegativeTtlMs(long rlsNegativeTtlMs) {
    this.rlsNegativeTtlMs = rlsNegativeTtlMs;
    return this;
  }

  public long getAuthorizationTimeoutMs() {
    return authorizationTimeoutMs;
  }

  public RealtimeOptions setAuthorizationTimeoutMs(long authorizationTimeoutMs) {
    this.authorizationTimeoutMs = authorizationTimeoutMs;
    return this;
  }

  public int getListenerPoolSize() {
    return listenerPoolSize;
  }

  public RealtimeOptions setListenerPoolSize(int listenerPoolSize) {
    this.listenerPoolSize = listenerPoolSize;
    return this;
  }

  public int getNotificationWorkers() {
    return notificationWorkers;
  }

  public RealtimeOptions setNotificationWorkers(int notificationWorkers) {
    this.notificationWorkers = notificationWorkers;
    return this;
  }

  public int getNotificationQueueSize() {
    return notificationQueueSize;
  }

  public RealtimeOptions setNotificationQueueSize(int notificationQueueSize) {
    this.notificationQueueSize = notificationQueueSize;
    return this;
  }

  public int getClientMessageQueueSize() {
    return clientMessageQueueSize;
  }

  public RealtimeOptions setClientMessageQueueSize(int clientMessageQueueSize) {
    this.clientMessageQueueSize = clientMessageQueueSize;
    return this;
  }

  public int getSlowClientThreshold() {
    return slowClientThreshold;
  }

  public RealtimeOptions setSlowClientThreshold(int slowClientThreshold) {
    this.slowClientThreshold = slowClientThreshold;
    return this;
  }

  public long getSlowClientTimeoutMs() {
    return slowClientTimeoutMs;
  }

  public RealtimeOptions setSlowClientTimeoutMs(long slowClientTimeoutMs) {
    this.slowClientTimeoutMs = slowClientTimeoutMs;
    return this;
  }

  public long getSlowClientCheckIntervalMs() {
    return slowClientCheckIntervalMs;
  }

  public RealtimeOptions setSlowClientCheckIntervalMs(long slowClientCheckIntervalMs) {
    this.slowClientCheckIntervalMs = slowClientCheckIntervalMs;
    return this;
  }

  public long getDedupWindowMs() {
    return dedupWindowMs;
  }

  public RealtimeOptions setDedupWindowMs(long dedupWindowMs) {
    this.dedupWindowMs = dedupWindowMs;
    return this;
  }

  public long getAuthTimeoutMs() {
    return authTimeoutMs;
  }

  public RealtimeOptions setAuthTimeoutMs(long authTimeoutMs) {
    this.authTimeoutMs = authTimeoutMs;
    return this;
  }

  public String getNotifyChannel() {
    return notifyChannel;
  }

  public RealtimeOptions setNotifyChannel(String notifyChannel) {
    this.notifyChannel = notifyChannel;
    return this;
  }

  public BackoffPolicy getReconnectPolicy() {
    return reconnectPolicy;
  }

  @GenIgnore
  public RealtimeOptions setReconnectPolicy(BackoffPolicy reconnectPolicy) {
    this.reconnectPolicy = Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
    return this;
  }

  /**
   * Raises the WebSocket frame and message limits of {@code server} above
   * {@link #getMessageSizeLimit()}, so an oversized client message reaches the protocol handler
   * and is answered with {@code message_too_large} instead of the transport closing the socket.
   */
  @GenIgnore
  public HttpServerOptions applyTo(HttpServerOptions server) {
    Objects.requireNonNull(server, "server");
    int transportLimit = transportMessageLimit();
    if (server.getMaxWebSocketMessageSize() < transportLimit) {
      server.setMaxWebSocketMessageSize(transportLimit);
    }
    if (server.getMaxWebSocketFrameSize() < transportLimit) {
      server.setMaxWebSocketFrameSize(transportLimit);
    }
    return server;
  }

  int transportMessageLimit() {
    return (int) Math.min(Integer.MAX_VALUE, messageSizeLimit * 2L);
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    RealtimeOptionsConverter.toJson(this, json);
    return json;
  }

  public RealtimeOptions merge(JsonObject other) {
    JsonObject json = toJson();
    json.mergeIn(other);
    return new RealtimeOptions(json);
  }

  public void validate() {
    OptionValidation.requireMin("maxConnections", maxConnections, 1);
    OptionValidation.requireMin("maxConnectionsPerUser", maxConnectionsPerUser, 1);
    OptionValidation.requireMin("maxConnectionsPerIp", maxConnectionsPerIp, 1);
    OptionValidation.requireMin("pingIntervalMs", pingIntervalMs, 1L);
    OptionValidation.requireMin("pongTimeoutMs", pongTimeoutMs, 1L);
    OptionValidation.requireMin("messageSizeLimit", messageSizeLimit, 256);
    OptionValidation.requireMin("channelBufferSize", channelBufferSize, 1);
    OptionValidation.requireMin("rlsCacheSize", rlsCacheSize, 1);
    OptionValidation.requireMin("rlsCacheTtlMs", rlsCacheTtlMs, 0L);
    OptionValidation.requireMin("rlsNegativeTtlMs", rlsNegativeTtlMs, 0L);
    OptionValidation.requireMin("authorizationTimeoutMs", authorizationTimeoutMs, 1L);
    OptionValidation.requireMin("listenerPoolSize", listenerPoolSize, 1);
    OptionValidation.requireMin("notificationWorkers", notificationWorkers, 1);
    OptionValidation.requireMin("notificationQueueSize", notificationQueueSize, 1);
    OptionValidation.requireMin("clientMessageQueueSize", clientMessageQueueSize, 1);
    OptionValidation.requireMin("slowClientThreshold", slowClientThreshold, 1);
    if (slowClientThreshold >= clientMessageQueueSize) {
      throw new IllegalArgumentException("slowClientThreshold must be < clientMessageQueueSize");
    }
    OptionValidation.requireMin("slowClientTimeoutMs", slowClientTimeoutMs, 0L);
    OptionValidation.requireMin("slowClientCheckIntervalMs", slowClientCheckIntervalMs, 1L);
    OptionValidation.requireMin("dedupWindowMs", dedupWindowMs, 1L);
    OptionValidation.requireMin("authTimeoutMs", authTimeoutMs, 1L);
    OptionValidation.requireIdentifier("notifyChannel", notifyChannel);
    Objects.requireNonNull(reconnectPolicy, "reconnectPolicy").validate();
  }

  private void init() {
    maxConnections = DEFAULT_MAX_CONNECTIONS;
    maxConnectionsPerUser = DEFAULT_MAX_CONNECTIONS_PER_USER;
    maxConnectionsPerIp = DEFAULT_MAX_CONNECTIONS_PER_IP;
    pingIntervalMs = DEFAULT_PING_INTERVAL_MS;
    pongTimeoutMs = DEFAULT_PONG_TIMEOUT_MS;
    messageSizeLimit = DEFAULT_MESSAGE_SIZE_LIMIT;
    channelBufferSize = DEFAULT_CHANNEL_BUFFER_SIZE;
    rlsCacheSize = DEFAULT_RLS_CACHE_SIZE;
    rlsCacheTtlMs = DEFAULT_RLS_CACHE_TTL_MS;
    rlsNegativeTtlMs = DEFAULT_RLS_NEGATIVE_TTL_MS;
    authorizationTimeoutMs = DEFAULT_AUTHORIZATION_TIMEOUT_MS;
    listenerPoolSize = DEFAULT_LISTENER_POOL_SIZE;
    notificationWorkers = DEFAULT_NOTIFICATION_WORKERS;
    notificationQueueSize = DEFAULT_NOTIFICATION_QUEUE_SIZE;
    clientMessageQueueSize = DEFAULT_CLIENT_MESSAGE_QUEUE_SIZE;
    slowClientThreshold = DEFAULT_SLOW_CLIENT_THRESHOLD;
    slowClientTimeoutMs = DEFAULT_SLOW_CLIENT_TIMEOUT_MS;
    slowClientCheckIntervalMs = DEFAULT_SLOW_CLIENT_CHECK_INTERVAL_MS;
    dedupWindowMs = DEFAULT_DEDUP_WINDOW_MS;
    authTimeoutMs = DEFAULT_AUTH_TIMEOUT_MS;
    notifyChannel = DEFAULT_NOTIFY_CHANNEL;
    reconnectPolicy = BackoffPolicy.exponential();
  }
}
