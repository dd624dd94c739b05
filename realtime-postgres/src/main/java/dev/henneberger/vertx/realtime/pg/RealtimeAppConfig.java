/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.henneberger.vertx.realtime.pg;

import dev.henneberger.vertx.realtime.core.RealtimeOptions;
import io.vertx.core.json.JsonObject;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Environment based settings for a realtime server backed by PostgreSQL.
 *
 * <p>Connection settings use the libpq variable names. Engine settings are read from
 * {@code REALTIME_*} variables; durations accept plain milliseconds or an {@code ms}, {@code s}
 * or {@code m} suffix. Values that cannot be parsed keep their defaults.
 */
public final class RealtimeAppConfig {

  private static final int DEFAULT_HTTP_PORT = 8080;

  private static final String[][] INT_SETTINGS = {
    {"REALTIME_MAX_CONNECTIONS", "maxConnections"},
    {"REALTIME_MAX_CONNECTIONS_PER_USER", "maxConnectionsPerUser"},
    {"REALTIME_MAX_CONNECTIONS_PER_IP", "maxConnectionsPerIp"},
    {"REALTIME_MESSAGE_SIZE_LIMIT", "messageSizeLimit"},
    {"REALTIME_CHANNEL_BUFFER_SIZE", "channelBufferSize"},
    {"REALTIME_RLS_CACHE_SIZE", "rlsCacheSize"},
    {"REALTIME_LISTENER_POOL_SIZE", "listenerPoolSize"},
    {"REALTIME_NOTIFICATION_WORKERS", "notificationWorkers"},
    {"REALTIME_NOTIFICATION_QUEUE_SIZE", "notificationQueueSize"},
    {"REALTIME_CLIENT_MESSAGE_QUEUE_SIZE", "clientMessageQueueSize"},
    {"REALTIME_SLOW_CLIENT_THRESHOLD", "slowClientThreshold"},
  };

  private static final String[][] DURATION_SETTINGS = {
    {"REALTIME_PING_INTERVAL", "pingIntervalMs"},
    {"REALTIME_PONG_TIMEOUT", "pongTimeoutMs"},
    {"REALTIME_RLS_CACHE_TTL", "rlsCacheTtlMs"},
    {"REALTIME_SLOW_CLIENT_TIMEOUT", "slowClientTimeoutMs"},
    {"REALTIME_AUTH_TIMEOUT", "authTimeoutMs"},
  };

  private final String pgHost;
  private final int pgPort;
  private final String pgDatabase;
  private final String pgUser;
  private final String pgPasswordEnv;
  private final boolean ssl;
  private final int httpPort;
  private final JsonObject realtimeSettings;

  private RealtimeAppConfig(String pgHost,
                            int pgPort,
                            String pgDatabase,
                            String pgUser,
                            String pgPasswordEnv,
                            boolean ssl,
                            int httpPort,
                            JsonObject realtimeSettings) {
    this.pgHost = pgHost;
    this.pgPort = pgPort;
    this.pgDatabase = pgDatabase;
    this.pgUser = pgUser;
    this.pgPasswordEnv = pgPasswordEnv;
    this.ssl = ssl;
    this.httpPort = httpPort;
    this.realtimeSettings = realtimeSettings;
  }

  public static RealtimeAppConfig fromEnv() {
    return fromMap(System.getenv());
  }

  static RealtimeAppConfig fromMap(Map<String, String> env) {
    Objects.requireNonNull(env, "env");

    String host = envOrDefault(env, "PGHOST", PostgresNotifyOptions.DEFAULT_HOST);
    int port = intEnvOrDefault(env, "PGPORT", PostgresNotifyOptions.DEFAULT_PORT);
    String database = envOrDefault(env, "PGDATABASE", "postgres");
    String user = envOrDefault(env, "PGUSER", "postgres");
    String passwordEnv = envOrDefault(env, "PG_PASSWORD_ENV", "PGPASSWORD");
    boolean ssl = boolEnvOrDefault(env, "PGSSL", false);
    int httpPort = intEnvOrDefault(env, "HTTP_PORT", DEFAULT_HTTP_PORT);

    JsonObject settings = new JsonObject();
    for (String[] setting : INT_SETTINGS) {
      Integer value = parseInt(env.get(setting[0]));
      if (value != null) {
        settings.put(setting[1], value);
      }
    }
    for (String[] setting : DURATION_SETTINGS) {
      Long value = parseDurationMillis(env.get(setting[0]));
      if (value != null) {
        settings.put(setting[1], value);
      }
    }
    String channel = env.get("REALTIME_NOTIFY_CHANNEL");
    if (channel != null && !channel.isBlank()) {
      settings.put("notifyChannel", channel.trim());
    }

    return new RealtimeAppConfig(host, port, database, user, passwordEnv, ssl, httpPort, settings);
  }

  public String pgHost() {
    return pgHost;
  }

  public int pgPort() {
    return pgPort;
  }

  public String pgDatabase() {
    return pgDatabase;
  }

  public String pgUser() {
    return pgUser;
  }

  public String pgPasswordEnv() {
    return pgPasswordEnv;
  }

  public boolean ssl() {
    return ssl;
  }

  public int httpPort() {
    return httpPort;
  }

  public PostgresNotifyOptions toNotifyOptions() {
    return new PostgresNotifyOptions()
      .setHost(pgHost)
      .setPort(pgPort)
      .setDatabase(pgDatabase)
      .setUser(pgUser)
      .setPasswordEnv(pgPasswordEnv)
      .setSsl(ssl);
  }

  public RealtimeOptions toRealtimeOptions() {
    return new RealtimeOptions(realtimeSettings.copy());
  }

  private static String envOrDefault(Map<String, String> env, String key, String defaultValue) {
    String value = env.get(key);
    return value == null || value.isBlank() ? defaultValue : value;
  }

  private static int intEnvOrDefault(Map<String, String> env, String key, int defaultValue) {
    Integer value = parseInt(env.get(key));
    return value == null ? defaultValue : value;
  }

  private static boolean boolEnvOrDefault(Map<String, String> env, String key, boolean defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return "true".equalsIgnoreCase(value) || "1".equals(value) || "yes".equalsIgnoreCase(value);
  }

  private static Integer parseInt(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ignore) {
      return null;
    }
  }

  static Long parseDurationMillis(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String text = value.trim().toLowerCase(Locale.ROOT);
    long unit = 1L;
    if (text.endsWith("ms")) {
      text = text.substring(0, text.length() - 2);
    } else if (text.endsWith("s")) {
      text = text.substring(0, text.length() - 1);
      unit = 1_000L;
    } else if (text.endsWith("m")) {
      text = text.substring(0, text.length() - 1);
      unit = 60_000L;
    }
    try {
      long amount = Long.parseLong(text.trim());
      return amount < 0L ? null : amount * unit;
    } catch (NumberFormatException ignore) {
      return null;
    }
  }
}
