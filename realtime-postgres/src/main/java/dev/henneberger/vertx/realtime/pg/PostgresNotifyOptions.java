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

import dev.henneberger.vertx.realtime.core.OptionValidation;
import io.vertx.codegen.annotations.DataObject;
import io.vertx.codegen.json.annotations.JsonGen;
import io.vertx.core.json.JsonObject;

/**
 * Connection settings shared by the PostgreSQL notification source, row authorizer and table
 * catalog.
 */
@DataObject
@JsonGen(publicConverter = false)
public class PostgresNotifyOptions {

  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 5432;
  public static final long DEFAULT_VALIDATION_INTERVAL_MS = 5_000L;
  public static final int DEFAULT_AUTHORIZER_POOL_SIZE = 4;
  public static final String DEFAULT_CLAIMS_SETTING = "request.jwt.claims";
  public static final String DEFAULT_REALTIME_SCHEMA = "realtime";
  public static final long DEFAULT_CATALOG_CACHE_TTL_MS = 10_000L;
  public static final String DEFAULT_APPLICATION_NAME = "vertx-realtime";
  public static final String DEFAULT_BROADCAST_CHANNEL = "realtime_broadcast";

  private String host;
  private int port;
  private String database;
  private String user;
  private String password;
  private String passwordEnv;
  private boolean ssl;
  private String applicationName;
  private long validationIntervalMs;
  private int authorizerPoolSize;
  private String claimsSetting;
  private String realtimeSchema;
  private long catalogCacheTtlMs;
  private String broadcastChannel;

  public PostgresNotifyOptions() {
    init();
  }

  public PostgresNotifyOptions(JsonObject json) {
    init();
    PostgresNotifyOptionsConverter.fromJson(json, this);
  }

  public PostgresNotifyOptions(PostgresNotifyOptions other) {
    this.host = other.host;
    this.port = other.port;
    this.database = other.database;
    this.user = other.user;
    this.password = other.password;
    this.passwordEnv = other.passwordEnv;
    this.ssl = other.ssl;
    this.applicationName = other.applicationName;
    this.validationIntervalMs = other.validationIntervalMs;
    this.authorizerPoolSize = other.authorizerPoolSize;
    this.claimsSetting = other.claimsSetting;
    this.realtimeSchema = other.realtimeSchema;
    this.catalogCacheTtlMs = other.catalogCacheTtlMs;
    this.broadcastChannel = other.broadcastChannel;
  }

  public String getHost() {
    return host;
  }

  public PostgresNotifyOptions setHost(String host) {
    this.host = host;
    return this;
  }

  public Integer getPort() {
    return port;
  }

  public PostgresNotifyOptions setPort(Integer port) {
    this.port = port;
    return this;
  }

  public String getDatabase() {
    return database;
  }

  public PostgresNotifyOptions setDatabase(String database) {
    this.database = database;
    return this;
  }

  public String getUser() {
    return user;
  }

  public PostgresNotifyOptions setUser(String user) {
    this.user = user;
    return this;
  }

  public String getPassword() {
    return password;
  }

  public PostgresNotifyOptions setPassword(String password) {
    this.password = password;
    return this;
  }

  public String getPasswordEnv() {
    return passwordEnv;
  }

  public PostgresNotifyOptions setPasswordEnv(String passwordEnv) {
    this.passwordEnv = passwordEnv;
    return this;
  }

  public Boolean getSsl() {
    return ssl;
  }

  public PostgresNotifyOptions setSsl(Boolean ssl) {
    this.ssl = Boolean.TRUE.equals(ssl);
    return this;
  }

  public String getApplicationName() {
    return applicationName;
  }

  public PostgresNotifyOptions setApplicationName(String applicationName) {
    this.applicationName = applicationName;
    return this;
  }

  /**
   * How often an idle listener connection is checked with {@code isValid}.
   */
  public long getValidationIntervalMs() {
    return validationIntervalMs;
  }

  public PostgresNotifyOptions setValidationIntervalMs(long validationIntervalMs) {
    this.validationIntervalMs = validationIntervalMs;
    return this;
  }

  public int getAuthorizerPoolSize() {
    return authorizerPoolSize;
  }

  public PostgresNotifyOptions setAuthorizerPoolSize(int authorizerPoolSize) {
    this.authorizerPoolSize = authorizerPoolSize;
    return this;
  }

  /**
   * Name of the transaction-local setting that carries the caller's claims as JSON, read by RLS
   * policies through {@code current_setting(...)}.
   */
  public String getClaimsSetting() {
    return claimsSetting;
  }

  public PostgresNotifyOptions setClaimsSetting(String claimsSetting) {
    this.claimsSetting = claimsSetting;
    return this;
  }

  public String getRealtimeSchema() {
    return realtimeSchema;
  }

  public PostgresNotifyOptions setRealtimeSchema(String realtimeSchema) {
    this.realtimeSchema = realtimeSchema;
    return this;
  }

  public long getCatalogCacheTtlMs() {
    return catalogCacheTtlMs;
  }

  public PostgresNotifyOptions setCatalogCacheTtlMs(long catalogCacheTtlMs) {
    this.catalogCacheTtlMs = catalogCacheTtlMs;
    return this;
  }

  public String getBroadcastChannel() {
    return broadcastChannel;
  }

  /**
   * Notify channel {@link PostgresBroadcastBus} uses between engine instances.
   */
  public PostgresNotifyOptions setBroadcastChannel(String broadcastChannel) {
    this.broadcastChannel = broadcastChannel;
    return this;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    PostgresNotifyOptionsConverter.toJson(this, json);
    return json;
  }

  public PostgresNotifyOptions merge(JsonObject other) {
    JsonObject json = toJson();
    json.mergeIn(other);
    return new PostgresNotifyOptions(json);
  }

  void validate() {
    OptionValidation.require("host", host);
    if (port < 1 || port > 65535) {
      throw new IllegalArgumentException("port must be between 1 and 65535");
    }
    OptionValidation.require("database", database);
    OptionValidation.require("user", user);
    OptionValidation.requireMin("validationIntervalMs", validationIntervalMs, 1L);
    OptionValidation.requireMin("authorizerPoolSize", authorizerPoolSize, 1);
    OptionValidation.require("claimsSetting", claimsSetting);
    if (!claimsSetting.matches("[A-Za-z_][A-Za-z0-9_]*\\.[A-Za-z_][A-Za-z0-9_.]*")) {
      throw new IllegalArgumentException("claimsSetting must be a dotted custom setting name: " + claimsSetting);
    }
    OptionValidation.requireIdentifier("realtimeSchema", realtimeSchema);
    OptionValidation.requireMin("catalogCacheTtlMs", catalogCacheTtlMs, 0L);
    OptionValidation.requireIdentifier("broadcastChannel", broadcastChannel);
  }

  private void init() {
    host = DEFAULT_HOST;
    port = DEFAULT_PORT;
    ssl = false;
    applicationName = DEFAULT_APPLICATION_NAME;
    validationIntervalMs = DEFAULT_VALIDATION_INTERVAL_MS;
    authorizerPoolSize = DEFAULT_AUTHORIZER_POOL_SIZE;
    claimsSetting = DEFAULT_CLAIMS_SETTING;
    realtimeSchema = DEFAULT_REALTIME_SCHEMA;
    catalogCacheTtlMs = DEFAULT_CATALOG_CACHE_TTL_MS;
    broadcastChannel = DEFAULT_BROADCAST_CHANNEL;
  }
}
