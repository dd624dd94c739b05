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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.realtime.core.BackoffPolicy;
import dev.henneberger.vertx.realtime.core.RealtimeOptions;
import io.vertx.core.json.JsonObject;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.postgresql.PGProperty;

class PostgresNotifyOptionsTest {

  @Test
  void jsonRoundTripKeepsFields() {
    PostgresNotifyOptions options = new PostgresNotifyOptions()
      .setHost("db")
      .setPort(6543)
      .setDatabase("app")
      .setUser("realtime")
      .setPasswordEnv("APP_PW")
      .setSsl(true)
      .setAuthorizerPoolSize(8)
      .setClaimsSetting("app.claims")
      .setRealtimeSchema("rt")
      .setBroadcastChannel("app_broadcast");

    PostgresNotifyOptions copy = new PostgresNotifyOptions(options.toJson());

    assertEquals("db", copy.getHost());
    assertEquals(6543, copy.getPort());
    assertEquals("app", copy.getDatabase());
    assertEquals("APP_PW", copy.getPasswordEnv());
    assertTrue(copy.getSsl());
    assertEquals(8, copy.getAuthorizerPoolSize());
    assertEquals("app.claims", copy.getClaimsSetting());
    assertEquals("rt", copy.getRealtimeSchema());
    assertEquals("app_broadcast", copy.getBroadcastChannel());
    assertEquals(PostgresNotifyOptions.DEFAULT_VALIDATION_INTERVAL_MS, copy.getValidationIntervalMs());
  }

  @Test
  void mergeOverridesOnlyGivenKeys() {
    PostgresNotifyOptions base = new PostgresNotifyOptions().setDatabase("app").setUser("realtime");

    PostgresNotifyOptions merged = base.merge(new JsonObject().put("host", "replica").put("ssl", true));

    assertEquals("replica", merged.getHost());
    assertTrue(merged.getSsl());
    assertEquals("app", merged.getDatabase());
    assertEquals("localhost", base.getHost());
    assertFalse(base.getSsl());
  }

  @Test
  void validateRejectsBadValues() {
    assertThrows(IllegalArgumentException.class, () -> new PostgresNotifyOptions().setUser("u").validate());
    assertThrows(IllegalArgumentException.class,
      () -> new PostgresNotifyOptions().setDatabase("d").setUser("u").setPort(0).validate());
    assertThrows(IllegalArgumentException.class,
      () -> new PostgresNotifyOptions().setDatabase("d").setUser("u").setAuthorizerPoolSize(0).validate());
    assertThrows(IllegalArgumentException.class,
      () -> new PostgresNotifyOptions().setDatabase("d").setUser("u").setClaimsSetting("claims; drop").validate());
    assertThrows(IllegalArgumentException.class,
      () -> new PostgresNotifyOptions().setDatabase("d").setUser("u").setRealtimeSchema("rt\"x").validate());
    assertThrows(IllegalArgumentException.class,
      () -> new PostgresNotifyOptions().setDatabase("d").setUser("u").setBroadcastChannel("a;b").validate());
  }

  @Test
  void connectionPropertiesUseExplicitPassword() {
    PostgresConnections connections = new PostgresConnections(new PostgresNotifyOptions()
      .setHost("db")
      .setPort(5433)
      .setDatabase("app")
      .setUser("realtime")
      .setPassword("secret")
      .setSsl(true));

    Properties props = connections.connectionProperties();

    assertEquals("jdbc:postgresql://db:5433/app", connections.jdbcUrl());
    assertEquals("realtime", PGProperty.USER.getOrDefault(props));
    assertEquals("secret", PGProperty.PASSWORD.getOrDefault(props));
    assertEquals("vertx-realtime", PGProperty.APPLICATION_NAME.getOrDefault(props));
    assertEquals("true", props.getProperty("ssl"));
  }

  @Test
  void quotesSchemaQualifiedRelations() {
    assertEquals("\"public\".\"invoices\"", PostgresRowAuthorizer.quoteRelation("public.invoices"));
    assertThrows(IllegalArgumentException.class, () -> PostgresRowAuthorizer.quoteRelation("invoices"));
    assertThrows(IllegalArgumentException.class, () -> PostgresRowAuthorizer.quoteRelation("public.inv\"oices"));
  }

  @Test
  void presetsProduceValidOptions() {
    RealtimeOptions production = new RealtimeOptions();
    RealtimeOptionPresets.applyProductionDefaults(production);
    production.validate();
    BackoffPolicy policy = production.getReconnectPolicy();
    assertEquals(30_000L, policy.getMaxDelay().toMillis());
    assertEquals(2.0d, policy.getMultiplier());

    RealtimeOptions local = new RealtimeOptions();
    RealtimeOptionPresets.applyLocalDevDefaults(local);
    local.validate();
    assertEquals(1, local.getListenerPoolSize());
    assertEquals(5_000L, local.getReconnectPolicy().getMaxDelay().toMillis());
  }
}
