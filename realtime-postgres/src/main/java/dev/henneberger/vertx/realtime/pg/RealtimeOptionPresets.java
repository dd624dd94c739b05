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

import dev.henneberger.vertx.realtime.core.BackoffPolicy;
import dev.henneberger.vertx.realtime.core.RealtimeOptions;
import java.time.Duration;
import java.util.Objects;

public final class RealtimeOptionPresets {

  private RealtimeOptionPresets() {
  }

  public static void applyProductionDefaults(RealtimeOptions options) {
    Objects.requireNonNull(options, "options");
    options
      .setListenerPoolSize(Math.max(2, options.getListenerPoolSize()))
      .setPingIntervalMs(30_000L)
      .setPongTimeoutMs(60_000L)
      .setReconnectPolicy(
        BackoffPolicy.exponential()
          .setInitialDelay(Duration.ofMillis(500))
          .setMaxDelay(Duration.ofSeconds(30))
          .setMultiplier(2.0d)
          .setJitter(0.2d)
      );
  }

  public static void applyLocalDevDefaults(RealtimeOptions options) {
    Objects.requireNonNull(options, "options");
    options
      .setListenerPoolSize(1)
      .setNotificationWorkers(1)
      .setRlsCacheTtlMs(1_000L)
      .setReconnectPolicy(
        BackoffPolicy.exponential()
          .setInitialDelay(Duration.ofMillis(200))
          .setMaxDelay(Duration.ofSeconds(5))
          .setMultiplier(1.5d)
          .setJitter(0.1d)
      );
  }
}
