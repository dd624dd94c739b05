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

import dev.henneberger.vertx.realtime.core.ListenerPool;
import dev.henneberger.vertx.realtime.core.RealtimeSubscription;
import java.util.Objects;
import org.slf4j.Logger;

public final class RealtimeLogging {

  private RealtimeLogging() {
  }

  public static RealtimeSubscription attachDefaultLogging(ListenerPool pool,
                                                          Logger logger,
                                                          String poolName) {
    Objects.requireNonNull(pool, "pool");
    Objects.requireNonNull(logger, "logger");
    String name = poolName == null || poolName.isBlank() ? "realtime" : poolName;

    return pool.onStateChange(change -> {
      Throwable cause = change.cause();
      if (cause != null) {
        logger.warn("pool={} listener={} state={} prev={} attempt={} cause={}",
          name,
          change.listenerIndex(),
          change.state(),
          change.previousState(),
          change.attempt(),
          cause.toString());
      } else {
        logger.info("pool={} listener={} state={} prev={} attempt={}",
          name,
          change.listenerIndex(),
          change.state(),
          change.previousState(),
          change.attempt());
      }
    });
  }
}
