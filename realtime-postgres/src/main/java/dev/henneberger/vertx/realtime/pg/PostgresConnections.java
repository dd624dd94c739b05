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

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Properties;
import org.postgresql.PGProperty;

final class PostgresConnections {

  private final PostgresNotifyOptions options;

  PostgresConnections(PostgresNotifyOptions options) {
    this.options = new PostgresNotifyOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();
  }

  PostgresNotifyOptions options() {
    return options;
  }

  Connection open() throws SQLException {
    return DriverManager.getConnection(jdbcUrl(), connectionProperties());
  }

  String jdbcUrl() {
    return "jdbc:postgresql://" + options.getHost() + ':' + options.getPort() + '/' + options.getDatabase();
  }

  Properties connectionProperties() {
    Properties props = new Properties();
    PGProperty.USER.set(props, options.getUser());

    String password = resolvePassword();
    if (password != null && !password.isBlank()) {
      PGProperty.PASSWORD.set(props, password);
    }

    String applicationName = options.getApplicationName();
    if (applicationName != null && !applicationName.isBlank()) {
      PGProperty.APPLICATION_NAME.set(props, applicationName);
    }

    if (Boolean.TRUE.equals(options.getSsl())) {
      props.setProperty("ssl", "true");
    }
    return props;
  }

  private String resolvePassword() {
    String password = options.getPassword();
    if (password == null || password.isBlank()) {
      String envName = options.getPasswordEnv();
      if (envName != null && !envName.isBlank()) {
        password = System.getenv(envName);
      }
    }
    return password;
  }
}
