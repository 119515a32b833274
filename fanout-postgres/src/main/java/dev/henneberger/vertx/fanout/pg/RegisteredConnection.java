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

package dev.henneberger.vertx.fanout.pg;

import java.sql.Connection;
import java.util.Objects;

public final class RegisteredConnection {

  private final ConnectionConfig config;
  private final Connection connection;

  RegisteredConnection(ConnectionConfig config, Connection connection) {
    this.config = Objects.requireNonNull(config, "config");
    this.connection = Objects.requireNonNull(connection, "connection");
  }

  public String slug() {
    return config.getSlug();
  }

  public ConnectionConfig config() {
    return config;
  }

  public Connection connection() {
    return connection;
  }
}
