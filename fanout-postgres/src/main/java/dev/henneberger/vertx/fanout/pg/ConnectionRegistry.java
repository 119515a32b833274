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
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the long-lived source connection of every configured data store. Each slug is connected at most once and
 * every connection is closed exactly once by {@link #close()}. Destination writes use dedicated connections from
 * {@link #openDedicated(String)} which the caller closes.
 */
public final class ConnectionRegistry implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(ConnectionRegistry.class);

  private final Map<String, ConnectionConfig> configs;
  private final ConnectionOpener opener;
  private final Map<String, RegisteredConnection> connected = new ConcurrentHashMap<>();
  private boolean closed;

  public ConnectionRegistry(Collection<ConnectionConfig> configs) {
    this(configs, ConnectionOpener.JDBC);
  }

  public ConnectionRegistry(Collection<ConnectionConfig> configs, ConnectionOpener opener) {
    Objects.requireNonNull(configs, "configs");
    this.opener = Objects.requireNonNull(opener, "opener");
    Map<String, ConnectionConfig> bySlug = new LinkedHashMap<>();
    for (ConnectionConfig config : configs) {
      config.validate();
      if (bySlug.put(config.getSlug(), new ConnectionConfig(config)) != null) {
        throw new IllegalArgumentException("duplicate connection slug " + config.getSlug());
      }
    }
    this.configs = bySlug;
  }

  /**
   * Opens the source connection for each binding's slug that is not connected yet.
   *
   * @throws ConnectionException with {@code NOT_FOUND} when a binding names an unknown slug
   */
  public synchronized void connect(List<DataStoreBinding> bindings) throws SQLException {
    Objects.requireNonNull(bindings, "bindings");
    if (closed) {
      throw new IllegalStateException("connection registry is closed");
    }
    for (DataStoreBinding binding : bindings) {
      String slug = binding.connectionSlug();
      if (connected.containsKey(slug)) {
        continue;
      }
      ConnectionConfig config = config(slug);
      Connection connection = opener.open(config);
      connected.put(slug, new RegisteredConnection(config, connection));
      LOG.info("Connected to [postgres] '{}' ({})", slug, config.dbIdentifier());
    }
  }

  /**
   * @throws ConnectionException with {@code NOT_CONNECTED} when {@link #connect(List)} has not opened the slug
   */
  public RegisteredConnection get(String slug) {
    Objects.requireNonNull(slug, "slug");
    RegisteredConnection connection = connected.get(slug);
    if (connection == null) {
      throw new ConnectionException(ConnectionException.Code.NOT_CONNECTED,
        "Connection '" + slug + "' is not connected");
    }
    return connection;
  }

  public boolean isConnected(String slug) {
    return connected.containsKey(slug);
  }

  public ConnectionConfig config(String slug) {
    Objects.requireNonNull(slug, "slug");
    ConnectionConfig config = configs.get(slug);
    if (config == null) {
      throw new ConnectionException(ConnectionException.Code.NOT_FOUND,
        "Connection '" + slug + "' not found");
    }
    return config;
  }

  public Connection openDedicated(String slug) throws SQLException {
    return opener.open(config(slug));
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    List<RegisteredConnection> toClose = new ArrayList<>(connected.values());
    connected.clear();
    for (RegisteredConnection registered : toClose) {
      try {
        registered.connection().close();
        LOG.info("Disconnected from [postgres] '{}'", registered.slug());
      } catch (SQLException e) {
        LOG.warn("Failed to close connection '{}'", registered.slug(), e);
      }
    }
  }
}
