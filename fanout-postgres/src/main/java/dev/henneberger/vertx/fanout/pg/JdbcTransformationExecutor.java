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

import dev.henneberger.vertx.fanout.core.MaterializedRow;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocking JDBC execution on Vert.x worker threads. Queries share the registry's source connection; each execution
 * opens and closes its own destination connection.
 */
public final class JdbcTransformationExecutor implements TransformationExecutor {

  private static final Logger LOG = LoggerFactory.getLogger(JdbcTransformationExecutor.class);

  private final Vertx vertx;
  private final ConnectionRegistry registry;

  public JdbcTransformationExecutor(Vertx vertx, ConnectionRegistry registry) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  @Override
  public Future<List<Map<String, Object>>> query(String connectionSlug, String sql, MaterializedRow parameters) {
    return vertx.executeBlocking(() -> {
      SqlPlaceholders.BoundStatement bound = SqlPlaceholders.bind(sql, parameters);
      Connection connection = registry.get(connectionSlug).connection();
      synchronized (connection) {
        try (PreparedStatement statement = prepare(connection, bound);
             ResultSet rs = statement.executeQuery()) {
          return readRows(rs);
        }
      }
    }, false);
  }

  @Override
  public Future<Void> execute(String connectionSlug, String sql, MaterializedRow row) {
    return vertx.executeBlocking(() -> {
      SqlPlaceholders.BoundStatement bound = SqlPlaceholders.bind(sql, row);
      try (Connection connection = registry.openDedicated(connectionSlug);
           PreparedStatement statement = prepare(connection, bound)) {
        int updated = statement.executeUpdate();
        LOG.debug("Applied row to '{}', {} row(s) affected", connectionSlug, updated);
        return null;
      }
    }, false);
  }

  private static PreparedStatement prepare(Connection connection, SqlPlaceholders.BoundStatement bound)
    throws SQLException {
    PreparedStatement statement = connection.prepareStatement(bound.sql());
    try {
      List<Object> params = bound.parameters();
      for (int i = 0; i < params.size(); i++) {
        statement.setObject(i + 1, params.get(i));
      }
      return statement;
    } catch (SQLException e) {
      statement.close();
      throw e;
    }
  }

  private static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
    ResultSetMetaData meta = rs.getMetaData();
    int columns = meta.getColumnCount();
    List<Map<String, Object>> rows = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> row = new LinkedHashMap<>();
      for (int i = 1; i <= columns; i++) {
        row.put(meta.getColumnLabel(i), rs.getObject(i));
      }
      rows.add(row);
    }
    return rows;
  }
}
