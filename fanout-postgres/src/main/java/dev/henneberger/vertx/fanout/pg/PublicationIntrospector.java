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
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads the observed publication snapshot from {@code pg_publication} and {@code pg_publication_tables}.
 */
public final class PublicationIntrospector {

  private static final String PUBLICATION_QUERY =
    "WITH pub AS ("
      + " SELECT pubname, puballtables FROM pg_publication WHERE pubname = ? LIMIT 1"
      + ") "
      + "SELECT pub.puballtables, pt.schemaname, pt.tablename "
      + "FROM pub LEFT JOIN pg_publication_tables pt ON pt.pubname = pub.pubname";

  private PublicationIntrospector() {
  }

  public static Optional<PostgresPublication> fetch(Connection connection, String publicationName) throws SQLException {
    Objects.requireNonNull(connection, "connection");
    Objects.requireNonNull(publicationName, "publicationName");

    boolean found = false;
    boolean allTables = false;
    List<PostgresTable> tables = new ArrayList<>();

    try (PreparedStatement statement = connection.prepareStatement(PUBLICATION_QUERY)) {
      statement.setString(1, publicationName);
      try (ResultSet rs = statement.executeQuery()) {
        while (rs.next()) {
          found = true;
          allTables = rs.getBoolean("puballtables");
          String schema = rs.getString("schemaname");
          if (schema != null) {
            tables.add(new PostgresTable(schema, rs.getString("tablename")));
          }
        }
      }
    }

    if (!found) {
      return Optional.empty();
    }
    return Optional.of(allTables
      ? PostgresPublication.forAllTables(publicationName)
      : PostgresPublication.forTables(publicationName, tables));
  }
}
