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

import dev.henneberger.vertx.fanout.core.Diagnostic;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Compares a configured publication with the one the database exposes. Purely advisory: callers decide whether
 * the returned errors halt replication.
 */
public final class PublicationStateVerifier {

  public static final String PUBLICATION_MISSING = "PUBLICATION_MISSING";
  public static final String PUBLICATION_SCOPE_MISMATCH = "PUBLICATION_SCOPE_MISMATCH";
  public static final String PUBLICATION_TABLES_MISSING = "PUBLICATION_TABLES_MISSING";

  private PublicationStateVerifier() {
  }

  public static List<Diagnostic> verify(String dbIdentifier,
                                        PostgresPublication configPublication,
                                        PostgresPublication databasePublication) {
    Objects.requireNonNull(dbIdentifier, "dbIdentifier");
    Objects.requireNonNull(configPublication, "configPublication");
    List<Diagnostic> errors = new ArrayList<>();
    String name = configPublication.name();

    if (databasePublication == null) {
      errors.add(Diagnostic.error(
        PUBLICATION_MISSING,
        "Publication \"" + name + "\" does not exist in database \"" + dbIdentifier + "\"",
        "Run: " + createPublicationStatement(configPublication)));
      return errors;
    }

    if (configPublication.allTables() && !databasePublication.allTables()) {
      errors.add(Diagnostic.error(
        PUBLICATION_SCOPE_MISMATCH,
        "Publication \"" + name + "\" in database \"" + dbIdentifier + "\" is configured for all tables, "
          + "but the database is not configured for all tables"));
    }

    if (!configPublication.allTables() && databasePublication.allTables()) {
      errors.add(Diagnostic.error(
        PUBLICATION_SCOPE_MISMATCH,
        "Publication \"" + name + "\" in database \"" + dbIdentifier + "\" is configured for specific tables, "
          + "but the database is configured for all tables"));
    }

    if (!configPublication.allTables() && !databasePublication.allTables()) {
      Set<PostgresTable> published = new HashSet<>(databasePublication.tables());
      List<PostgresTable> missing = configPublication.tables().stream()
        .filter(table -> !published.contains(table))
        .collect(Collectors.toList());
      if (!missing.isEmpty()) {
        errors.add(Diagnostic.error(
          PUBLICATION_TABLES_MISSING,
          "Publication \"" + name + "\" in database \"" + dbIdentifier + "\" is missing configured tables: "
            + joinTables(missing)));
      }
    }

    return errors;
  }

  static String createPublicationStatement(PostgresPublication publication) {
    if (publication.allTables()) {
      return "CREATE PUBLICATION " + publication.name() + " FOR ALL TABLES;";
    }
    return "CREATE PUBLICATION " + publication.name() + " FOR TABLE " + joinTables(publication.tables()) + ";";
  }

  private static String joinTables(List<PostgresTable> tables) {
    return tables.stream().map(PostgresTable::qualifiedName).collect(Collectors.joining(", "));
  }
}
