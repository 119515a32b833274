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

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot of a publication, either as configured or as observed in {@code pg_publication}.
 */
public final class PostgresPublication {

  private final String name;
  private final boolean allTables;
  private final List<PostgresTable> tables;

  private PostgresPublication(String name, boolean allTables, List<PostgresTable> tables) {
    this.name = Objects.requireNonNull(name, "name");
    this.allTables = allTables;
    this.tables = tables == null ? null : Collections.unmodifiableList(new ArrayList<>(tables));
  }

  public static PostgresPublication forAllTables(String name) {
    return new PostgresPublication(name, true, null);
  }

  public static PostgresPublication forTables(String name, List<PostgresTable> tables) {
    return new PostgresPublication(name, false, Objects.requireNonNull(tables, "tables"));
  }

  /**
   * Builds the configured snapshot for a data store: no table list means the publication covers all tables.
   */
  public static PostgresPublication configured(String name, List<String> publicationTables) {
    if (publicationTables == null) {
      return forAllTables(name);
    }
    List<PostgresTable> tables = new ArrayList<>(publicationTables.size());
    for (String table : publicationTables) {
      tables.add(PostgresTable.normalize(table));
    }
    return forTables(name, tables);
  }

  public String name() {
    return name;
  }

  public boolean allTables() {
    return allTables;
  }

  /**
   * The published tables, or {@code null} for an all-tables publication.
   */
  public List<PostgresTable> tables() {
    return tables;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject()
      .put("name", name)
      .put("allTables", allTables);
    if (tables != null) {
      JsonArray array = new JsonArray();
      tables.forEach(table -> array.add(table.qualifiedName()));
      json.put("tables", array);
    }
    return json;
  }
}
