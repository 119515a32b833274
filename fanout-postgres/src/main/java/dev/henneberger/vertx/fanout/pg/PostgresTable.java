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

import java.util.Objects;

/**
 * A table reference inside a publication.
 */
public final class PostgresTable {

  public static final String DEFAULT_SCHEMA = "public";

  private final String schema;
  private final String name;

  public PostgresTable(String schema, String name) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.name = Objects.requireNonNull(name, "name");
  }

  /**
   * Accepts {@code schema.table} or a bare {@code table}, which is placed in the {@code public} schema.
   */
  public static PostgresTable normalize(String table) {
    Objects.requireNonNull(table, "table");
    int dot = table.indexOf('.');
    if (dot < 0) {
      return new PostgresTable(DEFAULT_SCHEMA, table);
    }
    return new PostgresTable(table.substring(0, dot), table.substring(dot + 1));
  }

  public String schema() {
    return schema;
  }

  public String name() {
    return name;
  }

  public String qualifiedName() {
    return schema + "." + name;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PostgresTable)) {
      return false;
    }
    PostgresTable that = (PostgresTable) o;
    return schema.equals(that.schema) && name.equals(that.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(schema, name);
  }

  @Override
  public String toString() {
    return qualifiedName();
  }
}
