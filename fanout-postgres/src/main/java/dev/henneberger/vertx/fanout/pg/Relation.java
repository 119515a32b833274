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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Table metadata announced by a pgoutput {@code Relation} message. Row messages refer to it by OID.
 */
public final class Relation {

  private final int relationOid;
  private final String schema;
  private final String name;
  private final char replicaIdentity;
  private final List<RelationColumn> columns;

  public Relation(int relationOid, String schema, String name, char replicaIdentity, List<RelationColumn> columns) {
    this.relationOid = relationOid;
    this.schema = Objects.requireNonNull(schema, "schema");
    this.name = Objects.requireNonNull(name, "name");
    this.replicaIdentity = replicaIdentity;
    this.columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
  }

  public int relationOid() {
    return relationOid;
  }

  public String schema() {
    return schema;
  }

  public String name() {
    return name;
  }

  public char replicaIdentity() {
    return replicaIdentity;
  }

  public List<RelationColumn> columns() {
    return columns;
  }

  public List<String> keyColumns() {
    List<String> keys = new ArrayList<>();
    for (RelationColumn column : columns) {
      if (column.isKey()) {
        keys.add(column.name());
      }
    }
    return keys;
  }

  public String qualifiedName() {
    return schema + "." + name;
  }
}
