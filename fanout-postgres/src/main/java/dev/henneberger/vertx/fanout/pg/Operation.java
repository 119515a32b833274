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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One row change inside a transaction. Inserts and updates carry the new tuple; deletes carry only the old key
 * tuple. Updates carry {@code oldKeys} when the server sent the previous identity.
 */
public final class Operation {

  public enum Type {
    INSERT,
    UPDATE,
    DELETE
  }

  private final Type type;
  private final String tableSchema;
  private final String table;
  private final List<String> keyColumns;
  private final Map<String, Object> newValues;
  private final Map<String, Object> oldKeys;

  public Operation(Type type,
                   String tableSchema,
                   String table,
                   List<String> keyColumns,
                   Map<String, Object> newValues,
                   Map<String, Object> oldKeys) {
    this.type = Objects.requireNonNull(type, "type");
    this.tableSchema = Objects.requireNonNull(tableSchema, "tableSchema");
    this.table = Objects.requireNonNull(table, "table");
    this.keyColumns = List.copyOf(Objects.requireNonNull(keyColumns, "keyColumns"));
    this.newValues = newValues == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(newValues));
    this.oldKeys = oldKeys == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(oldKeys));
    if (type != Type.DELETE && this.newValues == null) {
      throw new IllegalArgumentException(type + " operation requires new values");
    }
  }

  static Operation fromMessage(WalMessage message) {
    switch (message.kind()) {
      case INSERT: {
        WalMessage.Insert insert = (WalMessage.Insert) message;
        Relation relation = insert.relation();
        return new Operation(Type.INSERT, relation.schema(), relation.name(), relation.keyColumns(),
          insert.newTuple(), null);
      }
      case UPDATE: {
        WalMessage.Update update = (WalMessage.Update) message;
        Relation relation = update.relation();
        return new Operation(Type.UPDATE, relation.schema(), relation.name(), relation.keyColumns(),
          update.newTuple(), update.oldTuple());
      }
      case DELETE: {
        WalMessage.Delete delete = (WalMessage.Delete) message;
        Relation relation = delete.relation();
        return new Operation(Type.DELETE, relation.schema(), relation.name(), relation.keyColumns(),
          null, delete.oldTuple());
      }
      default:
        throw new IllegalArgumentException("Not a row message: " + message.kind());
    }
  }

  public Type type() {
    return type;
  }

  public String tableSchema() {
    return tableSchema;
  }

  public String table() {
    return table;
  }

  public List<String> keyColumns() {
    return keyColumns;
  }

  public Map<String, Object> newValues() {
    return newValues;
  }

  public Map<String, Object> oldKeys() {
    return oldKeys;
  }

  /**
   * Values of the key columns in key order, taken from the new tuple, or from the old key tuple for deletes.
   */
  public Map<String, Object> keyValues() {
    Map<String, Object> source = type == Type.DELETE ? oldKeys : newValues;
    Map<String, Object> keys = new LinkedHashMap<>();
    for (String column : keyColumns) {
      keys.put(column, source == null ? null : source.get(column));
    }
    return keys;
  }

  public String qualifiedTable() {
    return tableSchema + "." + table;
  }

  @Override
  public String toString() {
    return type + " " + qualifiedTable() + " " + keyValues();
  }
}
