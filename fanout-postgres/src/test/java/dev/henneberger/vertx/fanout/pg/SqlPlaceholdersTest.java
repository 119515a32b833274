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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import dev.henneberger.vertx.fanout.core.MaterializedRow;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SqlPlaceholdersTest {

  private static final MaterializedRow ROW = row();

  @Test
  void bindsPositionalPlaceholdersInColumnOrder() {
    SqlPlaceholders.BoundStatement bound = SqlPlaceholders.bind(
      "INSERT INTO users_copy (name, id) VALUES ($2, $1) ON CONFLICT (id) DO UPDATE SET name = $2", ROW);

    assertEquals("INSERT INTO users_copy (name, id) VALUES (?, ?) ON CONFLICT (id) DO UPDATE SET name = ?",
      bound.sql());
    assertEquals(List.of("x", 5, "x"), bound.parameters());
  }

  @Test
  void bindsNamedPlaceholders() {
    SqlPlaceholders.BoundStatement bound = SqlPlaceholders.bind(
      "UPDATE users_copy SET name = :name WHERE id = :id", ROW);

    assertEquals("UPDATE users_copy SET name = ? WHERE id = ?", bound.sql());
    assertEquals(List.of("x", 5), bound.parameters());
  }

  @Test
  void leavesLiteralsCommentsAndCastsAlone() {
    SqlPlaceholders.BoundStatement bound = SqlPlaceholders.bind(
      "SELECT ':name', \"$1\", $1::int -- :id\n /* $2 */ FROM t", ROW);

    assertEquals("SELECT ':name', \"$1\", ?::int -- :id\n /* $2 */ FROM t", bound.sql());
    assertEquals(List.of(5), bound.parameters());
  }

  @Test
  void leavesArraySlicesEscapeStringsAndDollarQuotesAlone() {
    String sql = "SELECT tags[1:name], E'it\\'s :name', $body$ :id $1 $body$, $$ :name $$ FROM t WHERE id = :id";

    SqlPlaceholders.BoundStatement bound = SqlPlaceholders.bind(sql, ROW);

    assertEquals(
      "SELECT tags[1:name], E'it\\'s :name', $body$ :id $1 $body$, $$ :name $$ FROM t WHERE id = ?",
      bound.sql());
    assertEquals(List.of(5), bound.parameters());
  }

  @Test
  void rejectsPlaceholderOutsideRow() {
    IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
      () -> SqlPlaceholders.bind("SELECT $3", ROW));
    assertEquals("Placeholder $3 is out of range, row has 2 columns", error.getMessage());

    assertThrows(IllegalArgumentException.class, () -> SqlPlaceholders.bind("SELECT $0", ROW));
    assertThrows(IllegalArgumentException.class, () -> SqlPlaceholders.bind("SELECT :email", ROW));
  }

  @Test
  void rejectsMixedPlaceholderStyles() {
    assertThrows(IllegalArgumentException.class,
      () -> SqlPlaceholders.bind("UPDATE t SET name = :name WHERE id = $1", ROW));
  }

  private static MaterializedRow row() {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("id", 5);
    values.put("name", "x");
    return MaterializedRow.of(values);
  }
}
