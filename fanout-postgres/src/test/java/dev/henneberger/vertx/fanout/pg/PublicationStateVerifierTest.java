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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.fanout.core.Diagnostic;
import io.vertx.core.json.JsonObject;
import java.util.List;
import org.junit.jupiter.api.Test;

class PublicationStateVerifierTest {

  private static final String DB = "localhost:5432/shop";

  @Test
  void missingPublicationSuggestsCreateStatement() {
    List<Diagnostic> errors = PublicationStateVerifier.verify(DB,
      PostgresPublication.configured("shop_pub", List.of("orders", "sales.items")), null);

    assertEquals(1, errors.size());
    assertEquals(PublicationStateVerifier.PUBLICATION_MISSING, errors.get(0).code());
    assertEquals("Publication \"shop_pub\" does not exist in database \"localhost:5432/shop\"",
      errors.get(0).error());
    assertEquals("Run: CREATE PUBLICATION shop_pub FOR TABLE public.orders, sales.items;", errors.get(0).solution());
  }

  @Test
  void missingAllTablesPublicationSuggestsAllTables() {
    List<Diagnostic> errors = PublicationStateVerifier.verify(DB, PostgresPublication.forAllTables("shop_pub"), null);

    assertEquals("Run: CREATE PUBLICATION shop_pub FOR ALL TABLES;", errors.get(0).solution());
  }

  @Test
  void allTablesConfiguredButDatabaseIsScoped() {
    List<Diagnostic> errors = PublicationStateVerifier.verify(DB,
      PostgresPublication.forAllTables("shop_pub"),
      PostgresPublication.forTables("shop_pub", List.of(PostgresTable.normalize("orders"))));

    assertEquals(1, errors.size());
    assertEquals(PublicationStateVerifier.PUBLICATION_SCOPE_MISMATCH, errors.get(0).code());
    assertTrue(errors.get(0).error().endsWith(
      "is configured for all tables, but the database is not configured for all tables"));
  }

  @Test
  void scopedConfiguredButDatabaseIsAllTables() {
    List<Diagnostic> errors = PublicationStateVerifier.verify(DB,
      PostgresPublication.configured("shop_pub", List.of("orders")),
      PostgresPublication.forAllTables("shop_pub"));

    assertEquals(1, errors.size());
    assertEquals(PublicationStateVerifier.PUBLICATION_SCOPE_MISMATCH, errors.get(0).code());
    assertTrue(errors.get(0).error().endsWith(
      "is configured for specific tables, but the database is configured for all tables"));
  }

  @Test
  void reportsConfiguredTablesMissingFromDatabase() {
    List<Diagnostic> errors = PublicationStateVerifier.verify(DB,
      PostgresPublication.configured("shop_pub", List.of("orders", "public.customers")),
      PostgresPublication.forTables("shop_pub", List.of(
        new PostgresTable("public", "customers"), new PostgresTable("public", "audit"))));

    assertEquals(1, errors.size());
    assertEquals(PublicationStateVerifier.PUBLICATION_TABLES_MISSING, errors.get(0).code());
    assertEquals("Publication \"shop_pub\" in database \"localhost:5432/shop\" is missing configured tables: "
      + "public.orders", errors.get(0).error());
  }

  @Test
  void matchingPublicationIsOk() {
    PublicationState state = new PublicationState(DB,
      PostgresPublication.configured("shop_pub", List.of("orders")),
      PostgresPublication.forTables("shop_pub", List.of(new PostgresTable("public", "orders"))));

    assertTrue(state.ok());
    assertTrue(state.errors().isEmpty());
    assertTrue(new PublicationState(DB,
      PostgresPublication.forAllTables("p"), PostgresPublication.forAllTables("p")).ok());
  }

  @Test
  void stateSerializesErrors() {
    PublicationState state = new PublicationState(DB, PostgresPublication.forAllTables("shop_pub"), null);

    JsonObject json = state.toJson();

    assertFalse(state.ok());
    assertEquals(DB, json.getString("dbIdentifier"));
    assertTrue(json.getJsonObject("configPublication").getBoolean("allTables"));
    assertNull(json.getValue("databasePublication"));
    JsonObject error = json.getJsonArray("errors").getJsonObject(0);
    assertEquals("PUBLICATION_MISSING", error.getString("code"));
    assertEquals("Run: CREATE PUBLICATION shop_pub FOR ALL TABLES;", error.getString("solution"));
  }

  @Test
  void bareTableNamesLandInPublicSchema() {
    assertEquals(new PostgresTable("public", "orders"), PostgresTable.normalize("orders"));
    assertEquals(new PostgresTable("sales", "orders"), PostgresTable.normalize("sales.orders"));
  }
}
