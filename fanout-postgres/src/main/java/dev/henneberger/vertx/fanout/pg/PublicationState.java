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
import dev.henneberger.vertx.fanout.core.Diagnostics;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.List;
import java.util.Objects;

/**
 * Verification result for one data store. Derived on startup, never persisted.
 */
public final class PublicationState {

  private final String dbIdentifier;
  private final PostgresPublication configPublication;
  private final PostgresPublication databasePublication;
  private final List<Diagnostic> errors;

  public PublicationState(String dbIdentifier,
                          PostgresPublication configPublication,
                          PostgresPublication databasePublication) {
    this(dbIdentifier, configPublication, databasePublication,
      PublicationStateVerifier.verify(dbIdentifier, configPublication, databasePublication));
  }

  private PublicationState(String dbIdentifier,
                           PostgresPublication configPublication,
                           PostgresPublication databasePublication,
                           List<Diagnostic> errors) {
    this.dbIdentifier = Objects.requireNonNull(dbIdentifier, "dbIdentifier");
    this.configPublication = Objects.requireNonNull(configPublication, "configPublication");
    this.databasePublication = databasePublication;
    this.errors = List.copyOf(errors);
  }

  /**
   * State of a data store whose connection could not be used, so its publication was never inspected.
   */
  public static PublicationState unreachable(String dbIdentifier,
                                             PostgresPublication configPublication,
                                             Diagnostic connectionError) {
    return new PublicationState(dbIdentifier, configPublication, null,
      List.of(Objects.requireNonNull(connectionError, "connectionError")));
  }

  public String dbIdentifier() {
    return dbIdentifier;
  }

  public PostgresPublication configPublication() {
    return configPublication;
  }

  public PostgresPublication databasePublication() {
    return databasePublication;
  }

  public List<Diagnostic> errors() {
    return errors;
  }

  public boolean ok() {
    return !Diagnostics.hasErrors(errors);
  }

  public JsonObject toJson() {
    JsonArray errorArray = new JsonArray();
    for (Diagnostic error : errors) {
      JsonObject entry = new JsonObject().put("code", error.code()).put("error", error.error());
      if (error.hasSolution()) {
        entry.put("solution", error.solution());
      }
      errorArray.add(entry);
    }
    return new JsonObject()
      .put("dbIdentifier", dbIdentifier)
      .put("configPublication", configPublication.toJson())
      .put("databasePublication", databasePublication == null ? null : databasePublication.toJson())
      .put("errors", errorArray);
  }
}
