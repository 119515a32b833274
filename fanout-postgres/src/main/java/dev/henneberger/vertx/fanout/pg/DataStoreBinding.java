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

import dev.henneberger.vertx.fanout.core.OptionValidation;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Associates a source connection with the publication it replicates. A {@code null} table list means the
 * publication is expected to cover all tables.
 */
public final class DataStoreBinding {

  private final String connectionSlug;
  private final String publicationName;
  private final List<String> publicationTables;

  public DataStoreBinding(String connectionSlug, String publicationName, List<String> publicationTables) {
    OptionValidation.require("connectionSlug", connectionSlug);
    OptionValidation.require("publicationName", publicationName);
    this.connectionSlug = connectionSlug;
    this.publicationName = publicationName;
    this.publicationTables = publicationTables == null ? null : List.copyOf(publicationTables);
  }

  public static DataStoreBinding fromJson(JsonObject json) {
    Objects.requireNonNull(json, "json");
    JsonArray tables = json.getJsonArray("publicationTables");
    List<String> tableNames = null;
    if (tables != null) {
      tableNames = new ArrayList<>();
      for (Object table : tables) {
        tableNames.add(String.valueOf(table));
      }
    }
    return new DataStoreBinding(json.getString("connection"), json.getString("publicationName"), tableNames);
  }

  public String connectionSlug() {
    return connectionSlug;
  }

  public String publicationName() {
    return publicationName;
  }

  public List<String> publicationTables() {
    return publicationTables;
  }

  public PostgresPublication configPublication() {
    return PostgresPublication.configured(publicationName, publicationTables);
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("connection", connectionSlug)
      .put("publicationName", publicationName)
      .put("publicationTables", publicationTables == null ? null : new JsonArray(new ArrayList<>(publicationTables)));
  }
}
