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

import dev.henneberger.vertx.fanout.core.InMemorySchemaCatalog;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Static process configuration, read from one JSON document:
 *
 * <pre>
 * {
 *   "listener": { "slotName": "rejot_slot" },
 *   "connections": [ { "slug": "shop", "host": "localhost", "database": "shop", "user": "postgres" } ],
 *   "dataStores": [ { "connection": "shop", "publicationName": "shop_pub", "publicationTables": ["orders"] } ],
 *   "publicSchemas": [ ... ],
 *   "consumerSchemas": [ ... ],
 *   "dependencies": [ ... ]
 * }
 * </pre>
 *
 * The schema sections follow {@link InMemorySchemaCatalog#fromJson(JsonObject)}.
 */
public final class FanoutConfig {

  private final PostgresListenerOptions listenerOptions;
  private final List<ConnectionConfig> connections;
  private final List<DataStoreBinding> dataStores;
  private final InMemorySchemaCatalog catalog;

  private FanoutConfig(PostgresListenerOptions listenerOptions,
                       List<ConnectionConfig> connections,
                       List<DataStoreBinding> dataStores,
                       InMemorySchemaCatalog catalog) {
    this.listenerOptions = listenerOptions;
    this.connections = List.copyOf(connections);
    this.dataStores = List.copyOf(dataStores);
    this.catalog = catalog;
  }

  public static FanoutConfig load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    return fromJson(new JsonObject(Files.readString(path, StandardCharsets.UTF_8)));
  }

  public static FanoutConfig fromJson(JsonObject json) {
    Objects.requireNonNull(json, "json");

    List<ConnectionConfig> connections = new ArrayList<>();
    for (JsonObject item : objects(json.getJsonArray("connections"))) {
      ConnectionConfig config = new ConnectionConfig(item);
      config.validate();
      connections.add(config);
    }

    List<DataStoreBinding> dataStores = new ArrayList<>();
    for (JsonObject item : objects(json.getJsonArray("dataStores"))) {
      dataStores.add(DataStoreBinding.fromJson(item));
    }

    PostgresListenerOptions listenerOptions = new PostgresListenerOptions(json.getJsonObject("listener"));
    listenerOptions.validate();

    return new FanoutConfig(listenerOptions, connections, dataStores, InMemorySchemaCatalog.fromJson(json));
  }

  public PostgresListenerOptions listenerOptions() {
    return new PostgresListenerOptions(listenerOptions);
  }

  public List<ConnectionConfig> connections() {
    return connections;
  }

  public List<DataStoreBinding> dataStores() {
    return dataStores;
  }

  public InMemorySchemaCatalog catalog() {
    return catalog;
  }

  private static List<JsonObject> objects(JsonArray array) {
    List<JsonObject> out = new ArrayList<>();
    if (array == null) {
      return out;
    }
    for (int i = 0; i < array.size(); i++) {
      out.add(array.getJsonObject(i));
    }
    return out;
  }
}
