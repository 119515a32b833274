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

import io.vertx.core.json.JsonObject;

final class PostgresListenerOptionsConverter {

  private PostgresListenerOptionsConverter() {
  }

  static void fromJson(JsonObject json, PostgresListenerOptions options) {
    if (json == null) {
      return;
    }

    if (json.containsKey("slotName")) {
      options.setSlotName(json.getString("slotName"));
    }
    if (json.containsKey("protocolVersion")) {
      options.setProtocolVersion(json.getInteger("protocolVersion"));
    }
    if (json.containsKey("idlePollIntervalMs")) {
      options.setIdlePollIntervalMs(json.getLong("idlePollIntervalMs"));
    }
    if (json.containsKey("statusIntervalMs")) {
      options.setStatusIntervalMs(json.getInteger("statusIntervalMs"));
    }
  }

  static void toJson(PostgresListenerOptions options, JsonObject json) {
    json.put("slotName", options.getSlotName());
    json.put("protocolVersion", options.getProtocolVersion());
    json.put("idlePollIntervalMs", options.getIdlePollIntervalMs());
    json.put("statusIntervalMs", options.getStatusIntervalMs());
  }
}
