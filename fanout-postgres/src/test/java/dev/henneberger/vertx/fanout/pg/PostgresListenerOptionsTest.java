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

import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;

class PostgresListenerOptionsTest {

  @Test
  void defaultsToSharedSlot() {
    PostgresListenerOptions options = new PostgresListenerOptions();

    assertEquals("rejot_slot", options.getSlotName());
    assertEquals(2, options.getProtocolVersion());
    assertEquals(50L, options.getIdlePollIntervalMs());
    assertEquals(10_000, options.getStatusIntervalMs());
  }

  @Test
  void readsFromJsonAndSerializesToJson() {
    PostgresListenerOptions options = new PostgresListenerOptions(new JsonObject()
      .put("slotName", "orders_slot")
      .put("idlePollIntervalMs", 20L)
      .put("statusIntervalMs", 2000L));

    assertEquals("orders_slot", options.getSlotName());
    assertEquals(20L, options.getIdlePollIntervalMs());
    assertEquals(2000, options.getStatusIntervalMs());

    JsonObject out = options.toJson();
    assertEquals("orders_slot", out.getString("slotName"));
    assertEquals(2000L, out.getLong("statusIntervalMs"));
    assertEquals(2, out.getInteger("protocolVersion"));
  }

  @Test
  void mergesWithJsonLikeOtherVertxOptions() {
    PostgresListenerOptions merged = new PostgresListenerOptions()
      .setSlotName("a_slot")
      .merge(new JsonObject().put("idlePollIntervalMs", 5L));

    assertEquals("a_slot", merged.getSlotName());
    assertEquals(5L, merged.getIdlePollIntervalMs());
  }

  @Test
  void rejectsInvalidOptions() {
    assertThrows(IllegalArgumentException.class,
      () -> new PostgresListenerOptions().setSlotName("bad-slot").validate());
    IllegalArgumentException interval = assertThrows(IllegalArgumentException.class,
      () -> new PostgresListenerOptions().setIdlePollIntervalMs(0).validate());
    assertEquals("idlePollIntervalMs must be >= 1", interval.getMessage());
    IllegalArgumentException status = assertThrows(IllegalArgumentException.class,
      () -> new PostgresListenerOptions().setStatusIntervalMs(0).validate());
    assertEquals("statusIntervalMs must be >= 1", status.getMessage());
  }
}
