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
import io.vertx.codegen.annotations.DataObject;
import io.vertx.core.json.JsonObject;

/**
 * Replication slot and stream settings shared by every listener of a process.
 */
@DataObject
public class PostgresListenerOptions {

  public static final String DEFAULT_SLOT_NAME = "rejot_slot";
  public static final int DEFAULT_PROTOCOL_VERSION = 2;
  public static final long DEFAULT_IDLE_POLL_INTERVAL_MS = 50L;
  public static final int DEFAULT_STATUS_INTERVAL_MS = 10_000;

  private String slotName;
  private int protocolVersion;
  private long idlePollIntervalMs;
  private int statusIntervalMs;

  public PostgresListenerOptions() {
    init();
  }

  public PostgresListenerOptions(JsonObject json) {
    init();
    PostgresListenerOptionsConverter.fromJson(json, this);
  }

  public PostgresListenerOptions(PostgresListenerOptions other) {
    this.slotName = other.slotName;
    this.protocolVersion = other.protocolVersion;
    this.idlePollIntervalMs = other.idlePollIntervalMs;
    this.statusIntervalMs = other.statusIntervalMs;
  }

  public String getSlotName() {
    return slotName;
  }

  public PostgresListenerOptions setSlotName(String slotName) {
    this.slotName = slotName;
    return this;
  }

  public int getProtocolVersion() {
    return protocolVersion;
  }

  public PostgresListenerOptions setProtocolVersion(int protocolVersion) {
    this.protocolVersion = protocolVersion;
    return this;
  }

  public long getIdlePollIntervalMs() {
    return idlePollIntervalMs;
  }

  public PostgresListenerOptions setIdlePollIntervalMs(long idlePollIntervalMs) {
    this.idlePollIntervalMs = idlePollIntervalMs;
    return this;
  }

  public int getStatusIntervalMs() {
    return statusIntervalMs;
  }

  public PostgresListenerOptions setStatusIntervalMs(int statusIntervalMs) {
    this.statusIntervalMs = statusIntervalMs;
    return this;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    PostgresListenerOptionsConverter.toJson(this, json);
    return json;
  }

  public PostgresListenerOptions merge(JsonObject other) {
    JsonObject json = toJson();
    json.mergeIn(other);
    return new PostgresListenerOptions(json);
  }

  void validate() {
    OptionValidation.requireIdentifier("slotName", slotName);
    OptionValidation.requireMin("protocolVersion", protocolVersion, 1);
    OptionValidation.requireMin("idlePollIntervalMs", idlePollIntervalMs, 1);
    OptionValidation.requireMin("statusIntervalMs", statusIntervalMs, 1);
  }

  private void init() {
    slotName = DEFAULT_SLOT_NAME;
    protocolVersion = DEFAULT_PROTOCOL_VERSION;
    idlePollIntervalMs = DEFAULT_IDLE_POLL_INTERVAL_MS;
    statusIntervalMs = DEFAULT_STATUS_INTERVAL_MS;
  }
}
