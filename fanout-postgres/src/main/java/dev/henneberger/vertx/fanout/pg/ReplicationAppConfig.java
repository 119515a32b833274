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

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Objects;

/**
 * Environment-driven bootstrap settings of {@link FanoutLauncher}.
 */
public final class ReplicationAppConfig {

  static final String DEFAULT_CONFIG_PATH = "fanout.json";

  private final Path configPath;
  private final String slotName;
  private final Long listenForMs;

  private ReplicationAppConfig(Path configPath, String slotName, Long listenForMs) {
    this.configPath = configPath;
    this.slotName = slotName;
    this.listenForMs = listenForMs;
  }

  public static ReplicationAppConfig fromEnv() {
    return fromMap(System.getenv());
  }

  static ReplicationAppConfig fromMap(Map<String, String> env) {
    Objects.requireNonNull(env, "env");

    Path configPath = Paths.get(envOrDefault(env, "FANOUT_CONFIG", DEFAULT_CONFIG_PATH));
    String slotName = envOrDefault(env, "FANOUT_SLOT_NAME", null);
    Long listenForMs = longEnvOrDefault(env, "FANOUT_LISTEN_MS", null);

    return new ReplicationAppConfig(configPath, slotName, listenForMs);
  }

  public Path configPath() {
    return configPath;
  }

  /**
   * Slot name override, {@code null} to keep the configured one.
   */
  public String slotName() {
    return slotName;
  }

  /**
   * Bounded run length, {@code null} to run until the process is stopped.
   */
  public Long listenForMs() {
    return listenForMs;
  }

  public PostgresListenerOptions applyTo(PostgresListenerOptions options) {
    PostgresListenerOptions resolved = new PostgresListenerOptions(options);
    if (slotName != null) {
      resolved.setSlotName(slotName);
    }
    return resolved;
  }

  private static String envOrDefault(Map<String, String> env, String key, String defaultValue) {
    String value = env.get(key);
    return value == null || value.isBlank() ? defaultValue : value;
  }

  private static Long longEnvOrDefault(Map<String, String> env, String key, Long defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      long parsed = Long.parseLong(value.trim());
      return parsed > 0 ? Long.valueOf(parsed) : defaultValue;
    } catch (NumberFormatException ignore) {
      return defaultValue;
    }
  }
}
