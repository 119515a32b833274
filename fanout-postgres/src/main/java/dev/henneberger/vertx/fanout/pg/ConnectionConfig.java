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
import io.vertx.core.json.JsonObject;
import java.util.Properties;
import org.postgresql.PGProperty;

/**
 * How to reach one Postgres database, addressed by its connection slug.
 */
public class ConnectionConfig {

  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 5432;

  private String slug;
  private String host = DEFAULT_HOST;
  private int port = DEFAULT_PORT;
  private String database;
  private String user;
  private String password;
  private String passwordEnv;
  private boolean ssl;

  public ConnectionConfig() {
  }

  public ConnectionConfig(JsonObject json) {
    if (json == null) {
      return;
    }
    slug = json.getString("slug");
    host = json.getString("host", DEFAULT_HOST);
    port = json.getInteger("port", DEFAULT_PORT);
    database = json.getString("database");
    user = json.getString("user");
    password = json.getString("password");
    passwordEnv = json.getString("passwordEnv");
    ssl = json.getBoolean("ssl", false);
  }

  public ConnectionConfig(ConnectionConfig other) {
    this.slug = other.slug;
    this.host = other.host;
    this.port = other.port;
    this.database = other.database;
    this.user = other.user;
    this.password = other.password;
    this.passwordEnv = other.passwordEnv;
    this.ssl = other.ssl;
  }

  public String getSlug() {
    return slug;
  }

  public ConnectionConfig setSlug(String slug) {
    this.slug = slug;
    return this;
  }

  public String getHost() {
    return host;
  }

  public ConnectionConfig setHost(String host) {
    this.host = host;
    return this;
  }

  public int getPort() {
    return port;
  }

  public ConnectionConfig setPort(int port) {
    this.port = port;
    return this;
  }

  public String getDatabase() {
    return database;
  }

  public ConnectionConfig setDatabase(String database) {
    this.database = database;
    return this;
  }

  public String getUser() {
    return user;
  }

  public ConnectionConfig setUser(String user) {
    this.user = user;
    return this;
  }

  public String getPassword() {
    return password;
  }

  public ConnectionConfig setPassword(String password) {
    this.password = password;
    return this;
  }

  public String getPasswordEnv() {
    return passwordEnv;
  }

  public ConnectionConfig setPasswordEnv(String passwordEnv) {
    this.passwordEnv = passwordEnv;
    return this;
  }

  public boolean isSsl() {
    return ssl;
  }

  public ConnectionConfig setSsl(boolean ssl) {
    this.ssl = ssl;
    return this;
  }

  public String jdbcUrl() {
    return "jdbc:postgresql://" + host + ':' + port + '/' + database;
  }

  /**
   * Identifies the database in diagnostics, e.g. {@code localhost:5432/shop}.
   */
  public String dbIdentifier() {
    return host + ':' + port + '/' + database;
  }

  public Properties connectionProperties() {
    Properties props = new Properties();
    PGProperty.USER.set(props, user);

    String resolved = resolvePassword();
    if (resolved != null && !resolved.isBlank()) {
      PGProperty.PASSWORD.set(props, resolved);
    }

    if (ssl) {
      props.setProperty("ssl", "true");
    }
    // decoded WAL values arrive as text; let the server infer parameter types
    PGProperty.STRING_TYPE.set(props, "unspecified");
    return props;
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("slug", slug)
      .put("host", host)
      .put("port", port)
      .put("database", database)
      .put("user", user)
      .put("password", password)
      .put("passwordEnv", passwordEnv)
      .put("ssl", ssl);
  }

  public void validate() {
    OptionValidation.require("slug", slug);
    OptionValidation.require("host", host);
    OptionValidation.requirePort(port);
    OptionValidation.require("database", database);
    OptionValidation.require("user", user);
  }

  String resolvePassword() {
    String resolved = password;
    if (resolved == null || resolved.isBlank()) {
      if (passwordEnv != null && !passwordEnv.isBlank()) {
        resolved = System.getenv(passwordEnv);
      }
    }
    return resolved;
  }
}
