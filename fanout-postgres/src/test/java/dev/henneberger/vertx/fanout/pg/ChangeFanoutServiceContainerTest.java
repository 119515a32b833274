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
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.fanout.core.ConsumerSchema;
import dev.henneberger.vertx.fanout.core.Dependency;
import dev.henneberger.vertx.fanout.core.DependencyResolver;
import dev.henneberger.vertx.fanout.core.Diagnostic;
import dev.henneberger.vertx.fanout.core.InMemorySchemaCatalog;
import dev.henneberger.vertx.fanout.core.PublicSchema;
import dev.henneberger.vertx.fanout.core.Transformation;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.GenericContainer;

class ChangeFanoutServiceContainerTest {

  private static final String SLOT_NAME = "fanout_it_slot";
  private static final String PUBLICATION_NAME = "fanout_it_pub";
  private static final String DB_NAME = "testdb";
  private static final String DB_USER = "test";
  private static final String DB_PASSWORD = "test";

  @Test
  void fansOutCommittedRowsToConsumerTable() throws Exception {
    Assumptions.assumeTrue(
      DockerClientFactory.instance().isDockerAvailable(),
      "Docker is required for Testcontainers integration tests");

    GenericContainer<?> postgres = createPostgresContainer();
    try {
      postgres.start();
      execute(postgres,
        "CREATE TABLE users (id INTEGER PRIMARY KEY, name TEXT NOT NULL, email TEXT)",
        "CREATE TABLE users_copy (id INTEGER PRIMARY KEY, name TEXT NOT NULL)",
        "CREATE PUBLICATION " + PUBLICATION_NAME + " FOR TABLE users");

      Vertx vertx = Vertx.vertx();
      ConnectionRegistry registry = new ConnectionRegistry(List.of(
        connection(postgres, "shop"), connection(postgres, "warehouse")));
      DataStoreBinding binding = new DataStoreBinding("shop", PUBLICATION_NAME, List.of("users"));
      ChangeFanoutService service = service(vertx, registry, binding);

      try {
        List<PublicationState> states = await(service.verifyConnections());
        assertEquals(1, states.size());
        assertTrue(states.get(0).ok(), () -> states.get(0).toJson().encode());

        StartResult started = await(service.start(StartRequest.of(binding, null)));
        assertEquals(StartStatus.STARTED, started.status());
        assertNotNull(started.slotInfo());
        assertEquals(StartStatus.ALREADY_STARTED, await(service.start(StartRequest.of(binding, null))).status());

        execute(postgres,
          "INSERT INTO users (id, name, email) VALUES (5, 'x', 'x@example.com')",
          "INSERT INTO users (id, name) VALUES (6, 'y')");
        awaitCopy(postgres, 5, "x");
        awaitCopy(postgres, 6, "y");

        execute(postgres, "UPDATE users SET name = 'x2' WHERE id = 5");
        awaitCopy(postgres, 5, "x2");

        PostgresReplicationListener listener = service.listener("shop").orElseThrow();
        service.stop("shop");
        assertEquals(ListenerOutcome.STOPPED, await(listener.termination()));
        waitForSlotInactive(postgres, SLOT_NAME);

        execute(postgres, "INSERT INTO users (id, name) VALUES (7, 'z')");
        StartResult bounded = await(service.start(StartRequest.of(binding, 2000L)));
        assertEquals(StartStatus.STOPPED, bounded.status());
        assertEquals(Optional.of("z"), copiedName(postgres, 7));
        assertEquals(Optional.of("x2"), copiedName(postgres, 5));
      } finally {
        service.close();
        registry.close();
        vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
      }
    } finally {
      postgres.stop();
    }
  }

  @Test
  void inspectsSlotsAndPublications() throws Exception {
    Assumptions.assumeTrue(
      DockerClientFactory.instance().isDockerAvailable(),
      "Docker is required for Testcontainers integration tests");

    GenericContainer<?> postgres = createPostgresContainer();
    try {
      postgres.start();
      execute(postgres,
        "CREATE TABLE orders (id INTEGER PRIMARY KEY)",
        "CREATE PUBLICATION all_pub FOR ALL TABLES");

      try (Connection conn = DriverManager.getConnection(jdbcUrl(postgres), DB_USER, DB_PASSWORD)) {
        PostgresPublication allTables = PublicationIntrospector.fetch(conn, "all_pub").orElseThrow();
        assertTrue(allTables.allTables());
        assertFalse(PublicationIntrospector.fetch(conn, "missing_pub").isPresent());

        ReplicationSlotManager slots = new ReplicationSlotManager(conn);
        assertTrue(slots.diagnose("inspect_slot", DB_NAME).isEmpty());
        assertFalse(slots.hasSlot("inspect_slot"));
        assertTrue(slots.createSlot("inspect_slot"));
        assertTrue(slots.createSlot("inspect_slot"));
        assertTrue(slots.hasSlot("inspect_slot"));

        SlotInfo info = slots.getSlotInfo("inspect_slot");
        assertEquals("pgoutput", info.plugin());
        assertEquals(DB_NAME, info.database());
        assertFalse(info.active());
        assertNotNull(info.confirmedFlushLsn());

        List<Diagnostic> wrongDatabase = slots.diagnose("inspect_slot", "otherdb");
        assertEquals(1, wrongDatabase.size());
        assertEquals("SLOT_DATABASE_MISMATCH", wrongDatabase.get(0).code());
      }

      Vertx vertx = Vertx.vertx();
      ConnectionRegistry registry = new ConnectionRegistry(List.of(connection(postgres, "shop")));
      DataStoreBinding binding = new DataStoreBinding("shop", "missing_pub", null);
      ChangeFanoutService service = service(vertx, registry, binding);
      try {
        PublicationState state = await(service.verifyConnections()).get(0);
        assertFalse(state.ok());
        assertEquals(PublicationStateVerifier.PUBLICATION_MISSING, state.errors().get(0).code());
        assertTrue(await(service.startAll(null)).isEmpty());
      } finally {
        service.close();
        registry.close();
        vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
      }
    } finally {
      postgres.stop();
    }
  }

  private static ChangeFanoutService service(Vertx vertx, ConnectionRegistry registry, DataStoreBinding binding) {
    InMemorySchemaCatalog catalog = new InMemorySchemaCatalog()
      .addPublicSchema(new PublicSchema(1L, "users", "shop", "users", List.of(
        new Transformation(1, "SELECT name FROM users WHERE id = $1"))))
      .addConsumerSchema(new ConsumerSchema(2L, "users_copy", "warehouse", List.of(
        new Transformation(1, "INSERT INTO users_copy (id, name) VALUES (:id, :name) "
          + "ON CONFLICT (id) DO UPDATE SET name = EXCLUDED.name"))))
      .addDependency(new Dependency("default", 1L, 2L));
    ChangeTransformationPipeline pipeline = new ChangeTransformationPipeline(
      new ChangesService(catalog),
      new DependencyResolver(catalog, catalog),
      new JdbcTransformationExecutor(vertx, registry));
    PostgresListenerOptions options = new PostgresListenerOptions()
      .setSlotName(SLOT_NAME)
      .setIdlePollIntervalMs(20)
      .setStatusIntervalMs(1000);
    return new ChangeFanoutService(vertx, registry, List.of(binding), pipeline, options);
  }

  private static ConnectionConfig connection(GenericContainer<?> postgres, String slug) {
    return new ConnectionConfig()
      .setSlug(slug)
      .setHost(postgres.getHost())
      .setPort(postgres.getFirstMappedPort())
      .setDatabase(DB_NAME)
      .setUser(DB_USER)
      .setPassword(DB_PASSWORD);
  }

  private static void execute(GenericContainer<?> postgres, String... statements) throws Exception {
    try (Connection conn = DriverManager.getConnection(jdbcUrl(postgres), DB_USER, DB_PASSWORD);
         Statement statement = conn.createStatement()) {
      for (String sql : statements) {
        statement.execute(sql);
      }
    }
  }

  private static Optional<String> copiedName(GenericContainer<?> postgres, int id) throws Exception {
    try (Connection conn = DriverManager.getConnection(jdbcUrl(postgres), DB_USER, DB_PASSWORD);
         PreparedStatement statement = conn.prepareStatement("SELECT name FROM users_copy WHERE id = ?")) {
      statement.setInt(1, id);
      try (ResultSet rs = statement.executeQuery()) {
        return rs.next() ? Optional.of(rs.getString(1)) : Optional.empty();
      }
    }
  }

  private static void awaitCopy(GenericContainer<?> postgres, int id, String name) throws Exception {
    long deadline = System.currentTimeMillis() + 30_000L;
    while (System.currentTimeMillis() < deadline) {
      if (Optional.of(name).equals(copiedName(postgres, id))) {
        return;
      }
      Thread.sleep(100);
    }
    throw new AssertionError("users_copy row " + id + " never became '" + name + "'");
  }

  private static void waitForSlotInactive(GenericContainer<?> postgres, String slotName) throws Exception {
    long deadline = System.currentTimeMillis() + 30_000L;
    while (System.currentTimeMillis() < deadline) {
      try (Connection conn = DriverManager.getConnection(jdbcUrl(postgres), DB_USER, DB_PASSWORD);
           PreparedStatement statement = conn.prepareStatement(
             "SELECT active FROM pg_replication_slots WHERE slot_name = ?")) {
        statement.setString(1, slotName);
        try (ResultSet rs = statement.executeQuery()) {
          if (rs.next() && !rs.getBoolean(1)) {
            return;
          }
        }
      }
      Thread.sleep(100);
    }
    throw new AssertionError("Replication slot still active: " + slotName);
  }

  private static <T> T await(Future<T> future) throws Exception {
    return future.toCompletionStage().toCompletableFuture().get(60, TimeUnit.SECONDS);
  }

  private static GenericContainer<?> createPostgresContainer() {
    return new GenericContainer<>("postgres:16")
      .withExposedPorts(5432)
      .withEnv("POSTGRES_DB", DB_NAME)
      .withEnv("POSTGRES_USER", DB_USER)
      .withEnv("POSTGRES_PASSWORD", DB_PASSWORD)
      .withStartupTimeout(Duration.ofMinutes(10))
      .withCommand("postgres",
        "-c", "wal_level=logical",
        "-c", "max_replication_slots=10",
        "-c", "max_wal_senders=10");
  }

  private static String jdbcUrl(GenericContainer<?> postgres) {
    return "jdbc:postgresql://" + postgres.getHost() + ":" + postgres.getFirstMappedPort() + "/" + DB_NAME;
  }
}
