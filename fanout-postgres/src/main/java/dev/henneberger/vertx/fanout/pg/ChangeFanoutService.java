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
import dev.henneberger.vertx.fanout.core.ReplicationMetricsListener;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import org.postgresql.replication.LogSequenceNumber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the fan-out engine: verifies the configured data stores and starts one replication listener per
 * source connection.
 */
public final class ChangeFanoutService implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(ChangeFanoutService.class);

  private final Vertx vertx;
  private final ConnectionRegistry registry;
  private final List<DataStoreBinding> dataStores;
  private final ChangeTransformationPipeline pipeline;
  private final PostgresListenerOptions options;
  private final Map<String, PostgresReplicationListener> listeners = new ConcurrentHashMap<>();
  private final List<ReplicationMetricsListener> metricsListeners = new CopyOnWriteArrayList<>();

  public ChangeFanoutService(Vertx vertx,
                             ConnectionRegistry registry,
                             List<DataStoreBinding> dataStores,
                             ChangeTransformationPipeline pipeline,
                             PostgresListenerOptions options) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.dataStores = List.copyOf(Objects.requireNonNull(dataStores, "dataStores"));
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    this.options = new PostgresListenerOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();
  }

  public ChangeFanoutService addMetricsListener(ReplicationMetricsListener listener) {
    metricsListeners.add(Objects.requireNonNull(listener, "listener"));
    return this;
  }

  /**
   * Connects every configured data store and compares its configured publication with the database. The result
   * has one entry per data store, in configuration order. A data store whose connection is unknown or cannot be
   * opened gets a {@code CONNECTION_NOT_FOUND} or {@code CONNECTION_FAILED} error; the others are unaffected.
   */
  public Future<List<PublicationState>> verifyConnections() {
    return vertx.executeBlocking(() -> {
      List<PublicationState> states = new ArrayList<>();
      for (DataStoreBinding binding : dataStores) {
        PublicationState state = verify(binding);
        logState(binding, state);
        states.add(state);
      }
      return states;
    }, false);
  }

  /**
   * Starts replication for one data store. Never fails: problems are reported through the result status.
   */
  public Future<StartResult> start(StartRequest request) {
    Objects.requireNonNull(request, "request");
    String slug = request.connectionSlug();

    PostgresReplicationListener existing = listeners.get(slug);
    if (existing != null && existing.isRunning()) {
      return Future.succeededFuture(new StartResult(slug, StartStatus.ALREADY_STARTED, null));
    }

    return vertx.executeBlocking(() -> inspectSlot(request), false)
      .compose(check -> {
        if (check.status != null) {
          return Future.succeededFuture(new StartResult(slug, check.status, check.slotInfo));
        }
        return startListener(request, check.slotInfo);
      })
      .recover(err -> {
        LOG.error("Could not start replication for '{}'", slug, err);
        return Future.succeededFuture(new StartResult(slug, StartStatus.TERMINATED, null));
      });
  }

  /**
   * Verifies all data stores and starts those whose publication verified without errors.
   */
  public Future<List<StartResult>> startAll(Long listenForMs) {
    return verifyConnections().compose(states -> {
      List<Future<StartResult>> starts = new ArrayList<>();
      for (int i = 0; i < dataStores.size(); i++) {
        DataStoreBinding binding = dataStores.get(i);
        if (!states.get(i).ok()) {
          LOG.warn("Not starting replication for '{}', publication '{}' failed verification",
            binding.connectionSlug(), binding.publicationName());
          continue;
        }
        starts.add(start(StartRequest.of(binding, listenForMs)));
      }
      return Future.all(starts).map(done -> starts.stream().map(Future::result).collect(Collectors.toList()));
    });
  }

  public Optional<PostgresReplicationListener> listener(String connectionSlug) {
    return Optional.ofNullable(listeners.get(connectionSlug));
  }

  public void stop(String connectionSlug) {
    PostgresReplicationListener listener = listeners.remove(connectionSlug);
    if (listener != null) {
      listener.stop();
    }
  }

  @Override
  public void close() {
    for (String slug : new ArrayList<>(listeners.keySet())) {
      stop(slug);
    }
  }

  private PublicationState verify(DataStoreBinding binding) {
    String slug = binding.connectionSlug();
    try {
      registry.connect(List.of(binding));
      RegisteredConnection connection = registry.get(slug);
      Optional<PostgresPublication> databasePublication =
        PublicationIntrospector.fetch(connection.connection(), binding.publicationName());
      return new PublicationState(
        connection.config().dbIdentifier(),
        binding.configPublication(),
        databasePublication.orElse(null));
    } catch (ConnectionException e) {
      return PublicationState.unreachable(slug, binding.configPublication(),
        Diagnostic.error("CONNECTION_NOT_FOUND", e.getMessage(),
          "Add a connection with slug '" + slug + "' to the configuration"));
    } catch (SQLException e) {
      LOG.debug("Connection '{}' failed", slug, e);
      return PublicationState.unreachable(slug, binding.configPublication(),
        Diagnostic.error("CONNECTION_FAILED", "Connection '" + slug + "' failed: " + e.getMessage()));
    }
  }

  private SlotCheck inspectSlot(StartRequest request) throws Exception {
    String slug = request.connectionSlug();
    registry.connect(List.of(new DataStoreBinding(slug, request.publicationName(), null)));
    ConnectionConfig config = registry.config(slug);

    try (Connection connection = registry.openDedicated(slug)) {
      ReplicationSlotManager slots = new ReplicationSlotManager(connection);
      String slotName = options.getSlotName();

      List<Diagnostic> issues = slots.diagnose(slotName, config.getDatabase());
      if (Diagnostics.hasErrors(issues)) {
        LOG.error(Diagnostics.describeFailure("replication slot '" + slotName + "' on '" + slug + "'", issues));
        boolean walLevelInvalid = issues.stream().anyMatch(issue -> "WAL_LEVEL_INVALID".equals(issue.code()));
        return new SlotCheck(walLevelInvalid ? StartStatus.NO_LOGICAL_REPLICATION : StartStatus.TERMINATED, null);
      }

      if (!slots.hasSlot(slotName) && !slots.createSlot(slotName)) {
        return new SlotCheck(StartStatus.NO_LOGICAL_REPLICATION, null);
      }

      SlotInfo slotInfo = slots.getSlotInfo(slotName);
      if (slotInfo.active()) {
        LOG.info("Replication slot '{}' is already active (pid {})", slotName, slotInfo.activePid());
        return new SlotCheck(StartStatus.ALREADY_STARTED, slotInfo);
      }
      return new SlotCheck(null, slotInfo);
    }
  }

  private Future<StartResult> startListener(StartRequest request, SlotInfo slotInfo) {
    String slug = request.connectionSlug();
    PostgresReplicationListener listener = new PostgresReplicationListener(
      vertx,
      options,
      slug,
      PgReplicationTransport.factory(registry.config(slug), options, request.publicationName()),
      pipeline.commitHandler(slug));
    ReplicationLogging.attachDefaultLogging(listener, LOG, slug);
    for (ReplicationMetricsListener metricsListener : metricsListeners) {
      listener.addMetricsListener(metricsListener);
    }

    synchronized (listeners) {
      PostgresReplicationListener existing = listeners.get(slug);
      if (existing != null && existing.isRunning()) {
        return Future.succeededFuture(new StartResult(slug, StartStatus.ALREADY_STARTED, slotInfo));
      }
      listeners.put(slug, listener);
    }

    LogSequenceNumber resumeLsn = slotInfo.confirmedFlushLsn();
    LOG.info("Starting replication for '{}' publication={} slot={} resume={}",
      slug, request.publicationName(), slotInfo.slotName(), resumeLsn == null ? "-" : resumeLsn.asString());

    if (request.listenForMs() != null) {
      return listener.runFor(resumeLsn, request.listenForMs())
        .map(outcome -> new StartResult(slug,
          outcome == ListenerOutcome.STOPPED ? StartStatus.STOPPED : StartStatus.TERMINATED,
          slotInfo));
    }
    return listener.start(resumeLsn)
      .map(v -> new StartResult(slug, StartStatus.STARTED, slotInfo))
      .otherwise(err -> new StartResult(slug, StartStatus.TERMINATED, slotInfo));
  }

  private static void logState(DataStoreBinding binding, PublicationState state) {
    if (state.ok()) {
      LOG.info("Publication '{}' on '{}' ({}) verified",
        binding.publicationName(), binding.connectionSlug(), state.dbIdentifier());
      return;
    }
    LOG.error(Diagnostics.describeFailure(
      "publication '" + binding.publicationName() + "' on '" + binding.connectionSlug() + "'", state.errors()));
  }

  private static final class SlotCheck {
    private final StartStatus status;
    private final SlotInfo slotInfo;

    private SlotCheck(StartStatus status, SlotInfo slotInfo) {
      this.status = status;
      this.slotInfo = slotInfo;
    }
  }
}
