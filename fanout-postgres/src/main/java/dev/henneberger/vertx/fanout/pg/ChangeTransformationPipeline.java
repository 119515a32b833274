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

import dev.henneberger.vertx.fanout.core.CommitHandler;
import dev.henneberger.vertx.fanout.core.ConsumerSchema;
import dev.henneberger.vertx.fanout.core.DependencyResolver;
import dev.henneberger.vertx.fanout.core.MaterializedRow;
import dev.henneberger.vertx.fanout.core.Transformation;
import dev.henneberger.vertx.fanout.core.TransformationSelector;
import io.vertx.core.Future;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Carries one committed transaction from its source to every dependent consumer: materialize each changed row
 * through its public schema on the source, then apply the row with the newest transformation of every consumer
 * schema on that consumer's destination.
 *
 * <p>The result is {@code true} only if every materialization and every consumer write succeeded. Failures are
 * logged here and reported as {@code false}.
 */
public final class ChangeTransformationPipeline {

  private static final Logger LOG = LoggerFactory.getLogger(ChangeTransformationPipeline.class);

  private final ChangesService changesService;
  private final DependencyResolver dependencyResolver;
  private final TransformationExecutor executor;

  public ChangeTransformationPipeline(ChangesService changesService,
                                      DependencyResolver dependencyResolver,
                                      TransformationExecutor executor) {
    this.changesService = Objects.requireNonNull(changesService, "changesService");
    this.dependencyResolver = Objects.requireNonNull(dependencyResolver, "dependencyResolver");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  public CommitHandler<TransactionBuffer> commitHandler(String connectionSlug) {
    Objects.requireNonNull(connectionSlug, "connectionSlug");
    return buffer -> process(connectionSlug, buffer);
  }

  public Future<Boolean> process(String connectionSlug, TransactionBuffer buffer) {
    Objects.requireNonNull(connectionSlug, "connectionSlug");
    Objects.requireNonNull(buffer, "buffer");

    List<Future<Void>> work = new ArrayList<>();
    try {
      for (OperationTransformation item : changesService.getTransformationsForOperations(
        connectionSlug, buffer.operations())) {
        work.add(materialize(connectionSlug, item)
          .compose(row -> fanOut(item.publicSchemaId(), row)));
      }
    } catch (RuntimeException e) {
      logFailure(connectionSlug, buffer, e);
      return Future.succeededFuture(false);
    }

    if (work.isEmpty()) {
      return Future.succeededFuture(true);
    }

    int rows = work.size();
    return Future.all(work)
      .map(done -> {
        LOG.debug("Processed transaction xid={} from '{}': {} row(s) fanned out", buffer.xid(), connectionSlug, rows);
        return true;
      })
      .otherwise(err -> {
        logFailure(connectionSlug, buffer, err);
        return false;
      });
  }

  private Future<MaterializedRow> materialize(String connectionSlug, OperationTransformation item) {
    Operation operation = item.operation();
    Map<String, Object> keyValues = operation.keyValues();
    return executor.query(connectionSlug, item.transformation().sql(), MaterializedRow.of(keyValues))
      .compose(rows -> {
        if (rows.size() != 1) {
          return Future.failedFuture(new PipelineException("Public schema " + item.publicSchemaId()
            + " returned " + rows.size() + " rows for " + operation + ", expected exactly 1"));
        }
        return Future.succeededFuture(MaterializedRow.merge(keyValues, rows.get(0)));
      });
  }

  private Future<Void> fanOut(long publicSchemaId, MaterializedRow row) {
    List<ConsumerSchema> consumers = dependencyResolver.getConsumersForPublicSchema(publicSchemaId);
    List<Future<Void>> writes = new ArrayList<>(consumers.size());
    for (ConsumerSchema consumer : consumers) {
      Optional<Transformation> transformation = TransformationSelector.latest(consumer.transformations());
      if (!transformation.isPresent()) {
        writes.add(Future.failedFuture(new PipelineException(
          "Consumer schema " + consumer.id() + " (" + consumer.code() + ") has no transformations")));
        continue;
      }
      writes.add(executor.execute(consumer.destinationConnectionSlug(), transformation.get().sql(), row));
    }
    return Future.all(writes).mapEmpty();
  }

  private static void logFailure(String connectionSlug, TransactionBuffer buffer, Throwable error) {
    LOG.error("Failed to process transaction xid={} lsn={} from '{}'",
      buffer.xid(),
      buffer.commitLsn() == null ? null : buffer.commitLsn().asString(),
      connectionSlug,
      error);
  }
}
