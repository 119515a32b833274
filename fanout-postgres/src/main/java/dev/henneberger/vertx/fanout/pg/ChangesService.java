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

import dev.henneberger.vertx.fanout.core.PublicSchemaRepository;
import dev.henneberger.vertx.fanout.core.PublicSchemaTransformation;
import dev.henneberger.vertx.fanout.core.Transformation;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves the public schema transformations a transaction's operations must be materialized with.
 *
 * <p>Operations are collapsed to the last one per entity (table plus key values) so each changed row is
 * materialized once per commit. Each public schema on the table contributes its highest version only.
 */
public final class ChangesService {

  private final PublicSchemaRepository publicSchemas;

  public ChangesService(PublicSchemaRepository publicSchemas) {
    this.publicSchemas = Objects.requireNonNull(publicSchemas, "publicSchemas");
  }

  /**
   * @throws PipelineException for a delete on a table that public schemas are registered for
   */
  public List<OperationTransformation> getTransformationsForOperations(String connectionSlug,
                                                                       List<Operation> operations) {
    Objects.requireNonNull(connectionSlug, "connectionSlug");
    Objects.requireNonNull(operations, "operations");

    Map<List<Object>, Operation> lastOperationByEntity = new LinkedHashMap<>();
    for (Operation operation : operations) {
      List<Object> entityKey = new ArrayList<>();
      entityKey.add(operation.qualifiedTable());
      entityKey.addAll(operation.keyValues().values());
      lastOperationByEntity.remove(entityKey);
      lastOperationByEntity.put(entityKey, operation);
    }

    List<OperationTransformation> result = new ArrayList<>();
    for (Operation operation : lastOperationByEntity.values()) {
      List<PublicSchemaTransformation> candidates = publicSchemas.findByConnectionAndBaseTable(
        connectionSlug, operation.tableSchema(), operation.table());
      if (candidates.isEmpty()) {
        continue;
      }
      if (operation.type() == Operation.Type.DELETE) {
        throw new PipelineException("Delete not supported: " + operation);
      }
      for (Map.Entry<Long, Transformation> latest : latestPerPublicSchema(candidates).entrySet()) {
        result.add(new OperationTransformation(latest.getKey(), operation, latest.getValue()));
      }
    }
    return result;
  }

  private static Map<Long, Transformation> latestPerPublicSchema(List<PublicSchemaTransformation> candidates) {
    Map<Long, Transformation> latest = new LinkedHashMap<>();
    for (PublicSchemaTransformation candidate : candidates) {
      Transformation current = latest.get(candidate.publicSchemaId());
      if (current == null || candidate.transformation().majorVersion() > current.majorVersion()) {
        latest.put(candidate.publicSchemaId(), candidate.transformation());
      }
    }
    return latest;
  }
}
