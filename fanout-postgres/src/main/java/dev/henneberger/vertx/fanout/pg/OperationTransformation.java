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

import dev.henneberger.vertx.fanout.core.Transformation;
import java.util.Objects;

public final class OperationTransformation {

  private final long publicSchemaId;
  private final Operation operation;
  private final Transformation transformation;

  public OperationTransformation(long publicSchemaId, Operation operation, Transformation transformation) {
    this.publicSchemaId = publicSchemaId;
    this.operation = Objects.requireNonNull(operation, "operation");
    this.transformation = Objects.requireNonNull(transformation, "transformation");
  }

  public long publicSchemaId() {
    return publicSchemaId;
  }

  public Operation operation() {
    return operation;
  }

  public Transformation transformation() {
    return transformation;
  }
}
