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

import java.util.Objects;

public final class RelationColumn {

  private static final int FLAG_KEY = 1;

  private final int flags;
  private final String name;
  private final int typeOid;
  private final int typeModifier;

  public RelationColumn(int flags, String name, int typeOid, int typeModifier) {
    this.flags = flags;
    this.name = Objects.requireNonNull(name, "name");
    this.typeOid = typeOid;
    this.typeModifier = typeModifier;
  }

  public int flags() {
    return flags;
  }

  public String name() {
    return name;
  }

  public int typeOid() {
    return typeOid;
  }

  public int typeModifier() {
    return typeModifier;
  }

  /**
   * Whether the column is part of the table's replica identity.
   */
  public boolean isKey() {
    return (flags & FLAG_KEY) != 0;
  }
}
