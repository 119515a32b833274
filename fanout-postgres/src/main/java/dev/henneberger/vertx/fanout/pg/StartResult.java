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

public final class StartResult {

  private final String connectionSlug;
  private final StartStatus status;
  private final SlotInfo slotInfo;

  public StartResult(String connectionSlug, StartStatus status, SlotInfo slotInfo) {
    this.connectionSlug = Objects.requireNonNull(connectionSlug, "connectionSlug");
    this.status = Objects.requireNonNull(status, "status");
    this.slotInfo = slotInfo;
  }

  public String connectionSlug() {
    return connectionSlug;
  }

  public StartStatus status() {
    return status;
  }

  /**
   * The slot as seen before starting; {@code null} when the slot could not be inspected.
   */
  public SlotInfo slotInfo() {
    return slotInfo;
  }

  @Override
  public String toString() {
    return "StartResult{connection=" + connectionSlug + ", status=" + status + ", slotInfo=" + slotInfo + '}';
  }
}
