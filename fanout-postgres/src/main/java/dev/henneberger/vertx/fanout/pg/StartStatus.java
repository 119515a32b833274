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

public enum StartStatus {
  STARTED,
  ALREADY_STARTED,
  /** A bounded run used up its time and stopped cleanly. */
  STOPPED,
  TERMINATED,
  /** The replication slot could not be created, logical replication is unavailable on the server. */
  NO_LOGICAL_REPLICATION
}
