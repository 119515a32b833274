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

import java.sql.SQLException;
import org.postgresql.replication.LogSequenceNumber;

/**
 * Pull-based access to one logical replication session.
 */
public interface ReplicationTransport extends AutoCloseable {

  /**
   * @return the next event, or {@code null} when nothing is pending right now
   */
  WalEvent poll() throws SQLException;

  /**
   * Reports {@code lsn} as applied and flushed, allowing the server to advance the slot.
   */
  void acknowledge(LogSequenceNumber lsn) throws SQLException;

  @Override
  void close() throws SQLException;
}
