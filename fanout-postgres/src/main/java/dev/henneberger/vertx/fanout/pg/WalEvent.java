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
import org.postgresql.replication.LogSequenceNumber;

/**
 * A decoded message together with the stream position it was received at.
 */
public final class WalEvent {

  private final LogSequenceNumber streamLsn;
  private final WalMessage message;

  public WalEvent(LogSequenceNumber streamLsn, WalMessage message) {
    this.streamLsn = streamLsn;
    this.message = Objects.requireNonNull(message, "message");
  }

  public LogSequenceNumber streamLsn() {
    return streamLsn;
  }

  public WalMessage message() {
    return message;
  }

  @Override
  public String toString() {
    return message + "@" + (streamLsn == null ? null : streamLsn.asString());
  }
}
