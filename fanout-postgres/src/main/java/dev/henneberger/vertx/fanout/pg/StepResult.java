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
 * What the replication loop has to do after feeding one message to the {@link TransactionStateMachine}.
 */
public final class StepResult {

  public enum Kind {
    /** Nothing to do, read the next message. */
    CONTINUE,
    /** A transaction is complete, hand {@link #buffer()} to the commit handler. */
    COMMIT,
    /** Report {@link #lsn()} as flushed to the server. */
    ACKNOWLEDGE,
    /** A transaction at or below the resume position was skipped. */
    REPLAYED,
    /** A protocol invariant was violated; stop replicating. */
    FATAL
  }

  private static final StepResult CONTINUE = new StepResult(Kind.CONTINUE, null, null, null);

  private final Kind kind;
  private final TransactionBuffer buffer;
  private final LogSequenceNumber lsn;
  private final String reason;

  private StepResult(Kind kind, TransactionBuffer buffer, LogSequenceNumber lsn, String reason) {
    this.kind = kind;
    this.buffer = buffer;
    this.lsn = lsn;
    this.reason = reason;
  }

  public static StepResult proceed() {
    return CONTINUE;
  }

  public static StepResult commit(TransactionBuffer buffer) {
    return new StepResult(Kind.COMMIT, Objects.requireNonNull(buffer, "buffer"), buffer.commitEndLsn(), null);
  }

  public static StepResult acknowledge(LogSequenceNumber lsn) {
    return new StepResult(Kind.ACKNOWLEDGE, null, Objects.requireNonNull(lsn, "lsn"), null);
  }

  public static StepResult replayed(LogSequenceNumber lsn) {
    return new StepResult(Kind.REPLAYED, null, lsn, null);
  }

  public static StepResult fatal(String reason) {
    return new StepResult(Kind.FATAL, null, null, Objects.requireNonNull(reason, "reason"));
  }

  public Kind kind() {
    return kind;
  }

  public TransactionBuffer buffer() {
    return buffer;
  }

  public LogSequenceNumber lsn() {
    return lsn;
  }

  public String reason() {
    return reason;
  }

  @Override
  public String toString() {
    switch (kind) {
      case COMMIT:
        return "COMMIT(" + buffer + ")";
      case ACKNOWLEDGE:
      case REPLAYED:
        return kind + "(" + (lsn == null ? null : lsn.asString()) + ")";
      case FATAL:
        return "FATAL(" + reason + ")";
      default:
        return kind.name();
    }
  }
}
