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

import org.postgresql.replication.LogSequenceNumber;

/**
 * Per-listener transaction buffering. Holds either no buffer (between transactions) or exactly one buffer that
 * started with the most recent {@code begin}. Never throws for protocol violations; those come back as
 * {@link StepResult.Kind#FATAL}.
 *
 * <p>Not thread safe. Owned by one replication worker.
 */
public final class TransactionStateMachine {

  static final String RELATION_BEFORE_BEGIN = "Got relation before begin.";
  static final String OPERATION_BEFORE_RELATION = "Got operation before relation.";
  static final String MISSING_PROPERTIES = "Transaction buffer is missing required properties";

  private final LogSequenceNumber resumeLsn;
  private TransactionBuffer buffer;

  public TransactionStateMachine() {
    this(null);
  }

  /**
   * @param resumeLsn position already confirmed by the slot; transactions ending at or below it are skipped
   */
  public TransactionStateMachine(LogSequenceNumber resumeLsn) {
    this.resumeLsn = resumeLsn == null || LogSequenceNumber.INVALID_LSN.equals(resumeLsn) ? null : resumeLsn;
  }

  public StepResult step(LogSequenceNumber streamLsn, WalMessage message) {
    switch (message.kind()) {
      case BEGIN: {
        WalMessage.Begin begin = (WalMessage.Begin) message;
        buffer = new TransactionBuffer(begin.finalLsn(), streamLsn, begin.commitTime(), begin.xid());
        return StepResult.proceed();
      }
      case RELATION:
        if (buffer == null) {
          return StepResult.fatal(RELATION_BEFORE_BEGIN);
        }
        buffer.putRelation(((WalMessage.RelationMessage) message).relation());
        return StepResult.proceed();
      case INSERT:
      case UPDATE:
      case DELETE:
        if (buffer == null) {
          return StepResult.fatal(OPERATION_BEFORE_RELATION);
        }
        buffer.addOperation(Operation.fromMessage(message));
        return StepResult.proceed();
      case COMMIT:
        return onCommit((WalMessage.Commit) message);
      case KEEPALIVE: {
        WalMessage.Keepalive keepalive = (WalMessage.Keepalive) message;
        if (keepalive.shouldRespond() && buffer == null) {
          return StepResult.acknowledge(keepalive.lsn());
        }
        return StepResult.proceed();
      }
      default:
        return StepResult.fatal("Unsupported message " + message.kind());
    }
  }

  /**
   * Called once the committed buffer has been applied. Resets to the empty state and returns the position to
   * acknowledge.
   */
  public LogSequenceNumber completeCommit() {
    TransactionBuffer committed = buffer;
    if (committed == null) {
      throw new IllegalStateException("no transaction is awaiting completion");
    }
    buffer = null;
    return committed.commitEndLsn();
  }

  public boolean inTransaction() {
    return buffer != null;
  }

  public TransactionBuffer buffer() {
    return buffer;
  }

  private StepResult onCommit(WalMessage.Commit commit) {
    TransactionBuffer current = buffer;
    if (current == null || !current.hasRequiredProperties()) {
      return StepResult.fatal(MISSING_PROPERTIES);
    }
    if (!commit.commitLsn().equals(current.commitLsn())) {
      return StepResult.fatal("Commit LSN mismatch: expected " + current.commitLsn().asString()
        + " but got " + commit.commitLsn().asString());
    }

    // acknowledged position must be past the commit record, not the first LSN seen at begin
    current.advanceCommitEndLsn(commit.endLsn());

    if (resumeLsn != null && commit.endLsn().compareTo(resumeLsn) <= 0) {
      buffer = null;
      return StepResult.replayed(commit.endLsn());
    }
    return StepResult.commit(current);
  }
}
