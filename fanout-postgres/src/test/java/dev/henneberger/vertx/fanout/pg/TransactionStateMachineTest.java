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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.postgresql.replication.LogSequenceNumber;

class TransactionStateMachineTest {

  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
  private static final Relation USERS = new Relation(1, "public", "users", 'd', List.of(
    new RelationColumn(1, "id", 23, -1),
    new RelationColumn(0, "name", 25, -1)));

  @Test
  void buffersOperationsInArrivalOrderUntilCommit() {
    TransactionStateMachine machine = new TransactionStateMachine();

    assertEquals(StepResult.Kind.CONTINUE, machine.step(lsn(0x10), begin(0x40, 7)).kind());
    assertEquals(StepResult.Kind.CONTINUE, machine.step(lsn(0x10), new WalMessage.RelationMessage(USERS)).kind());
    machine.step(lsn(0x20), insert(1, "a"));
    machine.step(lsn(0x30), insert(2, "b"));

    StepResult result = machine.step(lsn(0x40), commit(0x40, 0x48));

    assertEquals(StepResult.Kind.COMMIT, result.kind());
    TransactionBuffer buffer = result.buffer();
    assertEquals(7L, buffer.xid());
    assertEquals(2, buffer.operations().size());
    assertEquals(Map.of("id", 1), buffer.operations().get(0).keyValues());
    assertEquals(Map.of("id", 2), buffer.operations().get(1).keyValues());
    assertSame(USERS, buffer.relations().get(1));
    assertEquals(lsn(0x48), result.lsn());
    assertTrue(machine.inTransaction());

    assertEquals(lsn(0x48), machine.completeCommit());
    assertFalse(machine.inTransaction());
    assertNull(machine.buffer());
  }

  @Test
  void commitEndLsnNeverMovesBackwards() {
    TransactionStateMachine machine = new TransactionStateMachine();
    machine.step(lsn(0x90), begin(0x40, 1));
    machine.step(lsn(0x90), new WalMessage.RelationMessage(USERS));
    machine.step(lsn(0x90), insert(1, "a"));

    StepResult result = machine.step(lsn(0x90), commit(0x40, 0x48));

    assertEquals(lsn(0x90), result.lsn());
  }

  @Test
  void newBeginDiscardsUnfinishedTransaction() {
    TransactionStateMachine machine = new TransactionStateMachine();
    machine.step(lsn(0x10), begin(0x40, 1));
    machine.step(lsn(0x10), new WalMessage.RelationMessage(USERS));
    machine.step(lsn(0x20), insert(1, "a"));

    machine.step(lsn(0x50), begin(0x80, 2));

    assertEquals(2L, machine.buffer().xid());
    assertTrue(machine.buffer().isEmpty());
    assertTrue(machine.buffer().relations().isEmpty());
  }

  @Test
  void relationBeforeBeginIsFatal() {
    StepResult result = new TransactionStateMachine().step(lsn(1), new WalMessage.RelationMessage(USERS));

    assertEquals(StepResult.Kind.FATAL, result.kind());
    assertEquals(TransactionStateMachine.RELATION_BEFORE_BEGIN, result.reason());
  }

  @Test
  void operationBeforeBeginIsFatal() {
    StepResult result = new TransactionStateMachine().step(lsn(1), insert(1, "a"));

    assertEquals(StepResult.Kind.FATAL, result.kind());
    assertEquals(TransactionStateMachine.OPERATION_BEFORE_RELATION, result.reason());
  }

  @Test
  void commitWithoutBeginIsFatal() {
    StepResult result = new TransactionStateMachine().step(lsn(1), commit(0x40, 0x48));

    assertEquals(StepResult.Kind.FATAL, result.kind());
    assertEquals(TransactionStateMachine.MISSING_PROPERTIES, result.reason());
  }

  @Test
  void commitLsnMismatchIsFatal() {
    TransactionStateMachine machine = new TransactionStateMachine();
    machine.step(lsn(0x10), begin(0x40, 1));

    StepResult result = machine.step(lsn(0x50), commit(0x41, 0x48));

    assertEquals(StepResult.Kind.FATAL, result.kind());
    assertEquals("Commit LSN mismatch: expected 0/40 but got 0/41", result.reason());
  }

  @Test
  void keepaliveIsAcknowledgedOnlyOutsideTransactions() {
    TransactionStateMachine machine = new TransactionStateMachine();

    StepResult idle = machine.step(lsn(0x10), new WalMessage.Keepalive(lsn(0x10), true));
    assertEquals(StepResult.Kind.ACKNOWLEDGE, idle.kind());
    assertEquals(lsn(0x10), idle.lsn());

    assertEquals(StepResult.Kind.CONTINUE,
      machine.step(lsn(0x10), new WalMessage.Keepalive(lsn(0x10), false)).kind());

    machine.step(lsn(0x20), begin(0x40, 1));
    assertEquals(StepResult.Kind.CONTINUE,
      machine.step(lsn(0x30), new WalMessage.Keepalive(lsn(0x30), true)).kind());
  }

  @Test
  void transactionsAtOrBelowResumePositionAreReplayed() {
    TransactionStateMachine machine = new TransactionStateMachine(lsn(0x48));
    machine.step(lsn(0x10), begin(0x40, 1));
    machine.step(lsn(0x10), new WalMessage.RelationMessage(USERS));
    machine.step(lsn(0x20), insert(1, "a"));

    StepResult replayed = machine.step(lsn(0x40), commit(0x40, 0x48));

    assertEquals(StepResult.Kind.REPLAYED, replayed.kind());
    assertFalse(machine.inTransaction());

    machine.step(lsn(0x50), begin(0x60, 2));
    machine.step(lsn(0x50), new WalMessage.RelationMessage(USERS));
    machine.step(lsn(0x55), insert(2, "b"));
    assertEquals(StepResult.Kind.COMMIT, machine.step(lsn(0x60), commit(0x60, 0x68)).kind());
  }

  @Test
  void invalidResumePositionReplaysNothing() {
    TransactionStateMachine machine = new TransactionStateMachine(LogSequenceNumber.INVALID_LSN);
    machine.step(lsn(0x10), begin(0x40, 1));

    assertEquals(StepResult.Kind.COMMIT, machine.step(lsn(0x40), commit(0x40, 0x48)).kind());
  }

  @Test
  void completingWithoutTransactionFails() {
    assertThrows(IllegalStateException.class, () -> new TransactionStateMachine().completeCommit());
  }

  private static LogSequenceNumber lsn(long value) {
    return LogSequenceNumber.valueOf(value);
  }

  private static WalMessage.Begin begin(long finalLsn, long xid) {
    return new WalMessage.Begin(lsn(finalLsn), NOW, xid);
  }

  private static WalMessage.Commit commit(long commitLsn, long endLsn) {
    return new WalMessage.Commit(0, lsn(commitLsn), lsn(endLsn), NOW);
  }

  private static WalMessage.Insert insert(int id, String name) {
    return new WalMessage.Insert(USERS, Map.of("id", id, "name", name));
  }
}
