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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.postgresql.replication.LogSequenceNumber;

/**
 * The operations of one in-flight transaction, accumulated between {@code begin} and {@code commit}. Only the
 * listener's worker thread mutates a buffer; handlers receive it after the commit has been validated.
 */
public final class TransactionBuffer {

  private final LogSequenceNumber commitLsn;
  private LogSequenceNumber commitEndLsn;
  private final Instant commitTime;
  private final long xid;
  private final List<Operation> operations = new ArrayList<>();
  private final Map<Integer, Relation> relations = new LinkedHashMap<>();

  TransactionBuffer(LogSequenceNumber commitLsn, LogSequenceNumber commitEndLsn, Instant commitTime, long xid) {
    this.commitLsn = commitLsn;
    this.commitEndLsn = commitEndLsn;
    this.commitTime = commitTime;
    this.xid = xid;
  }

  public LogSequenceNumber commitLsn() {
    return commitLsn;
  }

  /**
   * The position acknowledged once the transaction has been applied.
   */
  public LogSequenceNumber commitEndLsn() {
    return commitEndLsn;
  }

  public Instant commitTime() {
    return commitTime;
  }

  public long xid() {
    return xid;
  }

  public List<Operation> operations() {
    return Collections.unmodifiableList(operations);
  }

  public Map<Integer, Relation> relations() {
    return Collections.unmodifiableMap(relations);
  }

  public boolean isEmpty() {
    return operations.isEmpty();
  }

  boolean hasRequiredProperties() {
    return commitLsn != null && commitEndLsn != null && commitTime != null;
  }

  void putRelation(Relation relation) {
    relations.put(relation.relationOid(), relation);
  }

  void addOperation(Operation operation) {
    operations.add(operation);
  }

  void advanceCommitEndLsn(LogSequenceNumber endLsn) {
    if (endLsn != null && (commitEndLsn == null || endLsn.compareTo(commitEndLsn) > 0)) {
      commitEndLsn = endLsn;
    }
  }

  @Override
  public String toString() {
    return "TransactionBuffer{xid=" + xid
      + ", commitLsn=" + (commitLsn == null ? null : commitLsn.asString())
      + ", commitEndLsn=" + (commitEndLsn == null ? null : commitEndLsn.asString())
      + ", operations=" + operations.size()
      + '}';
  }
}
