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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.postgresql.replication.LogSequenceNumber;

/**
 * A decoded logical replication message. Row tuples keep column order; a {@code null} tuple means the server did
 * not send one.
 */
public abstract class WalMessage {

  public enum Kind {
    BEGIN,
    COMMIT,
    RELATION,
    INSERT,
    UPDATE,
    DELETE,
    KEEPALIVE
  }

  private WalMessage() {
  }

  public abstract Kind kind();

  @Override
  public String toString() {
    return kind().name();
  }

  public static final class Begin extends WalMessage {
    private final LogSequenceNumber finalLsn;
    private final Instant commitTime;
    private final long xid;

    public Begin(LogSequenceNumber finalLsn, Instant commitTime, long xid) {
      this.finalLsn = Objects.requireNonNull(finalLsn, "finalLsn");
      this.commitTime = commitTime;
      this.xid = xid;
    }

    /**
     * LSN of the transaction's commit record, repeated by the matching {@link Commit}.
     */
    public LogSequenceNumber finalLsn() {
      return finalLsn;
    }

    public Instant commitTime() {
      return commitTime;
    }

    public long xid() {
      return xid;
    }

    @Override
    public Kind kind() {
      return Kind.BEGIN;
    }
  }

  public static final class Commit extends WalMessage {
    private final int flags;
    private final LogSequenceNumber commitLsn;
    private final LogSequenceNumber endLsn;
    private final Instant commitTime;

    public Commit(int flags, LogSequenceNumber commitLsn, LogSequenceNumber endLsn, Instant commitTime) {
      this.flags = flags;
      this.commitLsn = Objects.requireNonNull(commitLsn, "commitLsn");
      this.endLsn = Objects.requireNonNull(endLsn, "endLsn");
      this.commitTime = commitTime;
    }

    public int flags() {
      return flags;
    }

    public LogSequenceNumber commitLsn() {
      return commitLsn;
    }

    public LogSequenceNumber endLsn() {
      return endLsn;
    }

    public Instant commitTime() {
      return commitTime;
    }

    @Override
    public Kind kind() {
      return Kind.COMMIT;
    }
  }

  public static final class RelationMessage extends WalMessage {
    private final Relation relation;

    public RelationMessage(Relation relation) {
      this.relation = Objects.requireNonNull(relation, "relation");
    }

    public Relation relation() {
      return relation;
    }

    @Override
    public Kind kind() {
      return Kind.RELATION;
    }
  }

  public static final class Insert extends WalMessage {
    private final Relation relation;
    private final Map<String, Object> newTuple;

    public Insert(Relation relation, Map<String, Object> newTuple) {
      this.relation = Objects.requireNonNull(relation, "relation");
      this.newTuple = tuple(newTuple);
    }

    public Relation relation() {
      return relation;
    }

    public Map<String, Object> newTuple() {
      return newTuple;
    }

    @Override
    public Kind kind() {
      return Kind.INSERT;
    }
  }

  public static final class Update extends WalMessage {
    private final Relation relation;
    private final Map<String, Object> oldTuple;
    private final Map<String, Object> newTuple;

    public Update(Relation relation, Map<String, Object> oldTuple, Map<String, Object> newTuple) {
      this.relation = Objects.requireNonNull(relation, "relation");
      this.oldTuple = tuple(oldTuple);
      this.newTuple = tuple(newTuple);
    }

    public Relation relation() {
      return relation;
    }

    public Map<String, Object> oldTuple() {
      return oldTuple;
    }

    public Map<String, Object> newTuple() {
      return newTuple;
    }

    @Override
    public Kind kind() {
      return Kind.UPDATE;
    }
  }

  public static final class Delete extends WalMessage {
    private final Relation relation;
    private final Map<String, Object> oldTuple;

    public Delete(Relation relation, Map<String, Object> oldTuple) {
      this.relation = Objects.requireNonNull(relation, "relation");
      this.oldTuple = tuple(oldTuple);
    }

    public Relation relation() {
      return relation;
    }

    public Map<String, Object> oldTuple() {
      return oldTuple;
    }

    @Override
    public Kind kind() {
      return Kind.DELETE;
    }
  }

  /**
   * Server heartbeat. Carries the position the server has sent so far.
   */
  public static final class Keepalive extends WalMessage {
    private final LogSequenceNumber lsn;
    private final boolean shouldRespond;

    public Keepalive(LogSequenceNumber lsn, boolean shouldRespond) {
      this.lsn = Objects.requireNonNull(lsn, "lsn");
      this.shouldRespond = shouldRespond;
    }

    public LogSequenceNumber lsn() {
      return lsn;
    }

    public boolean shouldRespond() {
      return shouldRespond;
    }

    @Override
    public Kind kind() {
      return Kind.KEEPALIVE;
    }
  }

  private static Map<String, Object> tuple(Map<String, Object> values) {
    return values == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }
}
