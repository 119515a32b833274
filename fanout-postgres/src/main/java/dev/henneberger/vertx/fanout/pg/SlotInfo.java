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

import java.time.OffsetDateTime;
import java.util.Objects;
import org.postgresql.replication.LogSequenceNumber;

/**
 * A row of {@code pg_replication_slots}. LSNs are {@code null} until the slot has been consumed from at least once;
 * {@code inactiveSince} is only reported by PostgreSQL 17 and later.
 */
public final class SlotInfo {

  private final String slotName;
  private final String plugin;
  private final String database;
  private final boolean active;
  private final Integer activePid;
  private final LogSequenceNumber restartLsn;
  private final LogSequenceNumber confirmedFlushLsn;
  private final boolean twoPhase;
  private final OffsetDateTime inactiveSince;

  public SlotInfo(String slotName,
                  String plugin,
                  String database,
                  boolean active,
                  Integer activePid,
                  LogSequenceNumber restartLsn,
                  LogSequenceNumber confirmedFlushLsn,
                  boolean twoPhase,
                  OffsetDateTime inactiveSince) {
    this.slotName = Objects.requireNonNull(slotName, "slotName");
    this.plugin = plugin;
    this.database = database;
    this.active = active;
    this.activePid = activePid;
    this.restartLsn = restartLsn;
    this.confirmedFlushLsn = confirmedFlushLsn;
    this.twoPhase = twoPhase;
    this.inactiveSince = inactiveSince;
  }

  public String slotName() {
    return slotName;
  }

  public String plugin() {
    return plugin;
  }

  public String database() {
    return database;
  }

  public boolean active() {
    return active;
  }

  public Integer activePid() {
    return activePid;
  }

  public LogSequenceNumber restartLsn() {
    return restartLsn;
  }

  public LogSequenceNumber confirmedFlushLsn() {
    return confirmedFlushLsn;
  }

  public boolean twoPhase() {
    return twoPhase;
  }

  public OffsetDateTime inactiveSince() {
    return inactiveSince;
  }

  @Override
  public String toString() {
    return "SlotInfo{slotName=" + slotName
      + ", plugin=" + plugin
      + ", database=" + database
      + ", active=" + active
      + ", activePid=" + activePid
      + ", restartLsn=" + (restartLsn == null ? null : restartLsn.asString())
      + ", confirmedFlushLsn=" + (confirmedFlushLsn == null ? null : confirmedFlushLsn.asString())
      + ", twoPhase=" + twoPhase
      + ", inactiveSince=" + inactiveSince
      + '}';
  }
}
