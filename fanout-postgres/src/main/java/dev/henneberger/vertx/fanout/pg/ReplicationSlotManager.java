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

import dev.henneberger.vertx.fanout.core.Diagnostic;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.postgresql.replication.LogSequenceNumber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Inspects and creates {@code pgoutput} logical replication slots over an ordinary (non-replication) connection.
 */
public final class ReplicationSlotManager {

  private static final Logger LOG = LoggerFactory.getLogger(ReplicationSlotManager.class);

  public static final String PLUGIN = "pgoutput";

  private final Connection connection;

  public ReplicationSlotManager(Connection connection) {
    this.connection = Objects.requireNonNull(connection, "connection");
  }

  public boolean hasSlot(String slotName) throws SQLException {
    Objects.requireNonNull(slotName, "slotName");
    try (PreparedStatement statement = connection.prepareStatement(
      "SELECT 1 FROM pg_replication_slots WHERE slot_name = ?")) {
      statement.setString(1, slotName);
      try (ResultSet rs = statement.executeQuery()) {
        return rs.next();
      }
    }
  }

  /**
   * Creates the slot. A creation failure is logged and reported as {@code false}; a slot that already exists counts
   * as created.
   */
  public boolean createSlot(String slotName) {
    Objects.requireNonNull(slotName, "slotName");
    try (PreparedStatement statement = connection.prepareStatement(
      "SELECT pg_create_logical_replication_slot(?, '" + PLUGIN + "')")) {
      statement.setString(1, slotName);
      statement.execute();
      LOG.info("Created replication slot '{}'", slotName);
      return true;
    } catch (SQLException e) {
      if (isSlotAlreadyExists(e)) {
        LOG.debug("Replication slot '{}' already exists", slotName);
        return true;
      }
      LOG.warn("Could not create replication slot '{}': {}", slotName, e.getMessage());
      return false;
    }
  }

  /**
   * @throws ConnectionException with {@code NOT_FOUND} when the slot does not exist
   */
  public SlotInfo getSlotInfo(String slotName) throws SQLException {
    Objects.requireNonNull(slotName, "slotName");
    String inactiveSince = hasInactiveSinceColumn() ? "inactive_since" : "NULL::timestamptz AS inactive_since";
    String sql = "SELECT slot_name, plugin, database, active, active_pid, restart_lsn, confirmed_flush_lsn, "
      + "two_phase, " + inactiveSince + " FROM pg_replication_slots WHERE slot_name = ?";

    try (PreparedStatement statement = connection.prepareStatement(sql)) {
      statement.setString(1, slotName);
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          throw new ConnectionException(ConnectionException.Code.NOT_FOUND,
            "Replication slot '" + slotName + "' not found");
        }
        int pid = rs.getInt("active_pid");
        Integer activePid = rs.wasNull() ? null : pid;
        return new SlotInfo(
          rs.getString("slot_name"),
          rs.getString("plugin"),
          rs.getString("database"),
          rs.getBoolean("active"),
          activePid,
          lsn(rs.getString("restart_lsn")),
          lsn(rs.getString("confirmed_flush_lsn")),
          rs.getBoolean("two_phase"),
          rs.getObject("inactive_since", OffsetDateTime.class)
        );
      }
    }
  }

  /**
   * Reports server settings and pre-existing slot state that would keep {@code slotName} from streaming
   * {@code pgoutput} changes of {@code database}.
   */
  public List<Diagnostic> diagnose(String slotName, String database) throws SQLException {
    List<Diagnostic> issues = new ArrayList<>();
    checkWalLevel(issues);
    checkExistingSlot(slotName, database, issues);
    return issues;
  }

  private void checkWalLevel(List<Diagnostic> issues) throws SQLException {
    try (PreparedStatement statement = connection.prepareStatement("SHOW wal_level");
         ResultSet rs = statement.executeQuery()) {
      String walLevel = rs.next() ? rs.getString(1) : null;
      if (!"logical".equalsIgnoreCase(walLevel)) {
        issues.add(Diagnostic.error(
          "WAL_LEVEL_INVALID",
          "wal_level is '" + walLevel + "'",
          "Set wal_level=logical and restart PostgreSQL."));
      }
    }
  }

  private void checkExistingSlot(String slotName, String database, List<Diagnostic> issues) throws SQLException {
    try (PreparedStatement statement = connection.prepareStatement(
      "SELECT plugin, database FROM pg_replication_slots WHERE slot_name = ?")) {
      statement.setString(1, slotName);
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          return;
        }
        String slotPlugin = rs.getString("plugin");
        String slotDatabase = rs.getString("database");
        if (!PLUGIN.equals(slotPlugin)) {
          issues.add(Diagnostic.error(
            "SLOT_PLUGIN_MISMATCH",
            "Replication slot '" + slotName + "' uses plugin '" + slotPlugin + "' but " + PLUGIN + " is required",
            "Drop the slot with pg_drop_replication_slot('" + slotName + "') or configure another slot name."));
        }
        if (database != null && !database.equals(slotDatabase)) {
          issues.add(Diagnostic.error(
            "SLOT_DATABASE_MISMATCH",
            "Replication slot '" + slotName + "' belongs to database '" + slotDatabase
              + "', expected '" + database + "'",
            "Configure a different slot name for this database."));
        }
      }
    }
  }

  private boolean hasInactiveSinceColumn() throws SQLException {
    try (PreparedStatement statement = connection.prepareStatement(
      "SELECT 1 FROM pg_attribute "
        + "WHERE attrelid = 'pg_catalog.pg_replication_slots'::regclass "
        + "AND attname = 'inactive_since' AND NOT attisdropped");
         ResultSet rs = statement.executeQuery()) {
      return rs.next();
    }
  }

  private static LogSequenceNumber lsn(String value) {
    return value == null ? null : LogSequenceNumber.valueOf(value);
  }

  static boolean isSlotAlreadyExists(SQLException error) {
    String state = error.getSQLState();
    if ("42710".equals(state)) {
      return true;
    }
    String message = error.getMessage();
    return message != null && message.contains("already exists");
  }
}
