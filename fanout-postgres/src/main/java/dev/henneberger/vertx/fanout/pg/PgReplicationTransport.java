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

import java.nio.ByteBuffer;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import org.postgresql.PGConnection;
import org.postgresql.PGProperty;
import org.postgresql.replication.LogSequenceNumber;
import org.postgresql.replication.PGReplicationStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ReplicationTransport} over the pgjdbc replication protocol.
 *
 * <p>pgjdbc answers server keepalives on its own inside {@code readPending()}. When the received position moves
 * while no data is pending this transport surfaces a {@link WalMessage.Keepalive} so the caller can decide whether
 * the position is safe to acknowledge.
 */
public final class PgReplicationTransport implements ReplicationTransport {

  private static final Logger LOG = LoggerFactory.getLogger(PgReplicationTransport.class);

  private final Connection connection;
  private final PGReplicationStream stream;
  private final PgOutputDecoder decoder = new PgOutputDecoder();
  private LogSequenceNumber lastKeepaliveLsn;

  private PgReplicationTransport(Connection connection, PGReplicationStream stream, LogSequenceNumber startLsn) {
    this.connection = connection;
    this.stream = stream;
    this.lastKeepaliveLsn = startLsn;
  }

  public static ReplicationTransportFactory factory(ConnectionConfig config,
                                                    PostgresListenerOptions options,
                                                    String publicationName) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(publicationName, "publicationName");
    return startLsn -> open(config, options, publicationName, startLsn);
  }

  static PgReplicationTransport open(ConnectionConfig config,
                                     PostgresListenerOptions options,
                                     String publicationName,
                                     LogSequenceNumber startLsn) throws SQLException {
    Connection replConn = openReplicationConnection(config);
    try {
      PGConnection pgConnection = replConn.unwrap(PGConnection.class);
      PGReplicationStream stream = pgConnection.getReplicationAPI()
        .replicationStream()
        .logical()
        .withSlotName(options.getSlotName())
        .withStartPosition(startLsn)
        .withSlotOption("proto_version", String.valueOf(options.getProtocolVersion()))
        .withSlotOption("publication_names", publicationName)
        .withStatusInterval(options.getStatusIntervalMs(), TimeUnit.MILLISECONDS)
        .start();
      LOG.info("Opened replication stream slot={} publication={} start={}",
        options.getSlotName(), publicationName, startLsn.asString());
      return new PgReplicationTransport(replConn, stream, startLsn);
    } catch (SQLException | RuntimeException e) {
      closeQuietly(replConn, e);
      throw e;
    }
  }

  @Override
  public WalEvent poll() throws SQLException {
    ByteBuffer buffer = stream.readPending();
    if (buffer == null) {
      LogSequenceNumber received = stream.getLastReceiveLSN();
      if (received == null || received.equals(LogSequenceNumber.INVALID_LSN) || received.equals(lastKeepaliveLsn)) {
        return null;
      }
      lastKeepaliveLsn = received;
      return new WalEvent(received, new WalMessage.Keepalive(received, true));
    }

    WalMessage message = decoder.decode(buffer);
    if (message == null) {
      return null;
    }
    return new WalEvent(stream.getLastReceiveLSN(), message);
  }

  @Override
  public void acknowledge(LogSequenceNumber lsn) throws SQLException {
    stream.setAppliedLSN(lsn);
    stream.setFlushedLSN(lsn);
    stream.forceUpdateStatus();
  }

  @Override
  public void close() throws SQLException {
    try {
      if (!stream.isClosed()) {
        stream.close();
      }
    } finally {
      connection.close();
    }
  }

  private static Connection openReplicationConnection(ConnectionConfig config) throws SQLException {
    Properties props = config.connectionProperties();
    PGProperty.REPLICATION.set(props, "database");
    PGProperty.PREFER_QUERY_MODE.set(props, "simple");
    PGProperty.ASSUME_MIN_SERVER_VERSION.set(props, "10");
    return DriverManager.getConnection(config.jdbcUrl(), props);
  }

  private static void closeQuietly(Connection connection, Exception primary) {
    try {
      connection.close();
    } catch (SQLException closeError) {
      primary.addSuppressed(closeError);
    }
  }
}
