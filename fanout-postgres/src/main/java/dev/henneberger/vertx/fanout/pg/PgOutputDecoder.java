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

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.postgresql.replication.LogSequenceNumber;

/**
 * Decoder for the native PostgreSQL {@code pgoutput} logical replication format, protocol version 2 without
 * streamed transactions.
 *
 * <p>Relations are cached for the lifetime of the decoder because the server announces a relation only once per
 * replication session. Create one decoder per session.
 */
public final class PgOutputDecoder {

  private static final long PG_EPOCH_SECONDS = 946684800L;

  private static final int OID_BOOL = 16;
  private static final int OID_INT2 = 21;
  private static final int OID_INT4 = 23;
  private static final int OID_INT8 = 20;
  private static final int OID_FLOAT4 = 700;
  private static final int OID_FLOAT8 = 701;
  private static final int OID_NUMERIC = 1700;

  private final Map<Integer, Relation> relations = new HashMap<>();

  public WalMessage decode(ByteBuffer buffer) {
    byte[] bytes = new byte[buffer.remaining()];
    buffer.get(bytes);
    return decode(bytes);
  }

  /**
   * @return the decoded message, or {@code null} for message types that carry nothing to replicate (truncate,
   *   type, origin and logical decoding messages)
   */
  public WalMessage decode(byte[] payload) {
    Cursor cursor = new Cursor(payload);
    if (!cursor.hasRemaining()) {
      return null;
    }

    char messageType = (char) cursor.readByte();
    switch (messageType) {
      case 'B':
        return decodeBegin(cursor);
      case 'C':
        return decodeCommit(cursor);
      case 'R':
        return decodeRelation(cursor);
      case 'I':
        return decodeInsert(cursor);
      case 'U':
        return decodeUpdate(cursor);
      case 'D':
        return decodeDelete(cursor);
      case 'T':
      case 'Y':
      case 'O':
      case 'M':
        return null;
      default:
        throw new IllegalArgumentException("Unsupported pgoutput message type: " + messageType);
    }
  }

  Relation cachedRelation(int relationOid) {
    return relations.get(relationOid);
  }

  private WalMessage.Begin decodeBegin(Cursor cursor) {
    LogSequenceNumber finalLsn = LogSequenceNumber.valueOf(cursor.readLong());
    Instant commitTime = fromPgEpochMicros(cursor.readLong());
    long xid = Integer.toUnsignedLong(cursor.readInt());
    return new WalMessage.Begin(finalLsn, commitTime, xid);
  }

  private WalMessage.Commit decodeCommit(Cursor cursor) {
    int flags = cursor.readByte();
    LogSequenceNumber commitLsn = LogSequenceNumber.valueOf(cursor.readLong());
    LogSequenceNumber endLsn = LogSequenceNumber.valueOf(cursor.readLong());
    Instant commitTime = fromPgEpochMicros(cursor.readLong());
    return new WalMessage.Commit(flags, commitLsn, endLsn, commitTime);
  }

  private WalMessage.RelationMessage decodeRelation(Cursor cursor) {
    int relationOid = cursor.readInt();
    String namespace = cursor.readCString();
    String table = cursor.readCString();
    char replicaIdentity = (char) cursor.readByte();
    int columnCount = cursor.readUnsignedShort();
    List<RelationColumn> columns = new ArrayList<>(columnCount);

    for (int i = 0; i < columnCount; i++) {
      int flags = cursor.readByte();
      String name = cursor.readCString();
      int typeOid = cursor.readInt();
      int typeModifier = cursor.readInt();
      columns.add(new RelationColumn(flags, name, typeOid, typeModifier));
    }

    // pgoutput sends an empty namespace for pg_catalog
    String schema = namespace.isEmpty() ? "pg_catalog" : namespace;
    Relation relation = new Relation(relationOid, schema, table, replicaIdentity, columns);
    relations.put(relationOid, relation);
    return new WalMessage.RelationMessage(relation);
  }

  private WalMessage.Insert decodeInsert(Cursor cursor) {
    Relation relation = relation(cursor.readInt());
    char tupleType = (char) cursor.readByte();
    if (tupleType != 'N') {
      throw new IllegalArgumentException("Unexpected tuple marker for INSERT: " + tupleType);
    }
    return new WalMessage.Insert(relation, decodeTuple(cursor, relation));
  }

  private WalMessage.Update decodeUpdate(Cursor cursor) {
    Relation relation = relation(cursor.readInt());

    Map<String, Object> oldTuple = null;
    char marker = (char) cursor.readByte();
    if (marker == 'K' || marker == 'O') {
      oldTuple = decodeTuple(cursor, relation);
      marker = (char) cursor.readByte();
    }
    if (marker != 'N') {
      throw new IllegalArgumentException("Unexpected tuple marker for UPDATE: " + marker);
    }
    return new WalMessage.Update(relation, oldTuple, decodeTuple(cursor, relation));
  }

  private WalMessage.Delete decodeDelete(Cursor cursor) {
    Relation relation = relation(cursor.readInt());
    char marker = (char) cursor.readByte();
    if (marker != 'K' && marker != 'O') {
      throw new IllegalArgumentException("Unexpected tuple marker for DELETE: " + marker);
    }
    return new WalMessage.Delete(relation, decodeTuple(cursor, relation));
  }

  private Map<String, Object> decodeTuple(Cursor cursor, Relation relation) {
    int colCount = cursor.readUnsignedShort();
    Map<String, Object> values = new LinkedHashMap<>();
    List<RelationColumn> columns = relation.columns();

    for (int i = 0; i < colCount; i++) {
      RelationColumn column = i < columns.size()
        ? columns.get(i)
        : new RelationColumn(0, "col_" + i, 0, -1);
      char kind = (char) cursor.readByte();
      switch (kind) {
        case 'n':
          values.put(column.name(), null);
          break;
        case 'u':
          // unchanged TOAST value, not sent by the server
          break;
        case 't': {
          int len = cursor.readInt();
          values.put(column.name(), convertTextValue(cursor.readString(len), column.typeOid()));
          break;
        }
        case 'b': {
          int len = cursor.readInt();
          values.put(column.name(), cursor.readBytes(len));
          break;
        }
        default:
          throw new IllegalArgumentException("Unsupported tuple column kind: " + kind);
      }
    }

    return values;
  }

  static Object convertTextValue(String raw, int typeOid) {
    if (raw == null) {
      return null;
    }

    try {
      switch (typeOid) {
        case OID_BOOL:
          return "t".equalsIgnoreCase(raw) || "true".equalsIgnoreCase(raw);
        case OID_INT2:
        case OID_INT4:
          return Integer.parseInt(raw);
        case OID_INT8:
          return Long.parseLong(raw);
        case OID_FLOAT4:
          return Float.parseFloat(raw);
        case OID_FLOAT8:
          return Double.parseDouble(raw);
        case OID_NUMERIC:
          return new BigDecimal(raw);
        default:
          return raw;
      }
    } catch (NumberFormatException notNumeric) {
      // NaN and Infinity stay textual
      return raw;
    }
  }

  private Relation relation(int relationOid) {
    Relation relation = relations.get(relationOid);
    if (relation == null) {
      throw new IllegalArgumentException("pgoutput relation metadata missing for relation id " + relationOid);
    }
    return relation;
  }

  private static Instant fromPgEpochMicros(long micros) {
    long seconds = Math.floorDiv(micros, 1_000_000L);
    long microsRemainder = Math.floorMod(micros, 1_000_000L);
    return Instant.ofEpochSecond(PG_EPOCH_SECONDS + seconds, microsRemainder * 1_000L);
  }

  private static final class Cursor {
    private final ByteBuffer buffer;

    private Cursor(byte[] bytes) {
      this.buffer = ByteBuffer.wrap(bytes);
    }

    private boolean hasRemaining() {
      return buffer.hasRemaining();
    }

    private byte readByte() {
      return buffer.get();
    }

    private int readUnsignedShort() {
      return buffer.getShort() & 0xffff;
    }

    private int readInt() {
      return buffer.getInt();
    }

    private long readLong() {
      return buffer.getLong();
    }

    private String readCString() {
      int start = buffer.position();
      int end = start;
      while (end < buffer.limit() && buffer.get(end) != 0) {
        end++;
      }
      String out = new String(buffer.array(), start, end - start, StandardCharsets.UTF_8);
      buffer.position(Math.min(buffer.limit(), end + 1));
      return out;
    }

    private String readString(int len) {
      return new String(readBytes(len), StandardCharsets.UTF_8);
    }

    private byte[] readBytes(int len) {
      byte[] out = new byte[len];
      buffer.get(out);
      return out;
    }
  }
}
