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

import dev.henneberger.vertx.fanout.core.MaterializedRow;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Rewrites transformation SQL into a JDBC statement. {@code $1, $2, ...} bind row values by position and
 * {@code :column} binds by column name. A statement may use one style only. Quoted literals (including
 * {@code E'...'} escape strings and {@code $tag$...$tag$} dollar quoting), quoted identifiers, comments,
 * {@code ::} casts and array slices such as {@code arr[1:n]} are copied unchanged.
 */
public final class SqlPlaceholders {

  private SqlPlaceholders() {
  }

  public static BoundStatement bind(String sql, MaterializedRow row) {
    Objects.requireNonNull(sql, "sql");
    Objects.requireNonNull(row, "row");

    List<Object> positionalValues = row.values();
    StringBuilder out = new StringBuilder(sql.length());
    List<Object> params = new ArrayList<>();
    boolean positional = false;
    boolean named = false;
    int bracketDepth = 0;

    int i = 0;
    int len = sql.length();
    while (i < len) {
      char c = sql.charAt(i);
      char next = i + 1 < len ? sql.charAt(i + 1) : '\0';

      if (c == '\'' && isEscapeStringPrefix(sql, i)) {
        int end = escapeStringEnd(sql, i + 1);
        out.append(sql, i, end);
        i = end;
      } else if (c == '\'' || c == '"') {
        int end = sql.indexOf(c, i + 1);
        end = end < 0 ? len : end + 1;
        out.append(sql, i, end);
        i = end;
      } else if (c == '-' && next == '-') {
        int end = sql.indexOf('\n', i);
        end = end < 0 ? len : end;
        out.append(sql, i, end);
        i = end;
      } else if (c == '/' && next == '*') {
        int end = sql.indexOf("*/", i + 2);
        end = end < 0 ? len : end + 2;
        out.append(sql, i, end);
        i = end;
      } else if (c == '$' && (next == '$' || isIdentifierStart(next)) && dollarTagEnd(sql, i) > 0) {
        int tagEnd = dollarTagEnd(sql, i);
        String tag = sql.substring(i, tagEnd);
        int close = sql.indexOf(tag, tagEnd);
        int end = close < 0 ? len : close + tag.length();
        out.append(sql, i, end);
        i = end;
      } else if (c == '[') {
        bracketDepth++;
        out.append(c);
        i++;
      } else if (c == ']') {
        bracketDepth = Math.max(0, bracketDepth - 1);
        out.append(c);
        i++;
      } else if (c == ':' && next == ':') {
        out.append("::");
        i += 2;
      } else if (c == '$' && Character.isDigit(next)) {
        int end = i + 1;
        while (end < len && Character.isDigit(sql.charAt(end))) {
          end++;
        }
        int index = Integer.parseInt(sql.substring(i + 1, end));
        if (index < 1 || index > positionalValues.size()) {
          throw new IllegalArgumentException("Placeholder $" + index + " is out of range, row has "
            + positionalValues.size() + " columns");
        }
        positional = true;
        params.add(positionalValues.get(index - 1));
        out.append('?');
        i = end;
      } else if (c == ':' && bracketDepth == 0 && isIdentifierStart(next)) {
        int end = i + 1;
        while (end < len && isIdentifierPart(sql.charAt(end))) {
          end++;
        }
        String name = sql.substring(i + 1, end);
        if (!row.contains(name)) {
          throw new IllegalArgumentException("Placeholder :" + name + " does not match any column of " + row.columns());
        }
        named = true;
        params.add(row.get(name));
        out.append('?');
        i = end;
      } else {
        out.append(c);
        i++;
      }

      if (positional && named) {
        throw new IllegalArgumentException("SQL mixes positional ($n) and named (:name) placeholders: " + sql);
      }
    }

    return new BoundStatement(out.toString(), params);
  }

  private static boolean isEscapeStringPrefix(String sql, int quote) {
    if (quote < 1) {
      return false;
    }
    char prefix = sql.charAt(quote - 1);
    if (prefix != 'E' && prefix != 'e') {
      return false;
    }
    return quote < 2 || !isIdentifierPart(sql.charAt(quote - 2));
  }

  private static int escapeStringEnd(String sql, int from) {
    int i = from;
    while (i < sql.length()) {
      char c = sql.charAt(i);
      if (c == '\\') {
        i += 2;
      } else if (c == '\'') {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
          i += 2;
        } else {
          return i + 1;
        }
      } else {
        i++;
      }
    }
    return sql.length();
  }

  /**
   * Returns the index just past the opening {@code $tag$} starting at {@code start}, or -1 when there is none.
   */
  private static int dollarTagEnd(String sql, int start) {
    int i = start + 1;
    while (i < sql.length() && isIdentifierPart(sql.charAt(i))) {
      i++;
    }
    return i < sql.length() && sql.charAt(i) == '$' ? i + 1 : -1;
  }

  private static boolean isIdentifierStart(char c) {
    return Character.isLetter(c) || c == '_';
  }

  private static boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  public static final class BoundStatement {
    private final String sql;
    private final List<Object> parameters;

    BoundStatement(String sql, List<Object> parameters) {
      this.sql = sql;
      this.parameters = Collections.unmodifiableList(parameters);
    }

    public String sql() {
      return sql;
    }

    public List<Object> parameters() {
      return parameters;
    }
  }
}
