package dev.henneberger.vertx.fanout.core;

import java.util.Objects;

/**
 * A versioned SQL mapping. Public schema transformations materialize one row for a key, consumer schema
 * transformations apply one row to a destination table.
 */
public final class Transformation {

  private final int majorVersion;
  private final String sql;

  public Transformation(int majorVersion, String sql) {
    OptionValidation.requireMin("majorVersion", majorVersion, 1);
    OptionValidation.require("sql", sql);
    this.majorVersion = majorVersion;
    this.sql = sql;
  }

  public int majorVersion() {
    return majorVersion;
  }

  public String sql() {
    return sql;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Transformation)) {
      return false;
    }
    Transformation that = (Transformation) o;
    return majorVersion == that.majorVersion && sql.equals(that.sql);
  }

  @Override
  public int hashCode() {
    return Objects.hash(majorVersion, sql);
  }

  @Override
  public String toString() {
    return "Transformation{v" + majorVersion + "}";
  }
}
