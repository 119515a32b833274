package dev.henneberger.vertx.fanout.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An ordered column/value association. Column order is part of the contract: positional SQL parameters are bound
 * in {@link #columns()} order.
 */
public final class MaterializedRow {

  private final Map<String, Object> values;

  private MaterializedRow(LinkedHashMap<String, Object> values) {
    this.values = Collections.unmodifiableMap(values);
  }

  public static MaterializedRow of(Map<String, Object> values) {
    return new MaterializedRow(new LinkedHashMap<>(Objects.requireNonNull(values, "values")));
  }

  /**
   * Key columns come first, in their given order, followed by query columns not already present. Query values
   * replace key values for the same column without moving it.
   */
  public static MaterializedRow merge(Map<String, Object> keyValues, Map<String, Object> queried) {
    Objects.requireNonNull(keyValues, "keyValues");
    Objects.requireNonNull(queried, "queried");
    LinkedHashMap<String, Object> merged = new LinkedHashMap<>(keyValues);
    merged.putAll(queried);
    return new MaterializedRow(merged);
  }

  public List<String> columns() {
    return new ArrayList<>(values.keySet());
  }

  public List<Object> values() {
    return new ArrayList<>(values.values());
  }

  public boolean contains(String column) {
    return values.containsKey(column);
  }

  public Object get(String column) {
    return values.get(column);
  }

  public int size() {
    return values.size();
  }

  public Map<String, Object> asMap() {
    return values;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MaterializedRow)) {
      return false;
    }
    MaterializedRow that = (MaterializedRow) o;
    return columns().equals(that.columns()) && values.equals(that.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
