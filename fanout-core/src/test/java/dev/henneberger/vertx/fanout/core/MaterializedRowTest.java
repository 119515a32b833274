package dev.henneberger.vertx.fanout.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MaterializedRowTest {

  @Test
  void keyColumnsComeFirst() {
    Map<String, Object> keys = new LinkedHashMap<>();
    keys.put("id", 5);
    Map<String, Object> queried = new LinkedHashMap<>();
    queried.put("name", "x");
    queried.put("id", 5);

    MaterializedRow row = MaterializedRow.merge(keys, queried);

    assertEquals(List.of("id", "name"), row.columns());
    assertEquals(List.of(5, "x"), row.values());
  }

  @Test
  void keepsKeyWhenQueryOmitsIt() {
    MaterializedRow row = MaterializedRow.merge(Map.of("id", 5), Map.of("name", "x"));

    assertEquals(5, row.get("id"));
    assertEquals("x", row.get("name"));
    assertEquals(2, row.size());
  }

  @Test
  void queriedValueOverridesKeyInPlace() {
    Map<String, Object> keys = new LinkedHashMap<>();
    keys.put("tenant", "a");
    keys.put("id", "5");
    Map<String, Object> queried = new LinkedHashMap<>();
    queried.put("total", 10);
    queried.put("id", 5);

    MaterializedRow row = MaterializedRow.merge(keys, queried);

    assertEquals(List.of("tenant", "id", "total"), row.columns());
    assertEquals(5, row.get("id"));
  }

  @Test
  void equalityIncludesColumnOrder() {
    Map<String, Object> ab = new LinkedHashMap<>();
    ab.put("a", 1);
    ab.put("b", 2);
    Map<String, Object> ba = new LinkedHashMap<>();
    ba.put("b", 2);
    ba.put("a", 1);

    assertEquals(MaterializedRow.of(ab), MaterializedRow.of(new LinkedHashMap<>(ab)));
    assertNotEquals(MaterializedRow.of(ab), MaterializedRow.of(ba));
  }
}
