package dev.henneberger.vertx.fanout.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class TransformationSelectorTest {

  @Test
  void picksHighestMajorVersion() {
    Transformation v1 = new Transformation(1, "INSERT INTO t VALUES ($1)");
    Transformation v3 = new Transformation(3, "INSERT INTO t3 VALUES ($1)");
    Transformation v2 = new Transformation(2, "INSERT INTO t2 VALUES ($1)");

    assertSame(v3, TransformationSelector.latest(List.of(v1, v3, v2)).orElseThrow());
  }

  @Test
  void firstListedWinsOnTie() {
    Transformation first = new Transformation(2, "SELECT 1");
    Transformation second = new Transformation(2, "SELECT 2");

    assertSame(first, TransformationSelector.latest(List.of(first, second)).orElseThrow());
    assertSame(second, TransformationSelector.latest(List.of(second, first)).orElseThrow());
  }

  @Test
  void emptyWhenNoTransformations() {
    assertFalse(TransformationSelector.latest(List.of()).isPresent());
  }

  @Test
  void rejectsInvalidTransformation() {
    IllegalArgumentException version = assertThrows(IllegalArgumentException.class,
      () -> new Transformation(0, "SELECT 1"));
    assertEquals("majorVersion must be >= 1", version.getMessage());
    assertThrows(IllegalArgumentException.class, () -> new Transformation(1, " "));
  }
}
