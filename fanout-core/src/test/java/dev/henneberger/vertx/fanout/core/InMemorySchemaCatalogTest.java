package dev.henneberger.vertx.fanout.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemorySchemaCatalogTest {

  @Test
  void loadsSchemasAndEdgesFromJson() {
    JsonObject json = new JsonObject()
      .put("publicSchemas", new JsonArray().add(new JsonObject()
        .put("id", 1)
        .put("code", "orders")
        .put("connection", "shop")
        .put("baseTable", "orders")
        .put("transformations", new JsonArray()
          .add(new JsonObject().put("majorVersion", 1).put("sql", "SELECT id FROM orders WHERE id = $1"))
          .add(new JsonObject().put("majorVersion", 2).put("sql", "SELECT id, total FROM orders WHERE id = $1")))))
      .put("consumerSchemas", new JsonArray().add(new JsonObject()
        .put("id", 7)
        .put("code", "orders_copy")
        .put("destinationConnection", "warehouse")
        .put("transformations", new JsonArray()
          .add(new JsonObject().put("sql", "INSERT INTO orders_copy VALUES ($1, $2)")))))
      .put("dependencies", new JsonArray().add(new JsonObject()
        .put("publicSchemaId", 1)
        .put("consumerSchemaId", 7)));

    InMemorySchemaCatalog catalog = InMemorySchemaCatalog.fromJson(json);

    List<PublicSchemaTransformation> transformations =
      catalog.findByConnectionAndBaseTable("shop", "public", "orders");
    assertEquals(2, transformations.size());
    assertEquals(1L, transformations.get(0).publicSchemaId());

    Dependency dependency = catalog.findByPublicSchemaId(1L).get(0);
    assertEquals(InMemorySchemaCatalog.DEFAULT_SYSTEM, dependency.systemSlug());
    assertEquals(1, catalog.findById(7L).orElseThrow().transformations().get(0).majorVersion());
  }

  @Test
  void matchesTablesCaseInsensitivelyWithinConnection() {
    InMemorySchemaCatalog catalog = new InMemorySchemaCatalog()
      .addPublicSchema(new PublicSchema(1L, "orders", "shop", "Sales.Orders",
        List.of(new Transformation(1, "SELECT 1"))));

    assertEquals(1, catalog.findByConnectionAndBaseTable("shop", "sales", "orders").size());
    assertTrue(catalog.findByConnectionAndBaseTable("other", "sales", "orders").isEmpty());
    assertTrue(catalog.findByConnectionAndBaseTable("shop", "public", "orders").isEmpty());
  }

  @Test
  void rejectsEdgesToUnknownSchemas() {
    InMemorySchemaCatalog catalog = new InMemorySchemaCatalog();

    IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
      () -> catalog.addDependency(new Dependency("default", 1L, 2L)));
    assertEquals("unknown public schema id 1", error.getMessage());
  }

  @Test
  void rejectsDuplicateIds() {
    InMemorySchemaCatalog catalog = new InMemorySchemaCatalog()
      .addConsumerSchema(new ConsumerSchema(3L, "a", "warehouse", List.of()));

    assertThrows(IllegalArgumentException.class,
      () -> catalog.addConsumerSchema(new ConsumerSchema(3L, "b", "warehouse", List.of())));
  }

  @Test
  void rejectsDocumentEntriesWithoutIds() {
    JsonObject missingSchemaId = new JsonObject().put("publicSchemas", new JsonArray()
      .add(new JsonObject().put("code", "orders").put("connection", "shop").put("baseTable", "orders")));
    IllegalArgumentException schemaError = assertThrows(IllegalArgumentException.class,
      () -> InMemorySchemaCatalog.fromJson(missingSchemaId));
    assertEquals("id is required", schemaError.getMessage());

    JsonObject missingEdgeId = new JsonObject()
      .put("publicSchemas", new JsonArray()
        .add(new JsonObject().put("id", 1L).put("code", "orders").put("connection", "shop").put("baseTable", "orders")))
      .put("dependencies", new JsonArray().add(new JsonObject().put("publicSchemaId", 1L)));
    IllegalArgumentException edgeError = assertThrows(IllegalArgumentException.class,
      () -> InMemorySchemaCatalog.fromJson(missingEdgeId));
    assertEquals("consumerSchemaId is required", edgeError.getMessage());
  }
}
