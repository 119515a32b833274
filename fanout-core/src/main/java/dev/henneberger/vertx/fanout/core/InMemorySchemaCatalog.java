package dev.henneberger.vertx.fanout.core;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Holds public schemas, consumer schemas and their dependency edges in memory. Backs all three repository
 * interfaces so a process can run from a static configuration document.
 */
public final class InMemorySchemaCatalog
  implements PublicSchemaRepository, ConsumerSchemaRepository, DependencyRepository {

  public static final String DEFAULT_SYSTEM = "default";

  private final Map<Long, PublicSchema> publicSchemas = new ConcurrentHashMap<>();
  private final Map<Long, ConsumerSchema> consumerSchemas = new ConcurrentHashMap<>();
  private final List<Dependency> dependencies = new CopyOnWriteArrayList<>();

  public InMemorySchemaCatalog addPublicSchema(PublicSchema schema) {
    Objects.requireNonNull(schema, "schema");
    if (publicSchemas.putIfAbsent(schema.id(), schema) != null) {
      throw new IllegalArgumentException("duplicate public schema id " + schema.id());
    }
    return this;
  }

  public InMemorySchemaCatalog addConsumerSchema(ConsumerSchema schema) {
    Objects.requireNonNull(schema, "schema");
    if (consumerSchemas.putIfAbsent(schema.id(), schema) != null) {
      throw new IllegalArgumentException("duplicate consumer schema id " + schema.id());
    }
    return this;
  }

  public InMemorySchemaCatalog addDependency(Dependency dependency) {
    Objects.requireNonNull(dependency, "dependency");
    if (!publicSchemas.containsKey(dependency.publicSchemaId())) {
      throw new IllegalArgumentException("unknown public schema id " + dependency.publicSchemaId());
    }
    if (!consumerSchemas.containsKey(dependency.consumerSchemaId())) {
      throw new IllegalArgumentException("unknown consumer schema id " + dependency.consumerSchemaId());
    }
    if (!dependencies.contains(dependency)) {
      dependencies.add(dependency);
    }
    return this;
  }

  @Override
  public List<PublicSchemaTransformation> findByConnectionAndBaseTable(String connectionSlug,
                                                                       String tableSchema,
                                                                       String table) {
    Objects.requireNonNull(connectionSlug, "connectionSlug");
    String qualified = qualify(tableSchema, table);
    List<PublicSchemaTransformation> result = new ArrayList<>();
    publicSchemas.values().stream()
      .filter(schema -> schema.connectionSlug().equals(connectionSlug))
      .filter(schema -> qualifyConfigured(schema.baseTable()).equals(qualified))
      .sorted((a, b) -> Long.compare(a.id(), b.id()))
      .forEach(schema -> {
        for (Transformation transformation : schema.transformations()) {
          result.add(new PublicSchemaTransformation(schema.id(), transformation));
        }
      });
    return result;
  }

  @Override
  public Optional<ConsumerSchema> findById(long consumerSchemaId) {
    return Optional.ofNullable(consumerSchemas.get(consumerSchemaId));
  }

  @Override
  public List<Dependency> findByPublicSchemaId(long publicSchemaId) {
    List<Dependency> result = new ArrayList<>();
    for (Dependency dependency : dependencies) {
      if (dependency.publicSchemaId() == publicSchemaId) {
        result.add(dependency);
      }
    }
    return result;
  }

  public static InMemorySchemaCatalog fromJson(JsonObject json) {
    Objects.requireNonNull(json, "json");
    InMemorySchemaCatalog catalog = new InMemorySchemaCatalog();

    for (JsonObject item : objects(json.getJsonArray("publicSchemas"))) {
      catalog.addPublicSchema(new PublicSchema(
        requiredId(item, "id"),
        item.getString("code"),
        item.getString("connection"),
        item.getString("baseTable"),
        transformations(item.getJsonArray("transformations"))));
    }
    for (JsonObject item : objects(json.getJsonArray("consumerSchemas"))) {
      catalog.addConsumerSchema(new ConsumerSchema(
        requiredId(item, "id"),
        item.getString("code"),
        item.getString("destinationConnection"),
        transformations(item.getJsonArray("transformations"))));
    }
    for (JsonObject item : objects(json.getJsonArray("dependencies"))) {
      catalog.addDependency(new Dependency(
        item.getString("system", DEFAULT_SYSTEM),
        requiredId(item, "publicSchemaId"),
        requiredId(item, "consumerSchemaId")));
    }
    return catalog;
  }

  private static long requiredId(JsonObject item, String fieldName) {
    Long value = item.getLong(fieldName);
    if (value == null) {
      throw new IllegalArgumentException(fieldName + " is required");
    }
    return value;
  }

  private static List<Transformation> transformations(JsonArray array) {
    List<Transformation> result = new ArrayList<>();
    for (JsonObject item : objects(array)) {
      result.add(new Transformation(item.getInteger("majorVersion", 1), item.getString("sql")));
    }
    return result;
  }

  private static List<JsonObject> objects(JsonArray array) {
    List<JsonObject> result = new ArrayList<>();
    if (array == null) {
      return result;
    }
    for (int i = 0; i < array.size(); i++) {
      result.add(array.getJsonObject(i));
    }
    return result;
  }

  private static String qualifyConfigured(String baseTable) {
    int dot = baseTable.indexOf('.');
    if (dot < 0) {
      return qualify("public", baseTable);
    }
    return qualify(baseTable.substring(0, dot), baseTable.substring(dot + 1));
  }

  private static String qualify(String tableSchema, String table) {
    String schema = tableSchema == null || tableSchema.isBlank() ? "public" : tableSchema;
    return (schema + "." + Objects.requireNonNull(table, "table")).toLowerCase(Locale.ROOT);
  }
}
