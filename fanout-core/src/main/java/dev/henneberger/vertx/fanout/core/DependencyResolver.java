package dev.henneberger.vertx.fanout.core;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Maps a public schema to the consumer schemas depending on it. All transformation versions are returned; version
 * selection happens in the pipeline through {@link TransformationSelector}.
 */
public final class DependencyResolver {

  private final DependencyRepository dependencies;
  private final ConsumerSchemaRepository consumerSchemas;

  public DependencyResolver(DependencyRepository dependencies, ConsumerSchemaRepository consumerSchemas) {
    this.dependencies = Objects.requireNonNull(dependencies, "dependencies");
    this.consumerSchemas = Objects.requireNonNull(consumerSchemas, "consumerSchemas");
  }

  public List<ConsumerSchema> getConsumersForPublicSchema(long publicSchemaId) {
    Set<Long> seen = new LinkedHashSet<>();
    List<ConsumerSchema> result = new ArrayList<>();
    for (Dependency dependency : dependencies.findByPublicSchemaId(publicSchemaId)) {
      long consumerSchemaId = dependency.consumerSchemaId();
      if (!seen.add(consumerSchemaId)) {
        continue;
      }
      ConsumerSchema consumer = consumerSchemas.findById(consumerSchemaId)
        .orElseThrow(() -> new IllegalStateException(
          "Dependency on public schema " + publicSchemaId + " references unknown consumer schema " + consumerSchemaId));
      result.add(consumer);
    }
    return result;
  }
}
