package dev.henneberger.vertx.fanout.core;

import java.util.List;

public interface DependencyRepository {
  List<Dependency> findByPublicSchemaId(long publicSchemaId);
}
