package dev.henneberger.vertx.fanout.core;

import java.util.List;

public interface PublicSchemaRepository {
  /**
   * Returns every transformation version of every public schema whose base table is {@code tableSchema.table} on
   * the given source connection.
   */
  List<PublicSchemaTransformation> findByConnectionAndBaseTable(String connectionSlug, String tableSchema, String table);
}
