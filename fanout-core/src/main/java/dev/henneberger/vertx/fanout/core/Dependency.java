package dev.henneberger.vertx.fanout.core;

import java.util.Objects;

/**
 * Edge from a public schema to a consumer schema that subscribes to it, scoped to one system.
 */
public final class Dependency {

  private final String systemSlug;
  private final long publicSchemaId;
  private final long consumerSchemaId;

  public Dependency(String systemSlug, long publicSchemaId, long consumerSchemaId) {
    this.systemSlug = Objects.requireNonNull(systemSlug, "systemSlug");
    this.publicSchemaId = publicSchemaId;
    this.consumerSchemaId = consumerSchemaId;
  }

  public String systemSlug() {
    return systemSlug;
  }

  public long publicSchemaId() {
    return publicSchemaId;
  }

  public long consumerSchemaId() {
    return consumerSchemaId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Dependency)) {
      return false;
    }
    Dependency that = (Dependency) o;
    return publicSchemaId == that.publicSchemaId
      && consumerSchemaId == that.consumerSchemaId
      && systemSlug.equals(that.systemSlug);
  }

  @Override
  public int hashCode() {
    return Objects.hash(systemSlug, publicSchemaId, consumerSchemaId);
  }
}
