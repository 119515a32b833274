package dev.henneberger.vertx.fanout.core;

import java.util.Objects;

public final class PublicSchemaTransformation {

  private final long publicSchemaId;
  private final Transformation transformation;

  public PublicSchemaTransformation(long publicSchemaId, Transformation transformation) {
    this.publicSchemaId = publicSchemaId;
    this.transformation = Objects.requireNonNull(transformation, "transformation");
  }

  public long publicSchemaId() {
    return publicSchemaId;
  }

  public Transformation transformation() {
    return transformation;
  }
}
