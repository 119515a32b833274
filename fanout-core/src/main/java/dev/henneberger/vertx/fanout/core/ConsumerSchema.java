package dev.henneberger.vertx.fanout.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A consumer schema applies materialized rows to a table on its destination connection.
 */
public final class ConsumerSchema {

  private final long id;
  private final String code;
  private final String destinationConnectionSlug;
  private final List<Transformation> transformations;

  public ConsumerSchema(long id, String code, String destinationConnectionSlug, List<Transformation> transformations) {
    OptionValidation.require("code", code);
    OptionValidation.require("destinationConnectionSlug", destinationConnectionSlug);
    this.id = id;
    this.code = code;
    this.destinationConnectionSlug = destinationConnectionSlug;
    this.transformations = Collections.unmodifiableList(
      new ArrayList<>(Objects.requireNonNull(transformations, "transformations")));
  }

  public long id() {
    return id;
  }

  public String code() {
    return code;
  }

  public String destinationConnectionSlug() {
    return destinationConnectionSlug;
  }

  public List<Transformation> transformations() {
    return transformations;
  }
}
