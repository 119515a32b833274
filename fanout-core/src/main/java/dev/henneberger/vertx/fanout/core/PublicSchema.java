package dev.henneberger.vertx.fanout.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A public schema materializes a canonical row for every change on its base table of one source connection.
 */
public final class PublicSchema {

  private final long id;
  private final String code;
  private final String connectionSlug;
  private final String baseTable;
  private final List<Transformation> transformations;

  public PublicSchema(long id,
                      String code,
                      String connectionSlug,
                      String baseTable,
                      List<Transformation> transformations) {
    OptionValidation.require("code", code);
    OptionValidation.require("connectionSlug", connectionSlug);
    OptionValidation.require("baseTable", baseTable);
    this.id = id;
    this.code = code;
    this.connectionSlug = connectionSlug;
    this.baseTable = baseTable;
    this.transformations = Collections.unmodifiableList(
      new ArrayList<>(Objects.requireNonNull(transformations, "transformations")));
  }

  public long id() {
    return id;
  }

  public String code() {
    return code;
  }

  public String connectionSlug() {
    return connectionSlug;
  }

  /**
   * The base table as {@code schema.table}.
   */
  public String baseTable() {
    return baseTable;
  }

  public List<Transformation> transformations() {
    return transformations;
  }
}
