package dev.henneberger.vertx.fanout.core;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

public final class TransformationSelector {

  private TransformationSelector() {
  }

  /**
   * Picks the transformation with the highest major version. On equal versions the first one in iteration order
   * wins.
   */
  public static Optional<Transformation> latest(Collection<Transformation> transformations) {
    Objects.requireNonNull(transformations, "transformations");
    Transformation latest = null;
    for (Transformation current : transformations) {
      if (latest == null || current.majorVersion() > latest.majorVersion()) {
        latest = current;
      }
    }
    return Optional.ofNullable(latest);
  }
}
