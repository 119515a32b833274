package dev.henneberger.vertx.fanout.core;

import java.util.Optional;

public interface ConsumerSchemaRepository {
  Optional<ConsumerSchema> findById(long consumerSchemaId);
}
