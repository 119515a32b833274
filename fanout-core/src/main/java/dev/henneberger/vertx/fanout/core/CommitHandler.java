package dev.henneberger.vertx.fanout.core;

import io.vertx.core.Future;

/**
 * Receives one committed transaction. A future completing with {@code true} means the transaction was fully
 * applied and its position may be acknowledged.
 */
@FunctionalInterface
public interface CommitHandler<T> {
  Future<Boolean> handle(T transaction);
}
