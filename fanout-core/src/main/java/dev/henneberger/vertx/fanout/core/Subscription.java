package dev.henneberger.vertx.fanout.core;

@FunctionalInterface
public interface Subscription {
  void cancel();
}
