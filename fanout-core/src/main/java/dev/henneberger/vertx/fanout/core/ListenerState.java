package dev.henneberger.vertx.fanout.core;

public enum ListenerState {
  IDLE,
  STARTING,
  SUBSCRIBED,
  STOPPED,
  FAILED
}
