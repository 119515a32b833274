package dev.henneberger.vertx.fanout.core;

public interface ReplicationMetricsListener {
  void onStateChange(ListenerStateChange stateChange);
  void onCommitProcessed(String streamName, String commitLsn, int operationCount, boolean applied);
  void onLsnAcknowledged(String streamName, String lsn);
}
