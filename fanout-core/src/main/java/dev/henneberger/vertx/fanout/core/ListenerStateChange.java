package dev.henneberger.vertx.fanout.core;

public final class ListenerStateChange {
  private final ListenerState previousState;
  private final ListenerState state;
  private final Throwable cause;

  public ListenerStateChange(ListenerState previousState, ListenerState state, Throwable cause) {
    this.previousState = previousState;
    this.state = state;
    this.cause = cause;
  }

  public ListenerState previousState() {
    return previousState;
  }

  public ListenerState state() {
    return state;
  }

  public Throwable cause() {
    return cause;
  }
}
