package dev.henneberger.vertx.realtime.core;

public final class ListenerStateChange {
  private final int listenerIndex;
  private final ListenerState previousState;
  private final ListenerState state;
  private final Throwable cause;
  private final long attempt;

  public ListenerStateChange(int listenerIndex,
                             ListenerState previousState,
                             ListenerState state,
                             Throwable cause,
                             long attempt) {
    this.listenerIndex = listenerIndex;
    this.previousState = previousState;
    this.state = state;
    this.cause = cause;
    this.attempt = attempt;
  }

  public int listenerIndex() {
    return listenerIndex;
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

  public long attempt() {
    return attempt;
  }
}
