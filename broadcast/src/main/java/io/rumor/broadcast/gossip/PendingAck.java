package io.rumor.broadcast.gossip;

import java.util.StringJoiner;

/** A value sent to a neighbour and not acknowledged by it yet. */
public final class PendingAck {

  private final String neighbor;
  private final Object value;
  private int attempts;
  private long nextDeadline;

  PendingAck(String neighbor, Object value, long nextDeadline) {
    this.neighbor = neighbor;
    this.value = value;
    this.nextDeadline = nextDeadline;
  }

  public String neighbor() {
    return neighbor;
  }

  public Object value() {
    return value;
  }

  /**
   * Returns number of resends, the initial send excluded.
   *
   * @return resend count
   */
  public int attempts() {
    return attempts;
  }

  public long nextDeadline() {
    return nextDeadline;
  }

  boolean isDue(long now) {
    return nextDeadline <= now;
  }

  void retried(long nextDeadline) {
    attempts++;
    this.nextDeadline = nextDeadline;
  }

  @Override
  public String toString() {
    return new StringJoiner(", ", PendingAck.class.getSimpleName() + "[", "]")
        .add("neighbor='" + neighbor + "'")
        .add("value=" + value)
        .add("attempts=" + attempts)
        .add("nextDeadline=" + nextDeadline)
        .toString();
  }
}
