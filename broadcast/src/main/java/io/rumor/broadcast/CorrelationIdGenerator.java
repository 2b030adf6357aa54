package io.rumor.broadcast;

import java.util.concurrent.atomic.AtomicLong;

/** Source of {@code msg_id} values for messages this node originates. */
public class CorrelationIdGenerator {

  private final AtomicLong counter = new AtomicLong();

  public long nextCid() {
    return counter.incrementAndGet();
  }
}
