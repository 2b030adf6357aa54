package io.rumor.broadcast.gossip;

import io.rumor.broadcast.BroadcastConfig;
import java.util.StringJoiner;

/**
 * Bounded exponential backoff: {@code min(maxDelay, initialDelay * multiplier^attempts)}. With a
 * multiplier of at least 1 the delay never decreases as attempts grow.
 */
final class BackoffPolicy {

  private final long initialDelay;
  private final long maxDelay;
  private final double multiplier;

  BackoffPolicy(long initialDelay, long maxDelay, double multiplier) {
    this.initialDelay = initialDelay;
    this.maxDelay = maxDelay;
    this.multiplier = multiplier;
  }

  static BackoffPolicy from(BroadcastConfig config) {
    return new BackoffPolicy(
        config.retryInitialDelay(), config.retryMaxDelay(), config.retryMultiplier());
  }

  /**
   * Returns delay to wait before the next resend.
   *
   * @param attempts resends already made
   * @return delay in millis
   */
  long delay(int attempts) {
    double delay = initialDelay * Math.pow(multiplier, attempts);
    return delay >= maxDelay ? maxDelay : (long) delay;
  }

  @Override
  public String toString() {
    return new StringJoiner(", ", BackoffPolicy.class.getSimpleName() + "[", "]")
        .add("initialDelay=" + initialDelay)
        .add("maxDelay=" + maxDelay)
        .add("multiplier=" + multiplier)
        .toString();
  }
}
