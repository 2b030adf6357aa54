package io.rumor.broadcast;

import java.util.StringJoiner;
import reactor.core.Exceptions;

public final class BroadcastConfig implements Cloneable {

  // Default settings for a harness-simulated network
  public static final long DEFAULT_TICK_INTERVAL = 100;
  public static final long DEFAULT_RETRY_INITIAL_DELAY = 300;
  public static final long DEFAULT_RETRY_MAX_DELAY = 3_000;
  public static final double DEFAULT_RETRY_MULTIPLIER = 2.0;
  public static final int DEFAULT_GOSSIP_MAX_BATCH_SIZE = 100;

  // Default settings for nodes talking over loopback or in-memory (overrides defaults)
  public static final long DEFAULT_LOCAL_TICK_INTERVAL = 20;
  public static final long DEFAULT_LOCAL_RETRY_INITIAL_DELAY = 50;
  public static final long DEFAULT_LOCAL_RETRY_MAX_DELAY = 400;

  /** Where neighbours come from before the first {@code topology} message arrives. */
  public enum TopologyFallback {
    /** No neighbours: values are stored and read back but not propagated. */
    NONE,
    /** Every other node of the roster is a neighbour. */
    ROSTER
  }

  private long tickInterval = DEFAULT_TICK_INTERVAL;
  private long retryInitialDelay = DEFAULT_RETRY_INITIAL_DELAY;
  private long retryMaxDelay = DEFAULT_RETRY_MAX_DELAY;
  private double retryMultiplier = DEFAULT_RETRY_MULTIPLIER;
  private int gossipMaxBatchSize = DEFAULT_GOSSIP_MAX_BATCH_SIZE;
  private TopologyFallback topologyFallback = TopologyFallback.NONE;

  public BroadcastConfig() {}

  public static BroadcastConfig defaultConfig() {
    return new BroadcastConfig();
  }

  /**
   * Creates {@code BroadcastConfig} with short intervals, suitable for nodes sharing a process or
   * a loopback interface.
   *
   * @return new {@code BroadcastConfig}
   */
  public static BroadcastConfig defaultLocalConfig() {
    return defaultConfig()
        .tickInterval(DEFAULT_LOCAL_TICK_INTERVAL)
        .retryInitialDelay(DEFAULT_LOCAL_RETRY_INITIAL_DELAY)
        .retryMaxDelay(DEFAULT_LOCAL_RETRY_MAX_DELAY);
  }

  /**
   * Setter for {@code tickInterval}.
   *
   * @param tickInterval interval in millis between two scans of the pending-ack table
   * @return new {@code BroadcastConfig}
   */
  public BroadcastConfig tickInterval(long tickInterval) {
    BroadcastConfig c = clone();
    c.tickInterval = tickInterval;
    return c;
  }

  public long tickInterval() {
    return tickInterval;
  }

  /**
   * Setter for {@code retryInitialDelay}.
   *
   * @param retryInitialDelay delay in millis before the first resend of an unacknowledged value
   * @return new {@code BroadcastConfig}
   */
  public BroadcastConfig retryInitialDelay(long retryInitialDelay) {
    BroadcastConfig c = clone();
    c.retryInitialDelay = retryInitialDelay;
    return c;
  }

  public long retryInitialDelay() {
    return retryInitialDelay;
  }

  /**
   * Setter for {@code retryMaxDelay}.
   *
   * @param retryMaxDelay upper bound in millis of the delay between two resends
   * @return new {@code BroadcastConfig}
   */
  public BroadcastConfig retryMaxDelay(long retryMaxDelay) {
    BroadcastConfig c = clone();
    c.retryMaxDelay = retryMaxDelay;
    return c;
  }

  public long retryMaxDelay() {
    return retryMaxDelay;
  }

  /**
   * Setter for {@code retryMultiplier}.
   *
   * @param retryMultiplier growth factor of the resend delay, at least 1
   * @return new {@code BroadcastConfig}
   */
  public BroadcastConfig retryMultiplier(double retryMultiplier) {
    BroadcastConfig c = clone();
    c.retryMultiplier = retryMultiplier;
    return c;
  }

  public double retryMultiplier() {
    return retryMultiplier;
  }

  /**
   * Setter for {@code gossipMaxBatchSize}.
   *
   * @param gossipMaxBatchSize max number of values carried by one gossip message
   * @return new {@code BroadcastConfig}
   */
  public BroadcastConfig gossipMaxBatchSize(int gossipMaxBatchSize) {
    BroadcastConfig c = clone();
    c.gossipMaxBatchSize = gossipMaxBatchSize;
    return c;
  }

  public int gossipMaxBatchSize() {
    return gossipMaxBatchSize;
  }

  /**
   * Setter for {@code topologyFallback}.
   *
   * @param topologyFallback neighbours to use until a topology is received
   * @return new {@code BroadcastConfig}
   */
  public BroadcastConfig topologyFallback(TopologyFallback topologyFallback) {
    BroadcastConfig c = clone();
    c.topologyFallback = topologyFallback;
    return c;
  }

  public TopologyFallback topologyFallback() {
    return topologyFallback;
  }

  /**
   * Checks settings consistency.
   *
   * @return this config
   * @throws IllegalArgumentException if any setting is out of range
   */
  public BroadcastConfig validate() {
    if (tickInterval <= 0) {
      throw new IllegalArgumentException("tickInterval must be positive: " + tickInterval);
    }
    if (retryInitialDelay <= 0) {
      throw new IllegalArgumentException(
          "retryInitialDelay must be positive: " + retryInitialDelay);
    }
    if (retryMaxDelay < retryInitialDelay) {
      throw new IllegalArgumentException(
          "retryMaxDelay must not be less than retryInitialDelay: " + retryMaxDelay);
    }
    if (retryMultiplier < 1.0) {
      throw new IllegalArgumentException("retryMultiplier must be >= 1: " + retryMultiplier);
    }
    if (gossipMaxBatchSize <= 0) {
      throw new IllegalArgumentException(
          "gossipMaxBatchSize must be positive: " + gossipMaxBatchSize);
    }
    if (topologyFallback == null) {
      throw new IllegalArgumentException("topologyFallback must be set");
    }
    return this;
  }

  @Override
  public BroadcastConfig clone() {
    try {
      return (BroadcastConfig) super.clone();
    } catch (CloneNotSupportedException e) {
      throw Exceptions.propagate(e);
    }
  }

  @Override
  public String toString() {
    return new StringJoiner(", ", BroadcastConfig.class.getSimpleName() + "[", "]")
        .add("tickInterval=" + tickInterval)
        .add("retryInitialDelay=" + retryInitialDelay)
        .add("retryMaxDelay=" + retryMaxDelay)
        .add("retryMultiplier=" + retryMultiplier)
        .add("gossipMaxBatchSize=" + gossipMaxBatchSize)
        .add("topologyFallback=" + topologyFallback)
        .toString();
  }
}
