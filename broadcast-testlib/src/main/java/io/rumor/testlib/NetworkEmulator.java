package io.rumor.testlib;

import io.rumor.transport.api.Message;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Network Emulator is allowing to control link quality between nodes in order to allow testing of
 * message loss, message delay, partitions and recovery.
 *
 * <p><b>NOTE:</b> used for test purposes.
 */
public final class NetworkEmulator {

  private static final Logger LOGGER = LoggerFactory.getLogger(NetworkEmulator.class);

  private volatile OutboundSettings defaultOutboundSettings = new OutboundSettings(0, 0);
  private volatile boolean defaultInboundPass = true;

  private final Map<String, OutboundSettings> outboundSettings = new ConcurrentHashMap<>();
  private final Map<String, Boolean> inboundSettings = new ConcurrentHashMap<>();

  private final AtomicLong totalMessageSentCount = new AtomicLong();
  private final AtomicLong totalOutboundMessageLostCount = new AtomicLong();
  private final AtomicLong totalInboundMessageLostCount = new AtomicLong();

  private final String address;

  /**
   * Creates new instance of network emulator.
   *
   * @param address local node id
   */
  NetworkEmulator(String address) {
    this.address = address;
  }

  //// OUTBOUND functions

  /**
   * Returns network outbound settings applied to the given destination.
   *
   * @param destination target node id
   * @return network outbound settings
   */
  public OutboundSettings outboundSettings(String destination) {
    return outboundSettings.getOrDefault(destination, defaultOutboundSettings);
  }

  /**
   * Setter for network emulator outbound settings for specific destination.
   *
   * @param destination target node id
   * @param lossPercent loss in percents
   * @param meanDelay mean delay
   */
  public void outboundSettings(String destination, int lossPercent, int meanDelay) {
    OutboundSettings settings = new OutboundSettings(lossPercent, meanDelay);
    outboundSettings.put(destination, settings);
    LOGGER.debug("[{}] Set outbound settings {} to {}", address, settings, destination);
  }

  /**
   * Setter for default outbound settings.
   *
   * @param lossPercent loss in percents
   * @param meanDelay mean delay
   */
  public void setDefaultOutboundSettings(int lossPercent, int meanDelay) {
    defaultOutboundSettings = new OutboundSettings(lossPercent, meanDelay);
    LOGGER.debug("[{}] Set default outbound settings {}", address, defaultOutboundSettings);
  }

  /** Blocks outbound messages to all destinations. */
  public void blockAllOutbound() {
    outboundSettings.clear();
    setDefaultOutboundSettings(100, 0);
  }

  /** Unblocks outbound messages to all destinations. */
  public void unblockAllOutbound() {
    outboundSettings.clear();
    setDefaultOutboundSettings(0, 0);
  }

  public void blockOutbound(String... destinations) {
    blockOutbound(Arrays.asList(destinations));
  }

  /**
   * Blocks outbound messages to the given destinations.
   *
   * @param destinations target node ids
   */
  public void blockOutbound(Collection<String> destinations) {
    for (String destination : destinations) {
      outboundSettings.put(destination, new OutboundSettings(100, 0));
    }
    LOGGER.debug("[{}] Blocked outbound to {}", address, destinations);
  }

  public void unblockOutbound(String... destinations) {
    unblockOutbound(Arrays.asList(destinations));
  }

  /**
   * Unblocks outbound messages to given destinations.
   *
   * @param destinations target node ids
   */
  public void unblockOutbound(Collection<String> destinations) {
    destinations.forEach(outboundSettings::remove);
    LOGGER.debug("[{}] Unblocked outbound {}", address, destinations);
  }

  public long totalMessageSentCount() {
    return totalMessageSentCount.get();
  }

  public long totalOutboundMessageLostCount() {
    return totalOutboundMessageLostCount.get();
  }

  /**
   * Conditionally fails given outbound message with {@link NetworkEmulatorException}.
   *
   * @param msg outbound message
   * @param destination target node id
   * @return mono message
   */
  public Mono<Message> tryFailOutbound(Message msg, String destination) {
    return Mono.defer(
        () -> {
          totalMessageSentCount.incrementAndGet();
          boolean isLost = outboundSettings(destination).evaluateLoss();
          if (isLost) {
            totalOutboundMessageLostCount.incrementAndGet();
            return Mono.error(
                new NetworkEmulatorException("NETWORK_BREAK detected, didn't send " + msg));
          } else {
            return Mono.just(msg);
          }
        });
  }

  /**
   * Conditionally delays given outbound message.
   *
   * @param msg outbound message
   * @param destination target node id
   * @return mono message
   */
  public Mono<Message> tryDelayOutbound(Message msg, String destination) {
    return Mono.defer(
        () -> {
          long delay = outboundSettings(destination).evaluateDelay();
          if (delay > 0) {
            return Mono.just(msg).delayElement(Duration.ofMillis(delay));
          } else {
            return Mono.just(msg);
          }
        });
  }

  //// INBOUND functions

  /**
   * Tells whether messages from the given source reach this node.
   *
   * @param source sender node id
   * @return true if messages pass
   */
  public boolean inboundPass(String source) {
    boolean pass = inboundSettings.getOrDefault(source, defaultInboundPass);
    if (!pass) {
      totalInboundMessageLostCount.incrementAndGet();
    }
    return pass;
  }

  /** Blocks inbound messages from all sources. */
  public void blockAllInbound() {
    inboundSettings.clear();
    defaultInboundPass = false;
    LOGGER.debug("[{}] Blocked inbound from all sources", address);
  }

  /** Unblocks inbound messages from all sources. */
  public void unblockAllInbound() {
    inboundSettings.clear();
    defaultInboundPass = true;
    LOGGER.debug("[{}] Unblocked inbound from all sources", address);
  }

  public void blockInbound(String... sources) {
    blockInbound(Arrays.asList(sources));
  }

  /**
   * Blocks inbound messages from the given sources.
   *
   * @param sources sender node ids
   */
  public void blockInbound(Collection<String> sources) {
    for (String source : sources) {
      inboundSettings.put(source, false);
    }
    LOGGER.debug("[{}] Blocked inbound from {}", address, sources);
  }

  public void unblockInbound(String... sources) {
    unblockInbound(Arrays.asList(sources));
  }

  /**
   * Unblocks inbound messages from the given sources.
   *
   * @param sources sender node ids
   */
  public void unblockInbound(Collection<String> sources) {
    sources.forEach(inboundSettings::remove);
    LOGGER.debug("[{}] Unblocked inbound from {}", address, sources);
  }

  public long totalInboundMessageLostCount() {
    return totalInboundMessageLostCount.get();
  }

  /**
   * Settings of the outbound link: percent of lost messages and mean delay in millis. Delays follow
   * an exponential distribution.
   */
  public static final class OutboundSettings {

    private final int lossPercent;
    private final int meanDelay;

    public OutboundSettings(int lossPercent, int meanDelay) {
      this.lossPercent = lossPercent;
      this.meanDelay = meanDelay;
    }

    public int lossPercent() {
      return lossPercent;
    }

    public int meanDelay() {
      return meanDelay;
    }

    /**
     * Indicator function telling is loss enabled.
     *
     * @return boolean indicating would loss occur
     */
    public boolean evaluateLoss() {
      return lossPercent > 0
          && (lossPercent >= 100 || ThreadLocalRandom.current().nextInt(100) < lossPercent);
    }

    /**
     * Evaluates network delay according to exponential distribution of probabilities.
     *
     * @return delay
     */
    public long evaluateDelay() {
      if (meanDelay > 0) {
        // log(1-x)/(1/mean)
        double x0 = ThreadLocalRandom.current().nextDouble();
        double y0 = -Math.log(1 - x0) * meanDelay;
        return (long) y0;
      }
      return 0;
    }

    @Override
    public String toString() {
      return new StringJoiner(", ", OutboundSettings.class.getSimpleName() + "[", "]")
          .add("lossPercent=" + lossPercent)
          .add("meanDelay=" + meanDelay)
          .toString();
    }
  }
}
