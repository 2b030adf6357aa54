package io.rumor.runner;

import io.rumor.broadcast.BroadcastConfig;
import io.rumor.broadcast.BroadcastConfig.TopologyFallback;
import io.rumor.broadcast.BroadcastNode;
import io.rumor.broadcast.BroadcastNodeImpl;
import io.rumor.transport.api.Transport;
import io.rumor.transport.api.TransportConfig;
import io.rumor.transport.api.TransportFactory;
import io.rumor.transport.stdio.StdioTransportFactory;
import java.util.Locale;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one broadcast node over stdin/stdout until stdin is closed. Logs go to stderr.
 *
 * <p>Settings are read from system properties: {@code rumor.tickInterval}, {@code
 * rumor.retryInitialDelay}, {@code rumor.retryMaxDelay}, {@code rumor.retryMultiplier}, {@code
 * rumor.gossipMaxBatchSize}, {@code rumor.topologyFallback} and {@code rumor.maxLineLength}.
 */
public final class BroadcastNodeRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(BroadcastNodeRunner.class);

  static final String PREFIX = "rumor.";

  private BroadcastNodeRunner() {
    // Do not instantiate
  }

  /**
   * Main.
   *
   * @param args ignored
   */
  public static void main(String[] args) {
    Properties properties = System.getProperties();
    try {
      run(new StdioTransportFactory(), broadcastConfig(properties), transportConfig(properties));
    } catch (Exception ex) {
      LOGGER.error("Node failed, cause:", ex);
      System.exit(1);
    }
  }

  /**
   * Binds a transport, runs a node over it and blocks until the inbound stream ends.
   *
   * @param transportFactory transport factory
   * @param config broadcast settings
   * @param transportConfig transport settings
   */
  static void run(
      TransportFactory transportFactory, BroadcastConfig config, TransportConfig transportConfig) {
    Transport transport = Transport.bindAwait(transportConfig.transportFactory(transportFactory));
    BroadcastNode node = new BroadcastNodeImpl(transport, config);

    LOGGER.debug("Starting node with config {}", config);
    node.start().block();

    node.onShutdown().block();
    LOGGER.debug("Node {} stopped", node.nodeId().orElse("uninitialized"));
    transport.stop().block();
  }

  /**
   * Builds broadcast settings from {@code rumor.*} properties over the defaults.
   *
   * @param properties properties
   * @return broadcast config
   * @throws IllegalArgumentException if a property can not be parsed or is out of range
   */
  static BroadcastConfig broadcastConfig(Properties properties) {
    BroadcastConfig config = BroadcastConfig.defaultConfig();

    String value;
    if ((value = property(properties, "tickInterval")) != null) {
      config = config.tickInterval(parseLong("tickInterval", value));
    }
    if ((value = property(properties, "retryInitialDelay")) != null) {
      config = config.retryInitialDelay(parseLong("retryInitialDelay", value));
    }
    if ((value = property(properties, "retryMaxDelay")) != null) {
      config = config.retryMaxDelay(parseLong("retryMaxDelay", value));
    }
    if ((value = property(properties, "retryMultiplier")) != null) {
      try {
        config = config.retryMultiplier(Double.parseDouble(value));
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(PREFIX + "retryMultiplier is not a number: " + value);
      }
    }
    if ((value = property(properties, "gossipMaxBatchSize")) != null) {
      config = config.gossipMaxBatchSize((int) parseLong("gossipMaxBatchSize", value));
    }
    if ((value = property(properties, "topologyFallback")) != null) {
      try {
        config = config.topologyFallback(TopologyFallback.valueOf(value.toUpperCase(Locale.ROOT)));
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException(
            PREFIX + "topologyFallback must be one of none, roster: " + value);
      }
    }

    return config.validate();
  }

  static TransportConfig transportConfig(Properties properties) {
    TransportConfig config = TransportConfig.defaultConfig();
    String value = property(properties, "maxLineLength");
    return value != null ? config.maxLineLength((int) parseLong("maxLineLength", value)) : config;
  }

  private static String property(Properties properties, String name) {
    String value = properties.getProperty(PREFIX + name);
    return value == null || value.trim().isEmpty() ? null : value.trim();
  }

  private static long parseLong(String name, String value) {
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(PREFIX + name + " is not a number: " + value);
    }
  }
}
