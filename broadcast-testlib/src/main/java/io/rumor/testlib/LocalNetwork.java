package io.rumor.testlib;

import static io.rumor.transport.utils.RetryNotSerializedEmitFailureHandler.RETRY_NOT_SERIALIZED;

import io.rumor.transport.api.Message;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * In-memory network standing in for the harness: routes messages between node transports by
 * destination id, and collects messages addressed to anyone else (clients) in a client inbox.
 * Every node transport is wrapped in a {@link NetworkEmulatorTransport} so links can be degraded
 * or cut.
 *
 * <p><b>NOTE:</b> used for test purposes.
 */
public final class LocalNetwork {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalNetwork.class);

  private final Map<String, LocalTransport> transports = new ConcurrentHashMap<>();
  private final Map<String, NetworkEmulatorTransport> emulators = new ConcurrentHashMap<>();
  private final Sinks.Many<Message> clientInbox = Sinks.many().replay().all();

  /**
   * Creates transport of a node with the given id.
   *
   * @param address node id
   * @return emulated transport of the node
   */
  public NetworkEmulatorTransport createTransport(String address) {
    LocalTransport transport = new LocalTransport(address, this);
    NetworkEmulatorTransport emulator = new NetworkEmulatorTransport(address, transport);
    if (transports.putIfAbsent(address, transport) != null) {
      throw new IllegalArgumentException("Address already taken: " + address);
    }
    emulators.put(address, emulator);
    return emulator;
  }

  public NetworkEmulator networkEmulator(String address) {
    NetworkEmulatorTransport emulator = emulators.get(address);
    if (emulator == null) {
      throw new IllegalArgumentException("Unknown address: " + address);
    }
    return emulator.networkEmulator();
  }

  /**
   * Sends a client request into the network, unaffected by emulation.
   *
   * @param message request, its {@code dest} must be a node of this network
   */
  public void inject(Message message) {
    deliver(message);
  }

  /**
   * Returns every message sent to a destination which is not a node of this network.
   *
   * @return replayed flux of client-bound messages
   */
  public Flux<Message> clientInbox() {
    return clientInbox.asFlux();
  }

  /**
   * Cuts every link between the two groups of nodes, in both directions.
   *
   * @param left one side
   * @param right other side
   */
  public void partition(Collection<String> left, Collection<String> right) {
    for (String node : left) {
      networkEmulator(node).blockOutbound(right);
    }
    for (String node : right) {
      networkEmulator(node).blockOutbound(left);
    }
    LOGGER.info("Partitioned {} from {}", left, right);
  }

  /** Restores every link. */
  public void heal() {
    emulators.values().forEach(emulator -> {
      emulator.networkEmulator().unblockAllOutbound();
      emulator.networkEmulator().unblockAllInbound();
    });
    LOGGER.info("Healed network");
  }

  void deliver(Message message) {
    LocalTransport target = message.dest() != null ? transports.get(message.dest()) : null;
    if (target != null) {
      target.receive(message);
    } else {
      clientInbox.emitNext(message, RETRY_NOT_SERIALIZED);
    }
  }
}
