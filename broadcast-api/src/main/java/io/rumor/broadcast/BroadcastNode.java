package io.rumor.broadcast;

import java.util.Optional;
import java.util.Set;
import reactor.core.publisher.Mono;

/**
 * A node of the broadcast protocol. It stores every value broadcast to it or gossiped to it by a
 * peer, and keeps re-sending each value to each of its neighbours until the neighbour acknowledges
 * it.
 */
public interface BroadcastNode {

  /**
   * Starts processing inbound messages and the periodic retry tick.
   *
   * @return promise completed once the node listens to its transport
   */
  Mono<BroadcastNode> start();

  /** Stops processing and releases the event loop. Pending retries are dropped. */
  Mono<Void> stop();

  /**
   * Returns node id assigned by {@code init}.
   *
   * @return node id, empty until initialized
   */
  Optional<String> nodeId();

  /**
   * Returns every value this node knows about.
   *
   * @return immutable copy of the known-set
   */
  Set<Object> snapshot();

  /**
   * Returns current gossip neighbours.
   *
   * @return immutable neighbour set
   */
  Set<String> neighbors();

  /**
   * Returns number of (neighbour, value) pairs sent but not yet acknowledged.
   *
   * @return pending acknowledgement count
   */
  int pendingAcks();

  /**
   * Completes when the node stops, either explicitly or because its inbound stream ended.
   *
   * @return promise of termination
   */
  Mono<Void> onShutdown();
}
