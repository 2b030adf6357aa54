package io.rumor.broadcast.topology;

import io.rumor.broadcast.NodeState;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the neighbours this node gossips to. The set is only ever replaced as a whole, readers
 * always see either the old or the new set.
 */
public final class TopologyManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(TopologyManager.class);

  private final NodeState localNode;

  private volatile Set<String> neighbors = Collections.emptySet();

  public TopologyManager(NodeState localNode) {
    this.localNode = Objects.requireNonNull(localNode, "localNode");
  }

  /**
   * Replaces the neighbour set. The local node is never its own neighbour and is filtered out.
   *
   * @param newNeighbors neighbour ids
   */
  public void setNeighbors(Collection<String> newNeighbors) {
    Set<String> set = new LinkedHashSet<>(newNeighbors);
    set.remove(localNode.nodeId());
    neighbors = Collections.unmodifiableSet(set);
    LOGGER.info("[{}] Neighbors are now {}", localNode.nodeId(), neighbors);
  }

  public Set<String> neighbors() {
    return neighbors;
  }
}
