package io.rumor.broadcast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/** Identity of the local node and the roster of the run. Created once, on {@code init}. */
public final class NodeState {

  private final String nodeId;
  private final List<String> roster;

  /**
   * Constructor.
   *
   * @param nodeId local node id
   * @param roster every node id of the run, local one included
   */
  public NodeState(String nodeId, List<String> roster) {
    this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
    this.roster = Collections.unmodifiableList(new ArrayList<>(roster));
  }

  public String nodeId() {
    return nodeId;
  }

  public List<String> roster() {
    return roster;
  }

  /**
   * Returns roster without the local node.
   *
   * @return remote node ids
   */
  public List<String> peers() {
    List<String> peers = new ArrayList<>(roster);
    peers.remove(nodeId);
    return peers;
  }

  @Override
  public String toString() {
    return new StringJoiner(", ", NodeState.class.getSimpleName() + "[", "]")
        .add("nodeId='" + nodeId + "'")
        .add("roster=" + roster)
        .toString();
  }
}
