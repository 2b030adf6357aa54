package io.rumor.broadcast.gossip;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pending acknowledgements indexed by (neighbour, value). Holds at most one entry per pair, so its
 * size is bounded by neighbours times distinct values no matter how many resends happen.
 */
final class PendingAckTable {

  private final Map<Key, PendingAck> entries = new ConcurrentHashMap<>();

  /**
   * Adds an entry unless one already exists for the pair.
   *
   * @return true if the entry was created
   */
  boolean add(String neighbor, Object value, long deadline) {
    return entries.putIfAbsent(new Key(neighbor, value), new PendingAck(neighbor, value, deadline))
        == null;
  }

  /**
   * Removes the entry of the pair.
   *
   * @return true if there was an entry
   */
  boolean remove(String neighbor, Object value) {
    return entries.remove(new Key(neighbor, value)) != null;
  }

  PendingAck get(String neighbor, Object value) {
    return entries.get(new Key(neighbor, value));
  }

  boolean contains(String neighbor, Object value) {
    return entries.containsKey(new Key(neighbor, value));
  }

  List<PendingAck> due(long now) {
    List<PendingAck> result = new ArrayList<>();
    for (PendingAck entry : entries.values()) {
      if (entry.isDue(now)) {
        result.add(entry);
      }
    }
    return result;
  }

  List<PendingAck> entries() {
    return new ArrayList<>(entries.values());
  }

  int size() {
    return entries.size();
  }

  private static final class Key {

    private final String neighbor;
    private final Object value;

    private Key(String neighbor, Object value) {
      this.neighbor = Objects.requireNonNull(neighbor, "neighbor");
      this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public boolean equals(Object that) {
      if (this == that) {
        return true;
      }
      if (that == null || getClass() != that.getClass()) {
        return false;
      }
      Key key = (Key) that;
      return neighbor.equals(key.neighbor) && value.equals(key.value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(neighbor, value);
    }
  }
}
