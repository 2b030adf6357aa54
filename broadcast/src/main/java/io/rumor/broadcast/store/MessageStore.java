package io.rumor.broadcast.store;

import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Set of broadcast values known to this node. Values are only ever added. Writes come from the
 * node's event loop, reads may come from any thread.
 */
public final class MessageStore {

  private final Set<Object> values = ConcurrentHashMap.newKeySet();

  /**
   * Adds the value if it is not known yet.
   *
   * @param value broadcast value
   * @return true if the value was not known before this call
   */
  public boolean record(Object value) {
    return values.add(Objects.requireNonNull(value, "value"));
  }

  public boolean contains(Object value) {
    return value != null && values.contains(value);
  }

  /**
   * Returns every known value.
   *
   * @return immutable copy of the known-set
   */
  public Set<Object> snapshot() {
    return Collections.unmodifiableSet(new HashSet<>(values));
  }

  public int size() {
    return values.size();
  }

  @Override
  public String toString() {
    return "MessageStore[size=" + values.size() + "]";
  }
}
