package io.rumor.broadcast.gossip;

import static io.rumor.broadcast.MessageTypes.GOSSIP;
import static io.rumor.broadcast.MessageTypes.MESSAGES;

import io.rumor.broadcast.BroadcastConfig;
import io.rumor.broadcast.CorrelationIdGenerator;
import io.rumor.broadcast.NodeState;
import io.rumor.broadcast.topology.TopologyManager;
import io.rumor.transport.api.Message;
import io.rumor.transport.api.Transport;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.scheduler.Scheduler;

/**
 * Pushes every value this node learns to each of its neighbours and keeps re-sending it, with
 * backoff, until that neighbour acknowledges it. Retries never give up: a partition of any length
 * is repaired once the link heals.
 *
 * <p>Not thread safe: every method must be called from the node's event loop {@code scheduler},
 * which is also where the periodic tick runs.
 */
public final class DisseminationEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(DisseminationEngine.class);

  // Injected

  private final NodeState localNode;
  private final TopologyManager topology;
  private final Transport transport;
  private final BroadcastConfig config;
  private final CorrelationIdGenerator cidGenerator;
  private final Scheduler scheduler;

  // Local State

  private final BackoffPolicy backoffPolicy;
  private final PendingAckTable pendingAcks = new PendingAckTable();
  private long currentPeriod = 0;

  // Disposables

  private final Disposable.Composite actionsDisposables = Disposables.composite();

  /**
   * Creates new instance of dissemination engine.
   *
   * @param localNode local node identity
   * @param topology source of current neighbours
   * @param transport transport
   * @param config broadcast settings
   * @param cidGenerator generator of outbound message ids
   * @param scheduler event loop scheduler
   */
  public DisseminationEngine(
      NodeState localNode,
      TopologyManager topology,
      Transport transport,
      BroadcastConfig config,
      CorrelationIdGenerator cidGenerator,
      Scheduler scheduler) {
    this.localNode = Objects.requireNonNull(localNode);
    this.topology = Objects.requireNonNull(topology);
    this.transport = Objects.requireNonNull(transport);
    this.config = Objects.requireNonNull(config);
    this.cidGenerator = Objects.requireNonNull(cidGenerator);
    this.scheduler = Objects.requireNonNull(scheduler);
    this.backoffPolicy = BackoffPolicy.from(config);
  }

  /** Starts the periodic retry tick on the event loop. */
  public void start() {
    actionsDisposables.add(
        scheduler.schedulePeriodically(
            this::doTick, config.tickInterval(), config.tickInterval(), TimeUnit.MILLISECONDS));
  }

  /** Stops the periodic retry tick. */
  public void stop() {
    actionsDisposables.dispose();
  }

  // ================================================
  // ============== Action Methods ==================
  // ================================================

  private void doTick() {
    try {
      tick(scheduler.now(TimeUnit.MILLISECONDS));
    } catch (Exception ex) {
      LOGGER.warn("[{}][{}][doTick] Exception occurred:", localNode.nodeId(), currentPeriod, ex);
    }
  }

  /**
   * Resends every value whose retry deadline has elapsed and pushes its deadline further using the
   * backoff policy. Due values are batched per neighbour.
   *
   * @param now current time in millis
   */
  public void tick(long now) {
    final long period = currentPeriod++;

    List<PendingAck> due = pendingAcks.due(now);
    if (due.isEmpty()) {
      return; // nothing to retry
    }

    Map<String, List<Object>> valuesByNeighbor = new LinkedHashMap<>();
    for (PendingAck pendingAck : due) {
      pendingAck.retried(now + backoffPolicy.delay(pendingAck.attempts() + 1));
      valuesByNeighbor
          .computeIfAbsent(pendingAck.neighbor(), neighbor -> new ArrayList<>())
          .add(pendingAck.value());
    }

    LOGGER.debug(
        "[{}][{}] Retrying {} unacknowledged value(s) to {}",
        localNode.nodeId(),
        period,
        due.size(),
        valuesByNeighbor.keySet());

    valuesByNeighbor.forEach(this::spreadTo);
  }

  // ================================================
  // ============== Event Listeners =================
  // ================================================

  /**
   * Fans a newly recorded value out to every current neighbour that has no pending entry for it
   * yet, sending it right away.
   *
   * @param value newly recorded value
   * @param origin neighbour the value came from, or null if it came from a client
   */
  public void onNewValue(Object value, String origin) {
    final long now = scheduler.now(TimeUnit.MILLISECONDS);
    final long deadline = now + backoffPolicy.delay(0);

    for (String neighbor : topology.neighbors()) {
      if (neighbor.equals(origin)) {
        continue; // origin already has it
      }
      if (pendingAcks.add(neighbor, value, deadline)) {
        sendGossip(neighbor, List.of(value));
      }
    }
  }

  /**
   * Sends every already known value to neighbours that just joined the neighbour set, creating a
   * pending entry for each pair that has none yet. Values go out batched per neighbour.
   *
   * @param addedNeighbors neighbours absent from the previous neighbour set
   * @param knownValues values recorded so far
   */
  public void onNeighborsAdded(Collection<String> addedNeighbors, Collection<?> knownValues) {
    final long now = scheduler.now(TimeUnit.MILLISECONDS);
    final long deadline = now + backoffPolicy.delay(0);

    for (String neighbor : addedNeighbors) {
      List<Object> values = new ArrayList<>();
      for (Object value : knownValues) {
        if (pendingAcks.add(neighbor, value, deadline)) {
          values.add(value);
        }
      }
      if (!values.isEmpty()) {
        LOGGER.debug(
            "[{}][{}] Sending {} known value(s) to new neighbor {}",
            localNode.nodeId(),
            currentPeriod,
            values.size(),
            neighbor);
        spreadTo(neighbor, values);
      }
    }
  }

  /**
   * Handles acknowledgement of a single value by a neighbour.
   *
   * @param neighbor acknowledging node
   * @param value acknowledged value
   * @return true if a pending entry was removed
   */
  public boolean onAck(String neighbor, Object value) {
    boolean removed = pendingAcks.remove(neighbor, value);
    if (!removed) {
      LOGGER.debug(
          "[{}][{}] Ignored ack of {} from {}: nothing pending",
          localNode.nodeId(),
          currentPeriod,
          value,
          neighbor);
    }
    return removed;
  }

  /**
   * Handles acknowledgement of a batch of values by a neighbour.
   *
   * @param neighbor acknowledging node
   * @param values acknowledged values
   */
  public void onAck(String neighbor, Collection<?> values) {
    for (Object value : values) {
      onAck(neighbor, value);
    }
  }

  // ================================================
  // ============== Helper Methods ==================
  // ================================================

  public int pendingCount() {
    return pendingAcks.size();
  }

  /**
   * Returns pending entry of the pair.
   *
   * @param neighbor neighbour id
   * @param value value
   * @return pending entry or null
   */
  public PendingAck pendingAck(String neighbor, Object value) {
    return pendingAcks.get(neighbor, value);
  }

  public List<PendingAck> pendingAcks() {
    return pendingAcks.entries();
  }

  private void spreadTo(String neighbor, List<Object> values) {
    final int batchSize = config.gossipMaxBatchSize();
    for (int from = 0; from < values.size(); from += batchSize) {
      sendGossip(neighbor, values.subList(from, Math.min(from + batchSize, values.size())));
    }
  }

  private void sendGossip(String neighbor, List<Object> values) {
    Message message = buildGossipMessage(neighbor, values);
    transport
        .send(message)
        .subscribe(
            null,
            ex ->
                LOGGER.debug(
                    "[{}][{}] Failed to send {} to {}, cause: {}",
                    localNode.nodeId(),
                    currentPeriod,
                    message,
                    neighbor,
                    ex.toString()));
  }

  private Message buildGossipMessage(String neighbor, List<Object> values) {
    return Message.withType(GOSSIP)
        .src(localNode.nodeId())
        .dest(neighbor)
        .msgId(cidGenerator.nextCid())
        .field(MESSAGES, new ArrayList<>(values))
        .build();
  }
}
