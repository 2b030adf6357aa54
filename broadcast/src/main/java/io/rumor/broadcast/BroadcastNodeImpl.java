package io.rumor.broadcast;

import static io.rumor.broadcast.MessageTypes.BROADCAST;
import static io.rumor.broadcast.MessageTypes.BROADCAST_OK;
import static io.rumor.broadcast.MessageTypes.CODE;
import static io.rumor.broadcast.MessageTypes.ERROR;
import static io.rumor.broadcast.MessageTypes.GOSSIP;
import static io.rumor.broadcast.MessageTypes.GOSSIP_OK;
import static io.rumor.broadcast.MessageTypes.INIT;
import static io.rumor.broadcast.MessageTypes.INIT_OK;
import static io.rumor.broadcast.MessageTypes.MESSAGE;
import static io.rumor.broadcast.MessageTypes.MESSAGES;
import static io.rumor.broadcast.MessageTypes.NODE_ID;
import static io.rumor.broadcast.MessageTypes.NODE_IDS;
import static io.rumor.broadcast.MessageTypes.READ;
import static io.rumor.broadcast.MessageTypes.READ_OK;
import static io.rumor.broadcast.MessageTypes.TEXT;
import static io.rumor.broadcast.MessageTypes.TOPOLOGY;
import static io.rumor.broadcast.MessageTypes.TOPOLOGY_OK;

import io.rumor.broadcast.BroadcastConfig.TopologyFallback;
import io.rumor.broadcast.gossip.DisseminationEngine;
import io.rumor.broadcast.store.MessageStore;
import io.rumor.broadcast.topology.TopologyManager;
import io.rumor.transport.api.Message;
import io.rumor.transport.api.Transport;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Broadcast node: dispatches inbound messages to the message store, the topology manager and the
 * dissemination engine, and answers requests.
 *
 * <p>Inbound messages and retry ticks both run on one single-threaded scheduler, which is the only
 * writer of node state.
 */
public final class BroadcastNodeImpl implements BroadcastNode {

  private static final Logger LOGGER = LoggerFactory.getLogger(BroadcastNode.class);

  // Injected

  private final Transport transport;
  private final BroadcastConfig config;
  private final Scheduler scheduler;
  private final boolean ownScheduler;

  // Local State

  private final CorrelationIdGenerator cidGenerator = new CorrelationIdGenerator();
  private final MessageStore messageStore = new MessageStore();

  // Assigned on init

  private volatile NodeState localNode;
  private volatile TopologyManager topology;
  private volatile DisseminationEngine disseminationEngine;

  // Disposables

  private final Disposable.Composite actionsDisposables = Disposables.composite();
  private final Sinks.Empty<Void> shutdown = Sinks.empty();

  /**
   * Creates a node running on its own single-threaded scheduler.
   *
   * @param transport transport
   * @param config broadcast settings
   */
  public BroadcastNodeImpl(Transport transport, BroadcastConfig config) {
    this(transport, config, Schedulers.newSingle("rumor-node", true), true);
  }

  /**
   * Creates a node running on the given scheduler, which must execute tasks one at a time.
   *
   * @param transport transport
   * @param config broadcast settings
   * @param scheduler single-threaded scheduler
   */
  public BroadcastNodeImpl(Transport transport, BroadcastConfig config, Scheduler scheduler) {
    this(transport, config, scheduler, false);
  }

  private BroadcastNodeImpl(
      Transport transport, BroadcastConfig config, Scheduler scheduler, boolean ownScheduler) {
    this.transport = Objects.requireNonNull(transport);
    this.config = Objects.requireNonNull(config).validate();
    this.scheduler = Objects.requireNonNull(scheduler);
    this.ownScheduler = ownScheduler;
  }

  @Override
  public Mono<BroadcastNode> start() {
    return Mono.fromRunnable(
            () ->
                actionsDisposables.add(
                    transport
                        .listen()
                        .publishOn(scheduler)
                        .subscribe(
                            this::onMessage,
                            ex -> LOGGER.error("[{}][onMessage][error] cause:", nodeName(), ex),
                            this::onInboundComplete)))
        .thenReturn(this);
  }

  @Override
  public Mono<Void> stop() {
    return Mono.fromRunnable(
        () -> {
          actionsDisposables.dispose();
          DisseminationEngine engine = disseminationEngine;
          if (engine != null) {
            engine.stop();
          }
          if (ownScheduler) {
            scheduler.dispose();
          }
          shutdown.tryEmitEmpty();
        });
  }

  @Override
  public Optional<String> nodeId() {
    NodeState node = localNode;
    return node != null ? Optional.of(node.nodeId()) : Optional.empty();
  }

  @Override
  public Set<Object> snapshot() {
    return messageStore.snapshot();
  }

  @Override
  public Set<String> neighbors() {
    TopologyManager manager = topology;
    return manager != null ? manager.neighbors() : Collections.emptySet();
  }

  @Override
  public int pendingAcks() {
    DisseminationEngine engine = disseminationEngine;
    return engine != null ? engine.pendingCount() : 0;
  }

  @Override
  public Mono<Void> onShutdown() {
    return shutdown.asMono();
  }

  DisseminationEngine disseminationEngine() {
    return disseminationEngine;
  }

  // ================================================
  // ============== Event Listeners =================
  // ================================================

  private void onMessage(Message message) {
    LOGGER.trace("[{}] Received {}", nodeName(), message);
    try {
      dispatch(message);
    } catch (ProtocolException ex) {
      LOGGER.warn("[{}] Rejected {}: {}", nodeName(), message, ex.getMessage());
      replyError(message, ex.errorCode(), ex.getMessage());
    } catch (Exception ex) {
      LOGGER.error("[{}] Failed to handle {}, cause:", nodeName(), message, ex);
      replyError(message, ErrorCode.CRASH, String.valueOf(ex));
    }
  }

  private void onInboundComplete() {
    LOGGER.info("[{}] Inbound stream completed, stopping", nodeName());
    stop().subscribe();
  }

  private void dispatch(Message message) {
    final String type = message.type();
    if (type == null) {
      throw ProtocolException.malformed("body has no type");
    }

    if (INIT.equals(type)) {
      onInit(message);
      return;
    }

    if (localNode == null) {
      if (message.isReply()) {
        LOGGER.debug("[{}] Dropped reply received before init: {}", nodeName(), message);
        return;
      }
      throw ProtocolException.notInitialized(type);
    }

    switch (type) {
      case TOPOLOGY:
        onTopology(message);
        break;
      case BROADCAST:
        onBroadcast(message);
        break;
      case READ:
        onRead(message);
        break;
      case GOSSIP:
        onGossip(message);
        break;
      case GOSSIP_OK:
        onGossipAck(message);
        break;
      default:
        if (message.isReply()) {
          LOGGER.debug("[{}] Ignored reply {}", nodeName(), message);
          return;
        }
        throw ProtocolException.notSupported(type);
    }
  }

  private void onInit(Message message) {
    final String nodeId = requireString(message, NODE_ID);
    final List<String> nodeIds = requireStringList(message, NODE_IDS);

    NodeState current = localNode;
    if (current != null) {
      if (!current.nodeId().equals(nodeId)) {
        throw new ProtocolException(
            ErrorCode.TEMPORARILY_UNAVAILABLE,
            "Node already initialized as " + current.nodeId() + ", rejected init as " + nodeId);
      }
      LOGGER.debug("[{}] Repeated init, acknowledging again", nodeId);
      reply(message, INIT_OK);
      return;
    }

    NodeState node = new NodeState(nodeId, nodeIds);
    TopologyManager manager = new TopologyManager(node);
    if (config.topologyFallback() == TopologyFallback.ROSTER) {
      manager.setNeighbors(node.peers());
    }
    DisseminationEngine engine =
        new DisseminationEngine(node, manager, transport, config, cidGenerator, scheduler);

    topology = manager;
    disseminationEngine = engine;
    localNode = node;
    engine.start();

    LOGGER.info("[{}] Initialized, roster: {}, config: {}", nodeId, node.roster(), config);
    reply(message, INIT_OK);
  }

  private void onTopology(Message message) {
    Object field = message.field(TOPOLOGY);
    if (!(field instanceof Map)) {
      throw ProtocolException.malformed("topology must be an object");
    }
    Map<?, ?> adjacency = (Map<?, ?>) field;
    Object neighbors = adjacency.get(localNode.nodeId());
    Set<String> previous = topology.neighbors();
    if (neighbors == null) {
      LOGGER.warn("[{}] Topology has no entry for this node, using no neighbors", nodeName());
      topology.setNeighbors(Collections.emptyList());
    } else {
      topology.setNeighbors(asStringList(neighbors, TOPOLOGY));
    }

    // values recorded earlier were fanned out to the old set only
    Set<String> added = new LinkedHashSet<>(topology.neighbors());
    added.removeAll(previous);
    if (!added.isEmpty() && messageStore.size() > 0) {
      disseminationEngine.onNeighborsAdded(added, messageStore.snapshot());
    }
    reply(message, TOPOLOGY_OK);
  }

  private void onBroadcast(Message message) {
    if (!message.hasField(MESSAGE) || message.field(MESSAGE) == null) {
      throw ProtocolException.malformed("broadcast requires a message");
    }
    Object value = message.field(MESSAGE);
    if (messageStore.record(value)) {
      LOGGER.debug("[{}] Recorded {} from {}", nodeName(), value, message.src());
      disseminationEngine.onNewValue(value, null);
    }
    reply(message, BROADCAST_OK);
  }

  private void onRead(Message message) {
    reply(
        Message.replyTo(message, READ_OK)
            .field(MESSAGES, new ArrayList<>(messageStore.snapshot())));
  }

  private void onGossip(Message message) {
    final String from = message.src();
    final List<?> values = requireValues(message);

    for (Object value : values) {
      if (messageStore.record(value)) {
        LOGGER.debug("[{}] Recorded {} gossiped by {}", nodeName(), value, from);
        disseminationEngine.onNewValue(value, from);
      }
    }

    // acknowledged whether new or not, the sender only needs to stop retrying
    reply(Message.replyTo(message, GOSSIP_OK).field(MESSAGES, new ArrayList<>(values)));
  }

  private void onGossipAck(Message message) {
    disseminationEngine.onAck(message.src(), requireValues(message));
  }

  // ================================================
  // ============== Helper Methods ==================
  // ================================================

  private String nodeName() {
    NodeState node = localNode;
    return node != null ? node.nodeId() : "uninitialized";
  }

  private void reply(Message request, String type) {
    reply(Message.replyTo(request, type));
  }

  private void reply(Message.Builder builder) {
    Message message = builder.msgId(cidGenerator.nextCid()).build();
    transport
        .send(message)
        .subscribe(
            null,
            ex ->
                LOGGER.debug(
                    "[{}] Failed to send {}, cause: {}", nodeName(), message, ex.toString()));
  }

  private void replyError(Message request, ErrorCode errorCode, String text) {
    if (request.msgId() == null || request.src() == null) {
      return; // no one to correlate the error with
    }
    reply(
        Message.replyTo(request, ERROR)
            .field(CODE, errorCode.code())
            .field(TEXT, text));
  }

  private static String requireString(Message message, String name) {
    Object value = message.field(name);
    if (!(value instanceof String) || ((String) value).isEmpty()) {
      throw ProtocolException.malformed(name + " must be a non-empty string");
    }
    return (String) value;
  }

  private static List<String> requireStringList(Message message, String name) {
    return asStringList(message.field(name), name);
  }

  private static List<String> asStringList(Object value, String name) {
    if (!(value instanceof List)) {
      throw ProtocolException.malformed(name + " must be a list of node ids");
    }
    List<String> result = new ArrayList<>();
    for (Object item : (List<?>) value) {
      if (!(item instanceof String)) {
        throw ProtocolException.malformed(name + " must be a list of node ids");
      }
      result.add((String) item);
    }
    return result;
  }

  private static List<?> requireValues(Message message) {
    Object value = message.field(MESSAGES);
    if (!(value instanceof List)) {
      throw ProtocolException.malformed(MESSAGES + " must be a list");
    }
    List<?> values = (List<?>) value;
    for (Object item : values) {
      if (item == null) {
        throw ProtocolException.malformed(MESSAGES + " must not contain null");
      }
    }
    return values;
  }
}
