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
import static io.rumor.broadcast.MessageTypes.TOPOLOGY;
import static io.rumor.broadcast.MessageTypes.TOPOLOGY_OK;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.rumor.testlib.LocalNetwork;
import io.rumor.testlib.NetworkEmulatorTransport;
import io.rumor.transport.api.Message;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

public class BroadcastNodeImplTest extends BaseTest {

  private static final List<String> ROSTER = Arrays.asList("n1", "n2", "n3");

  private final List<Message> clientInbox = new CopyOnWriteArrayList<>();
  private final Map<String, BroadcastNode> nodes = new LinkedHashMap<>();

  private VirtualTimeScheduler scheduler;
  private LocalNetwork network;
  private long nextMsgId = 1;

  @BeforeEach
  public void setUp() {
    scheduler = VirtualTimeScheduler.create();
    network = new LocalNetwork();
    network.clientInbox().subscribe(clientInbox::add);
    for (String id : ROSTER) {
      NetworkEmulatorTransport transport = network.createTransport(id);
      BroadcastNode node =
          new BroadcastNodeImpl(transport, BroadcastConfig.defaultLocalConfig(), scheduler);
      node.start().block();
      nodes.put(id, node);
    }
  }

  @AfterEach
  public void tearDown() {
    nodes.values().forEach(node -> node.stop().block());
    scheduler.dispose();
  }

  @Test
  public void testInitIsAcknowledged() {
    Message request = request("n1", INIT).field(NODE_ID, "n1").field(NODE_IDS, ROSTER).build();

    Message reply = call(request);

    assertEquals(INIT_OK, reply.type());
    assertEquals("n1", reply.src());
    assertEquals("c1", reply.dest());
    assertEquals(request.msgId(), reply.inReplyTo());
    assertEquals(Optional.of("n1"), nodes.get("n1").nodeId());
  }

  @Test
  public void testRequestBeforeInitIsRejected() {
    Message reply = call(request("n1", READ).build());

    assertEquals(ERROR, reply.type());
    assertEquals(ErrorCode.TEMPORARILY_UNAVAILABLE.code(), code(reply));
    assertEquals(Optional.empty(), nodes.get("n1").nodeId());
  }

  @Test
  public void testRepeatedInit() {
    init("n1");

    assertEquals(INIT_OK, init("n1").type());

    Message conflicting = init("n1", "n2");
    assertEquals(ERROR, conflicting.type());
    assertEquals(ErrorCode.TEMPORARILY_UNAVAILABLE.code(), code(conflicting));
    assertEquals(Optional.of("n1"), nodes.get("n1").nodeId());
  }

  @Test
  public void testMalformedInitIsRejected() {
    Message reply = call(request("n1", INIT).field(NODE_ID, "n1").build());

    assertEquals(ERROR, reply.type());
    assertEquals(ErrorCode.MALFORMED_REQUEST.code(), code(reply));
    assertEquals(Optional.empty(), nodes.get("n1").nodeId());
  }

  @Test
  public void testTopologySetsNeighbors() {
    init("n1");

    Message reply = topology("n1", Map.of("n1", List.of("n1", "n2", "n3"), "n2", List.of("n1")));

    assertEquals(TOPOLOGY_OK, reply.type());
    assertEquals(Set.of("n2", "n3"), nodes.get("n1").neighbors());
  }

  @Test
  public void testTopologyWithoutEntryMeansNoNeighbors() {
    init("n1");
    topology("n1", Map.of("n1", List.of("n2")));

    Message reply = topology("n1", Map.of("n2", List.of("n1")));

    assertEquals(TOPOLOGY_OK, reply.type());
    assertTrue(nodes.get("n1").neighbors().isEmpty());
  }

  @Test
  public void testUnknownRequestTypeIsNotSupported() {
    init("n1");

    Message reply = call(request("n1", "cas").build());

    assertEquals(ERROR, reply.type());
    assertEquals(ErrorCode.NOT_SUPPORTED.code(), code(reply));
  }

  @Test
  public void testUnknownReplyIsIgnored() {
    init("n1");
    int before = clientInbox.size();

    network.inject(Message.withType("echo_ok").src("c1").dest("n1").inReplyTo(42).build());

    assertEquals(before, clientInbox.size());
  }

  @Test
  public void testBroadcastWithoutMessageIsMalformed() {
    init("n1");

    Message reply = call(request("n1", BROADCAST).build());

    assertEquals(ERROR, reply.type());
    assertEquals(ErrorCode.MALFORMED_REQUEST.code(), code(reply));
  }

  @Test
  public void testReadOfEmptyNode() {
    init("n1");

    assertEquals(List.of(), read("n1"));
  }

  @Test
  public void testBroadcastReachesNeighborsAndIsAcknowledged() {
    ROSTER.forEach(this::init);
    Map<String, List<String>> topology =
        Map.of("n1", List.of("n2", "n3"), "n2", List.of("n1"), "n3", List.of("n1"));
    ROSTER.forEach(id -> topology(id, topology));

    Message reply = call(request("n1", BROADCAST).field(MESSAGE, 5L).build());

    assertEquals(BROADCAST_OK, reply.type());
    assertEquals(List.of(5L), read("n1"));
    assertEquals(List.of(5L), read("n2"));
    assertEquals(List.of(5L), read("n3"));
    nodes.values().forEach(node -> assertEquals(0, node.pendingAcks(), "pending on " + node));
  }

  @Test
  public void testDuplicateBroadcastsAreStoredOnce() {
    ROSTER.forEach(this::init);
    Map<String, List<String>> topology =
        Map.of("n1", List.of("n2", "n3"), "n2", List.of("n1", "n3"), "n3", List.of("n1", "n2"));
    ROSTER.forEach(id -> topology(id, topology));

    call(request("n1", BROADCAST).field(MESSAGE, 5L).build());
    call(request("n1", BROADCAST).field(MESSAGE, 5L).build());
    call(request("n2", BROADCAST).field(MESSAGE, 5L).build());
    call(request("n3", BROADCAST).field(MESSAGE, 6L).build());

    for (String id : ROSTER) {
      List<Object> values = read(id);
      assertEquals(2, values.size(), id + " read " + values);
      assertEquals(Set.of(5L, 6L), new HashSet<>(values));
    }
  }

  @Test
  public void testGossipIsAlwaysAcknowledged() {
    init("n1");
    call(request("n1", BROADCAST).field(MESSAGE, 1L).build());

    Message gossip =
        Message.withType(GOSSIP)
            .src("n9")
            .dest("n1")
            .msgId(100)
            .field(MESSAGES, Arrays.asList(1L, 2L))
            .build();
    Message reply = call(gossip);

    assertEquals(GOSSIP_OK, reply.type());
    assertEquals("n9", reply.dest());
    assertEquals(100L, reply.inReplyTo());
    List<Object> acked = reply.field(MESSAGES);
    assertEquals(Arrays.asList(1L, 2L), acked);
    assertEquals(Set.of(1L, 2L), nodes.get("n1").snapshot());
  }

  @Test
  public void testMalformedGossipIsRejected() {
    init("n1");

    Message reply =
        call(Message.withType(GOSSIP).src("n9").dest("n1").msgId(7).field(MESSAGES, 3L).build());

    assertEquals(ERROR, reply.type());
    assertEquals(ErrorCode.MALFORMED_REQUEST.code(), code(reply));
  }

  @Test
  public void testRosterFallbackBeforeTopology() {
    NetworkEmulatorTransport transport = network.createTransport("n4");
    BroadcastNode node =
        new BroadcastNodeImpl(
            transport,
            BroadcastConfig.defaultLocalConfig()
                .topologyFallback(BroadcastConfig.TopologyFallback.ROSTER),
            scheduler);
    node.start().block();
    nodes.put("n4", node);

    init("n4", "n4");

    assertEquals(Set.of("n1", "n2", "n3"), node.neighbors());
  }

  @Test
  public void testNodeStopsWhenInboundCompletes() {
    NetworkEmulatorTransport transport = network.createTransport("n5");
    BroadcastNode node =
        new BroadcastNodeImpl(transport, BroadcastConfig.defaultLocalConfig(), scheduler);
    node.start().block();
    nodes.put("n5", node);

    transport.stop().block();

    StepVerifier.create(node.onShutdown()).expectComplete().verify(Duration.ofSeconds(3));
    assertFalse(node.nodeId().isPresent());
  }

  // ==== helpers ====

  private Message.Builder request(String dest, String type) {
    return Message.withType(type).src("c1").dest(dest).msgId(nextMsgId++);
  }

  private Message call(Message request) {
    network.inject(request);
    return clientInbox.stream()
        .filter(reply -> request.msgId().equals(reply.inReplyTo()))
        .filter(reply -> request.src().equals(reply.dest()))
        .reduce((first, second) -> second)
        .orElseThrow(() -> new AssertionError("no reply to " + request));
  }

  private Message init(String id) {
    return init(id, id);
  }

  private Message init(String dest, String nodeId) {
    List<String> roster = new ArrayList<>(ROSTER);
    if (!roster.contains(nodeId)) {
      roster.add(nodeId);
    }
    return call(request(dest, INIT).field(NODE_ID, nodeId).field(NODE_IDS, roster).build());
  }

  private Message topology(String id, Map<String, List<String>> topology) {
    return call(request(id, TOPOLOGY).field(TOPOLOGY, topology).build());
  }

  private List<Object> read(String id) {
    Message reply = call(request(id, READ).build());
    assertEquals(READ_OK, reply.type());
    return reply.field(MESSAGES);
  }

  private static int code(Message reply) {
    Number code = reply.field(CODE);
    return code.intValue();
  }
}
