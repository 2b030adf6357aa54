package io.rumor.broadcast;

/** Body types and field names of the broadcast protocol. */
public final class MessageTypes {

  // Types

  public static final String INIT = "init";
  public static final String INIT_OK = "init_ok";
  public static final String TOPOLOGY = "topology";
  public static final String TOPOLOGY_OK = "topology_ok";
  public static final String BROADCAST = "broadcast";
  public static final String BROADCAST_OK = "broadcast_ok";
  public static final String READ = "read";
  public static final String READ_OK = "read_ok";
  public static final String GOSSIP = "gossip";
  public static final String GOSSIP_OK = "gossip_ok";
  public static final String ERROR = "error";

  // Fields

  public static final String NODE_ID = "node_id";
  public static final String NODE_IDS = "node_ids";
  public static final String MESSAGE = "message";
  public static final String MESSAGES = "messages";
  public static final String CODE = "code";
  public static final String TEXT = "text";

  private MessageTypes() {
    // Do not instantiate
  }
}
