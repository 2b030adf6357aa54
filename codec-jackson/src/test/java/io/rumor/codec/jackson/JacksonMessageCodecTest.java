package io.rumor.codec.jackson;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.rumor.transport.api.Message;
import io.rumor.transport.api.MessageCodec;
import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JacksonMessageCodecTest {

  private static final MessageCodec messageCodec = MessageCodec.load();

  @Test
  void codecIsDiscoveredThroughServiceLoader() {
    assertInstanceOf(JacksonMessageCodec.class, messageCodec);
  }

  @Test
  void decodeBroadcastRequest() throws Exception {
    Message message =
        messageCodec.decode(
            "{\"src\":\"c1\",\"dest\":\"n1\",\"body\":{\"type\":\"broadcast\",\"msg_id\":7,\"message\":42}}");

    assertEquals("c1", message.src());
    assertEquals("n1", message.dest());
    assertEquals("broadcast", message.type());
    assertEquals(7L, message.msgId());
    assertFalse(message.isReply());
    assertEquals(Long.valueOf(42), message.field("message"));
  }

  @Test
  void decodeTopologyKeepsNestedStructure() throws Exception {
    Message message =
        messageCodec.decode(
            "{\"src\":\"c1\",\"dest\":\"n1\",\"body\":{\"type\":\"topology\",\"msg_id\":1,"
                + "\"topology\":{\"n1\":[\"n2\",\"n3\"],\"n2\":[\"n1\"]}}}");

    Map<String, List<String>> topology = message.field("topology");
    assertEquals(Arrays.asList("n2", "n3"), topology.get("n1"));
  }

  @Test
  void encodeReadReplyOnSingleLine() throws Exception {
    Message request =
        Message.withType("read").src("c1").dest("n1").msgId(3).build();
    Message reply =
        Message.replyTo(request, "read_ok").field("messages", Arrays.asList(1L, 2L)).build();

    String line = messageCodec.encode(reply);

    assertFalse(line.contains("\n"));
    assertEquals(
        "{\"src\":\"n1\",\"dest\":\"c1\",\"body\":{\"type\":\"read_ok\",\"in_reply_to\":3,"
            + "\"messages\":[1,2]}}",
        line);
  }

  @Test
  void serializeDoesNotCloseTargetStream() throws Exception {
    CloseTrackingStream stream = new CloseTrackingStream();

    messageCodec.serialize(Message.withType("gossip_ok").src("n1").dest("n2").build(), stream);

    assertFalse(stream.closed);
    assertTrue(stream.size() > 0);
  }

  @Test
  void rejectEnvelopeWithoutType() {
    assertThrows(
        IllegalArgumentException.class,
        () -> messageCodec.decode("{\"src\":\"c1\",\"dest\":\"n1\",\"body\":{\"msg_id\":1}}"));
  }

  @Test
  void rejectEnvelopeWithoutBody() {
    assertThrows(
        IllegalArgumentException.class,
        () -> messageCodec.decode("{\"src\":\"c1\",\"dest\":\"n1\"}"));
  }

  @Test
  void rejectInvalidJson() {
    assertThrows(Exception.class, () -> messageCodec.decode("{\"src\":"));
  }

  @Test
  void missingSourceDecodesAsNull() throws Exception {
    Message message = messageCodec.decode("{\"body\":{\"type\":\"read\"}}");

    assertNull(message.src());
    assertNull(message.msgId());
  }

  private static final class CloseTrackingStream extends OutputStream {

    private final ByteArrayOutputStream delegate = new ByteArrayOutputStream();
    private boolean closed;

    @Override
    public void write(int b) {
      delegate.write(b);
    }

    @Override
    public void close() {
      closed = true;
    }

    int size() {
      return delegate.size();
    }
  }
}
