package io.rumor.transport.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

public class MessageTest {

  @Test
  public void testReplySwapsAddressesAndCorrelates() {
    Message request = Message.withType("read").src("c1").dest("n1").msgId(9).build();

    Message reply = Message.replyTo(request, "read_ok").msgId(1).build();

    assertEquals("n1", reply.src());
    assertEquals("c1", reply.dest());
    assertEquals("read_ok", reply.type());
    assertEquals(Long.valueOf(9), reply.inReplyTo());
    assertEquals(Long.valueOf(1), reply.msgId());
    assertTrue(reply.isReply());
    assertFalse(request.isReply());
  }

  @Test
  public void testReplyToUncorrelatedRequestHasNoInReplyTo() {
    Message request = Message.withType("gossip").src("n2").dest("n1").build();

    Message reply = Message.replyTo(request, "gossip_ok").build();

    assertNull(reply.inReplyTo());
    assertFalse(reply.isReply());
  }

  @Test
  public void testBodyIsUnmodifiable() {
    Message message = Message.withType("broadcast").field("message", 5L).build();
    Map<String, Object> body = message.body();

    assertThrows(UnsupportedOperationException.class, () -> body.put("message", 6L));
    assertTrue(message.hasField("message"));
    assertFalse(message.hasField("messages"));
  }

  @Test
  public void testCopyKeepsFields() {
    Message original =
        Message.withType("broadcast").src("c1").dest("n1").field("message", 5L).build();

    Message copy = Message.with(original).dest("n2").build();

    assertEquals("n2", copy.dest());
    assertEquals(original.body(), copy.body());
  }
}
