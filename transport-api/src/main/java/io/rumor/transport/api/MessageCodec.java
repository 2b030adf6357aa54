package io.rumor.transport.api;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ServiceLoader;
import java.util.stream.StreamSupport;

/** Contains methods for message serializing/deserializing logic. */
public interface MessageCodec {

  /**
   * Returns the first codec registered under {@code META-INF/services}.
   *
   * @return message codec
   * @throws IllegalStateException if no codec is on the classpath
   */
  static MessageCodec load() {
    return StreamSupport.stream(ServiceLoader.load(MessageCodec.class).spliterator(), false)
        .findFirst()
        .orElseThrow(() -> new IllegalStateException("No MessageCodec registered"));
  }

  /**
   * Deserializes message from given input stream.
   *
   * @param stream input stream
   * @return message from the input stream
   */
  Message deserialize(InputStream stream) throws Exception;

  /**
   * Serializes given message into given output stream.
   *
   * @param message message
   * @param stream output stream
   */
  void serialize(Message message, OutputStream stream) throws Exception;

  /**
   * Decodes a single frame (one line without the trailing newline).
   *
   * @param line frame
   * @return decoded message
   */
  default Message decode(String line) throws Exception {
    return deserialize(new ByteArrayInputStream(line.getBytes(StandardCharsets.UTF_8)));
  }

  /**
   * Encodes message into a single frame (no trailing newline).
   *
   * @param message message
   * @return frame
   */
  default String encode(Message message) throws Exception {
    ByteArrayOutputStream stream = new ByteArrayOutputStream();
    serialize(message, stream);
    return stream.toString(StandardCharsets.UTF_8);
  }
}
