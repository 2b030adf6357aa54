package io.rumor.codec.jackson;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.rumor.transport.api.Message;
import io.rumor.transport.api.MessageCodec;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON message codec. A message is encoded as {@code {"src":..,"dest":..,"body":{..}}} on a
 * single line.
 */
public class JacksonMessageCodec implements MessageCodec {

  private static final TypeReference<Map<String, Object>> MAP_TYPE =
      new TypeReference<Map<String, Object>>() {};

  private static final String SRC = "src";
  private static final String DEST = "dest";
  private static final String BODY = "body";

  private final ObjectMapper delegate;

  /** Create instance with default {@link ObjectMapper}. */
  public JacksonMessageCodec() {
    this(DefaultObjectMapper.OBJECT_MAPPER);
  }

  /**
   * Create instance with external {@link ObjectMapper}.
   *
   * @param delegate jackson object mapper
   */
  public JacksonMessageCodec(ObjectMapper delegate) {
    this.delegate = delegate;
  }

  /**
   * Deserializes message from given input stream.
   *
   * @param stream input stream
   * @return message from the input stream
   * @throws IllegalArgumentException if the envelope has no body object or no body type
   */
  @Override
  public Message deserialize(InputStream stream) throws Exception {
    Map<String, Object> envelope = delegate.readValue(stream, MAP_TYPE);
    if (envelope == null) {
      throw new IllegalArgumentException("Empty envelope");
    }

    Object body = envelope.get(BODY);
    if (!(body instanceof Map)) {
      throw new IllegalArgumentException("Envelope has no body: " + envelope);
    }

    @SuppressWarnings("unchecked")
    Map<String, Object> fields = (Map<String, Object>) body;
    if (!(fields.get(Message.TYPE) instanceof String)) {
      throw new IllegalArgumentException("Body has no type: " + envelope);
    }

    return Message.builder()
        .src(asString(envelope.get(SRC)))
        .dest(asString(envelope.get(DEST)))
        .body(fields)
        .build();
  }

  /**
   * Serializes given message into given output stream.
   *
   * @param message message
   * @param stream output stream
   */
  @Override
  public void serialize(Message message, OutputStream stream) throws Exception {
    Map<String, Object> envelope = new LinkedHashMap<>();
    envelope.put(SRC, message.src());
    envelope.put(DEST, message.dest());
    envelope.put(BODY, message.body());
    delegate.writeValue(stream, envelope);
  }

  private static String asString(Object value) {
    return value != null ? value.toString() : null;
  }
}
