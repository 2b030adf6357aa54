package io.rumor.transport.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Message envelope exchanged between nodes and the harness. An envelope has a source, a
 * destination and a body. The body always carries a {@code type} and optionally a {@code msg_id}
 * (requests expecting a reply) and an {@code in_reply_to} (replies). Everything else in the body is
 * type specific and kept as opaque fields.
 */
public final class Message {

  public static final String TYPE = "type";
  public static final String MSG_ID = "msg_id";
  public static final String IN_REPLY_TO = "in_reply_to";

  private final String src;
  private final String dest;
  private final Map<String, Object> body;

  private Message(Builder builder) {
    this.src = builder.src;
    this.dest = builder.dest;
    this.body = Collections.unmodifiableMap(new LinkedHashMap<>(builder.body));
  }

  /**
   * Instantiates new message builder.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Instantiates new message builder with the given type.
   *
   * @param type message type
   * @return new builder
   */
  public static Builder withType(String type) {
    return builder().type(type);
  }

  /**
   * Instantiates new message builder which copies everything from the given message.
   *
   * @param message message to copy
   * @return new builder
   */
  public static Builder with(Message message) {
    return builder().src(message.src).dest(message.dest).body(message.body);
  }

  /**
   * Instantiates a reply builder for the given request: source and destination are swapped and
   * {@code in_reply_to} is set to the request's {@code msg_id}.
   *
   * @param request request being replied to
   * @param type reply type
   * @return new builder
   */
  public static Builder replyTo(Message request, String type) {
    Builder builder = builder().src(request.dest).dest(request.src).type(type);
    Long msgId = request.msgId();
    if (msgId != null) {
      builder.inReplyTo(msgId);
    }
    return builder;
  }

  public String src() {
    return src;
  }

  public String dest() {
    return dest;
  }

  /**
   * Returns the whole body, including {@code type}, {@code msg_id} and {@code in_reply_to}.
   *
   * @return unmodifiable body
   */
  public Map<String, Object> body() {
    return body;
  }

  public String type() {
    Object type = body.get(TYPE);
    return type != null ? type.toString() : null;
  }

  public Long msgId() {
    return asLong(body.get(MSG_ID));
  }

  public Long inReplyTo() {
    return asLong(body.get(IN_REPLY_TO));
  }

  public boolean isReply() {
    return body.containsKey(IN_REPLY_TO);
  }

  /**
   * Returns a type specific body field.
   *
   * @param name field name
   * @param <T> expected type
   * @return field value or null
   */
  @SuppressWarnings("unchecked")
  public <T> T field(String name) {
    return (T) body.get(name);
  }

  public boolean hasField(String name) {
    return body.containsKey(name);
  }

  private static Long asLong(Object value) {
    if (value instanceof Number) {
      return ((Number) value).longValue();
    }
    return null;
  }

  @Override
  public boolean equals(Object that) {
    if (this == that) {
      return true;
    }
    if (that == null || getClass() != that.getClass()) {
      return false;
    }
    Message message = (Message) that;
    return Objects.equals(src, message.src)
        && Objects.equals(dest, message.dest)
        && Objects.equals(body, message.body);
  }

  @Override
  public int hashCode() {
    return Objects.hash(src, dest, body);
  }

  @Override
  public String toString() {
    return new StringJoiner(", ", Message.class.getSimpleName() + "[", "]")
        .add("src='" + src + "'")
        .add("dest='" + dest + "'")
        .add("body=" + body)
        .toString();
  }

  public static final class Builder {

    private String src;
    private String dest;
    private final Map<String, Object> body = new LinkedHashMap<>();

    private Builder() {}

    public Builder src(String src) {
      this.src = src;
      return this;
    }

    public Builder dest(String dest) {
      this.dest = dest;
      return this;
    }

    public Builder type(String type) {
      body.put(TYPE, Objects.requireNonNull(type, "type"));
      return this;
    }

    public Builder msgId(long msgId) {
      body.put(MSG_ID, msgId);
      return this;
    }

    public Builder inReplyTo(long inReplyTo) {
      body.put(IN_REPLY_TO, inReplyTo);
      return this;
    }

    /**
     * Sets type specific body field.
     *
     * @param name field name
     * @param value field value
     * @return this builder
     */
    public Builder field(String name, Object value) {
      body.put(Objects.requireNonNull(name, "name"), value);
      return this;
    }

    /**
     * Copies all the given fields into the body.
     *
     * @param fields body fields
     * @return this builder
     */
    public Builder body(Map<String, Object> fields) {
      body.putAll(fields);
      return this;
    }

    public Message build() {
      return new Message(this);
    }
  }
}
