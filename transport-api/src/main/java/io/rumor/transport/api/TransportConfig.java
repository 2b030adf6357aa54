package io.rumor.transport.api;

import java.util.StringJoiner;
import reactor.core.Exceptions;

public final class TransportConfig implements Cloneable {

  public static final int DEFAULT_MAX_LINE_LENGTH = 2 * 1024 * 1024; // 2 MB

  private MessageCodec messageCodec;
  private int maxLineLength = DEFAULT_MAX_LINE_LENGTH;
  private TransportFactory transportFactory;

  public TransportConfig() {}

  public static TransportConfig defaultConfig() {
    return new TransportConfig();
  }

  /**
   * Returns configured codec, or the one registered under {@code META-INF/services} if none was
   * set explicitly.
   *
   * @return message codec
   */
  public MessageCodec messageCodec() {
    return messageCodec != null ? messageCodec : MessageCodec.load();
  }

  /**
   * Setter for {@code messageCodec}.
   *
   * @param messageCodec message codec
   * @return new {@code TransportConfig} instance
   */
  public TransportConfig messageCodec(MessageCodec messageCodec) {
    TransportConfig t = clone();
    t.messageCodec = messageCodec;
    return t;
  }

  public int maxLineLength() {
    return maxLineLength;
  }

  /**
   * Setter for {@code maxLineLength}. Inbound frames longer than this are dropped.
   *
   * @param maxLineLength max frame length in chars
   * @return new {@code TransportConfig} instance
   */
  public TransportConfig maxLineLength(int maxLineLength) {
    TransportConfig t = clone();
    t.maxLineLength = maxLineLength;
    return t;
  }

  public TransportFactory transportFactory() {
    return transportFactory;
  }

  /**
   * Setter for {@code transportFactory}.
   *
   * @param transportFactory transport factory
   * @return new {@code TransportConfig} instance
   */
  public TransportConfig transportFactory(TransportFactory transportFactory) {
    TransportConfig t = clone();
    t.transportFactory = transportFactory;
    return t;
  }

  @Override
  public TransportConfig clone() {
    try {
      return (TransportConfig) super.clone();
    } catch (CloneNotSupportedException e) {
      throw Exceptions.propagate(e);
    }
  }

  @Override
  public String toString() {
    return new StringJoiner(", ", TransportConfig.class.getSimpleName() + "[", "]")
        .add("messageCodec=" + messageCodec)
        .add("maxLineLength=" + maxLineLength)
        .add("transportFactory=" + transportFactory)
        .toString();
  }
}
