package io.rumor.transport.api;

import java.util.Objects;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Transport is responsible for delivering messages between this node, its peers and the harness.
 * Destination of a message is taken from its envelope ({@link Message#dest()}).
 */
public interface Transport {

  /**
   * Start transport. After this call messages start flowing to {@link #listen()} subscribers.
   *
   * @return started {@code Transport}
   */
  Mono<Transport> start();

  /**
   * Stop transport and release all resources which belong to it. After transport is stopped it
   * can't be used again. Flux returned from {@link #listen()} completes.
   */
  Mono<Void> stop();

  /**
   * Return transport's stopped state.
   *
   * @return true if transport was stopped; false otherwise
   */
  boolean isStopped();

  /**
   * Sends message to its destination. Send is an async operation, the caller is not expected to
   * wait on the result: a lost message is observationally identical to a successfully sent one
   * that was never answered.
   *
   * @param message message to send
   * @return promise which will be completed with result of sending (void or exception)
   */
  Mono<Void> send(Message message);

  /**
   * Returns stream of received messages. Completes when transport is stopped or its input is
   * exhausted, never errors.
   *
   * @return flux of received messages
   */
  Flux<Message> listen();

  /**
   * Init transport with the given configuration synchronously.
   *
   * @param config transport config
   * @return started transport
   */
  static Transport bindAwait(TransportConfig config) {
    try {
      return bind(config).block();
    } catch (Exception e) {
      throw Exceptions.propagate(e.getCause() != null ? e.getCause() : e);
    }
  }

  /**
   * Init transport with the given configuration asynchronously.
   *
   * @param config transport config
   * @return promise for bind operation
   */
  static Mono<Transport> bind(TransportConfig config) {
    Objects.requireNonNull(config.transportFactory(), "[bind] transportFactory");
    return config.transportFactory().createTransport(config).start();
  }
}
