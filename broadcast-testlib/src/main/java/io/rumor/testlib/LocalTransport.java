package io.rumor.testlib;

import static io.rumor.transport.utils.RetryNotSerializedEmitFailureHandler.RETRY_NOT_SERIALIZED;

import io.rumor.transport.api.Message;
import io.rumor.transport.api.Transport;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/** In-memory transport of one node of a {@link LocalNetwork}. */
public final class LocalTransport implements Transport {

  private final String address;
  private final LocalNetwork network;
  private final Sinks.Many<Message> sink = Sinks.many().multicast().onBackpressureBuffer();

  private volatile boolean stopped;

  LocalTransport(String address, LocalNetwork network) {
    this.address = address;
    this.network = network;
  }

  public String address() {
    return address;
  }

  @Override
  public Mono<Transport> start() {
    return Mono.just(this);
  }

  @Override
  public Mono<Void> stop() {
    return Mono.fromRunnable(
        () -> {
          stopped = true;
          sink.emitComplete(RETRY_NOT_SERIALIZED);
        });
  }

  @Override
  public boolean isStopped() {
    return stopped;
  }

  @Override
  public Mono<Void> send(Message message) {
    return Mono.fromRunnable(
        () -> {
          if (stopped) {
            throw new IllegalStateException("Transport " + address + " is stopped");
          }
          network.deliver(message);
        });
  }

  @Override
  public Flux<Message> listen() {
    return sink.asFlux().onBackpressureBuffer();
  }

  void receive(Message message) {
    if (!stopped) {
      sink.emitNext(message, RETRY_NOT_SERIALIZED);
    }
  }
}
