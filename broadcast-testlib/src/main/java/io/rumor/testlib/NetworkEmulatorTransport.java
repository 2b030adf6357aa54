package io.rumor.testlib;

import io.rumor.transport.api.Message;
import io.rumor.transport.api.Transport;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/** Transport decorator which passes every message through a {@link NetworkEmulator}. */
public final class NetworkEmulatorTransport implements Transport {

  private final Transport transport;
  private final NetworkEmulator networkEmulator;

  /**
   * Constructor.
   *
   * @param address node id of the wrapped transport
   * @param transport transport
   */
  public NetworkEmulatorTransport(String address, Transport transport) {
    this.transport = transport;
    this.networkEmulator = new NetworkEmulator(address);
  }

  public NetworkEmulator networkEmulator() {
    return networkEmulator;
  }

  @Override
  public Mono<Transport> start() {
    return transport.start().thenReturn(this);
  }

  @Override
  public Mono<Void> stop() {
    return transport.stop();
  }

  @Override
  public boolean isStopped() {
    return transport.isStopped();
  }

  @Override
  public Mono<Void> send(Message message) {
    return Mono.defer(
        () ->
            networkEmulator
                .tryFailOutbound(message, message.dest())
                .flatMap(msg -> networkEmulator.tryDelayOutbound(msg, message.dest()))
                .flatMap(transport::send));
  }

  @Override
  public Flux<Message> listen() {
    return transport
        .listen()
        .filter(message -> networkEmulator.inboundPass(message.src()))
        .onBackpressureBuffer();
  }
}
