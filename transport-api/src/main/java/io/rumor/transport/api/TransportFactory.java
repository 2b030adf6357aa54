package io.rumor.transport.api;

public interface TransportFactory {

  Transport createTransport(TransportConfig config);
}
