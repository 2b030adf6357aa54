package io.rumor.transport.stdio;

import io.rumor.transport.api.Transport;
import io.rumor.transport.api.TransportConfig;
import io.rumor.transport.api.TransportFactory;
import java.io.InputStream;
import java.io.OutputStream;

public final class StdioTransportFactory implements TransportFactory {

  private final InputStream input;
  private final OutputStream output;

  /** Binds transport to the process standard streams. */
  public StdioTransportFactory() {
    this(System.in, System.out);
  }

  public StdioTransportFactory(InputStream input, OutputStream output) {
    this.input = input;
    this.output = output;
  }

  @Override
  public Transport createTransport(TransportConfig config) {
    return new StdioTransport(config, input, output);
  }
}
