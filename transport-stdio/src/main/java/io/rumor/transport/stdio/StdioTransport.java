package io.rumor.transport.stdio;

import static io.rumor.transport.utils.RetryNotSerializedEmitFailureHandler.RETRY_NOT_SERIALIZED;

import io.rumor.transport.api.Message;
import io.rumor.transport.api.MessageCodec;
import io.rumor.transport.api.Transport;
import io.rumor.transport.api.TransportConfig;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Transport over a pair of byte streams, one JSON message per line. Used to talk to the harness,
 * which also relays peer-to-peer messages through the same streams.
 */
public final class StdioTransport implements Transport {

  private static final Logger LOGGER = LoggerFactory.getLogger(StdioTransport.class);

  private final InputStream input;
  private final Writer output;
  private final MessageCodec messageCodec;
  private final int maxLineLength;

  private final Sinks.Many<Message> sink = Sinks.many().multicast().onBackpressureBuffer();
  private final Scheduler readScheduler;

  private volatile boolean stopped;

  /**
   * Constructor.
   *
   * @param config transport config
   * @param input inbound frames
   * @param output outbound frames
   */
  public StdioTransport(TransportConfig config, InputStream input, OutputStream output) {
    this.input = Objects.requireNonNull(input, "input");
    this.output =
        new OutputStreamWriter(Objects.requireNonNull(output, "output"), StandardCharsets.UTF_8);
    this.messageCodec = config.messageCodec();
    this.maxLineLength = config.maxLineLength();
    this.readScheduler = Schedulers.newSingle("stdio-reader", true);
  }

  @Override
  public Mono<Transport> start() {
    return Mono.fromRunnable(() -> readScheduler.schedule(this::readLoop)).thenReturn(this);
  }

  @Override
  public Mono<Void> stop() {
    return Mono.fromRunnable(
        () -> {
          if (stopped) {
            return;
          }
          stopped = true;
          sink.emitComplete(RETRY_NOT_SERIALIZED);
          readScheduler.dispose();
        });
  }

  @Override
  public boolean isStopped() {
    return stopped;
  }

  @Override
  public Mono<Void> send(Message message) {
    return Mono.fromCallable(
            () -> {
              if (stopped) {
                throw new IllegalStateException("Transport is stopped");
              }
              writeLine(messageCodec.encode(message));
              return message;
            })
        .then();
  }

  @Override
  public Flux<Message> listen() {
    return sink.asFlux().onBackpressureBuffer();
  }

  private void readLoop() {
    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
      String line;
      while (!stopped && (line = readFrame(reader)) != null) {
        onLine(line);
      }
      LOGGER.debug("Input exhausted, completing inbound stream");
    } catch (IOException ex) {
      if (!stopped) {
        LOGGER.error("Failed to read inbound frame, cause: {}", ex.toString());
      }
    } finally {
      sink.emitComplete(RETRY_NOT_SERIALIZED);
    }
  }

  /**
   * Reads one frame up to the next line feed. At most {@code maxLineLength} chars are kept in
   * memory: the rest of a longer frame is read and thrown away, and the frame is returned empty.
   *
   * @param reader inbound chars
   * @return frame without its line terminator, or null at end of input
   */
  private String readFrame(Reader reader) throws IOException {
    StringBuilder frame = new StringBuilder();
    long length = 0;
    int ch;
    while ((ch = reader.read()) != -1 && ch != '\n') {
      if (length++ < maxLineLength) {
        frame.append((char) ch);
      }
    }
    if (ch == -1 && length == 0) {
      return null;
    }
    if (length > maxLineLength) {
      LOGGER.warn("Dropped inbound frame of {} chars (max {})", length, maxLineLength);
      return "";
    }
    int last = frame.length() - 1;
    if (last >= 0 && frame.charAt(last) == '\r') {
      frame.setLength(last);
    }
    return frame.toString();
  }

  private void onLine(String line) {
    if (line.isBlank()) {
      return;
    }
    final Message message;
    try {
      message = messageCodec.decode(line);
    } catch (Exception ex) {
      LOGGER.warn("Dropped malformed inbound frame: {}, cause: {}", line, ex.toString());
      return;
    }
    LOGGER.trace("Received {}", message);
    sink.emitNext(message, RETRY_NOT_SERIALIZED);
  }

  private void writeLine(String line) {
    synchronized (output) {
      try {
        output.write(line);
        output.write('\n');
        output.flush();
      } catch (IOException ex) {
        throw new UncheckedIOException(ex);
      }
    }
  }
}
