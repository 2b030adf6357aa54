package io.rumor.testlib;

public final class NetworkEmulatorException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public NetworkEmulatorException(String message) {
    super(message);
  }

  @Override
  public synchronized Throwable fillInStackTrace() {
    return this;
  }
}
