package io.rumor.broadcast;

/** Request could not be served; turned into an {@code error} reply to the sender. */
public class ProtocolException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final ErrorCode errorCode;

  public ProtocolException(ErrorCode errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  public ErrorCode errorCode() {
    return errorCode;
  }

  public static ProtocolException notSupported(String type) {
    return new ProtocolException(ErrorCode.NOT_SUPPORTED, "Unsupported message type: " + type);
  }

  public static ProtocolException notInitialized(String type) {
    return new ProtocolException(
        ErrorCode.TEMPORARILY_UNAVAILABLE, "Node is not initialized yet, rejected: " + type);
  }

  public static ProtocolException malformed(String reason) {
    return new ProtocolException(ErrorCode.MALFORMED_REQUEST, reason);
  }
}
