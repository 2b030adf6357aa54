package io.rumor.broadcast;

/** Error codes carried by {@code error} replies, numbered as the harness expects them. */
public enum ErrorCode {
  NOT_SUPPORTED(10),
  TEMPORARILY_UNAVAILABLE(11),
  MALFORMED_REQUEST(12),
  CRASH(13);

  private final int code;

  ErrorCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
