package io.rumor.broadcast;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

public class ErrorCodeTest {

  @Test
  public void testCodesEmittedByNode() {
    assertEquals(10, ErrorCode.NOT_SUPPORTED.code());
    assertEquals(11, ErrorCode.TEMPORARILY_UNAVAILABLE.code());
    assertEquals(12, ErrorCode.MALFORMED_REQUEST.code());
    assertEquals(13, ErrorCode.CRASH.code());
    assertEquals(4, ErrorCode.values().length);
  }

  @Test
  public void testFactoriesCarryCodes() {
    assertEquals(ErrorCode.NOT_SUPPORTED, ProtocolException.notSupported("cas").errorCode());
    assertEquals(
        ErrorCode.TEMPORARILY_UNAVAILABLE, ProtocolException.notInitialized("read").errorCode());
    assertEquals(ErrorCode.MALFORMED_REQUEST, ProtocolException.malformed("bad").errorCode());
  }
}
