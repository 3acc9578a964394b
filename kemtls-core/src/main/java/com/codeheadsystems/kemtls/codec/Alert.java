package com.codeheadsystems.kemtls.codec;

/**
 * Alert: a single code byte. Only two codes are ever sent; the failure code is deliberately
 * generic so the peer learns nothing about which check failed.
 */
public record Alert(byte code) implements HandshakeMessage {

  public static final byte CLOSE_NOTIFY_CODE = 0x00;
  public static final byte FAILURE_CODE = 0x28;

  public static final Alert CLOSE_NOTIFY = new Alert(CLOSE_NOTIFY_CODE);
  public static final Alert FAILURE = new Alert(FAILURE_CODE);

  public static Alert parse(byte[] payload) {
    if (payload.length != 1) {
      throw HandshakeMessage.malformed("Alert must be 1 byte, got " + payload.length);
    }
    return new Alert(payload[0]);
  }

  /**
   * Is close notify.
   *
   * @return true for an orderly shutdown
   */
  public boolean isCloseNotify() {
    return code == CLOSE_NOTIFY_CODE;
  }

  @Override
  public MessageType type() {
    return MessageType.ALERT;
  }

  @Override
  public byte[] payload() {
    return new byte[]{code};
  }
}
