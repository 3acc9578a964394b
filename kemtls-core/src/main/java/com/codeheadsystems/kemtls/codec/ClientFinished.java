package com.codeheadsystems.kemtls.codec;

import java.util.Arrays;

/**
 * ClientFinished: transcript MAC.
 * Sent by the client last. mac = HMAC(macKey, ClientHello || ServerHello || ServerFinished)
 */
public record ClientFinished(byte[] mac) implements HandshakeMessage {

  public static final int MAC_LENGTH = 32;

  public ClientFinished {
    if (mac.length != MAC_LENGTH) {
      throw new IllegalArgumentException("mac must be " + MAC_LENGTH + " bytes");
    }
  }

  /**
   * Parses a ClientFinished payload.
   */
  public static ClientFinished parse(byte[] payload) {
    if (payload.length != MAC_LENGTH) {
      throw HandshakeMessage.malformed("ClientFinished must be " + MAC_LENGTH + " bytes, got " + payload.length);
    }
    return new ClientFinished(payload.clone());
  }

  @Override
  public MessageType type() {
    return MessageType.CLIENT_FINISHED;
  }

  @Override
  public byte[] payload() {
    return mac.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ClientFinished other && Arrays.equals(mac, other.mac);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(mac);
  }

  @Override
  public String toString() {
    return "ClientFinished[]";
  }
}
