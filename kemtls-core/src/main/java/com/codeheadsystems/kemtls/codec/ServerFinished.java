package com.codeheadsystems.kemtls.codec;

import java.util.Arrays;

/**
 * ServerFinished: transcript MAC.
 * Sent by the server after ServerHello. mac = HMAC(macKey, ClientHello || ServerHello)
 */
public record ServerFinished(byte[] mac) implements HandshakeMessage {

  public static final int MAC_LENGTH = 32;

  public ServerFinished {
    if (mac.length != MAC_LENGTH) {
      throw new IllegalArgumentException("mac must be " + MAC_LENGTH + " bytes");
    }
  }

  /**
   * Parses a ServerFinished payload.
   */
  public static ServerFinished parse(byte[] payload) {
    if (payload.length != MAC_LENGTH) {
      throw HandshakeMessage.malformed("ServerFinished must be " + MAC_LENGTH + " bytes, got " + payload.length);
    }
    return new ServerFinished(payload.clone());
  }

  @Override
  public MessageType type() {
    return MessageType.SERVER_FINISHED;
  }

  @Override
  public byte[] payload() {
    return mac.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ServerFinished other && Arrays.equals(mac, other.mac);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(mac);
  }

  @Override
  public String toString() {
    return "ServerFinished[]";
  }
}
