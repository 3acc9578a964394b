package com.codeheadsystems.kemtls.codec;

import static com.codeheadsystems.kemtls.common.ByteUtils.concat;
import static com.codeheadsystems.kemtls.common.ByteUtils.slice;

import java.util.Arrays;

/**
 * ClientHello: the client's ephemeral KEM public key and nonce.
 * Wire format: ephemeralPublicKey || clientNonce(32)
 */
public record ClientHello(byte[] ephemeralPublicKey, byte[] clientNonce) implements HandshakeMessage {

  public static final int NONCE_LENGTH = 32;

  public ClientHello {
    if (clientNonce.length != NONCE_LENGTH) {
      throw new IllegalArgumentException("clientNonce must be " + NONCE_LENGTH + " bytes");
    }
    if (ephemeralPublicKey.length == 0) {
      throw new IllegalArgumentException("ephemeralPublicKey must not be empty");
    }
  }

  /**
   * Parses a ClientHello payload. The key is everything before the trailing nonce.
   */
  public static ClientHello parse(byte[] payload) {
    if (payload.length <= NONCE_LENGTH) {
      throw HandshakeMessage.malformed("ClientHello too short: " + payload.length + " bytes");
    }
    int keyLength = payload.length - NONCE_LENGTH;
    return new ClientHello(slice(payload, 0, keyLength), slice(payload, keyLength, NONCE_LENGTH));
  }

  @Override
  public MessageType type() {
    return MessageType.CLIENT_HELLO;
  }

  @Override
  public byte[] payload() {
    return concat(ephemeralPublicKey, clientNonce);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ClientHello other
        && Arrays.equals(ephemeralPublicKey, other.ephemeralPublicKey)
        && Arrays.equals(clientNonce, other.clientNonce);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(ephemeralPublicKey) + Arrays.hashCode(clientNonce);
  }

  @Override
  public String toString() {
    return "ClientHello[ephemeralPublicKey=" + ephemeralPublicKey.length + " bytes]";
  }
}
