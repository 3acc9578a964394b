package com.codeheadsystems.kemtls.codec;

import static com.codeheadsystems.kemtls.common.ByteUtils.concat;
import static com.codeheadsystems.kemtls.common.ByteUtils.slice;

import com.codeheadsystems.kemtls.certificate.Certificate;
import java.util.Arrays;
import java.util.Objects;

/**
 * ServerHello: KEM ciphertext, server nonce and the server certificate.
 * Wire format: ciphertext(ciphertextLength) || serverNonce(32) || certificate
 */
public record ServerHello(byte[] ciphertext, byte[] serverNonce, Certificate certificate)
    implements HandshakeMessage {

  public static final int NONCE_LENGTH = 32;

  public ServerHello {
    Objects.requireNonNull(certificate, "certificate");
    if (serverNonce.length != NONCE_LENGTH) {
      throw new IllegalArgumentException("serverNonce must be " + NONCE_LENGTH + " bytes");
    }
  }

  /**
   * Parses a ServerHello payload.
   *
   * @param payload          the payload
   * @param ciphertextLength fixed ciphertext length of the negotiated KEM
   * @return the message
   */
  public static ServerHello parse(byte[] payload, int ciphertextLength) {
    if (payload.length < ciphertextLength + NONCE_LENGTH) {
      throw HandshakeMessage.malformed("ServerHello too short: " + payload.length + " bytes");
    }
    int certOffset = ciphertextLength + NONCE_LENGTH;
    return new ServerHello(
        slice(payload, 0, ciphertextLength),
        slice(payload, ciphertextLength, NONCE_LENGTH),
        Certificate.deserialize(slice(payload, certOffset, payload.length - certOffset)));
  }

  @Override
  public MessageType type() {
    return MessageType.SERVER_HELLO;
  }

  @Override
  public byte[] payload() {
    return concat(ciphertext, serverNonce, certificate.serialize());
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ServerHello other
        && Arrays.equals(ciphertext, other.ciphertext)
        && Arrays.equals(serverNonce, other.serverNonce)
        && certificate.equals(other.certificate);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * Arrays.hashCode(ciphertext) + Arrays.hashCode(serverNonce)) + certificate.hashCode();
  }

  @Override
  public String toString() {
    return "ServerHello[ciphertext=" + ciphertext.length + " bytes, certificate=" + certificate + "]";
  }
}
