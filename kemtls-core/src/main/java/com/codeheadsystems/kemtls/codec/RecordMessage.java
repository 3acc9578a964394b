package com.codeheadsystems.kemtls.codec;

import java.util.Arrays;

/**
 * Application data record: AEAD ciphertext including the 16-byte tag.
 */
public record RecordMessage(byte[] ciphertext) implements HandshakeMessage {

  public static RecordMessage parse(byte[] payload) {
    return new RecordMessage(payload.clone());
  }

  @Override
  public MessageType type() {
    return MessageType.RECORD;
  }

  @Override
  public byte[] payload() {
    return ciphertext.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof RecordMessage other && Arrays.equals(ciphertext, other.ciphertext);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(ciphertext);
  }

  @Override
  public String toString() {
    return "RecordMessage[" + ciphertext.length + " bytes]";
  }
}
