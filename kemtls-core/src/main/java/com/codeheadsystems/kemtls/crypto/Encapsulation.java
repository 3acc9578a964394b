package com.codeheadsystems.kemtls.crypto;

/**
 * Output of {@link KeyEncapsulation#encapsulate(byte[])}: the ciphertext for the peer and the
 * shared secret kept locally.
 */
public record Encapsulation(byte[] ciphertext, byte[] sharedSecret) {

  @Override
  public String toString() {
    return "Encapsulation[ciphertext=" + ciphertext.length + " bytes, sharedSecret=<redacted>]";
  }
}
