package com.codeheadsystems.kemtls.crypto;

/**
 * Signature capability used to create and verify certificates.
 * <p>
 * Implementations must be safe for concurrent use.
 */
public interface Signature {

  /**
   * Algorithm name, e.g. {@code ML-DSA-65}.
   *
   * @return the name
   */
  String algorithm();

  /**
   * Generates a fresh key pair.
   *
   * @return the key pair
   */
  AsymmetricKeyPair generateKeyPair();

  /**
   * Signs {@code message}.
   *
   * @param privateKey the signing key
   * @param message    the message
   * @return the signature
   */
  byte[] sign(byte[] privateKey, byte[] message);

  /**
   * Verifies {@code signature} over {@code message}. Malformed keys or signatures yield
   * {@code false}, never an exception.
   *
   * @param publicKey the verification key
   * @param message   the message
   * @param signature the signature
   * @return true when valid
   */
  boolean verify(byte[] publicKey, byte[] message, byte[] signature);
}
