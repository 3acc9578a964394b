package com.codeheadsystems.kemtls.crypto;

/**
 * Key encapsulation capability consumed by the handshake.
 * <p>
 * Implementations must be stateless or internally synchronized: a single instance is shared
 * by every connection of a server.
 */
public interface KeyEncapsulation {

  /**
   * Algorithm name, e.g. {@code ML-KEM-768}.
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
   * Encapsulates a fresh shared secret to {@code publicKey}.
   *
   * @param publicKey the recipient public key
   * @return ciphertext and shared secret
   * @throws com.codeheadsystems.kemtls.common.KemTlsException with CRYPTO_ERROR on a malformed key
   */
  Encapsulation encapsulate(byte[] publicKey);

  /**
   * Recovers the shared secret from {@code ciphertext}.
   *
   * @param privateKey the recipient private key
   * @param ciphertext the ciphertext
   * @return the shared secret
   * @throws com.codeheadsystems.kemtls.common.KemTlsException with CRYPTO_ERROR on malformed input
   */
  byte[] decapsulate(byte[] privateKey, byte[] ciphertext);

  /**
   * Fixed ciphertext length for this algorithm. Used to split the ServerHello payload.
   *
   * @return bytes
   */
  int ciphertextLength();

  /**
   * Fixed shared secret length for this algorithm.
   *
   * @return bytes
   */
  int sharedSecretLength();
}
