package com.codeheadsystems.kemtls.crypto;

import com.codeheadsystems.kemtls.common.ByteUtils;

/**
 * Encoded public and private key of a KEM or signature key pair.
 */
public record AsymmetricKeyPair(byte[] publicKey, byte[] privateKey) {

  /**
   * Zeroes the private key. The public key is left intact.
   */
  public void destroyPrivateKey() {
    ByteUtils.wipe(privateKey);
  }

  @Override
  public String toString() {
    return "AsymmetricKeyPair[publicKey=" + publicKey.length + " bytes, privateKey=<redacted>]";
  }
}
