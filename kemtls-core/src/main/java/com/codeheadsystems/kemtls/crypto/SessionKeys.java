package com.codeheadsystems.kemtls.crypto;

import com.codeheadsystems.kemtls.common.ByteUtils;
import java.security.MessageDigest;
import java.util.Arrays;

/**
 * Keys derived from one handshake's shared secret.
 *
 * @param encKey AES-256-GCM record key, 32 bytes
 * @param macKey finished MAC key, 32 bytes
 * @param iv     record nonce base, 16 bytes (the first 12 are used)
 */
public record SessionKeys(byte[] encKey, byte[] macKey, byte[] iv) {

  public static final int ENC_KEY_LENGTH = 32;
  public static final int MAC_KEY_LENGTH = 32;
  public static final int IV_LENGTH = 16;

  public SessionKeys {
    if (encKey.length != ENC_KEY_LENGTH || macKey.length != MAC_KEY_LENGTH || iv.length != IV_LENGTH) {
      throw new IllegalArgumentException("Session key lengths must be 32/32/16");
    }
    encKey = encKey.clone();
    macKey = macKey.clone();
    iv = iv.clone();
  }

  @Override
  public byte[] encKey() {
    return encKey.clone();
  }

  @Override
  public byte[] macKey() {
    return macKey.clone();
  }

  @Override
  public byte[] iv() {
    return iv.clone();
  }

  /**
   * Zeroes the key material. The instance is unusable afterwards.
   */
  public void destroy() {
    ByteUtils.wipe(encKey);
    ByteUtils.wipe(macKey);
    ByteUtils.wipe(iv);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SessionKeys other
        && MessageDigest.isEqual(encKey, other.encKey)
        && MessageDigest.isEqual(macKey, other.macKey)
        && MessageDigest.isEqual(iv, other.iv);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * Arrays.hashCode(encKey) + Arrays.hashCode(macKey)) + Arrays.hashCode(iv);
  }

  @Override
  public String toString() {
    return "SessionKeys[<redacted>]";
  }
}
