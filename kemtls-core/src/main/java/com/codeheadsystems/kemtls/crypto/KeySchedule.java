package com.codeheadsystems.kemtls.crypto;

import static com.codeheadsystems.kemtls.common.ByteUtils.concat;

import com.codeheadsystems.kemtls.common.ByteUtils;
import com.codeheadsystems.kemtls.common.FailureKind;
import com.codeheadsystems.kemtls.common.KemTlsException;
import java.nio.charset.StandardCharsets;

/**
 * Derives {@link SessionKeys} from a KEM shared secret and both handshake nonces.
 * <pre>
 *   prk    = HKDF-Extract("KEMTLS-Session-Keys", ss)
 *   encKey = HKDF-Expand-Label(prk, "enc", cn || sn, 32)
 *   macKey = HKDF-Expand-Label(prk, "mac", cn || sn, 32)
 *   iv     = HKDF-Expand-Label(prk, "iv",  cn || sn, 16)
 * </pre>
 */
public class KeySchedule {

  /**
   * Extract salt.
   */
  public static final byte[] SALT = "KEMTLS-Session-Keys".getBytes(StandardCharsets.US_ASCII);

  public static final int NONCE_LENGTH = 32;

  private final int sharedSecretLength;

  /**
   * Instantiates a new Key schedule.
   *
   * @param sharedSecretLength the only accepted shared secret length
   */
  public KeySchedule(int sharedSecretLength) {
    this.sharedSecretLength = sharedSecretLength;
  }

  /**
   * Key schedule for the given KEM.
   *
   * @param kem the kem
   * @return the key schedule
   */
  public static KeySchedule forKem(KeyEncapsulation kem) {
    return new KeySchedule(kem.sharedSecretLength());
  }

  /**
   * Derive session keys. Pure: the same inputs always give the same keys.
   *
   * @param sharedSecret the shared secret; not modified
   * @param clientNonce  32-byte client nonce
   * @param serverNonce  32-byte server nonce
   * @return the session keys
   * @throws KemTlsException with {@link FailureKind#CRYPTO_ERROR} on a wrong-length secret
   */
  public SessionKeys derive(byte[] sharedSecret, byte[] clientNonce, byte[] serverNonce) {
    if (sharedSecret == null || sharedSecret.length != sharedSecretLength) {
      throw new KemTlsException(FailureKind.CRYPTO_ERROR, "Shared secret must be "
          + sharedSecretLength + " bytes, got " + (sharedSecret == null ? "null" : sharedSecret.length));
    }
    if (clientNonce.length != NONCE_LENGTH || serverNonce.length != NONCE_LENGTH) {
      throw new IllegalArgumentException("Nonces must be " + NONCE_LENGTH + " bytes");
    }
    byte[] prk = Hkdf.extract(SALT, sharedSecret);
    byte[] context = concat(clientNonce, serverNonce);
    byte[] encKey = Hkdf.expandLabel(prk, "enc", context, SessionKeys.ENC_KEY_LENGTH);
    byte[] macKey = Hkdf.expandLabel(prk, "mac", context, SessionKeys.MAC_KEY_LENGTH);
    byte[] iv = Hkdf.expandLabel(prk, "iv", context, SessionKeys.IV_LENGTH);
    try {
      return new SessionKeys(encKey, macKey, iv);
    } finally {
      ByteUtils.wipe(prk);
      ByteUtils.wipe(encKey);
      ByteUtils.wipe(macKey);
      ByteUtils.wipe(iv);
    }
  }
}
