package com.codeheadsystems.kemtls.crypto;

import static com.codeheadsystems.kemtls.common.ByteUtils.I2OSP;
import static com.codeheadsystems.kemtls.common.ByteUtils.concat;

import java.nio.charset.StandardCharsets;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * HKDF-SHA256 (RFC 5869) and HMAC-SHA256 on the BouncyCastle lightweight API, plus the
 * KEMTLS label expansion.
 */
public class Hkdf {

  /**
   * HMAC-SHA256 output length, also the PRK length.
   */
  public static final int HASH_LENGTH = 32;

  /**
   * Upper bound on a single expand output.
   */
  public static final int MAX_OUTPUT_LENGTH = 255 * HASH_LENGTH;

  private static final byte[] LABEL_PREFIX = "kemtls ".getBytes(StandardCharsets.US_ASCII);

  private Hkdf() {
  }

  /**
   * HKDF-Extract. A null or empty salt acts as {@value #HASH_LENGTH} zero bytes.
   */
  public static byte[] extract(byte[] salt, byte[] ikm) {
    byte[] effectiveSalt = salt == null || salt.length == 0 ? null : salt;
    return new HKDFBytesGenerator(new SHA256Digest()).extractPRK(effectiveSalt, ikm);
  }

  /**
   * HKDF-Expand of {@code prk} to {@code len} bytes.
   *
   * @throws IllegalArgumentException unless {@code 0 < len <= MAX_OUTPUT_LENGTH}
   */
  public static byte[] expand(byte[] prk, byte[] info, int len) {
    if (len <= 0 || len > MAX_OUTPUT_LENGTH) {
      throw new IllegalArgumentException("Invalid HKDF output length: " + len);
    }
    HKDFBytesGenerator generator = new HKDFBytesGenerator(new SHA256Digest());
    generator.init(HKDFParameters.skipExtractParameters(prk, info));
    byte[] okm = new byte[len];
    generator.generateBytes(okm, 0, len);
    return okm;
  }

  /**
   * HKDF-Expand-Label. The info block is
   * {@code I2OSP(length, 2) || I2OSP(|L|, 1) || L || I2OSP(|context|, 1) || context}
   * with {@code L = "kemtls " + label}.
   */
  public static byte[] expandLabel(byte[] secret, String label, byte[] context, int length) {
    byte[] fullLabel = concat(LABEL_PREFIX, label.getBytes(StandardCharsets.US_ASCII));
    if (fullLabel.length > 255 || context.length > 255) {
      throw new IllegalArgumentException("Label and context must each fit in 255 bytes");
    }
    return expand(secret,
        concat(I2OSP(length, 2), I2OSP(fullLabel.length, 1), fullLabel, I2OSP(context.length, 1), context),
        length);
  }

  /**
   * HMAC-SHA256(key, data).
   */
  public static byte[] hmacSha256(byte[] key, byte[] data) {
    HMac hmac = new HMac(new SHA256Digest());
    hmac.init(new KeyParameter(key));
    hmac.update(data, 0, data.length);
    byte[] out = new byte[hmac.getMacSize()];
    hmac.doFinal(out, 0);
    return out;
  }
}
