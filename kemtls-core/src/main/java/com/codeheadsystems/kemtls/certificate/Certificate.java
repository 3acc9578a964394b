package com.codeheadsystems.kemtls.certificate;

import static com.codeheadsystems.kemtls.common.ByteUtils.concat;
import static com.codeheadsystems.kemtls.common.ByteUtils.encodeVector;

import com.codeheadsystems.kemtls.common.ByteUtils;
import com.codeheadsystems.kemtls.common.FailureKind;
import com.codeheadsystems.kemtls.common.KemTlsException;
import com.codeheadsystems.kemtls.crypto.Signature;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Self-signed KEMTLS server certificate binding a subject to a long-term KEM public key.
 * The issuer is always the subject.
 * <p>
 * Wire format: vec(subject) || vec(kemPublicKey) || vec(sigPublicKey) || vec(signature),
 * where vec(x) = I2OSP(len(x), 2) || x. The signature covers the first three vectors.
 * <p>
 * Not a PKI: trust rests entirely on the embedded signature key.
 */
public record Certificate(String subject, byte[] kemPublicKey, byte[] sigPublicKey, byte[] signature) {

  private static final int MAX_VECTOR = 0xFFFF;

  public Certificate {
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(kemPublicKey, "kemPublicKey");
    Objects.requireNonNull(sigPublicKey, "sigPublicKey");
    Objects.requireNonNull(signature, "signature");
  }

  /**
   * Creates and signs a certificate.
   *
   * @param subject         the subject (also the issuer)
   * @param kemPublicKey    the long-term KEM public key being certified
   * @param sigPublicKey    the verification key embedded in the certificate
   * @param sigPrivateKey   the matching signing key
   * @param signatureScheme the signature capability
   * @return the certificate
   */
  public static Certificate create(String subject, byte[] kemPublicKey, byte[] sigPublicKey,
                                   byte[] sigPrivateKey, Signature signatureScheme) {
    byte[] tbs = toBeSigned(subject, kemPublicKey, sigPublicKey);
    byte[] signature = signatureScheme.sign(sigPrivateKey, tbs);
    return new Certificate(subject, kemPublicKey.clone(), sigPublicKey.clone(), signature);
  }

  /**
   * The bytes covered by the signature.
   */
  static byte[] toBeSigned(String subject, byte[] kemPublicKey, byte[] sigPublicKey) {
    return concat(
        vector(subject.getBytes(StandardCharsets.UTF_8)),
        vector(kemPublicKey),
        vector(sigPublicKey));
  }

  /**
   * To be signed bytes of this certificate.
   *
   * @return the bytes
   */
  public byte[] toBeSigned() {
    return toBeSigned(subject, kemPublicKey, sigPublicKey);
  }

  /**
   * Checks the embedded signature against the embedded verification key.
   *
   * @param signatureScheme the signature capability
   * @return true when the signature verifies; false for any verifier failure
   */
  public boolean verify(Signature signatureScheme) {
    try {
      return signatureScheme.verify(sigPublicKey, toBeSigned(), signature);
    } catch (RuntimeException e) {
      return false;
    }
  }

  /**
   * Serializes to wire format.
   *
   * @return the bytes
   */
  public byte[] serialize() {
    return concat(toBeSigned(), vector(signature));
  }

  /**
   * Parses a certificate. The input must contain exactly one certificate.
   *
   * @param bytes the bytes
   * @return the certificate
   * @throws KemTlsException with {@link FailureKind#MALFORMED_MESSAGE} on truncation or trailing bytes
   */
  public static Certificate deserialize(byte[] bytes) {
    int[] offset = {0};
    byte[] subject = readVector(bytes, offset);
    byte[] kemPublicKey = readVector(bytes, offset);
    byte[] sigPublicKey = readVector(bytes, offset);
    byte[] signature = readVector(bytes, offset);
    if (offset[0] != bytes.length) {
      throw new KemTlsException(FailureKind.MALFORMED_MESSAGE,
          "Certificate has " + (bytes.length - offset[0]) + " trailing bytes");
    }
    return new Certificate(new String(subject, StandardCharsets.UTF_8), kemPublicKey, sigPublicKey, signature);
  }

  private static byte[] vector(byte[] data) {
    if (data.length > MAX_VECTOR) {
      throw new IllegalArgumentException("Certificate field too long: " + data.length);
    }
    return encodeVector(data);
  }

  private static byte[] readVector(byte[] bytes, int[] offset) {
    if (bytes.length - offset[0] < 2) {
      throw new KemTlsException(FailureKind.MALFORMED_MESSAGE, "Certificate truncated in length prefix");
    }
    int length = (int) ByteUtils.OS2IP(bytes, offset[0], 2);
    offset[0] += 2;
    if (bytes.length - offset[0] < length) {
      throw new KemTlsException(FailureKind.MALFORMED_MESSAGE,
          "Certificate field of " + length + " bytes truncated");
    }
    byte[] out = ByteUtils.slice(bytes, offset[0], length);
    offset[0] += length;
    return out;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Certificate other
        && subject.equals(other.subject)
        && Arrays.equals(kemPublicKey, other.kemPublicKey)
        && Arrays.equals(sigPublicKey, other.sigPublicKey)
        && Arrays.equals(signature, other.signature);
  }

  @Override
  public int hashCode() {
    int result = subject.hashCode();
    result = 31 * result + Arrays.hashCode(kemPublicKey);
    result = 31 * result + Arrays.hashCode(sigPublicKey);
    return 31 * result + Arrays.hashCode(signature);
  }

  @Override
  public String toString() {
    return "Certificate[subject=" + subject + ", kemPublicKey=" + kemPublicKey.length
        + " bytes, sigPublicKey=" + sigPublicKey.length + " bytes]";
  }
}
