package com.codeheadsystems.kemtls.certificate;

import com.codeheadsystems.kemtls.common.ByteUtils;
import com.codeheadsystems.kemtls.common.FailureKind;
import com.codeheadsystems.kemtls.common.KemTlsException;
import com.codeheadsystems.kemtls.crypto.AsymmetricKeyPair;
import com.codeheadsystems.kemtls.crypto.Encapsulation;
import com.codeheadsystems.kemtls.crypto.KeyEncapsulation;
import com.codeheadsystems.kemtls.crypto.Signature;
import java.security.MessageDigest;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Long-term server credentials: the certificate, its signing key, and its KEM private key.
 * Created once at startup and shared read-only by every server handshake. The handshake
 * itself only needs the certificate; the KEM private key is what {@link #checkKemKeyPair}
 * uses to prove an externally supplied identity is consistent before a server starts.
 *
 * @param certificate      the self-signed certificate
 * @param signingPrivateKey the key that signed the certificate
 * @param kemPrivateKey    the private half of {@link Certificate#kemPublicKey()}
 */
public record ServerIdentity(Certificate certificate, byte[] signingPrivateKey, byte[] kemPrivateKey) {

  private static final Logger log = LoggerFactory.getLogger(ServerIdentity.class);

  public ServerIdentity {
    Objects.requireNonNull(certificate, "certificate");
    signingPrivateKey = signingPrivateKey.clone();
    kemPrivateKey = kemPrivateKey.clone();
  }

  /**
   * Generates fresh long-term keys and a self-signed certificate for {@code subject}.
   *
   * @param subject   the certificate subject
   * @param kem       the key encapsulation
   * @param signature the signature scheme
   * @return the identity
   */
  public static ServerIdentity generate(String subject, KeyEncapsulation kem, Signature signature) {
    AsymmetricKeyPair sigKeys = signature.generateKeyPair();
    AsymmetricKeyPair kemKeys = kem.generateKeyPair();
    Certificate certificate = Certificate.create(subject, kemKeys.publicKey(), sigKeys.publicKey(),
        sigKeys.privateKey(), signature);
    log.info("Generated server identity: subject={}, kem={}, signature={}",
        subject, kem.algorithm(), signature.algorithm());
    log.warn("Server certificate for {} is self-signed; this trust model is not for production use", subject);
    return new ServerIdentity(certificate, sigKeys.privateKey(), kemKeys.privateKey());
  }

  /**
   * Encapsulates to the certificate's KEM public key and decapsulates with the held private key.
   *
   * @param kem the key encapsulation the server will run with
   * @throws KemTlsException with {@link FailureKind#CRYPTO_ERROR} when the halves do not match
   */
  public void checkKemKeyPair(KeyEncapsulation kem) {
    Encapsulation trial = kem.encapsulate(certificate.kemPublicKey());
    byte[] recovered = null;
    try {
      recovered = kem.decapsulate(kemPrivateKey, trial.ciphertext());
      if (!MessageDigest.isEqual(trial.sharedSecret(), recovered)) {
        throw new KemTlsException(FailureKind.CRYPTO_ERROR,
            "KEM private key does not match the certificate for " + certificate.subject());
      }
    } finally {
      ByteUtils.wipe(trial.sharedSecret());
      if (recovered != null) {
        ByteUtils.wipe(recovered);
      }
    }
    log.debug("KEM key pair for {} verified", certificate.subject());
  }

  @Override
  public byte[] signingPrivateKey() {
    return signingPrivateKey.clone();
  }

  @Override
  public byte[] kemPrivateKey() {
    return kemPrivateKey.clone();
  }

  @Override
  public String toString() {
    return "ServerIdentity[certificate=" + certificate + ", keys=<redacted>]";
  }
}
