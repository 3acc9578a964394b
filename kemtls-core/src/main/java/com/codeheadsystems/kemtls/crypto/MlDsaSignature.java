package com.codeheadsystems.kemtls.crypto;

import com.codeheadsystems.kemtls.common.FailureKind;
import com.codeheadsystems.kemtls.common.KemTlsException;
import com.codeheadsystems.kemtls.common.RandomProvider;
import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.CryptoException;
import org.bouncycastle.crypto.params.ParametersWithRandom;
import org.bouncycastle.pqc.crypto.mldsa.MLDSAKeyGenerationParameters;
import org.bouncycastle.pqc.crypto.mldsa.MLDSAKeyPairGenerator;
import org.bouncycastle.pqc.crypto.mldsa.MLDSAParameters;
import org.bouncycastle.pqc.crypto.mldsa.MLDSAPrivateKeyParameters;
import org.bouncycastle.pqc.crypto.mldsa.MLDSAPublicKeyParameters;
import org.bouncycastle.pqc.crypto.mldsa.MLDSASigner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ML-DSA (FIPS 204) over the BouncyCastle lightweight API.
 * <p>
 * Supported parameter sets: {@code ML-DSA-44}, {@code ML-DSA-65} (default), {@code ML-DSA-87}.
 * A new {@link MLDSASigner} is created per call, so the adapter is safe to share.
 */
public class MlDsaSignature implements Signature {

  private static final Logger log = LoggerFactory.getLogger(MlDsaSignature.class);

  private final String name;
  private final MLDSAParameters parameters;
  private final RandomProvider randomProvider;

  private MlDsaSignature(String name, MLDSAParameters parameters, RandomProvider randomProvider) {
    this.name = name;
    this.parameters = parameters;
    this.randomProvider = randomProvider;
  }

  /**
   * Returns the adapter for the given name.  Accepted names: {@code "ML-DSA-44"},
   * {@code "ML-DSA-65"}, {@code "ML-DSA-87"}.
   *
   * @param name           the name
   * @param randomProvider source of randomness for key generation and hedged signing
   * @return the signature
   * @throws IllegalArgumentException for unrecognised names
   */
  public static MlDsaSignature fromName(String name, RandomProvider randomProvider) {
    return switch (name) {
      case "ML-DSA-44" -> new MlDsaSignature(name, MLDSAParameters.ml_dsa_44, randomProvider);
      case "ML-DSA-65" -> new MlDsaSignature(name, MLDSAParameters.ml_dsa_65, randomProvider);
      case "ML-DSA-87" -> new MlDsaSignature(name, MLDSAParameters.ml_dsa_87, randomProvider);
      default -> throw new IllegalArgumentException("Unknown signature algorithm: " + name
          + ". Valid values: ML-DSA-44, ML-DSA-65, ML-DSA-87");
    };
  }

  /**
   * ML-DSA-65 with a default {@link RandomProvider}.
   *
   * @return the signature
   */
  public static MlDsaSignature mlDsa65() {
    return fromName("ML-DSA-65", new RandomProvider());
  }

  @Override
  public String algorithm() {
    return name;
  }

  @Override
  public AsymmetricKeyPair generateKeyPair() {
    MLDSAKeyPairGenerator generator = new MLDSAKeyPairGenerator();
    generator.init(new MLDSAKeyGenerationParameters(randomProvider.random(), parameters));
    AsymmetricCipherKeyPair keyPair = generator.generateKeyPair();
    return new AsymmetricKeyPair(
        ((MLDSAPublicKeyParameters) keyPair.getPublic()).getEncoded(),
        ((MLDSAPrivateKeyParameters) keyPair.getPrivate()).getEncoded());
  }

  @Override
  public byte[] sign(byte[] privateKey, byte[] message) {
    try {
      MLDSASigner signer = new MLDSASigner();
      signer.init(true, new ParametersWithRandom(
          new MLDSAPrivateKeyParameters(parameters, privateKey), randomProvider.random()));
      signer.update(message, 0, message.length);
      return signer.generateSignature();
    } catch (CryptoException | RuntimeException e) {
      throw new KemTlsException(FailureKind.CRYPTO_ERROR, name + " signing failed", e);
    }
  }

  @Override
  public boolean verify(byte[] publicKey, byte[] message, byte[] signature) {
    try {
      MLDSASigner verifier = new MLDSASigner();
      verifier.init(false, new MLDSAPublicKeyParameters(parameters, publicKey));
      verifier.update(message, 0, message.length);
      return verifier.verifySignature(signature);
    } catch (RuntimeException e) {
      log.debug("{} verification rejected malformed input: {}", name, e.getMessage());
      return false;
    }
  }

  @Override
  public String toString() {
    return "MlDsaSignature[" + name + "]";
  }
}
