package com.codeheadsystems.kemtls.crypto;

import com.codeheadsystems.kemtls.common.FailureKind;
import com.codeheadsystems.kemtls.common.KemTlsException;
import com.codeheadsystems.kemtls.common.RandomProvider;
import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.SecretWithEncapsulation;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMExtractor;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMGenerator;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMKeyGenerationParameters;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMKeyPairGenerator;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMParameters;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMPrivateKeyParameters;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMPublicKeyParameters;

/**
 * ML-KEM (FIPS 203) over the BouncyCastle lightweight API.
 * <p>
 * Supported parameter sets:
 * <ul>
 *   <li>ML-KEM-512 — ciphertext 768 bytes</li>
 *   <li>ML-KEM-768 — ciphertext 1088 bytes (default)</li>
 *   <li>ML-KEM-1024 — ciphertext 1568 bytes</li>
 * </ul>
 * Keys travel in their raw FIPS 203 encodings. Stateless apart from the injected random
 * source, so one instance can serve every connection.
 */
public class MlKemKeyEncapsulation implements KeyEncapsulation {

  private static final int SHARED_SECRET_LENGTH = 32;

  private final String name;
  private final MLKEMParameters parameters;
  private final int ciphertextLength;
  private final RandomProvider randomProvider;

  private MlKemKeyEncapsulation(String name, MLKEMParameters parameters, int ciphertextLength,
                                RandomProvider randomProvider) {
    this.name = name;
    this.parameters = parameters;
    this.ciphertextLength = ciphertextLength;
    this.randomProvider = randomProvider;
  }

  /**
   * Returns the adapter for the given name.  Accepted names: {@code "ML-KEM-512"},
   * {@code "ML-KEM-768"}, {@code "ML-KEM-1024"}.
   *
   * @param name           the name
   * @param randomProvider source of randomness for key generation and encapsulation
   * @return the key encapsulation
   * @throws IllegalArgumentException for unrecognised names
   */
  public static MlKemKeyEncapsulation fromName(String name, RandomProvider randomProvider) {
    return switch (name) {
      case "ML-KEM-512" -> new MlKemKeyEncapsulation(name, MLKEMParameters.ml_kem_512, 768, randomProvider);
      case "ML-KEM-768" -> new MlKemKeyEncapsulation(name, MLKEMParameters.ml_kem_768, 1088, randomProvider);
      case "ML-KEM-1024" -> new MlKemKeyEncapsulation(name, MLKEMParameters.ml_kem_1024, 1568, randomProvider);
      default -> throw new IllegalArgumentException("Unknown KEM algorithm: " + name
          + ". Valid values: ML-KEM-512, ML-KEM-768, ML-KEM-1024");
    };
  }

  /**
   * ML-KEM-768 with a default {@link RandomProvider}.
   *
   * @return the key encapsulation
   */
  public static MlKemKeyEncapsulation mlKem768() {
    return fromName("ML-KEM-768", new RandomProvider());
  }

  @Override
  public String algorithm() {
    return name;
  }

  @Override
  public AsymmetricKeyPair generateKeyPair() {
    MLKEMKeyPairGenerator generator = new MLKEMKeyPairGenerator();
    generator.init(new MLKEMKeyGenerationParameters(randomProvider.random(), parameters));
    AsymmetricCipherKeyPair keyPair = generator.generateKeyPair();
    return new AsymmetricKeyPair(
        ((MLKEMPublicKeyParameters) keyPair.getPublic()).getEncoded(),
        ((MLKEMPrivateKeyParameters) keyPair.getPrivate()).getEncoded());
  }

  @Override
  public Encapsulation encapsulate(byte[] publicKey) {
    try {
      MLKEMPublicKeyParameters recipient = new MLKEMPublicKeyParameters(parameters, publicKey);
      SecretWithEncapsulation result = new MLKEMGenerator(randomProvider.random()).generateEncapsulated(recipient);
      return new Encapsulation(result.getEncapsulation(), result.getSecret());
    } catch (RuntimeException e) {
      throw new KemTlsException(FailureKind.CRYPTO_ERROR, name + " encapsulation failed", e);
    }
  }

  @Override
  public byte[] decapsulate(byte[] privateKey, byte[] ciphertext) {
    if (ciphertext.length != ciphertextLength) {
      throw new KemTlsException(FailureKind.CRYPTO_ERROR, name + " ciphertext must be "
          + ciphertextLength + " bytes, got " + ciphertext.length);
    }
    try {
      MLKEMPrivateKeyParameters key = new MLKEMPrivateKeyParameters(parameters, privateKey);
      return new MLKEMExtractor(key).extractSecret(ciphertext);
    } catch (RuntimeException e) {
      throw new KemTlsException(FailureKind.CRYPTO_ERROR, name + " decapsulation failed", e);
    }
  }

  @Override
  public int ciphertextLength() {
    return ciphertextLength;
  }

  @Override
  public int sharedSecretLength() {
    return SHARED_SECRET_LENGTH;
  }

  @Override
  public String toString() {
    return "MlKemKeyEncapsulation[" + name + "]";
  }
}
