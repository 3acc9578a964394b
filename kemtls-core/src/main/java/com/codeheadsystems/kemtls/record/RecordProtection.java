package com.codeheadsystems.kemtls.record;

import com.codeheadsystems.kemtls.codec.MessageType;
import com.codeheadsystems.kemtls.common.ByteUtils;
import com.codeheadsystems.kemtls.common.FailureKind;
import com.codeheadsystems.kemtls.common.KemTlsException;
import com.codeheadsystems.kemtls.crypto.SessionKeys;
import com.codeheadsystems.kemtls.handshake.Role;
import com.codeheadsystems.kemtls.handshake.Session;
import java.security.GeneralSecurityException;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES-256-GCM protection of application records for one established session.
 * <p>
 * nonce = iv[0..12] XOR (0x000000 || direction || seq_be64), AAD = 0x10 || seq_be64.
 * Each direction keeps its own sequence counter starting at zero, so a nonce is never reused
 * under the session key. A record that is replayed, reordered or reflected back to its sender
 * fails authentication.
 * <p>
 * Not thread-safe: each connection owns one instance, and sends and receives are serialized
 * by the channel.
 */
public class RecordProtection {

  public static final int TAG_LENGTH = 16;
  public static final int NONCE_LENGTH = 12;

  private static final String TRANSFORMATION = "AES/GCM/NoPadding";
  private static final long MAX_SEQUENCE = -1L; // 2^64 - 1 as unsigned

  private final SecretKey key;
  private final byte[] iv;
  private final Role role;
  private long sendSequence;
  private long receiveSequence;

  /**
   * Instantiates record protection for the local role.
   *
   * @param keys the session keys; copied
   * @param role the local role
   */
  public RecordProtection(SessionKeys keys, Role role) {
    byte[] encKey = keys.encKey();
    this.key = new SecretKeySpec(encKey, "AES");
    ByteUtils.wipe(encKey);
    this.iv = ByteUtils.slice(keys.iv(), 0, NONCE_LENGTH);
    this.role = role;
  }

  /**
   * Record protection for an established session.
   *
   * @param session the session
   * @return the record protection
   */
  public static RecordProtection forSession(Session session) {
    return new RecordProtection(session.keys(), session.role());
  }

  /**
   * Encrypts one record with the next send sequence number.
   *
   * @param plaintext the plaintext, possibly empty
   * @return ciphertext with tag
   * @throws KemTlsException with {@link FailureKind#CRYPTO_ERROR} once the counter is exhausted
   */
  public byte[] seal(byte[] plaintext) {
    long sequence = nextSequence(sendSequence);
    try {
      Cipher cipher = cipher(Cipher.ENCRYPT_MODE, role.sendDirection(), sequence);
      byte[] out = cipher.doFinal(plaintext);
      sendSequence = sequence + 1;
      return out;
    } catch (GeneralSecurityException e) {
      throw new KemTlsException(FailureKind.CRYPTO_ERROR, "Record encryption failed", e);
    }
  }

  /**
   * Decrypts the next expected record.
   *
   * @param ciphertext ciphertext with tag
   * @return the plaintext
   * @throws KemTlsException with {@link FailureKind#AUTHENTICATION_FAILURE} on any tag failure
   */
  public byte[] open(byte[] ciphertext) {
    long sequence = nextSequence(receiveSequence);
    if (ciphertext.length < TAG_LENGTH) {
      throw new KemTlsException(FailureKind.AUTHENTICATION_FAILURE, "Record shorter than tag");
    }
    try {
      Cipher cipher = cipher(Cipher.DECRYPT_MODE, role.receiveDirection(), sequence);
      byte[] out = cipher.doFinal(ciphertext);
      receiveSequence = sequence + 1;
      return out;
    } catch (AEADBadTagException e) {
      throw new KemTlsException(FailureKind.AUTHENTICATION_FAILURE, "Record authentication failed", e);
    } catch (GeneralSecurityException e) {
      throw new KemTlsException(FailureKind.CRYPTO_ERROR, "Record decryption failed", e);
    }
  }

  /**
   * Number of records sealed so far.
   *
   * @return the send sequence
   */
  public long sendSequence() {
    return sendSequence;
  }

  /**
   * Number of records opened so far.
   *
   * @return the receive sequence
   */
  public long receiveSequence() {
    return receiveSequence;
  }

  /**
   * Nonce for a record in the given direction.
   *
   * @param direction 0x01 client-to-server, 0x02 server-to-client
   * @param sequence  the sequence number
   * @return 12 bytes
   */
  byte[] nonce(byte direction, long sequence) {
    byte[] mask = new byte[NONCE_LENGTH];
    mask[3] = direction;
    System.arraycopy(ByteUtils.longToBytes(sequence), 0, mask, 4, 8);
    return ByteUtils.xor(iv, mask);
  }

  static byte[] additionalData(long sequence) {
    return ByteUtils.concat(new byte[]{MessageType.RECORD.tag()}, ByteUtils.longToBytes(sequence));
  }

  private Cipher cipher(int mode, byte direction, long sequence) throws GeneralSecurityException {
    Cipher cipher = Cipher.getInstance(TRANSFORMATION);
    cipher.init(mode, key, new GCMParameterSpec(TAG_LENGTH * 8, nonce(direction, sequence)));
    cipher.updateAAD(additionalData(sequence));
    return cipher;
  }

  private static long nextSequence(long sequence) {
    if (sequence == MAX_SEQUENCE) {
      throw new KemTlsException(FailureKind.CRYPTO_ERROR, "Record sequence number exhausted");
    }
    return sequence;
  }

  /**
   * Test hook: positions both counters, so exhaustion can be exercised.
   */
  void setSequences(long send, long receive) {
    this.sendSequence = send;
    this.receiveSequence = receive;
  }
}
