package com.codeheadsystems.kemtls.handshake;

import com.codeheadsystems.kemtls.certificate.Certificate;
import com.codeheadsystems.kemtls.common.ByteUtils;
import com.codeheadsystems.kemtls.crypto.AsymmetricKeyPair;
import com.codeheadsystems.kemtls.crypto.SessionKeys;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of one handshake. Every step produces a new context; only the
 * secret-wiping helpers touch array contents in place.
 * <p>
 * Nullable fields are filled in as the handshake progresses: {@code ephemeralKeys} exists
 * only on the client between ClientHello and ServerHello, {@code keys} from the moment they
 * are derived, {@code failure} only in {@link ConnectionState#FAILED}.
 *
 * @param role            the local role
 * @param state           the state
 * @param transcript      encoded frames of every handshake message so far, in order
 * @param clientNonce     client nonce, or null
 * @param serverNonce     server nonce, or null
 * @param ephemeralKeys   client ephemeral KEM key pair, or null
 * @param keys            derived session keys, or null
 * @param peerCertificate verified server certificate (client role), or null
 * @param failure         the failure, or null
 */
public record HandshakeContext(Role role,
                               ConnectionState state,
                               byte[] transcript,
                               byte[] clientNonce,
                               byte[] serverNonce,
                               AsymmetricKeyPair ephemeralKeys,
                               SessionKeys keys,
                               Certificate peerCertificate,
                               HandshakeFailure failure) {

  public HandshakeContext {
    Objects.requireNonNull(role, "role");
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(transcript, "transcript");
  }

  /**
   * A fresh context in {@link ConnectionState#IDLE}.
   *
   * @param role the role
   * @return the context
   */
  public static HandshakeContext idle(Role role) {
    return new HandshakeContext(role, ConnectionState.IDLE, new byte[0], null, null, null, null, null, null);
  }

  HandshakeContext advance(ConnectionState newState, byte[] newTranscript) {
    return new HandshakeContext(role, newState, newTranscript, clientNonce, serverNonce,
        ephemeralKeys, keys, peerCertificate, null);
  }

  HandshakeContext withClientHello(AsymmetricKeyPair newEphemeralKeys, byte[] newClientNonce) {
    return new HandshakeContext(role, state, transcript, newClientNonce, serverNonce,
        newEphemeralKeys, keys, peerCertificate, null);
  }

  HandshakeContext withKeys(byte[] newClientNonce, byte[] newServerNonce, SessionKeys newKeys,
                            Certificate newPeerCertificate) {
    return new HandshakeContext(role, state, transcript, newClientNonce, newServerNonce,
        null, newKeys, newPeerCertificate, null);
  }

  /**
   * FAILED copy of this context. Wipes the ephemeral private key, and the session keys unless
   * they were already released through an established {@link Session}.
   */
  HandshakeContext failed(HandshakeFailure newFailure) {
    wipeSecrets();
    return new HandshakeContext(role, ConnectionState.FAILED, transcript, clientNonce, serverNonce,
        null, null, peerCertificate, newFailure);
  }

  void wipeSecrets() {
    if (ephemeralKeys != null) {
      ephemeralKeys.destroyPrivateKey();
    }
    if (keys != null && state != ConnectionState.ESTABLISHED) {
      keys.destroy();
    }
  }

  /**
   * Is established.
   *
   * @return true in {@link ConnectionState#ESTABLISHED}
   */
  public boolean isEstablished() {
    return state == ConnectionState.ESTABLISHED;
  }

  /**
   * The session, available only once established.
   *
   * @return the session or empty
   */
  public Optional<Session> session() {
    if (!isEstablished()) {
      return Optional.empty();
    }
    return Optional.of(new Session(role, clientNonce, serverNonce, keys, Optional.ofNullable(peerCertificate)));
  }

  @Override
  public byte[] transcript() {
    return transcript.clone();
  }

  /**
   * The failure, if any.
   *
   * @return the failure
   */
  public Optional<HandshakeFailure> failureReason() {
    return Optional.ofNullable(failure);
  }

  static byte[] append(byte[] transcript, byte[] frameBytes) {
    return ByteUtils.concat(transcript, frameBytes);
  }

  @Override
  public String toString() {
    return "HandshakeContext[role=" + role + ", state=" + state + ", transcript=" + transcript.length
        + " bytes" + (failure == null ? "" : ", failure=" + failure.kind()) + "]";
  }
}
