package com.codeheadsystems.kemtls.handshake;

import com.codeheadsystems.kemtls.certificate.Certificate;
import com.codeheadsystems.kemtls.crypto.SessionKeys;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of a completed handshake. Holds the derived keys, never the shared secret.
 *
 * @param role            local role
 * @param clientNonce     client nonce
 * @param serverNonce     server nonce
 * @param keys            the session keys
 * @param peerCertificate the server certificate, present when the local role is client
 */
public record Session(Role role, byte[] clientNonce, byte[] serverNonce, SessionKeys keys,
                      Optional<Certificate> peerCertificate) {

  public Session {
    Objects.requireNonNull(role, "role");
    Objects.requireNonNull(keys, "keys");
    Objects.requireNonNull(peerCertificate, "peerCertificate");
    clientNonce = clientNonce.clone();
    serverNonce = serverNonce.clone();
  }

  @Override
  public byte[] clientNonce() {
    return clientNonce.clone();
  }

  @Override
  public byte[] serverNonce() {
    return serverNonce.clone();
  }

  @Override
  public String toString() {
    return "Session[role=" + role + ", peer=" + peerCertificate.map(Certificate::subject).orElse("-") + "]";
  }
}
