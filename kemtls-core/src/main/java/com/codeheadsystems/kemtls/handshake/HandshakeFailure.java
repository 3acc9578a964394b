package com.codeheadsystems.kemtls.handshake;

import com.codeheadsystems.kemtls.common.FailureKind;
import com.codeheadsystems.kemtls.common.KemTlsException;
import java.util.Objects;

/**
 * A handshake failure reported as a value.
 *
 * @param kind    the kind
 * @param message local diagnostic text; never sent to the peer
 */
public record HandshakeFailure(FailureKind kind, String message) {

  public HandshakeFailure {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(message, "message");
  }

  /**
   * Converts to an exception for callers that propagate failures by throwing.
   *
   * @return the exception
   */
  public KemTlsException toException() {
    return new KemTlsException(kind, message);
  }
}
