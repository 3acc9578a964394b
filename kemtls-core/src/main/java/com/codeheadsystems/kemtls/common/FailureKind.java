package com.codeheadsystems.kemtls.common;

/**
 * Every way a KEMTLS connection can fail. Each kind is terminal for its session.
 */
public enum FailureKind {

  /**
   * Structural error in a frame or payload: truncated, oversized, unknown tag, trailing bytes.
   */
  MALFORMED_MESSAGE,

  /**
   * A message arrived in a state that does not expect it.
   */
  PROTOCOL_VIOLATION,

  /**
   * A certificate signature, finished MAC, or record tag did not verify.
   */
  AUTHENTICATION_FAILURE,

  /**
   * A primitive rejected its input or produced output of an unexpected length.
   */
  CRYPTO_ERROR,

  /**
   * A bounded read expired.
   */
  TIMEOUT,

  /**
   * The peer closed the stream or sent an alert.
   */
  CONNECTION_CLOSED
}
