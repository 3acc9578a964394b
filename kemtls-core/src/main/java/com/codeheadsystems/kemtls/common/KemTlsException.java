package com.codeheadsystems.kemtls.common;

/**
 * Unchecked failure of a KEMTLS operation, tagged with its {@link FailureKind}.
 * <p>
 * The kind is for local diagnostics and tests only. Nothing derived from it is ever sent to
 * the peer, which only sees a generic alert.
 */
public class KemTlsException extends RuntimeException {

  private final FailureKind failureKind;

  /**
   * Instantiates a new KEMTLS exception.
   *
   * @param failureKind the failure kind
   * @param message     the message
   */
  public KemTlsException(final FailureKind failureKind, final String message) {
    super(message);
    this.failureKind = failureKind;
  }

  /**
   * Instantiates a new KEMTLS exception.
   *
   * @param failureKind the failure kind
   * @param message     the message
   * @param cause       the cause
   */
  public KemTlsException(final FailureKind failureKind, final String message, final Throwable cause) {
    super(message, cause);
    this.failureKind = failureKind;
  }

  /**
   * Failure kind.
   *
   * @return the failure kind
   */
  public FailureKind failureKind() {
    return failureKind;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + failureKind + "]: " + getMessage();
  }
}
