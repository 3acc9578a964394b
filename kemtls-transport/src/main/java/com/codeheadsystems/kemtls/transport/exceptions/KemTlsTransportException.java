package com.codeheadsystems.kemtls.transport.exceptions;

/**
 * Socket-level failure that is not a protocol failure: connect, bind or accept errors.
 */
public class KemTlsTransportException extends RuntimeException {
  /**
   * Instantiates a new KEMTLS transport exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public KemTlsTransportException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
