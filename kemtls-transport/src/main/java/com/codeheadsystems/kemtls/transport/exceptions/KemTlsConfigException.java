package com.codeheadsystems.kemtls.transport.exceptions;

/**
 * A configuration source could not be read or bound.
 */
public class KemTlsConfigException extends RuntimeException {
  /**
   * Instantiates a new KEMTLS config exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public KemTlsConfigException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
