package com.codeheadsystems.kemtls.codec;

import com.codeheadsystems.kemtls.common.FailureKind;
import com.codeheadsystems.kemtls.common.KemTlsException;

/**
 * A typed KEMTLS message. Each variant owns its fixed payload layout.
 */
public sealed interface HandshakeMessage
    permits ClientHello, ServerHello, ServerFinished, ClientFinished, RecordMessage, Alert {

  /**
   * Wire type.
   *
   * @return the type
   */
  MessageType type();

  /**
   * Serialized payload, without the frame header.
   *
   * @return the payload
   */
  byte[] payload();

  /**
   * Wraps the payload in a frame.
   *
   * @return the frame
   */
  default Frame toFrame() {
    return new Frame(type(), payload());
  }

  /**
   * Parses a frame into its typed message.
   *
   * @param frame            the frame
   * @param ciphertextLength KEM ciphertext length, needed to split a ServerHello
   * @return the message
   * @throws KemTlsException with {@link FailureKind#MALFORMED_MESSAGE} on a bad payload
   */
  static HandshakeMessage parse(Frame frame, int ciphertextLength) {
    return switch (frame.type()) {
      case CLIENT_HELLO -> ClientHello.parse(frame.payload());
      case SERVER_HELLO -> ServerHello.parse(frame.payload(), ciphertextLength);
      case SERVER_FINISHED -> ServerFinished.parse(frame.payload());
      case CLIENT_FINISHED -> ClientFinished.parse(frame.payload());
      case RECORD -> RecordMessage.parse(frame.payload());
      case ALERT -> Alert.parse(frame.payload());
    };
  }

  /**
   * Shorthand for a malformed-payload failure.
   */
  static KemTlsException malformed(String message) {
    return new KemTlsException(FailureKind.MALFORMED_MESSAGE, message);
  }
}
