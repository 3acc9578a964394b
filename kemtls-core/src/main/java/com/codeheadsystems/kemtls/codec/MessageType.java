package com.codeheadsystems.kemtls.codec;

import java.util.Optional;

/**
 * One-byte type tags of the KEMTLS wire format.
 */
public enum MessageType {

  CLIENT_HELLO((byte) 0x01),
  SERVER_HELLO((byte) 0x02),
  CLIENT_FINISHED((byte) 0x05),
  SERVER_FINISHED((byte) 0x06),
  RECORD((byte) 0x10),
  ALERT((byte) 0xFF);

  private final byte tag;

  MessageType(byte tag) {
    this.tag = tag;
  }

  /**
   * The wire tag.
   *
   * @return the tag byte
   */
  public byte tag() {
    return tag;
  }

  /**
   * Resolves a wire tag.
   *
   * @param tag the tag byte
   * @return the message type, or empty for an unassigned tag
   */
  public static Optional<MessageType> fromTag(byte tag) {
    for (MessageType type : values()) {
      if (type.tag == tag) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
