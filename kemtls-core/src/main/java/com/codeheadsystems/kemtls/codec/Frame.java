package com.codeheadsystems.kemtls.codec;

import java.util.Arrays;
import java.util.Objects;

/**
 * A decoded wire unit: type tag plus raw payload.
 * Wire format: type(1) || length(4, big-endian) || payload
 */
public record Frame(MessageType type, byte[] payload) {

  /**
   * Size of the type-and-length header.
   */
  public static final int HEADER_LENGTH = 5;

  public Frame {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(payload, "payload");
  }

  /**
   * Serializes to wire format. The encoding is canonical, so a frame decoded from bytes
   * re-encodes to exactly those bytes.
   */
  public byte[] encode() {
    byte[] out = new byte[HEADER_LENGTH + payload.length];
    out[0] = type.tag();
    out[1] = (byte) (payload.length >>> 24);
    out[2] = (byte) (payload.length >>> 16);
    out[3] = (byte) (payload.length >>> 8);
    out[4] = (byte) payload.length;
    System.arraycopy(payload, 0, out, HEADER_LENGTH, payload.length);
    return out;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Frame other && type == other.type && Arrays.equals(payload, other.payload);
  }

  @Override
  public int hashCode() {
    return 31 * type.hashCode() + Arrays.hashCode(payload);
  }

  @Override
  public String toString() {
    return "Frame[type=" + type + ", length=" + payload.length + "]";
  }
}
