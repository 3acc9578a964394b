package com.codeheadsystems.kemtls.codec;

import com.codeheadsystems.kemtls.common.ByteUtils;
import com.codeheadsystems.kemtls.common.FailureKind;
import com.codeheadsystems.kemtls.common.KemTlsException;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

/**
 * Encodes and decodes length-prefixed KEMTLS frames.
 * <p>
 * Declared lengths come from untrusted input, so every decode path checks them against
 * {@link #maxMessageSize()} before allocating.
 */
public class WireCodec {

  /**
   * Default bound on a single frame's payload (1 MiB).
   */
  public static final int DEFAULT_MAX_MESSAGE_SIZE = 1 << 20;

  /**
   * Codec with the default bound.
   */
  public static final WireCodec DEFAULT = new WireCodec(DEFAULT_MAX_MESSAGE_SIZE);

  private final int maxMessageSize;

  /**
   * Instantiates a new Wire codec.
   *
   * @param maxMessageSize largest accepted payload length in bytes
   */
  public WireCodec(int maxMessageSize) {
    if (maxMessageSize <= 0) {
      throw new IllegalArgumentException("maxMessageSize must be positive: " + maxMessageSize);
    }
    this.maxMessageSize = maxMessageSize;
  }

  /**
   * Max message size.
   *
   * @return the largest accepted payload length
   */
  public int maxMessageSize() {
    return maxMessageSize;
  }

  /**
   * encode(type, payload) = [type][length BE32][payload].
   *
   * @param type    the type
   * @param payload the payload
   * @return the wire bytes
   */
  public byte[] encode(MessageType type, byte[] payload) {
    if (payload.length > maxMessageSize) {
      throw new KemTlsException(FailureKind.MALFORMED_MESSAGE,
          "Payload of " + payload.length + " bytes exceeds maximum " + maxMessageSize);
    }
    return new Frame(type, payload).encode();
  }

  /**
   * Decodes the first frame in {@code bytes}. Trailing bytes are left for the caller.
   *
   * @param bytes the input
   * @return the frame and the number of bytes it occupied
   * @throws KemTlsException with {@link FailureKind#MALFORMED_MESSAGE} on any structural error
   */
  public DecodedFrame decode(byte[] bytes) {
    if (bytes == null || bytes.length < Frame.HEADER_LENGTH) {
      throw malformed("Frame header truncated");
    }
    MessageType type = resolveType(bytes[0]);
    long length = ByteUtils.OS2IP(bytes, 1, 4);
    checkLength(length);
    if (bytes.length - Frame.HEADER_LENGTH < length) {
      throw malformed("Declared length " + length + " exceeds available "
          + (bytes.length - Frame.HEADER_LENGTH) + " bytes");
    }
    byte[] payload = ByteUtils.slice(bytes, Frame.HEADER_LENGTH, (int) length);
    return new DecodedFrame(new Frame(type, payload), Frame.HEADER_LENGTH + (int) length);
  }

  /**
   * Reads exactly one frame from a stream. Blocks until the frame is complete.
   *
   * @param in the stream
   * @return the frame
   * @throws EOFException    if the stream ends before or inside a frame
   * @throws IOException     on any other read failure, including socket timeouts
   * @throws KemTlsException with {@link FailureKind#MALFORMED_MESSAGE} on a bad header
   */
  public Frame readFrame(InputStream in) throws IOException {
    byte[] header = in.readNBytes(Frame.HEADER_LENGTH);
    if (header.length < Frame.HEADER_LENGTH) {
      throw new EOFException("Stream ended after " + header.length + " header bytes");
    }
    MessageType type = resolveType(header[0]);
    long length = ByteUtils.OS2IP(header, 1, 4);
    checkLength(length);
    byte[] payload = in.readNBytes((int) length);
    if (payload.length < length) {
      throw new EOFException("Stream ended after " + payload.length + " of " + length + " payload bytes");
    }
    return new Frame(type, payload);
  }

  private MessageType resolveType(byte tag) {
    return MessageType.fromTag(tag)
        .orElseThrow(() -> malformed(String.format("Unknown message type 0x%02x", tag & 0xFF)));
  }

  private void checkLength(long length) {
    if (length > maxMessageSize) {
      throw malformed("Declared length " + length + " exceeds maximum " + maxMessageSize);
    }
  }

  private static KemTlsException malformed(String message) {
    return new KemTlsException(FailureKind.MALFORMED_MESSAGE, message);
  }

  /**
   * Result of decoding one frame from a byte array.
   *
   * @param frame         the frame
   * @param bytesConsumed header plus payload length
   */
  public record DecodedFrame(Frame frame, int bytesConsumed) {
  }
}
