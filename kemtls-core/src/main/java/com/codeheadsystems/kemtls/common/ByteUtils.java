package com.codeheadsystems.kemtls.common;

import java.util.Arrays;

/**
 * Utility methods for octet string encoding used by the KEMTLS wire formats.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Integer to Octet String Primitive (I2OSP) from RFC 8017.
   * Converts a non-negative integer to a big-endian octet string of specified length.
   *
   * @param value  the value
   * @param length the length
   * @return the byte [ ]
   */
  public static byte[] I2OSP(int value, int length) {
    if (value < 0 || (length < 4 && value >= (1 << (8 * length)))) {
      throw new IllegalArgumentException("Value too large for specified length");
    }
    byte[] result = new byte[length];
    for (int i = length - 1; i >= 0; i--) {
      result[i] = (byte) (value & 0xFF);
      value >>= 8;
    }
    return result;
  }

  /**
   * Big-endian encoding of a 64-bit counter.
   *
   * @param value the value
   * @return eight bytes
   */
  public static byte[] longToBytes(long value) {
    byte[] result = new byte[8];
    for (int i = 7; i >= 0; i--) {
      result[i] = (byte) (value & 0xFF);
      value >>>= 8;
    }
    return result;
  }

  /**
   * Reads an unsigned big-endian integer of {@code length} bytes (at most 4) at {@code offset}.
   *
   * @param bytes  the source
   * @param offset the offset
   * @param length the number of bytes
   * @return the value as a long, so that 4-byte lengths above {@link Integer#MAX_VALUE} survive
   */
  public static long OS2IP(byte[] bytes, int offset, int length) {
    long value = 0;
    for (int i = 0; i < length; i++) {
      value = (value << 8) | (bytes[offset + i] & 0xFF);
    }
    return value;
  }

  /**
   * Concatenates multiple byte arrays into a single array.
   *
   * @param arrays the arrays
   * @return the byte [ ]
   */
  public static byte[] concat(byte[]... arrays) {
    int totalLength = 0;
    for (byte[] arr : arrays) {
      totalLength += arr.length;
    }
    byte[] result = new byte[totalLength];
    int offset = 0;
    for (byte[] arr : arrays) {
      System.arraycopy(arr, 0, result, offset, arr.length);
      offset += arr.length;
    }
    return result;
  }

  /**
   * Length-prefixed vector: I2OSP(len(data), 2) || data.
   *
   * @param data the data
   * @return the encoded vector
   */
  public static byte[] encodeVector(byte[] data) {
    return concat(I2OSP(data.length, 2), data);
  }

  /**
   * XOR two byte arrays of equal length.
   *
   * @param a the a
   * @param b the b
   * @return the byte [ ]
   */
  public static byte[] xor(byte[] a, byte[] b) {
    if (a.length != b.length) {
      throw new IllegalArgumentException("XOR arrays must have equal length: " + a.length + " vs " + b.length);
    }
    byte[] out = new byte[a.length];
    for (int i = 0; i < a.length; i++) {
      out[i] = (byte) (a[i] ^ b[i]);
    }
    return out;
  }

  /**
   * Copies {@code len} bytes starting at {@code off}.
   *
   * @param src the source
   * @param off the offset
   * @param len the length
   * @return a new array
   */
  public static byte[] slice(byte[] src, int off, int len) {
    return Arrays.copyOfRange(src, off, off + len);
  }

  /**
   * Overwrites the array with zeros. Null-safe.
   *
   * @param secret the secret bytes
   */
  public static void wipe(byte[] secret) {
    if (secret != null) {
      Arrays.fill(secret, (byte) 0);
    }
  }
}
