package com.codeheadsystems.otp.rfc.common;

/**
 * Utility methods for fixed-width big-endian octet strings.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Integer to Octet String Primitive (I2OSP) for a 64-bit value.
   * The value is treated as unsigned, so negative longs encode their two's complement bits.
   *
   * @param value  the value
   * @param length the length, 1 to 8 bytes
   * @return the byte [ ]
   */
  public static byte[] I2OSP(long value, int length) {
    if (length < 1 || length > Long.BYTES) {
      throw new IllegalArgumentException("Length must be between 1 and 8: " + length);
    }
    if (length < Long.BYTES && (value >>> (8 * length)) != 0) {
      throw new IllegalArgumentException("Value too large for specified length");
    }
    byte[] result = new byte[length];
    for (int i = length - 1; i >= 0; i--) {
      result[i] = (byte) (value & 0xFF);
      value >>>= 8;
    }
    return result;
  }

  /**
   * Octet String to Integer Primitive (OS2IP), the inverse of {@link #I2OSP(long, int)}.
   *
   * @param bytes 1 to 8 big-endian bytes
   * @return the value, as unsigned bits in a long
   */
  public static long OS2IP(byte[] bytes) {
    if (bytes.length < 1 || bytes.length > Long.BYTES) {
      throw new IllegalArgumentException("Octet string must be between 1 and 8 bytes: " + bytes.length);
    }
    long result = 0;
    for (byte b : bytes) {
      result = (result << 8) | (b & 0xFF);
    }
    return result;
  }

  /**
   * Reads four bytes at the offset as a big-endian signed 32-bit integer.
   *
   * @param bytes  the bytes
   * @param offset the offset of the first byte
   * @return the int
   */
  public static int readInt(byte[] bytes, int offset) {
    if (offset < 0 || offset + Integer.BYTES > bytes.length) {
      throw new IllegalArgumentException("Offset " + offset + " out of range for " + bytes.length + " bytes");
    }
    return ((bytes[offset] & 0xFF) << 24)
        | ((bytes[offset + 1] & 0xFF) << 16)
        | ((bytes[offset + 2] & 0xFF) << 8)
        | (bytes[offset + 3] & 0xFF);
  }
}
