package com.codeheadsystems.otp.rfc.hotp;

import com.codeheadsystems.otp.rfc.common.ByteUtils;

/**
 * The HOTP moving factor: an unsigned 64-bit value, serialized as 8 big-endian bytes.
 * Arithmetic wraps modulo 2^64. Ordering is unsigned.
 *
 * @param value the counter, interpreted as unsigned
 */
public record Counter(long value) implements Comparable<Counter> {

  /**
   * Width of the serialized counter in bytes.
   */
  public static final int LENGTH = 8;

  public static final Counter ZERO = new Counter(0L);

  /**
   * Reads a counter from its 8-byte big-endian encoding.
   *
   * @param bytes exactly 8 bytes
   * @return the counter
   */
  public static Counter fromBytes(byte[] bytes) {
    if (bytes.length != LENGTH) {
      throw new IllegalArgumentException("Counter must be " + LENGTH + " bytes: " + bytes.length);
    }
    return new Counter(ByteUtils.OS2IP(bytes));
  }

  /**
   * The 8-byte big-endian encoding used as the HMAC message.
   *
   * @return a new byte [ ]
   */
  public byte[] toBytes() {
    return ByteUtils.I2OSP(value, LENGTH);
  }

  /**
   * The successor, modulo 2^64.
   *
   * @return the counter
   */
  public Counter increment() {
    return new Counter(value + 1);
  }

  /**
   * Advances by the given number of steps, modulo 2^64.
   *
   * @param steps non-negative step count
   * @return the counter
   */
  public Counter plus(long steps) {
    if (steps < 0) {
      throw new IllegalArgumentException("steps must be non-negative: " + steps);
    }
    return new Counter(value + steps);
  }

  @Override
  public int compareTo(Counter other) {
    return Long.compareUnsigned(value, other.value);
  }

  @Override
  public String toString() {
    return Long.toUnsignedString(value);
  }
}
