package com.codeheadsystems.otp.rfc.hotp;

import com.codeheadsystems.otp.rfc.common.ByteUtils;
import com.codeheadsystems.otp.rfc.common.OtpError;
import com.codeheadsystems.otp.rfc.common.OtpException;
import org.bouncycastle.crypto.digests.SHA1Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * HOTP value generation per RFC 4226 Section 5.
 * <p>
 * HOTP(K, C) = Truncate(HMAC-SHA-1(K, C)) mod 10^Digit. Only SHA-1 is supported.
 */
public class HotpGenerator {

  public static final int MIN_DIGITS = 6;
  public static final int MAX_DIGITS = 8;

  /**
   * HMAC-SHA-1 output length.
   */
  public static final int HMAC_LENGTH = 20;

  private static final int[] POWERS_OF_TEN = {
      1, 10, 100, 1_000, 10_000, 100_000, 1_000_000, 10_000_000, 100_000_000
  };

  private HotpGenerator() {
  }

  /**
   * Computes the HOTP value for the counter.
   *
   * @param secret  the shared secret
   * @param counter the moving factor
   * @param digits  6, 7 or 8
   * @return the code, in [0, 10^digits)
   * @throws OtpException with {@link OtpError#INVALID_DIGIT_COUNT} if digits is out of range
   */
  public static int hotp(byte[] secret, Counter counter, int digits) {
    checkDigits(digits);
    byte[] hs = hmacSha1(secret, counter.toBytes());
    return dynamicTruncation(hs) % POWERS_OF_TEN[digits];
  }

  /**
   * HMAC-SHA-1(key, data).
   *
   * @param key  the key
   * @param data the message
   * @return the 20-byte mac
   */
  public static byte[] hmacSha1(byte[] key, byte[] data) {
    HMac hmac = new HMac(new SHA1Digest());
    hmac.init(new KeyParameter(key));
    hmac.update(data, 0, data.length);
    byte[] out = new byte[HMAC_LENGTH];
    hmac.doFinal(out, 0);
    return out;
  }

  /**
   * Dynamic truncation, RFC 4226 Section 5.3: the low nibble of the last byte selects four
   * bytes, read big-endian with the sign bit masked off.
   *
   * @param hs a 20-byte HMAC-SHA-1 value
   * @return the 31-bit Snum
   */
  public static int dynamicTruncation(byte[] hs) {
    if (hs.length != HMAC_LENGTH) {
      throw new IllegalArgumentException("HMAC-SHA-1 value must be " + HMAC_LENGTH + " bytes: " + hs.length);
    }
    int offset = hs[HMAC_LENGTH - 1] & 0x0F;
    return ByteUtils.readInt(hs, offset) & 0x7FFFFFFF;
  }

  /**
   * Zero-pads a code to its display width.
   *
   * @param code   the code
   * @param digits 6, 7 or 8
   * @return the string
   */
  public static String format(int code, int digits) {
    checkDigits(digits);
    return String.format("%0" + digits + "d", code);
  }

  /**
   * 10^digits, the exclusive upper bound of a code with that many digits.
   *
   * @param digits 6, 7 or 8
   * @return the modulus
   */
  public static int modulus(int digits) {
    checkDigits(digits);
    return POWERS_OF_TEN[digits];
  }

  /**
   * Whether the digit count is supported.
   *
   * @param digits the digits
   * @return true for 6, 7 or 8
   */
  public static boolean isValidDigits(int digits) {
    return digits >= MIN_DIGITS && digits <= MAX_DIGITS;
  }

  private static void checkDigits(int digits) {
    if (!isValidDigits(digits)) {
      throw new OtpException(OtpError.INVALID_DIGIT_COUNT, "Digits must be 6, 7 or 8: " + digits);
    }
  }
}
