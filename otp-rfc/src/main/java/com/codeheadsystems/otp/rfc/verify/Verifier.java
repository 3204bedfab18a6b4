package com.codeheadsystems.otp.rfc.verify;

import com.codeheadsystems.otp.rfc.common.OtpError;
import com.codeheadsystems.otp.rfc.hotp.Counter;
import com.codeheadsystems.otp.rfc.hotp.HotpGenerator;
import com.codeheadsystems.otp.rfc.totp.TotpConfig;
import com.codeheadsystems.otp.rfc.totp.TotpCounterDerivation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a submitted code against HOTP values for a bounded, forward-only run of counters,
 * RFC 4226 Section 7.4. The first match wins and reports how many increments it took, which
 * the caller uses to resynchronize its counter.
 * <p>
 * Nothing here throws for a wrong code or an out-of-window clock; those come back as a
 * rejected {@link VerificationResult}.
 */
public class Verifier {

  private static final Logger log = LoggerFactory.getLogger(Verifier.class);

  /**
   * Smallest and largest codes accepted by {@link #verify(byte[], Counter, int, int)}.
   */
  public static final int MIN_SUBMITTED = 100_000;
  public static final int MAX_SUBMITTED = 99_999_999;

  private Verifier() {
  }

  /**
   * Verifies a code whose digit count is inferred from its decimal length.
   * <p>
   * A 6-digit code with a leading zero arrives as a 5-digit integer and is rejected with
   * {@link OtpError#INVALID_DIGIT_COUNT}. An 8-digit code with a leading zero still matches,
   * because truncating to 7 digits yields the same value. Use
   * {@link #verify(byte[], Counter, int, int, int)} when the digit count is known.
   *
   * @param secret    the shared secret
   * @param counter   the first counter to try
   * @param submitted the code presented by the client
   * @param threshold how many counters to try
   * @return the verification result
   */
  public static VerificationResult verify(byte[] secret, Counter counter, int submitted, int threshold) {
    if (threshold <= 0) {
      return VerificationResult.rejected(OtpError.INVALID_THRESHOLD);
    }
    if (submitted < MIN_SUBMITTED || submitted > MAX_SUBMITTED) {
      log.debug("verify(): submitted code out of range");
      return VerificationResult.rejected(OtpError.INVALID_DIGIT_COUNT);
    }
    return search(secret, counter, submitted, digitCount(submitted), threshold);
  }

  /**
   * Verifies a code of a known digit count. Leading zeros are significant only through
   * {@code digits}, so {@code 012345} is passed as 12345 with digits 6.
   *
   * @param secret    the shared secret
   * @param counter   the first counter to try
   * @param code      the code presented by the client
   * @param digits    6, 7 or 8
   * @param threshold how many counters to try
   * @return the verification result
   */
  public static VerificationResult verify(byte[] secret, Counter counter, int code, int digits, int threshold) {
    if (threshold <= 0) {
      return VerificationResult.rejected(OtpError.INVALID_THRESHOLD);
    }
    if (!HotpGenerator.isValidDigits(digits) || code < 0 || code >= HotpGenerator.modulus(digits)) {
      log.debug("verify(): code does not have {} digits", digits);
      return VerificationResult.rejected(OtpError.INVALID_DIGIT_COUNT);
    }
    return search(secret, counter, code, digits, threshold);
  }

  /**
   * Verifies a TOTP code at the given Unix time using the configuration's period, t0, drift,
   * digits and threshold.
   *
   * @param secret the shared secret
   * @param code   the code presented by the client
   * @param config the configuration
   * @param now    seconds since the Unix epoch
   * @return the verification result
   */
  public static VerificationResult verify(byte[] secret, int code, TotpConfig config, long now) {
    Counter counter = new TotpCounterDerivation(config).counterAt(now);
    return verify(secret, counter, code, config.digits(), config.threshold());
  }

  private static VerificationResult search(byte[] secret, Counter counter, int code, int digits, int threshold) {
    Counter current = counter;
    for (int remaining = threshold; remaining > 0; remaining--) {
      if (HotpGenerator.hotp(secret, current, digits) == code) {
        int steps = threshold - remaining;
        log.debug("verify(): synchronized after {} step(s) at counter {}", steps, current);
        return VerificationResult.synchronizedAt(steps, current);
      }
      current = current.increment();
    }
    log.debug("verify(): no match in {} counter(s) from {}", threshold, counter);
    return VerificationResult.rejected(OtpError.INVALID_THRESHOLD);
  }

  static int digitCount(int value) {
    return Integer.toString(value).length();
  }
}
