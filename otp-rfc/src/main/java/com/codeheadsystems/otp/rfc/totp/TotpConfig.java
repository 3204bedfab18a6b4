package com.codeheadsystems.otp.rfc.totp;

import com.codeheadsystems.otp.rfc.hotp.HotpGenerator;

/**
 * Parameters shared by TOTP counter derivation, verification and provisioning.
 *
 * @param period     time step X in seconds
 * @param t0         Unix time at which counting starts
 * @param drift      steps subtracted from the derived counter so the forward search also
 *                   covers clients that are behind
 * @param digits     code length, 6, 7 or 8
 * @param threshold  counters tried by the verifier before giving up
 * @param secretBits length of generated secrets in bits
 */
public record TotpConfig(
    long period,
    long t0,
    long drift,
    int digits,
    int threshold,
    int secretBits
) {

  /**
   * 30 second steps from the Unix epoch, 2 steps of drift, 6 digits, 15 attempts, 160-bit secrets.
   * With these values a client whose clock is up to two steps behind still verifies.
   */
  public static final TotpConfig DEFAULT = new TotpConfig(30, 0, 2, 6, 15, 160);

  public TotpConfig {
    if (period <= 0) {
      throw new IllegalArgumentException("period must be positive: " + period);
    }
    if (drift < 0) {
      throw new IllegalArgumentException("drift must be non-negative: " + drift);
    }
    if (!HotpGenerator.isValidDigits(digits)) {
      throw new IllegalArgumentException("digits must be 6, 7 or 8: " + digits);
    }
    if (threshold < 1) {
      throw new IllegalArgumentException("threshold must be at least 1: " + threshold);
    }
    if (secretBits <= 0 || secretBits % 8 != 0) {
      throw new IllegalArgumentException("secretBits must be a positive multiple of 8: " + secretBits);
    }
  }

  public TotpConfig withPeriod(long period) {
    return new TotpConfig(period, t0, drift, digits, threshold, secretBits);
  }

  public TotpConfig withT0(long t0) {
    return new TotpConfig(period, t0, drift, digits, threshold, secretBits);
  }

  public TotpConfig withDrift(long drift) {
    return new TotpConfig(period, t0, drift, digits, threshold, secretBits);
  }

  public TotpConfig withDigits(int digits) {
    return new TotpConfig(period, t0, drift, digits, threshold, secretBits);
  }

  public TotpConfig withThreshold(int threshold) {
    return new TotpConfig(period, t0, drift, digits, threshold, secretBits);
  }

  public TotpConfig withSecretBits(int secretBits) {
    return new TotpConfig(period, t0, drift, digits, threshold, secretBits);
  }

  /**
   * The threshold that makes the verification window symmetric around the server's step:
   * {@code drift} steps behind through {@code drift} steps ahead.
   *
   * @return 2 * drift + 1
   */
  public int symmetricThreshold() {
    return Math.toIntExact(2 * drift + 1);
  }
}
