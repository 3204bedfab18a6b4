package com.codeheadsystems.otp.rfc.common;

/**
 * The closed set of failure kinds reported by this library.
 */
public enum OtpError {

  /**
   * The submitted code's digit count is not 6, 7 or 8, or a digits parameter is out of range.
   */
  INVALID_DIGIT_COUNT("Invalid number of digits in the code. Must be 6, 7 or 8 digits"),

  /**
   * Verification attempts were exhausted without a match. Covers both a wrong code and a
   * clock drift larger than the configured window.
   */
  INVALID_THRESHOLD("Invalid threshold"),

  /**
   * The entropy source failed while generating a secret.
   */
  RANDOM_SOURCE_FAILURE("Random source failure"),

  /**
   * The payload does not fit in any QR code symbol version.
   */
  QR_CAPACITY_EXCEEDED("QR code capacity exceeded");

  private final String description;

  OtpError(final String description) {
    this.description = description;
  }

  /**
   * Human readable description.
   *
   * @return the description
   */
  public String description() {
    return description;
  }
}
