package com.codeheadsystems.otp.rfc.common;

/**
 * Raised for precondition failures and collaborator failures. Expected verification failures
 * are never thrown; they are returned as a
 * {@link com.codeheadsystems.otp.rfc.verify.VerificationResult}.
 */
public class OtpException extends RuntimeException {

  private final OtpError error;

  /**
   * Instantiates a new Otp exception.
   *
   * @param error   the error kind
   * @param message the message
   */
  public OtpException(final OtpError error, final String message) {
    super(message);
    this.error = error;
  }

  /**
   * Instantiates a new Otp exception.
   *
   * @param error   the error kind
   * @param message the message
   * @param cause   the cause
   */
  public OtpException(final OtpError error, final String message, final Throwable cause) {
    super(message, cause);
    this.error = error;
  }

  /**
   * The error kind.
   *
   * @return the otp error
   */
  public OtpError error() {
    return error;
  }
}
