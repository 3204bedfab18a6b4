package com.codeheadsystems.otp.server.exceptions;

import com.codeheadsystems.otp.rfc.common.OtpError;

/**
 * Thrown when a code is not accepted. The message never says whether the principal exists.
 */
public class AuthenticationFailedException extends SecurityException {

  private final OtpError error;

  /**
   * Instantiates a new Authentication failed exception.
   *
   * @param error the verification error, or null if the principal is unknown
   */
  public AuthenticationFailedException(final OtpError error) {
    super("Authentication failed");
    this.error = error;
  }

  /**
   * The verification error, or null if the principal is unknown.
   *
   * @return the otp error
   */
  public OtpError error() {
    return error;
  }
}
