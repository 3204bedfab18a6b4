package com.codeheadsystems.otp.rfc.provisioning;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HMAC algorithms that can be advertised in a provisioning URI.
 * <p>
 * Only SHA1 is implemented. Requests for anything else are coerced to SHA1 so that the
 * authenticator app computes the same codes as {@link com.codeheadsystems.otp.rfc.hotp.HotpGenerator}.
 */
public enum OtpAlgorithm {

  SHA1;

  private static final Logger log = LoggerFactory.getLogger(OtpAlgorithm.class);

  /**
   * Maps a requested algorithm name to a supported one.
   *
   * @param requested algorithm name, may be null
   * @return always {@link #SHA1}
   */
  public static OtpAlgorithm coerce(String requested) {
    if (requested != null && !SHA1.name().equals(requested)) {
      log.warn("Algorithm {} is not supported, using SHA1", requested);
    }
    return SHA1;
  }
}
