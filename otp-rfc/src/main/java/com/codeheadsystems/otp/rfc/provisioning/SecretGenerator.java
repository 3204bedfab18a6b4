package com.codeheadsystems.otp.rfc.provisioning;

import com.codeheadsystems.otp.rfc.common.OtpError;
import com.codeheadsystems.otp.rfc.common.OtpException;
import com.codeheadsystems.otp.rfc.common.RandomProvider;
import com.codeheadsystems.otp.rfc.totp.TotpConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates shared secrets from a {@link RandomProvider}. RFC 4226 recommends 160 bits.
 */
public class SecretGenerator {

  private static final Logger log = LoggerFactory.getLogger(SecretGenerator.class);

  private final RandomProvider randomProvider;

  public SecretGenerator() {
    this(new RandomProvider());
  }

  public SecretGenerator(final RandomProvider randomProvider) {
    this.randomProvider = randomProvider;
  }

  /**
   * A secret of {@link TotpConfig#DEFAULT} length.
   *
   * @return the secret
   */
  public byte[] generate() {
    return generate(TotpConfig.DEFAULT.secretBits());
  }

  /**
   * A secret of the given length.
   *
   * @param nbBits a positive multiple of 8
   * @return nbBits / 8 random bytes
   * @throws OtpException with {@link OtpError#RANDOM_SOURCE_FAILURE} if the random source fails
   */
  public byte[] generate(int nbBits) {
    if (nbBits <= 0 || nbBits % 8 != 0) {
      throw new IllegalArgumentException("Secret length must be a positive multiple of 8 bits: " + nbBits);
    }
    try {
      return randomProvider.randomBytes(nbBits / 8);
    } catch (RuntimeException e) {
      log.error("generate({}): random source failed", nbBits, e);
      throw new OtpException(OtpError.RANDOM_SOURCE_FAILURE, "Unable to generate a " + nbBits + "-bit secret", e);
    }
  }
}
