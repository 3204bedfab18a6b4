package com.codeheadsystems.otp.rfc.verify;

import com.codeheadsystems.otp.rfc.common.OtpError;
import com.codeheadsystems.otp.rfc.hotp.Counter;
import java.util.Objects;

/**
 * Outcome of a verification: either synchronized after {@code steps} forward increments, at
 * {@code counter}, or rejected with an {@link OtpError}.
 *
 * @param steps   forward increments needed to match, or -1 when rejected
 * @param counter the counter that matched, or null when rejected
 * @param error   the rejection reason, or null when synchronized
 */
public record VerificationResult(int steps, Counter counter, OtpError error) {

  public static VerificationResult synchronizedAt(int steps, Counter counter) {
    return new VerificationResult(steps, Objects.requireNonNull(counter), null);
  }

  public static VerificationResult rejected(OtpError error) {
    return new VerificationResult(-1, null, Objects.requireNonNull(error));
  }

  public boolean isSynchronized() {
    return error == null;
  }

  public boolean isRejected() {
    return error != null;
  }

  @Override
  public String toString() {
    return isSynchronized()
        ? "Synchronized(steps=" + steps + ", counter=" + counter + ")"
        : "Rejected(" + error + ")";
  }
}
