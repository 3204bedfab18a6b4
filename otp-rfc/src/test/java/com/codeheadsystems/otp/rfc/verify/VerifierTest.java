package com.codeheadsystems.otp.rfc.verify;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.otp.rfc.common.OtpError;
import com.codeheadsystems.otp.rfc.hotp.Counter;
import com.codeheadsystems.otp.rfc.hotp.HotpGenerator;
import com.codeheadsystems.otp.rfc.totp.TotpConfig;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class VerifierTest {

  private static final byte[] SECRET = "12345678901234567890".getBytes(StandardCharsets.US_ASCII);

  /**
   * Digit count inferred from the decimal length of the submitted code.
   */
  @Nested
  class InferredDigits {

    // RFC 4226 Appendix D codes for counters 0..9
    @ParameterizedTest
    @CsvSource({
        "755224, 0", "287082, 1", "359152, 2", "969429, 3", "338314, 4",
        "254676, 5", "287922, 6", "162583, 7", "399871, 8", "520489, 9"
    })
    void codeStepsAheadReportsSteps(int code, int steps) {
      VerificationResult result = Verifier.verify(SECRET, Counter.ZERO, code, 15);

      assertThat(result.isSynchronized()).isTrue();
      assertThat(result.steps()).isEqualTo(steps);
      assertThat(result.counter()).isEqualTo(new Counter(steps));
    }

    @Test
    void noMatchInWindowIsInvalidThreshold() {
      // counter 0's code, searched from counter 1 through 9
      VerificationResult result = Verifier.verify(SECRET, new Counter(1), 755224, 9);

      assertThat(result.isRejected()).isTrue();
      assertThat(result.error()).isEqualTo(OtpError.INVALID_THRESHOLD);
    }

    @Test
    void codeJustBeyondThresholdIsRejected() {
      // counter 9's code with a window of counters 0..8
      assertThat(Verifier.verify(SECRET, Counter.ZERO, 520489, 9).error()).isEqualTo(OtpError.INVALID_THRESHOLD);
      assertThat(Verifier.verify(SECRET, Counter.ZERO, 520489, 10).steps()).isEqualTo(9);
    }

    @Test
    void searchIsForwardOnly() {
      // counter 0's code is behind counter 5
      assertThat(Verifier.verify(SECRET, new Counter(5), 755224, 5).error()).isEqualTo(OtpError.INVALID_THRESHOLD);
    }

    @ParameterizedTest
    @ValueSource(ints = {99999, 100000000, 0, -1, 12345})
    void lengthOutsideSixToEightIsInvalidDigitCount(int submitted) {
      assertThat(Verifier.verify(SECRET, Counter.ZERO, submitted, 15).error()).isEqualTo(OtpError.INVALID_DIGIT_COUNT);
    }

    @ParameterizedTest
    @ValueSource(ints = {100000, 99999999})
    void boundaryLengthsAreSearched(int submitted) {
      VerificationResult result = Verifier.verify(SECRET, Counter.ZERO, submitted, 10);
      assertThat(result.error()).isNotEqualTo(OtpError.INVALID_DIGIT_COUNT);
    }

    @Test
    void eightDigitCodeWithLeadingZeroStillMatches() {
      // RFC 6238 time 1111111109 gives 07081804; as an int it has 7 digits and matches
      // the 7-digit truncation of the same HMAC.
      VerificationResult result = Verifier.verify(SECRET, new Counter(37037036L), 7081804, 1);
      assertThat(result.isSynchronized()).isTrue();
      assertThat(result.steps()).isZero();
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -3})
    void nonPositiveThresholdIsInvalidThreshold(int threshold) {
      assertThat(Verifier.verify(SECRET, Counter.ZERO, 99999, threshold).error()).isEqualTo(OtpError.INVALID_THRESHOLD);
    }
  }

  /**
   * Digit count stated by the caller.
   */
  @Nested
  class ExplicitDigits {

    @Test
    void everyOffsetInsideTheWindowIsFoundAtThatOffset() {
      Counter start = new Counter(1000L);
      for (int k = 0; k < 15; k++) {
        int code = HotpGenerator.hotp(SECRET, start.plus(k), 6);
        VerificationResult result = Verifier.verify(SECRET, start, code, 6, 15);
        assertThat(result.steps()).as("offset %d", k).isEqualTo(k);
      }
    }

    @Test
    void leadingZeroCodeIsAccepted() {
      // counter 37037036: 6-digit code is 081804
      VerificationResult result = Verifier.verify(SECRET, new Counter(37037036L), 81804, 6, 1);
      assertThat(result.isSynchronized()).isTrue();
    }

    @Test
    void leadingZeroCodeIsRejectedWhenDigitsAreInferred() {
      assertThat(Verifier.verify(SECRET, new Counter(37037036L), 81804, 1).error())
          .isEqualTo(OtpError.INVALID_DIGIT_COUNT);
    }

    @Test
    void codeTooLargeForDigitsIsInvalidDigitCount() {
      assertThat(Verifier.verify(SECRET, Counter.ZERO, 1_000_000, 6, 15).error()).isEqualTo(OtpError.INVALID_DIGIT_COUNT);
      assertThat(Verifier.verify(SECRET, Counter.ZERO, -1, 6, 15).error()).isEqualTo(OtpError.INVALID_DIGIT_COUNT);
    }

    @Test
    void unsupportedDigitsIsInvalidDigitCount() {
      assertThat(Verifier.verify(SECRET, Counter.ZERO, 12345, 5, 15).error()).isEqualTo(OtpError.INVALID_DIGIT_COUNT);
    }

    @Test
    void eightDigitCodes() {
      assertThat(Verifier.verify(SECRET, Counter.ZERO, 94287082, 8, 2).steps()).isEqualTo(1);
    }
  }

  /**
   * Clock skew between client and server, drift 2 steps of 30 seconds.
   */
  @Nested
  class DriftWindow {

    private static final long NOW = 1_500_000_000L; // a step boundary: 50,000,000 x 30
    private final TotpConfig symmetric = TotpConfig.DEFAULT.withThreshold(TotpConfig.DEFAULT.symmetricThreshold());

    private int clientCode(long clientTime) {
      return HotpGenerator.hotp(SECRET, new Counter(clientTime / 30), 6);
    }

    @Test
    void clientInStepIsTwoStepsFromTheBiasedCounter() {
      assertThat(Verifier.verify(SECRET, clientCode(NOW), symmetric, NOW).steps()).isEqualTo(2);
    }

    @Test
    void clientAheadBy59SecondsVerifies() {
      VerificationResult result = Verifier.verify(SECRET, clientCode(NOW + 59), symmetric, NOW);
      assertThat(result.isSynchronized()).isTrue();
      assertThat(result.steps()).isEqualTo(3);
    }

    @Test
    void clientAheadBy120SecondsDoesNot() {
      assertThat(Verifier.verify(SECRET, clientCode(NOW + 120), symmetric, NOW).error())
          .isEqualTo(OtpError.INVALID_THRESHOLD);
    }

    @Test
    void clientBehindBy59SecondsVerifies() {
      VerificationResult result = Verifier.verify(SECRET, clientCode(NOW - 59), symmetric, NOW);
      assertThat(result.isSynchronized()).isTrue();
      assertThat(result.steps()).isZero();
    }

    @Test
    void clientBehindBy120SecondsDoesNot() {
      assertThat(Verifier.verify(SECRET, clientCode(NOW - 120), symmetric, NOW).error())
          .isEqualTo(OtpError.INVALID_THRESHOLD);
    }

    @Test
    void defaultThresholdReachesTwelveStepsAhead() {
      assertThat(Verifier.verify(SECRET, clientCode(NOW + 12 * 30), TotpConfig.DEFAULT, NOW).steps()).isEqualTo(14);
      assertThat(Verifier.verify(SECRET, clientCode(NOW + 13 * 30), TotpConfig.DEFAULT, NOW).error())
          .isEqualTo(OtpError.INVALID_THRESHOLD);
    }
  }

  @Test
  void digitCount() {
    assertThat(Verifier.digitCount(100000)).isEqualTo(6);
    assertThat(Verifier.digitCount(9999999)).isEqualTo(7);
    assertThat(Verifier.digitCount(99999999)).isEqualTo(8);
  }

  @Test
  void resultToString() {
    assertThat(VerificationResult.synchronizedAt(3, new Counter(7)).toString()).isEqualTo("Synchronized(steps=3, counter=7)");
    assertThat(VerificationResult.rejected(OtpError.INVALID_THRESHOLD).toString()).isEqualTo("Rejected(INVALID_THRESHOLD)");
  }
}
