package com.codeheadsystems.otp.rfc.totp;

import com.codeheadsystems.otp.rfc.hotp.Counter;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps Unix time to a HOTP counter, RFC 6238 Section 4.2: T = (now - T0) / X.
 * <p>
 * The result is biased backward by {@code drift} steps. Verification only searches forward, so
 * starting early lets a client whose clock runs behind the server still match.
 * All arithmetic is unsigned 64-bit.
 */
public class TotpCounterDerivation {

  private static final Logger log = LoggerFactory.getLogger(TotpCounterDerivation.class);

  private final TotpConfig config;
  private final Clock clock;

  public TotpCounterDerivation(final TotpConfig config) {
    this(config, Clock.systemUTC());
  }

  public TotpCounterDerivation(final TotpConfig config, final Clock clock) {
    this.config = config;
    this.clock = clock;
  }

  /**
   * The counter for the clock's current time.
   *
   * @return the counter
   */
  public Counter currentCounter() {
    return counterAt(clock.instant().getEpochSecond());
  }

  /**
   * The counter for the given Unix time: floor((now - t0) / period) - drift.
   * <p>
   * When fewer than {@code drift} steps have elapsed since t0 the counter is clamped to zero
   * instead of wrapping.
   *
   * @param now seconds since the Unix epoch, unsigned
   * @return the counter
   * @throws IllegalArgumentException if now is before t0
   */
  public Counter counterAt(long now) {
    if (Long.compareUnsigned(now, config.t0()) < 0) {
      throw new IllegalArgumentException("Time " + Long.toUnsignedString(now)
          + " is before t0 " + Long.toUnsignedString(config.t0()));
    }
    long steps = Long.divideUnsigned(now - config.t0(), config.period());
    if (Long.compareUnsigned(steps, config.drift()) < 0) {
      log.debug("counterAt({}): {} steps since t0 is less than drift {}, clamping to 0",
          Long.toUnsignedString(now), steps, config.drift());
      return Counter.ZERO;
    }
    return new Counter(steps - config.drift());
  }

  /**
   * The instant at which the counter's time step begins, t0 + counter * period.
   * Useful when logging which step a code was accepted for.
   *
   * @param counter the counter
   * @return the instant
   * @throws IllegalArgumentException if the step start is not representable as an {@link Instant}
   */
  public Instant stepStart(Counter counter) {
    if (counter.value() < 0) {
      throw new IllegalArgumentException("Counter " + counter + " is out of range");
    }
    try {
      return Instant.ofEpochSecond(Math.addExact(config.t0(), Math.multiplyExact(counter.value(), config.period())));
    } catch (ArithmeticException | DateTimeException e) {
      throw new IllegalArgumentException("Counter " + counter + " is out of range", e);
    }
  }

  public TotpConfig config() {
    return config;
  }
}
